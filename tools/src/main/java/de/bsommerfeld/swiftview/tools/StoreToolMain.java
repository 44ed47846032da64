package de.bsommerfeld.swiftview.tools;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Offline maintenance of thumbnail store files, outside the running
 * application.
 *
 * <pre>
 * swiftview-store migrate   &lt;file&gt;
 * swiftview-store status    &lt;file&gt;
 * swiftview-store downgrade &lt;file&gt; --to &lt;version&gt;
 * </pre>
 *
 * Exit codes: 0 success or nothing to do, 1 failure, 2 usage error.
 */
@Command(name = "swiftview-store",
        mixinStandardHelpOptions = true,
        version = "swiftview-store 1.0",
        description = "Inspect and migrate SwiftView thumbnail stores",
        subcommands = { MigrateCommand.class, StatusCommand.class, DowngradeCommand.class })
public class StoreToolMain implements Runnable {

    static final int EXIT_FAILURE = 1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new StoreToolMain());
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand");
    }
}
