package de.bsommerfeld.swiftview.tools;

import de.bsommerfeld.swiftview.db.StoreException;
import de.bsommerfeld.swiftview.db.StoreOperator;
import de.bsommerfeld.swiftview.db.StoreSettings;
import de.bsommerfeld.swiftview.db.StoreTask;
import de.bsommerfeld.swiftview.db.migration.MigrationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base for subcommands that operate on one existing store file. The file is
 * accessed through a {@link StoreOperator}, like the engine does, and every
 * migration step runs in its own transaction.
 */
abstract class StoreCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(StoreCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "<file>", description = "Thumbnail store file")
    Path file;

    final MigrationRunner runner = new MigrationRunner();

    @Override
    public Integer call() {
        if (!Files.isRegularFile(file)) {
            err().println("No such store file: " + file);
            return StoreToolMain.EXIT_FAILURE;
        }
        try (StoreOperator operator = new StoreOperator(file, StoreSettings.defaults())) {
            return run(operator);
        } catch (StoreException e) {
            LOG.debug("{} failed on {}", spec.name(), file, e);
            err().println(spec.name() + " failed: " + e.getMessage());
            return StoreToolMain.EXIT_FAILURE;
        }
    }

    abstract int run(StoreOperator operator);

    /** Runs {@code task} on the operator's writer in auto-commit mode and waits for it. */
    static <T> T session(StoreOperator operator, StoreTask<T> task) {
        return StoreOperator.await(operator.scheduleSession(task));
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
