package de.bsommerfeld.swiftview.tools;

import de.bsommerfeld.swiftview.db.StoreOperator;
import de.bsommerfeld.swiftview.db.migration.MigrationReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Reverts migrations. Lossy: going below v2 drops metadata-only rows.
 */
@Command(name = "downgrade", description = "Revert schema migrations down to a version")
class DowngradeCommand extends StoreCommand {

    @Option(names = "--to", required = true, paramLabel = "<version>", description = "Target schema version")
    int target;

    @Override
    int run(StoreOperator operator) {
        MigrationReport report = session(operator, conn -> runner.downgrade(conn, target));
        if (report.isNoOp()) {
            out().printf("%s: schema v%d, nothing to revert%n", file, report.fromVersion());
        } else {
            out().printf("%s: schema v%d -> v%d%n", file, report.fromVersion(), report.toVersion());
        }
        return 0;
    }
}
