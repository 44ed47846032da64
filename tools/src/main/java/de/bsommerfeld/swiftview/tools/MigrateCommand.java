package de.bsommerfeld.swiftview.tools;

import de.bsommerfeld.swiftview.db.StoreOperator;
import de.bsommerfeld.swiftview.db.migration.MigrationReport;
import picocli.CommandLine.Command;

@Command(name = "migrate", description = "Apply pending schema migrations")
class MigrateCommand extends StoreCommand {

    @Override
    int run(StoreOperator operator) {
        MigrationReport report = session(operator, runner::migrate);
        if (report.isNoOp()) {
            out().printf("%s: schema v%d -> v%d (up to date)%n", file, report.fromVersion(), report.toVersion());
        } else {
            out().printf("%s: schema v%d -> v%d%n", file, report.fromVersion(), report.toVersion());
        }
        return 0;
    }
}
