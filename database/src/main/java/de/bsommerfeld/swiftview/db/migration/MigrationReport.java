package de.bsommerfeld.swiftview.db.migration;

import java.util.List;

/**
 * What a {@link MigrationRunner} run did.
 *
 * @param fromVersion version found on open
 * @param toVersion   version after the run
 * @param applied     target versions of the steps applied, in order
 */
public record MigrationReport(int fromVersion, int toVersion, List<Integer> applied) {

    public MigrationReport {
        applied = List.copyOf(applied);
    }

    public boolean isNoOp() {
        return applied.isEmpty();
    }
}
