package de.bsommerfeld.swiftview.db;

import de.bsommerfeld.swiftview.core.domain.CacheRow;
import de.bsommerfeld.swiftview.core.domain.FileStat;

/**
 * Per-file outcome of {@link ThumbnailStore#scanExisting}.
 */
public sealed interface ScanResult permits ScanResult.Valid, ScanResult.Missing {

    String path();

    /** A populated row whose stat values and thumbnail box match the live file. */
    record Valid(CacheRow.Populated row) implements ScanResult {
        @Override
        public String path() {
            return row.path();
        }
    }

    /**
     * No usable thumbnail.
     *
     * @param stat        live file state
     * @param metaCurrent a metadata-only row matching {@code stat} already
     *                    exists, so no new one needs to be written
     */
    record Missing(FileStat stat, boolean metaCurrent) implements ScanResult {
        @Override
        public String path() {
            return stat.path();
        }
    }
}
