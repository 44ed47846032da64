package de.bsommerfeld.swiftview.db;

import de.bsommerfeld.swiftview.core.config.EngineConfig;

/**
 * Connection and retry parameters of one store.
 *
 * @param busyTimeoutMs  SQLite lock wait per attempt
 * @param writeRetries   retries after the first attempt on a busy store
 * @param retryBackoffMs first backoff, doubled per retry
 * @param scanChunkSize  paths per {@code IN (...)} query of a bulk scan
 */
public record StoreSettings(int busyTimeoutMs, int writeRetries, long retryBackoffMs, int scanChunkSize) {

    public StoreSettings {
        if (busyTimeoutMs < 0 || writeRetries < 0 || retryBackoffMs < 0)
            throw new IllegalArgumentException("Store settings must not be negative");
        if (scanChunkSize <= 0)
            throw new IllegalArgumentException("scanChunkSize must be positive: " + scanChunkSize);
    }

    public static StoreSettings defaults() {
        return from(new EngineConfig());
    }

    public static StoreSettings from(EngineConfig config) {
        return new StoreSettings(config.getBusyTimeoutMs(), config.getWriteRetries(),
                config.getRetryBackoffMs(), config.getScanChunkSize());
    }
}
