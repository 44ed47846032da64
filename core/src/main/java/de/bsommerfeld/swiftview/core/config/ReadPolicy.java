package de.bsommerfeld.swiftview.core.config;

/**
 * How a read reaches the persistent store. Chosen explicitly per call site.
 */
public enum ReadPolicy {

    /**
     * Queued on the store operator alongside writes. Totally ordered with
     * respect to writes, but waits behind them.
     */
    OPERATOR,

    /**
     * Independent read-only connection. Higher throughput; relies on the
     * store's WAL journal for consistent reads while a write is in progress.
     */
    DIRECT
}
