package de.bsommerfeld.swiftview.decoder.pool;

import java.util.concurrent.CompletableFuture;

/**
 * Bounded, CPU-bound execution context for decode work. The returned future
 * always completes normally; failures are {@link DecodeResult.Failed}
 * values. It completes exceptionally only if the pool was closed.
 */
public interface DecodePool extends AutoCloseable {

    CompletableFuture<DecodeResult> decode(DecodeTask task);

    /** Maximum number of tasks executing at the same time. */
    int parallelism();

    @Override
    void close();
}
