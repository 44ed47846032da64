package de.bsommerfeld.swiftview.engine.loader;

import de.bsommerfeld.swiftview.core.domain.CacheKey;
import de.bsommerfeld.swiftview.core.domain.DecodeIdentity;

import java.util.concurrent.CompletableFuture;

/**
 * Returned by {@link Loader#submit}. The generation orders requests for the
 * same {@link DecodeIdentity}: the highest admitted generation wins.
 *
 * <p>
 * {@link #outcome()} completes on the loader's coordinator thread. Hop to
 * another executor before doing real work in a callback.
 */
public final class DecodeHandle {

    private final CacheKey key;
    private final long generation;
    private final long submittedAt;
    private final CompletableFuture<DecodeOutcome> outcome = new CompletableFuture<>();

    DecodeHandle(CacheKey key, long generation) {
        this.key = key;
        this.generation = generation;
        this.submittedAt = System.currentTimeMillis();
    }

    public CacheKey key() {
        return key;
    }

    public DecodeIdentity identity() {
        return key.identity();
    }

    public long generation() {
        return generation;
    }

    /** Epoch milliseconds of the {@code submit} call. */
    public long submittedAt() {
        return submittedAt;
    }

    public CompletableFuture<DecodeOutcome> outcome() {
        return outcome;
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    boolean complete(DecodeOutcome result) {
        return outcome.complete(result);
    }

    boolean drop(DecodeOutcome.Reason reason) {
        return outcome.complete(new DecodeOutcome.Dropped(reason));
    }

    @Override
    public String toString() {
        return "DecodeHandle[" + key.mode() + " " + key.path() + " #" + generation + "]";
    }
}
