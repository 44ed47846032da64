package de.bsommerfeld.swiftview.engine.loader;

import de.bsommerfeld.swiftview.decoder.pool.DecodePool;
import de.bsommerfeld.swiftview.decoder.pool.DecodeResult;
import de.bsommerfeld.swiftview.decoder.pool.DecodeTask;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Pool whose futures are completed by the test.
 */
class ControlledDecodePool implements DecodePool {

    record Pending(DecodeTask task, CompletableFuture<DecodeResult> future) {
    }

    private final BlockingQueue<Pending> received = new LinkedBlockingQueue<>();
    volatile boolean closed;

    @Override
    public CompletableFuture<DecodeResult> decode(DecodeTask task) {
        Pending pending = new Pending(task, new CompletableFuture<>());
        received.add(pending);
        return pending.future();
    }

    Pending next() throws InterruptedException {
        Pending pending = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(pending, "no task reached the pool");
        return pending;
    }

    /** Completes every arriving task with {@code result} until {@code handle} is done. */
    void completeAllUntil(DecodeHandle handle, DecodeResult result) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!handle.isDone() && System.currentTimeMillis() < deadline) {
            Pending pending = received.poll(20, TimeUnit.MILLISECONDS);
            if (pending != null)
                pending.future().complete(result);
        }
    }

    int waiting() {
        return received.size();
    }

    @Override
    public int parallelism() {
        return 1;
    }

    @Override
    public void close() {
        closed = true;
    }
}
