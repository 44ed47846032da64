package de.bsommerfeld.swiftview.decoder.pool;

import de.bsommerfeld.swiftview.decoder.Decoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs decodes on a fixed thread pool inside the calling JVM. No crash
 * isolation: a native fault in a codec takes the whole process down. Used
 * when {@code processIsolation} is switched off, and in tests.
 */
public class InProcessDecodePool implements DecodePool {

    private static final Logger LOG = LoggerFactory.getLogger(InProcessDecodePool.class);

    private final Decoder decoder;
    private final int parallelism;
    private final ExecutorService executor;

    public InProcessDecodePool(Decoder decoder, int parallelism) {
        if (parallelism <= 0)
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        this.decoder = decoder;
        this.parallelism = parallelism;
        AtomicInteger threadIds = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "swiftview-decode-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<DecodeResult> decode(DecodeTask task) {
        try {
            return CompletableFuture.supplyAsync(() -> task.runWith(decoder), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public int parallelism() {
        return parallelism;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS))
                LOG.warn("Decode threads did not stop within 5s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
