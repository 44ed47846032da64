package de.bsommerfeld.swiftview.decoder.pool;

import de.bsommerfeld.swiftview.core.domain.DecodeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link DecodePool} that runs every decode in a separate OS process.
 *
 * <h3>Workers</h3>
 * Up to {@code parallelism} child JVMs are kept alive and reused. They are
 * started lazily, on the first task that finds no idle worker. A pool thread
 * takes exclusive ownership of a worker for the duration of one task and
 * returns it to the idle queue afterwards.
 *
 * <h3>Crash handling</h3>
 * If a worker dies mid-task (codec fault, out of memory, killed) the broken
 * pipe surfaces as an {@link IOException}. The worker is discarded and that
 * one task completes with {@link DecodeError.Kind#WORKER_CRASHED}. The next
 * task starts a fresh worker. Other tasks are unaffected.
 *
 * <p>
 * Only {@link DecodeTask} and {@link DecodeResult} data cross the process
 * boundary, see {@link WorkerProtocol}.
 */
public class ProcessDecodePool implements DecodePool {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessDecodePool.class);

    private final WorkerLauncher launcher;
    private final int parallelism;
    private final ExecutorService executor;
    private final BlockingQueue<WorkerProcess> idle = new LinkedBlockingQueue<>();
    private final Set<WorkerProcess> all = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public ProcessDecodePool(WorkerLauncher launcher, int parallelism) {
        if (parallelism <= 0)
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        this.launcher = launcher;
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
            return CompletableFuture.supplyAsync(() -> runOnWorker(task), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public int parallelism() {
        return parallelism;
    }

    /** Number of live worker processes, idle or busy. */
    public int liveWorkers() {
        return (int) all.stream().filter(WorkerProcess::isAlive).count();
    }

    private DecodeResult runOnWorker(DecodeTask task) {
        WorkerProcess worker;
        try {
            worker = acquire();
        } catch (IOException e) {
            LOG.error("Could not start decode worker for {}", task.path(), e);
            return new DecodeResult.Failed(DecodeError.of(DecodeError.Kind.INTERNAL,
                    "Could not start decode worker: " + e.getMessage()));
        }

        try {
            DecodeResult result = worker.execute(task);
            release(worker);
            return result;
        } catch (IOException e) {
            LOG.warn("Decode worker {} died while decoding {}: {}", worker.pid(), task.path(), e.getMessage());
            discard(worker);
            return new DecodeResult.Failed(DecodeError.of(DecodeError.Kind.WORKER_CRASHED,
                    "Decode worker crashed while decoding " + task.path()));
        }
    }

    private WorkerProcess acquire() throws IOException {
        WorkerProcess worker;
        while ((worker = idle.poll()) != null) {
            if (worker.isAlive())
                return worker;
            discard(worker);
        }
        worker = launcher.start();
        all.add(worker);
        return worker;
    }

    private void release(WorkerProcess worker) {
        if (closed) {
            all.remove(worker);
            worker.shutdown();
            return;
        }
        idle.offer(worker);
    }

    private void discard(WorkerProcess worker) {
        all.remove(worker);
        worker.destroy();
    }

    @Override
    public void close() {
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Decode tasks still running after 10s, killing workers");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        WorkerProcess worker;
        while ((worker = idle.poll()) != null) {
            all.remove(worker);
            worker.shutdown();
        }
        all.forEach(WorkerProcess::destroy);
        all.clear();
        LOG.info("Decode pool closed");
    }
}
