package de.bsommerfeld.swiftview.engine.loader;

import de.bsommerfeld.swiftview.core.domain.CacheKey;
import de.bsommerfeld.swiftview.core.domain.DecodeError;
import de.bsommerfeld.swiftview.core.domain.DecodeIdentity;
import de.bsommerfeld.swiftview.core.domain.DecodeMode;
import de.bsommerfeld.swiftview.decoder.pool.DecodePool;
import de.bsommerfeld.swiftview.decoder.pool.DecodeResult;
import de.bsommerfeld.swiftview.decoder.pool.DecodeTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Work dispatcher in front of a {@link DecodePool}.
 *
 * <h3>Supersession</h3>
 * Per {@link DecodeIdentity} (path and mode, target size ignored) only the
 * request with the highest generation is current. Admitting a newer request
 * drops the older handle with {@link DecodeOutcome.Reason#SUPERSEDED} right
 * away. Its decode, if already running, is not interrupted; the result is
 * discarded when it arrives.
 *
 * <h3>Threads</h3>
 * <ul>
 * <li>coordinator: a single thread that owns the table of current handles
 * and the ignore list. Admission, cancellation and delivery all run
 * here.</li>
 * <li>io: {@code ioThreads} threads that hand admitted work to the decode
 * pool. Nothing reaches the pool before admission bookkeeping is done.</li>
 * </ul>
 * Public methods never block.
 *
 * <p>
 * Decode failures are not retried. The loader owns the pool and closes it.
 */
public class Loader implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Loader.class);

    private final DecodePool pool;
    private final ExecutorService coordinator;
    private final ExecutorService io;
    private final AtomicLong generations = new AtomicLong();

    // Coordinator thread only
    private final Map<DecodeIdentity, DecodeHandle> current = new HashMap<>();
    private final Set<String> ignored = new HashSet<>();

    private volatile boolean closed;

    public Loader(DecodePool pool, int ioThreads) {
        if (ioThreads <= 0)
            throw new IllegalArgumentException("ioThreads must be positive: " + ioThreads);
        this.pool = pool;
        this.coordinator = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "swiftview-loader");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger ioIds = new AtomicInteger();
        this.io = Executors.newFixedThreadPool(ioThreads, r -> {
            Thread t = new Thread(r, "swiftview-loader-io-" + ioIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /** IO pool size used when none is configured. */
    public static int defaultIoThreads() {
        return Math.max(2, Math.min(4, Runtime.getRuntime().availableProcessors()));
    }

    // =====================================================================
    // Public API
    // =====================================================================

    /**
     * Admits a request. The handle is returned at once; its generation is
     * fixed here, so of two racing submits the later call wins.
     */
    public DecodeHandle submit(CacheKey key) {
        DecodeHandle handle = new DecodeHandle(key, generations.incrementAndGet());
        if (closed || !onCoordinator(() -> admit(handle)))
            handle.drop(DecodeOutcome.Reason.SHUTDOWN);
        return handle;
    }

    /** Best effort: a running decode finishes, its result is discarded. */
    public void cancel(DecodeHandle handle) {
        onCoordinator(() -> {
            current.remove(handle.identity(), handle);
            if (handle.drop(DecodeOutcome.Reason.CANCELLED))
                LOG.debug("Cancelled {}", handle);
        });
    }

    /** Cancels the current requests of every mode for {@code path}. */
    public void cancelAllFor(String path) {
        onCoordinator(() -> dropAllFor(path, DecodeOutcome.Reason.CANCELLED));
    }

    /**
     * Drops everything pending for {@code path} and every later submission
     * until {@link #unignore}.
     */
    public void ignore(String path) {
        onCoordinator(() -> {
            ignored.add(path);
            dropAllFor(path, DecodeOutcome.Reason.IGNORED);
        });
    }

    public void unignore(String path) {
        onCoordinator(() -> ignored.remove(path));
    }

    /** Cancels every pending request. */
    public void clearPending() {
        onCoordinator(() -> {
            int n = dropAll(DecodeOutcome.Reason.CANCELLED);
            if (n > 0)
                LOG.debug("Cleared {} pending decode requests", n);
        });
    }

    public int parallelism() {
        return pool.parallelism();
    }

    // =====================================================================
    // Coordinator
    // =====================================================================

    private void admit(DecodeHandle handle) {
        if (closed) {
            handle.drop(DecodeOutcome.Reason.SHUTDOWN);
            return;
        }
        if (ignored.contains(handle.key().path())) {
            handle.drop(DecodeOutcome.Reason.IGNORED);
            return;
        }

        DecodeHandle previous = current.get(handle.identity());
        if (previous != null && previous.generation() > handle.generation()) {
            handle.drop(DecodeOutcome.Reason.SUPERSEDED);
            return;
        }
        if (previous != null && previous.drop(DecodeOutcome.Reason.SUPERSEDED))
            LOG.debug("{} superseded by #{}", previous, handle.generation());

        current.put(handle.identity(), handle);
        LOG.debug("Admitted {}", handle);

        try {
            io.execute(() -> dispatch(handle));
        } catch (RejectedExecutionException e) {
            current.remove(handle.identity(), handle);
            handle.drop(DecodeOutcome.Reason.SHUTDOWN);
        }
    }

    private void deliver(DecodeHandle handle, DecodeResult result, Throwable error) {
        if (!current.remove(handle.identity(), handle)) {
            LOG.debug("Discarding stale result for {}", handle);
            return;
        }

        DecodeOutcome outcome;
        if (error != null) {
            LOG.error("Decode pool failed for {}", handle, error);
            outcome = new DecodeOutcome.Failed(DecodeError.of(DecodeError.Kind.INTERNAL,
                    error.getClass().getSimpleName() + ": " + error.getMessage()));
        } else if (result instanceof DecodeResult.Failed failed) {
            outcome = new DecodeOutcome.Failed(failed.error());
        } else {
            outcome = new DecodeOutcome.Decoded(result);
        }
        handle.complete(outcome);
    }

    private void dropAllFor(String path, DecodeOutcome.Reason reason) {
        for (DecodeMode mode : DecodeMode.values()) {
            DecodeHandle handle = current.remove(new DecodeIdentity(path, mode));
            if (handle != null && handle.drop(reason))
                LOG.debug("Dropped {} ({})", handle, reason);
        }
    }

    private int dropAll(DecodeOutcome.Reason reason) {
        List<DecodeHandle> handles = new ArrayList<>(current.values());
        current.clear();
        handles.forEach(h -> h.drop(reason));
        return handles.size();
    }

    private boolean onCoordinator(Runnable task) {
        try {
            coordinator.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    // =====================================================================
    // IO pool
    // =====================================================================

    private void dispatch(DecodeHandle handle) {
        // Superseded or cancelled while queued: skip the decode entirely
        if (handle.isDone())
            return;
        try {
            pool.decode(DecodeTask.of(handle.key()))
                    .whenComplete((result, error) -> onCoordinator(() -> deliver(handle, result, error)));
        } catch (RuntimeException e) {
            onCoordinator(() -> deliver(handle, null, e));
        }
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Drops every pending handle with {@link DecodeOutcome.Reason#SHUTDOWN},
     * stops the loader threads and closes the decode pool.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;

        onCoordinator(() -> dropAll(DecodeOutcome.Reason.SHUTDOWN));
        shutdown(coordinator, "coordinator");
        shutdown(io, "io");
        pool.close();
        LOG.info("Loader shut down");
    }

    private static void shutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Loader {} threads did not stop within 30s", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
