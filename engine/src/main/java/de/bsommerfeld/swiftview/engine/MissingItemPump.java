package de.bsommerfeld.swiftview.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Turns bulk cache-miss reports into small, spaced-out batches of thumbnail
 * requests, so opening a folder with thousands of missing thumbnails does
 * not put thousands of decodes in flight at once.
 *
 * <p>
 * Paths are queued FIFO. Every {@code intervalMs} one tick hands at most
 * {@code batchSize} of them to the sink; the timer re-arms only while the
 * queue is non-empty. A path is queued once per session, i.e. until
 * {@link #clear()} or {@link #forget(Path)}.
 *
 * <p>
 * Queue state is owned by the pump thread; the public methods only post
 * messages to it.
 */
public class MissingItemPump implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MissingItemPump.class);

    private final Consumer<List<Path>> sink;
    private final int batchSize;
    private final long intervalMs;
    private final ScheduledExecutorService scheduler;

    // Pump thread only
    private final Deque<Path> queue = new ArrayDeque<>();
    private final Set<Path> seen = new HashSet<>();
    private boolean armed;

    private volatile int pending;

    public MissingItemPump(Consumer<List<Path>> sink, int batchSize, long intervalMs) {
        if (batchSize <= 0)
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        this.sink = sink;
        this.batchSize = batchSize;
        this.intervalMs = Math.max(0, intervalMs);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "swiftview-pump");
            t.setDaemon(true);
            return t;
        });
    }

    public void enqueue(Collection<Path> paths) {
        if (paths.isEmpty())
            return;
        List<Path> copy = List.copyOf(paths);
        post(() -> {
            int added = 0;
            for (Path path : copy) {
                if (seen.add(path)) {
                    queue.addLast(path);
                    added++;
                }
            }
            pending = queue.size();
            if (added > 0)
                LOG.debug("Queued {} missing thumbnails ({} pending)", added, queue.size());
            arm();
        });
    }

    /** Empties the queue and starts a new session. */
    public void clear() {
        post(() -> {
            queue.clear();
            seen.clear();
            pending = 0;
        });
    }

    /** Removes {@code path} from the queue and lets it be queued again. */
    public void forget(Path path) {
        post(() -> {
            queue.remove(path);
            seen.remove(path);
            pending = queue.size();
        });
    }

    /** Paths waiting for a tick. Eventually consistent. */
    public int pendingCount() {
        return pending;
    }

    private void arm() {
        if (armed || queue.isEmpty())
            return;
        armed = true;
        try {
            scheduler.schedule(this::tick, intervalMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            armed = false;
        }
    }

    private void tick() {
        armed = false;
        List<Path> batch = new ArrayList<>(batchSize);
        while (batch.size() < batchSize && !queue.isEmpty())
            batch.add(queue.pollFirst());
        pending = queue.size();

        if (!batch.isEmpty()) {
            try {
                sink.accept(batch);
            } catch (RuntimeException e) {
                LOG.error("Missing-thumbnail sink failed for batch of {}", batch.size(), e);
            }
        }
        arm();
    }

    private void post(Runnable task) {
        try {
            scheduler.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Pump closed, message dropped");
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS))
                LOG.warn("Pump thread did not stop within 5s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
