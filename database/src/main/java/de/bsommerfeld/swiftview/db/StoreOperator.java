package de.bsommerfeld.swiftview.db;

import de.bsommerfeld.swiftview.core.config.ReadPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * The single gateway to one SQLite store file. It is the only component that
 * opens write transactions on that file.
 *
 * <h3>Threading model</h3>
 * <ul>
 * <li><strong>Writes</strong> run on one dedicated writer thread, strictly in
 * submission order, no matter how many threads submit. Each write is one
 * transaction.</li>
 * <li><strong>Reads</strong> follow a {@link ReadPolicy} chosen per call
 * site: {@code OPERATOR} queues them on the writer thread behind pending
 * writes, {@code DIRECT} runs them on a small reader pool over read-only
 * connections. Direct reads rely on WAL mode, which every write connection
 * enables.</li>
 * </ul>
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per task and closed when the task ends,
 * successful or not. Nothing holds a file handle between tasks.
 *
 * <h3>Busy handling</h3>
 * Every connection waits up to {@code busyTimeoutMs} for a lock. If SQLite
 * still reports {@code SQLITE_BUSY} or {@code SQLITE_LOCKED}, the task is
 * rolled back and retried after {@code retryBackoffMs * 2^(attempt-1)}, up to
 * {@code writeRetries} times, then fails with {@link StoreBusyException}. The
 * backoff sleeps on the executing thread, so later writes stay behind the
 * retried one. Other SQL errors fail the task at once.
 *
 * <p>
 * All scheduling methods return immediately. Only {@link #readSync} blocks.
 */
public class StoreOperator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StoreOperator.class);
    private static final int READER_THREADS = 2;
    private static final AtomicInteger READER_IDS = new AtomicInteger();

    private final Path dbFile;
    private final StoreSettings settings;
    private final String url;
    private final ExecutorService writer;
    private final ExecutorService readers;
    private volatile Thread writerThread;
    private volatile boolean closed;

    public StoreOperator(Path dbFile, StoreSettings settings) {
        this.dbFile = dbFile.toAbsolutePath();
        this.settings = settings;
        this.url = "jdbc:sqlite:" + this.dbFile;
        String name = "swiftview-store-" + this.dbFile.getParent().getFileName();
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            writerThread = t;
            return t;
        });
        this.readers = Executors.newFixedThreadPool(READER_THREADS, r -> {
            Thread t = new Thread(r, "swiftview-store-reader-" + READER_IDS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Path file() {
        return dbFile;
    }

    public StoreSettings settings() {
        return settings;
    }

    // =====================================================================
    // Scheduling
    // =====================================================================

    /** Runs the task in its own transaction on the writer thread. */
    public <T> CompletableFuture<T> scheduleWrite(StoreTask<T> task) {
        return submit(writer, () -> runWithRetry("write", task, true, false));
    }

    /**
     * Runs all tasks, in order, inside one transaction on the writer thread.
     * Either all of them take effect or none.
     */
    public CompletableFuture<Void> scheduleWriteBatch(List<? extends StoreTask<?>> tasks) {
        List<StoreTask<?>> copy = List.copyOf(tasks);
        return scheduleWrite(conn -> {
            for (StoreTask<?> task : copy)
                task.execute(conn);
            return null;
        });
    }

    /**
     * Runs the task on the writer thread with auto-commit on, so the task
     * manages its own transactions. The migration runner uses this to commit
     * each step separately.
     */
    public <T> CompletableFuture<T> scheduleSession(StoreTask<T> task) {
        return submit(writer, () -> runWithRetry("session", task, false, false));
    }

    /** Operator-mediated read, ordered behind every write submitted before it. */
    public <T> CompletableFuture<T> scheduleRead(StoreTask<T> task) {
        return read(ReadPolicy.OPERATOR, task);
    }

    public <T> CompletableFuture<T> read(ReadPolicy policy, StoreTask<T> task) {
        if (policy == ReadPolicy.DIRECT)
            return submit(readers, () -> runWithRetry("read", task, false, true));
        return submit(writer, () -> runWithRetry("read", task, false, false));
    }

    /**
     * Blocking operator read. Called from the writer thread itself (inside
     * another task) it runs inline instead of deadlocking.
     *
     * @throws StoreException if the read fails
     */
    public <T> T readSync(StoreTask<T> task) {
        if (Thread.currentThread() == writerThread)
            return runWithRetry("read", task, false, false);
        return await(scheduleRead(task));
    }

    /**
     * Waits for a store future and unwraps its failure into the original
     * {@link StoreException}.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while waiting for the store", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            throw new StoreException("Store task failed", cause);
        }
    }

    private <T> CompletableFuture<T> submit(ExecutorService executor, Supplier<T> work) {
        if (closed)
            return CompletableFuture.failedFuture(new StoreException("Store operator closed: " + dbFile));
        try {
            return CompletableFuture.supplyAsync(work, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new StoreException("Store operator closed: " + dbFile, e));
        }
    }

    // =====================================================================
    // Execution
    // =====================================================================

    private <T> T runWithRetry(String kind, StoreTask<T> task, boolean transactional, boolean readOnly) {
        int attempt = 0;
        while (true) {
            try {
                return runOnce(task, transactional, readOnly);
            } catch (SQLException e) {
                if (!isTransient(e))
                    throw new StoreException("Store " + kind + " failed on " + dbFile + ": " + e.getMessage(), e);

                attempt++;
                if (attempt > settings.writeRetries()) {
                    LOG.error("Store {} on {} still busy after {} attempts", kind, dbFile, attempt);
                    throw new StoreBusyException("Store busy: " + dbFile, attempt, e);
                }
                long backoff = settings.retryBackoffMs() * (1L << (attempt - 1));
                LOG.warn("Store busy on {} ({} attempt {}/{}), retrying in {} ms",
                        dbFile.getFileName(), kind, attempt, settings.writeRetries(), backoff);
                sleep(backoff);
            }
        }
    }

    private <T> T runOnce(StoreTask<T> task, boolean transactional, boolean readOnly) throws SQLException {
        try (Connection conn = openConnection(readOnly)) {
            if (!transactional)
                return task.execute(conn);

            conn.setAutoCommit(false);
            try {
                T result = task.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            }
        }
    }

    /**
     * Opens a connection scoped to one task. Package-private so tests can
     * inject failing connections.
     */
    Connection openConnection(boolean readOnly) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(settings.busyTimeoutMs());
        if (readOnly) {
            config.setReadOnly(true);
        } else {
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        }
        return DriverManager.getConnection(url, config.toProperties());
    }

    static boolean isTransient(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                int primary = sql.getErrorCode() & 0xFF;
                if (primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code)
                    return true;
            }
        }
        return false;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted during store retry backoff", e);
        }
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Stops accepting work, drains queued writes (up to 30s) and shuts the
     * threads down.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        readers.shutdown();
        writer.shutdown();
        try {
            if (!writer.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Store writer for {} did not drain within 30s", dbFile);
                writer.shutdownNow();
            }
            if (!readers.awaitTermination(5, TimeUnit.SECONDS))
                readers.shutdownNow();
        } catch (InterruptedException e) {
            writer.shutdownNow();
            readers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.debug("Store operator closed: {}", dbFile);
    }
}
