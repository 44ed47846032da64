package de.bsommerfeld.swiftview.engine;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.swiftview.core.config.EngineConfig;
import de.bsommerfeld.swiftview.core.domain.CacheKey;
import de.bsommerfeld.swiftview.core.domain.CacheRow;
import de.bsommerfeld.swiftview.core.domain.DecodeError;
import de.bsommerfeld.swiftview.core.domain.DecodeMode;
import de.bsommerfeld.swiftview.core.domain.FileStat;
import de.bsommerfeld.swiftview.core.domain.FolderSnapshot;
import de.bsommerfeld.swiftview.core.domain.PixelBuffer;
import de.bsommerfeld.swiftview.core.domain.TargetSize;
import de.bsommerfeld.swiftview.core.event.ApplicationEventBus;
import de.bsommerfeld.swiftview.core.event.EngineEvents.DecodeFailedEvent;
import de.bsommerfeld.swiftview.core.event.EngineEvents.EngineErrorEvent;
import de.bsommerfeld.swiftview.core.event.EngineEvents.FolderScannedEvent;
import de.bsommerfeld.swiftview.core.event.EngineEvents.ThumbnailReadyEvent;
import de.bsommerfeld.swiftview.core.event.EngineEvents.ThumbnailRowsLoadedEvent;
import de.bsommerfeld.swiftview.core.util.PathKeys;
import de.bsommerfeld.swiftview.db.ScanResult;
import de.bsommerfeld.swiftview.db.StoreException;
import de.bsommerfeld.swiftview.db.StoreSettings;
import de.bsommerfeld.swiftview.db.ThumbnailStore;
import de.bsommerfeld.swiftview.db.ThumbnailStores;
import de.bsommerfeld.swiftview.decoder.DecodeException;
import de.bsommerfeld.swiftview.decoder.Decoder;
import de.bsommerfeld.swiftview.decoder.EncodedImage;
import de.bsommerfeld.swiftview.decoder.pool.DecodeResult;
import de.bsommerfeld.swiftview.engine.cache.MemoryCache;
import de.bsommerfeld.swiftview.engine.cache.Thumbnail;
import de.bsommerfeld.swiftview.engine.loader.DecodeHandle;
import de.bsommerfeld.swiftview.engine.loader.DecodeOutcome;
import de.bsommerfeld.swiftview.engine.loader.Loader;
import de.bsommerfeld.swiftview.engine.scan.FolderScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry point for consumers: views, thumbnails, folder opening and
 * invalidation. Every public method returns at once; results arrive through
 * the returned futures and the {@link ApplicationEventBus}.
 *
 * <h3>Lookup order</h3>
 * Memory cache, then the folder's thumbnail store, then a decode through the
 * {@link Loader}. A decoded thumbnail is written back to the store
 * asynchronously and put into the memory cache.
 *
 * <h3>Threads</h3>
 * <ul>
 * <li>engine: owns the open stores and the pending-thumbnail table. Store
 * opening (and its migrations) runs here.</li>
 * <li>folder: runs the open-folder pipeline and bulk scans, which block per
 * store chunk.</li>
 * </ul>
 *
 * <h3>Stores</h3>
 * Only {@link #openFolder} creates a store file. Requests for files in other
 * folders use that folder's store if one already exists and otherwise decode
 * without persisting. Such stores stay open on a small most-recently-used
 * basis.
 *
 * <h3>Invalidation</h3>
 * Work that started before an {@link #invalidate} of its file never reaches
 * a cache, the store or its caller; the caller's future completes with a
 * {@link RequestDroppedException}.
 *
 * <h3>Failures</h3>
 * A failed decode completes the caller's future with a {@link DecodeException}
 * and posts a {@link DecodeFailedEvent}. A dropped request completes it with
 * a {@link RequestDroppedException}. Background store failures are logged and
 * posted as {@link EngineErrorEvent}; they never fail an unrelated request.
 */
@Singleton
public class ImageEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ImageEngine.class);

    /** Stores kept open at once, the open folder's included. */
    static final int MAX_OPEN_STORES = 4;

    private final EngineConfig config;
    private final ApplicationEventBus eventBus;
    private final Decoder decoder;
    private final Loader loader;
    private final MemoryCache<PixelBuffer> viewCache;
    private final MemoryCache<Thumbnail> thumbnailCache;
    private final StoreSettings storeSettings;
    private final TargetSize thumbSize;
    private final MissingItemPump pump;
    private final ExecutorService engineThread;
    private final ExecutorService folderThread;

    // Engine thread only
    private final Map<String, CompletableFuture<Thumbnail>> pendingThumbnails = new HashMap<>();
    private final Map<Path, ThumbnailStore> stores = new LinkedHashMap<>(8, 0.75f, true);
    private Path openedFolder;

    // Path -> invalidation sequence number of its latest invalidate()
    private final AtomicLong invalidationSeq = new AtomicLong();
    private final Map<String, Long> invalidatedAt = new ConcurrentHashMap<>();

    private volatile boolean closed;

    @Inject
    public ImageEngine(EngineConfig config, ApplicationEventBus eventBus, Decoder decoder, Loader loader,
            MemoryCache<PixelBuffer> viewCache, MemoryCache<Thumbnail> thumbnailCache) {
        this.config = config;
        this.eventBus = eventBus;
        this.decoder = decoder;
        this.loader = loader;
        this.viewCache = viewCache;
        this.thumbnailCache = thumbnailCache;
        this.storeSettings = StoreSettings.from(config);
        this.thumbSize = config.thumbnailSize();
        this.pump = new MissingItemPump(this::requestMissing, config.getPumpBatchSize(), config.getPumpIntervalMs());
        this.engineThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "swiftview-engine");
            t.setDaemon(true);
            return t;
        });
        this.folderThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "swiftview-folder");
            t.setDaemon(true);
            return t;
        });
    }

    // =====================================================================
    // Views
    // =====================================================================

    public CompletableFuture<PixelBuffer> requestView(Path file) {
        return requestView(file, null);
    }

    /**
     * Decodes {@code file} for display, fitted into {@code target} or at full
     * resolution if {@code target} is {@code null}. View requests are not
     * shared: a newer request for the same file supersedes this one.
     */
    public CompletableFuture<PixelBuffer> requestView(Path file, TargetSize target) {
        String path = PathKeys.dbKey(file);
        CacheKey key = CacheKey.full(path, target);
        PixelBuffer cached = viewCache.get(key);
        if (cached != null)
            return CompletableFuture.completedFuture(cached);

        CompletableFuture<PixelBuffer> result = new CompletableFuture<>();
        long seq = invalidationSeq.get();
        loader.submit(key).outcome().whenComplete((outcome, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else if (outcome instanceof DecodeOutcome.Decoded decoded
                    && decoded.result() instanceof DecodeResult.Pixels pixels) {
                if (putIfCurrent(viewCache, key, pixels.pixels(), seq))
                    result.complete(pixels.pixels());
                else
                    dropStale(path, result);
            } else {
                fail(path, DecodeMode.FULL, outcome, result);
            }
        });
        return result;
    }

    // =====================================================================
    // Thumbnails
    // =====================================================================

    /**
     * Thumbnail of {@code file} in the configured box. Concurrent requests
     * for the same file share one lookup and at most one decode.
     */
    public CompletableFuture<Thumbnail> requestThumbnail(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        String path = PathKeys.dbKey(absolute);
        Thumbnail cached = thumbnailCache.get(thumbKey(path));
        if (cached != null)
            return CompletableFuture.completedFuture(cached);

        CompletableFuture<Thumbnail> result = new CompletableFuture<>();
        runOnEngine(() -> thumbnailFuture(absolute, path).whenComplete(relay(result)), result);
        return result;
    }

    private CompletableFuture<Thumbnail> thumbnailFuture(Path file, String path) {
        Thumbnail cached = thumbnailCache.get(thumbKey(path));
        if (cached != null)
            return CompletableFuture.completedFuture(cached);

        CompletableFuture<Thumbnail> pending = pendingThumbnails.get(path);
        if (pending != null) {
            LOG.debug("Joining pending thumbnail request for {}", path);
            return pending;
        }

        CompletableFuture<Thumbnail> result = new CompletableFuture<>();
        pendingThumbnails.put(path, result);
        startThumbnail(file, new ThumbnailJob(path, invalidationSeq.get(), result));
        return result;
    }

    /** One thumbnail lookup, from the engine thread's pending table to its caller. */
    private record ThumbnailJob(String path, long seq, CompletableFuture<Thumbnail> result) {
    }

    private void startThumbnail(Path file, ThumbnailJob job) {
        FileStat stat;
        try {
            stat = FileStat.of(file);
        } catch (IOException e) {
            pendingThumbnails.remove(job.path(), job.result());
            fail(job.path(), DecodeMode.THUMBNAIL,
                    new DecodeOutcome.Failed(DecodeError.of(DecodeError.Kind.UNREADABLE,
                            "Cannot stat " + file + ": " + e.getMessage())),
                    job.result());
            return;
        }

        Path folder = file.getParent();
        ThumbnailStore store = existingStoreOrNull(folder);
        CompletableFuture<Optional<CacheRow>> probe = store == null
                ? CompletableFuture.completedFuture(Optional.empty())
                : store.probe(job.path(), config.getProbeReadPolicy());
        probe.whenComplete((row, error) -> runOnEngine(() -> onProbed(job, folder, stat, store, row, error),
                job.result()));
    }

    private void onProbed(ThumbnailJob job, Path folder, FileStat stat, ThumbnailStore store,
            Optional<CacheRow> row, Throwable error) {
        String path = job.path();
        if (error != null) {
            LOG.warn("Store probe for {} failed, decoding instead: {}", path, unwrap(error).getMessage());
        } else if (row.isPresent() && row.get() instanceof CacheRow.Populated populated
                && populated.isValidFor(stat, thumbSize)) {
            if (isDecodable(populated)) {
                finishThumbnail(job, Thumbnail.of(populated));
                return;
            }
            LOG.warn("Stored thumbnail of {} does not decode, clearing it", path);
            if (isLive(folder, store))
                store.clearThumbnail(path).whenComplete(logFailure("clear corrupt thumbnail of " + path));
        }

        DecodeHandle handle = loader.submit(CacheKey.thumbnail(path, thumbSize));
        handle.outcome().whenComplete(
                (outcome, e) -> runOnEngine(() -> onThumbnailDecoded(job, folder, stat, store, outcome, e),
                        job.result()));
    }

    private void onThumbnailDecoded(ThumbnailJob job, Path folder, FileStat stat, ThumbnailStore store,
            DecodeOutcome outcome, Throwable error) {
        String path = job.path();
        if (error != null) {
            pendingThumbnails.remove(path, job.result());
            job.result().completeExceptionally(unwrap(error));
            return;
        }
        if (!(outcome instanceof DecodeOutcome.Decoded decoded
                && decoded.result() instanceof DecodeResult.Encoded encoded)) {
            pendingThumbnails.remove(path, job.result());
            fail(path, DecodeMode.THUMBNAIL, outcome, job.result());
            return;
        }
        if (invalidatedSince(path, job.seq())) {
            pendingThumbnails.remove(path, job.result());
            dropStale(path, job.result());
            return;
        }

        EncodedImage image = encoded.image();
        eventBus.post(new ThumbnailReadyEvent(path, image.bytes(), image.sourceWidth(), image.sourceHeight()));
        if (isLive(folder, store)) {
            CacheRow row = CacheRow.populated(stat, image.sourceWidth(), image.sourceHeight(), thumbSize,
                    image.bytes(), System.currentTimeMillis());
            store.upsert(row).whenComplete(logFailure("store thumbnail of " + path));
        }
        finishThumbnail(job, Thumbnail.of(path, image));
    }

    private void finishThumbnail(ThumbnailJob job, Thumbnail thumbnail) {
        pendingThumbnails.remove(job.path(), job.result());
        if (putIfCurrent(thumbnailCache, thumbKey(job.path()), thumbnail, job.seq()))
            job.result().complete(thumbnail);
        else
            dropStale(job.path(), job.result());
    }

    private void requestMissing(List<Path> batch) {
        for (Path file : batch) {
            requestThumbnail(file).whenComplete((thumbnail, error) -> {
                // Failures are already posted as events
                if (error != null)
                    LOG.debug("Missing thumbnail for {} not produced: {}", file, error.getMessage());
            });
        }
    }

    private boolean isDecodable(CacheRow.Populated row) {
        try {
            decoder.decodeEncoded(row.thumbnail());
            return true;
        } catch (DecodeException e) {
            return false;
        }
    }

    private CacheKey thumbKey(String path) {
        return CacheKey.thumbnail(path, thumbSize);
    }

    // =====================================================================
    // Invalidation
    // =====================================================================

    /**
     * Forgets everything known about {@code file}: memory cache entries,
     * pending requests and its store row. Call when the file was modified,
     * removed or renamed.
     */
    public void invalidate(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        String path = PathKeys.dbKey(absolute);
        invalidatedAt.merge(path, invalidationSeq.incrementAndGet(), Math::max);
        loader.cancelAllFor(path);
        viewCache.invalidate(path);
        thumbnailCache.invalidate(path);
        pump.forget(absolute);
        runOnEngine(() -> {
            pendingThumbnails.remove(path);
            ThumbnailStore store = stores.get(absolute.getParent());
            if (store != null)
                store.delete(path).whenComplete(logFailure("delete row of " + path));
        }, null);
    }

    /**
     * Empties the folder's store and the memory caches. Completes with the
     * number of rows removed, {@code 0} if the folder has no store.
     */
    public CompletableFuture<Integer> clearCache(Path folder) {
        Path dir = folder.toAbsolutePath().normalize();
        CompletableFuture<Integer> result = new CompletableFuture<>();
        runOnEngine(() -> {
            pump.clear();
            viewCache.clear();
            thumbnailCache.clear();
            try {
                ThumbnailStore store = existingStore(dir);
                if (store == null)
                    result.complete(0);
                else
                    store.deleteAll().whenComplete(relay(result));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, result);
        return result;
    }

    // =====================================================================
    // Folders
    // =====================================================================

    /**
     * Opens {@code folder} for browsing:
     * <ol>
     * <li>lists it and posts a {@link FolderScannedEvent}</li>
     * <li>opens its store and removes rows of files that are gone</li>
     * <li>bulk-checks every image against the store; valid thumbnails go to
     * the memory cache and out as one {@link ThumbnailRowsLoadedEvent}</li>
     * <li>writes metadata-only rows for images without one</li>
     * <li>hands every image without a valid thumbnail to the pump</li>
     * </ol>
     * A store that did not exist before is not scanned.
     */
    public CompletableFuture<FolderSnapshot> openFolder(Path folder) {
        Path dir = folder.toAbsolutePath().normalize();
        CompletableFuture<FolderSnapshot> result = new CompletableFuture<>();
        runOnFolder(() -> {
            try {
                result.complete(loadFolder(dir));
            } catch (IOException | RuntimeException e) {
                LOG.error("Failed to open folder {}", dir, e);
                eventBus.post(new EngineErrorEvent("open folder " + dir, e.getMessage()));
                result.completeExceptionally(e);
            }
        }, result);
        return result;
    }

    private FolderSnapshot loadFolder(Path dir) throws IOException {
        long seq = invalidationSeq.get();
        FolderSnapshot snapshot = FolderScanner.scan(dir);
        eventBus.post(new FolderScannedEvent(snapshot));
        pump.clear();

        FolderStore opened = awaitEngine(() -> switchStore(dir));
        ThumbnailStore store = opened.store();
        Map<String, FileStat> stats = statAll(snapshot.imagePaths());
        store.retainOnly(stats.keySet()).whenComplete(logFailure("remove stale rows of " + dir));

        List<CacheRow> loaded = new ArrayList<>();
        List<FileStat> missing = new ArrayList<>();
        List<FileStat> needMeta = new ArrayList<>();

        if (opened.created()) {
            missing.addAll(stats.values());
            needMeta.addAll(stats.values());
        } else {
            try (Stream<ScanResult> results = store.scanExisting(List.copyOf(stats.values()), thumbSize,
                    config.getScanReadPolicy())) {
                results.forEach(r -> {
                    if (r instanceof ScanResult.Valid valid) {
                        CacheRow.Populated row = valid.row();
                        if (isDecodable(row)) {
                            if (putIfCurrent(thumbnailCache, thumbKey(row.path()), Thumbnail.of(row), seq))
                                loaded.add(row);
                        } else {
                            LOG.warn("Stored thumbnail of {} does not decode, clearing it", row.path());
                            store.clearThumbnail(row.path())
                                    .whenComplete(logFailure("clear corrupt thumbnail of " + row.path()));
                            missing.add(stats.get(row.path()));
                        }
                    } else if (r instanceof ScanResult.Missing m) {
                        missing.add(m.stat());
                        if (!m.metaCurrent())
                            needMeta.add(m.stat());
                    }
                });
            }
        }

        if (!loaded.isEmpty())
            eventBus.post(new ThumbnailRowsLoadedEvent(PathKeys.dbKey(dir), loaded));

        if (!needMeta.isEmpty()) {
            try {
                await(store.upsertMeta(needMeta, thumbSize));
            } catch (StoreException e) {
                LOG.error("Failed to write metadata rows for {}", dir, e);
                eventBus.post(new EngineErrorEvent("write metadata rows of " + dir, e.getMessage()));
            }
        }

        pump.enqueue(missing.stream().map(s -> PathKeys.toPath(s.path())).toList());
        LOG.info("Opened {}: {} images, {} cached, {} missing", dir, stats.size(), loaded.size(), missing.size());
        return snapshot;
    }

    /**
     * Bulk validity check outside of {@link #openFolder}. Files that cannot
     * be stat'ed are left out of the result; files in a folder without a
     * store are all missing.
     */
    public CompletableFuture<List<ScanResult>> scanExisting(List<Path> files) {
        CompletableFuture<List<ScanResult>> result = new CompletableFuture<>();
        runOnFolder(() -> {
            try {
                Map<Path, List<Path>> byFolder = files.stream()
                        .map(f -> f.toAbsolutePath().normalize())
                        .collect(Collectors.groupingBy(Path::getParent, LinkedHashMap::new, Collectors.toList()));

                List<ScanResult> results = new ArrayList<>();
                for (Map.Entry<Path, List<Path>> entry : byFolder.entrySet()) {
                    ThumbnailStore store = awaitEngine(() -> existingStore(entry.getKey()));
                    List<FileStat> stats = List.copyOf(statAll(entry.getValue()).values());
                    if (store == null) {
                        stats.forEach(stat -> results.add(new ScanResult.Missing(stat, false)));
                        continue;
                    }
                    try (Stream<ScanResult> scan = store.scanExisting(stats, thumbSize, config.getScanReadPolicy())) {
                        scan.forEach(results::add);
                    }
                }
                result.complete(results);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, result);
        return result;
    }

    private Map<String, FileStat> statAll(List<Path> files) {
        Map<String, FileStat> stats = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                FileStat stat = FileStat.of(file);
                stats.put(stat.path(), stat);
            } catch (IOException e) {
                LOG.debug("Cannot stat {}: {}", file, e.getMessage());
            }
        }
        return stats;
    }

    // =====================================================================
    // Stores (engine thread)
    // =====================================================================

    /**
     * @param created the store file was created by this call, so it cannot
     *                hold any rows yet
     */
    private record FolderStore(ThumbnailStore store, boolean created) {
    }

    /** Opens or creates the store of {@code folder} and closes every other one. */
    private FolderStore switchStore(Path folder) {
        Iterator<Map.Entry<Path, ThumbnailStore>> it = stores.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Path, ThumbnailStore> entry = it.next();
            if (!entry.getKey().equals(folder)) {
                entry.getValue().close();
                it.remove();
            }
        }
        ThumbnailStore store = stores.get(folder);
        boolean created = false;
        if (store == null) {
            store = ThumbnailStores.open(folder, storeSettings);
            created = store.isNew();
            stores.put(folder, store);
        }
        openedFolder = folder;
        return new FolderStore(store, created);
    }

    /**
     * The store of {@code folder} if it is open or its file exists, else
     * {@code null}. Never creates a store file.
     */
    private ThumbnailStore existingStore(Path folder) {
        ThumbnailStore store = stores.get(folder);
        if (store != null)
            return store;
        if (ThumbnailStores.findExisting(folder).isEmpty())
            return null;

        store = ThumbnailStores.open(folder, storeSettings);
        stores.put(folder, store);
        evictIdleStores();
        return store;
    }

    private ThumbnailStore existingStoreOrNull(Path folder) {
        try {
            return existingStore(folder);
        } catch (RuntimeException e) {
            LOG.error("Cannot open thumbnail store in {}", folder, e);
            eventBus.post(new EngineErrorEvent("open store in " + folder, e.getMessage()));
            return null;
        }
    }

    /** {@code store} is still the open store of {@code folder}; evicted or switched stores are closed. */
    private boolean isLive(Path folder, ThumbnailStore store) {
        return store != null && stores.get(folder) == store;
    }

    /** Closes least recently used stores beyond the limit, never the open folder's. */
    private void evictIdleStores() {
        Iterator<Map.Entry<Path, ThumbnailStore>> it = stores.entrySet().iterator();
        while (stores.size() > MAX_OPEN_STORES && it.hasNext()) {
            Map.Entry<Path, ThumbnailStore> eldest = it.next();
            if (eldest.getKey().equals(openedFolder))
                continue;
            it.remove();
            eldest.getValue().close();
            LOG.debug("Closed idle thumbnail store of {}", eldest.getKey());
        }
    }

    /** Number of stores currently open. */
    int openStoreCount() {
        return awaitEngine(stores::size);
    }

    // =====================================================================
    // Plumbing
    // =====================================================================

    private boolean invalidatedSince(String path, long seq) {
        return invalidatedAt.getOrDefault(path, 0L) > seq;
    }

    /**
     * Caches {@code value} unless its path was invalidated after {@code seq}.
     * An invalidation that races the put is seen by the second check and
     * undoes it.
     */
    private <V> boolean putIfCurrent(MemoryCache<V> cache, CacheKey key, V value, long seq) {
        if (invalidatedSince(key.path(), seq))
            return false;
        cache.put(key, value);
        if (invalidatedSince(key.path(), seq)) {
            cache.remove(key, value);
            return false;
        }
        return true;
    }

    private static void dropStale(String path, CompletableFuture<?> result) {
        LOG.debug("Discarding result for {}: invalidated while in flight", path);
        result.completeExceptionally(new RequestDroppedException(path, DecodeOutcome.Reason.CANCELLED));
    }

    private void fail(String path, DecodeMode mode, DecodeOutcome outcome, CompletableFuture<?> result) {
        if (outcome instanceof DecodeOutcome.Failed failed) {
            LOG.warn("Decode of {} ({}) failed: {}", path, mode, failed.error());
            eventBus.post(new DecodeFailedEvent(path, mode, failed.error()));
            result.completeExceptionally(new DecodeException(failed.error()));
        } else if (outcome instanceof DecodeOutcome.Dropped dropped) {
            LOG.debug("Request for {} ({}) dropped: {}", path, mode, dropped.reason());
            result.completeExceptionally(new RequestDroppedException(path, dropped.reason()));
        } else {
            result.completeExceptionally(new IllegalStateException("Unexpected outcome for " + path + ": " + outcome));
        }
    }

    private BiConsumer<Object, Throwable> logFailure(String action) {
        return (value, error) -> {
            if (error == null)
                return;
            Throwable cause = unwrap(error);
            LOG.error("Failed to {}", action, cause);
            eventBus.post(new EngineErrorEvent(action, cause.getMessage()));
        };
    }

    private static <T> BiConsumer<T, Throwable> relay(CompletableFuture<T> target) {
        return (value, error) -> {
            if (error != null)
                target.completeExceptionally(unwrap(error));
            else
                target.complete(value);
        };
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null)
            return error.getCause();
        return error;
    }

    private void runOnEngine(Runnable task, CompletableFuture<?> onRejected) {
        run(engineThread, task, onRejected);
    }

    private void runOnFolder(Runnable task, CompletableFuture<?> onRejected) {
        run(folderThread, task, onRejected);
    }

    private static void run(ExecutorService executor, Runnable task, CompletableFuture<?> onRejected) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            if (onRejected != null)
                onRejected.completeExceptionally(new IllegalStateException("Image engine is closed", e));
        }
    }

    private <T> T awaitEngine(Supplier<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        runOnEngine(() -> {
            try {
                future.complete(task.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }, future);
        return await(future);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the engine", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            throw new IllegalStateException(cause);
        }
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /** Current number of paths waiting in the missing-thumbnail queue. */
    public int missingPending() {
        return pump.pendingCount();
    }

    /**
     * Stops the pump and the loader (pending requests complete with
     * {@link RequestDroppedException}), then drains and closes every open
     * store.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;

        pump.close();
        loader.close();
        shutdown(folderThread, "folder");
        shutdown(engineThread, "engine");

        int storeCount = stores.size();
        stores.values().forEach(ThumbnailStore::close);
        stores.clear();
        viewCache.clear();
        thumbnailCache.clear();
        LOG.info("Image engine closed ({} stores)", storeCount);
    }

    private static void shutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Engine {} thread did not stop within 30s", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
