package de.bsommerfeld.swiftview.engine.cache;

import de.bsommerfeld.swiftview.core.domain.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local map from {@link CacheKey} to ready render data. Consulted
 * before the store or the decoder. A {@code FULL} entry never answers a
 * {@code THUMBNAIL} lookup or the other way round, since the mode is part of
 * the key.
 *
 * <p>
 * Unbounded for now.
 */
public class MemoryCache<V> {

    // TODO: LRU eviction with a configurable byte budget per cache (view recency vs. folder coverage)

    private static final Logger LOG = LoggerFactory.getLogger(MemoryCache.class);

    private final String name;
    private final Map<CacheKey, V> entries = new ConcurrentHashMap<>();

    public MemoryCache(String name) {
        this.name = name;
    }

    /** @return the cached value, or {@code null} on a miss */
    public V get(CacheKey key) {
        return entries.get(key);
    }

    public void put(CacheKey key, V value) {
        entries.put(key, value);
    }

    /** Removes the entry for {@code key} only while it still maps to {@code value}. */
    public boolean remove(CacheKey key, V value) {
        return entries.remove(key, value);
    }

    /** Removes every entry for {@code path}, whatever its mode or size. */
    public int invalidate(String path) {
        int before = entries.size();
        entries.keySet().removeIf(key -> key.path().equals(path));
        int removed = before - entries.size();
        if (removed > 0)
            LOG.debug("Invalidated {} {} entries for {}", removed, name, path);
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public String name() {
        return name;
    }
}
