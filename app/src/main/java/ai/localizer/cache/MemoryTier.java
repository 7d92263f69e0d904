package ai.localizer.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Access-ordered map with least-recently-used eviction. Not thread-safe: owners guard every call
 * with their own lock.
 */
final class MemoryTier {

    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final int capacity;
    private long evictionCount;

    MemoryTier(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be zero or greater");
        }
        this.capacity = capacity;
    }

    /**
     * Returns the live entry for {@code key}, promoting it to most recently used. An expired entry
     * is dropped and reported absent.
     */
    Optional<CacheEntry> get(String key, Optional<Duration> ttl, Instant now) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(ttl, now)) {
            entries.remove(key);
            return Optional.empty();
        }
        CacheEntry touched = entry.touch(now);
        entries.put(key, touched);
        return Optional.of(touched);
    }

    void put(String key, CacheEntry entry) {
        entries.put(key, entry);
        evictOverflow();
    }

    void remove(String key) {
        entries.remove(key);
    }

    void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    int capacity() {
        return capacity;
    }

    long evictionCount() {
        return evictionCount;
    }

    private void evictOverflow() {
        Iterator<Map.Entry<String, CacheEntry>> iterator = entries.entrySet().iterator();
        while (entries.size() > capacity && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
            evictionCount++;
        }
    }
}
