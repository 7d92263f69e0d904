package ai.localizer.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-tier cache: a bounded LRU memory tier in front of a {@link KeyValueStore}.
 *
 * <p>The persistent tier is the source of truth for {@link #size()}. Reads that fail or find an
 * unreadable value in the store degrade to a miss; writes that fail propagate. Both tiers are
 * updated under the same lock, store first, so a failed write leaves the memory tier untouched.
 */
public class PersistentTranslationCache implements TranslationCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(PersistentTranslationCache.class);
    private static final char SEPARATOR = '|';

    private final MemoryTier memory;
    private final KeyValueStore store;
    private final Optional<Duration> ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public PersistentTranslationCache(KeyValueStore store, int maxMemoryEntries) {
        this(store, maxMemoryEntries, Optional.empty(), Clock.systemUTC());
    }

    public PersistentTranslationCache(KeyValueStore store, int maxMemoryEntries, Optional<Duration> ttl, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.memory = new MemoryTier(maxMemoryEntries);
        this.ttl = ttl == null ? Optional.empty() : ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<String> get(CacheKey key) {
        Objects.requireNonNull(key, "key");
        String storageKey = key.toStorageKey();
        lock.lock();
        try {
            Instant now = clock.instant();
            Optional<CacheEntry> hot = memory.get(storageKey, ttl, now);
            if (hot.isPresent()) {
                return hot.map(CacheEntry::value);
            }
            Optional<CacheEntry> persisted = readPersisted(storageKey);
            if (persisted.isEmpty()) {
                return Optional.empty();
            }
            CacheEntry entry = persisted.get();
            if (entry.isExpired(ttl, now)) {
                dropExpired(storageKey);
                return Optional.empty();
            }
            memory.put(storageKey, entry.touch(now));
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(CacheKey key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        String storageKey = key.toStorageKey();
        lock.lock();
        try {
            CacheEntry entry = CacheEntry.created(value, clock.instant());
            store.put(storageKey, encode(entry));
            memory.put(storageKey, entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(CacheKey key) {
        Objects.requireNonNull(key, "key");
        String storageKey = key.toStorageKey();
        lock.lock();
        try {
            store.remove(storageKey);
            memory.remove(storageKey);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            store.clear();
            memory.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of entries currently held in the memory tier.
     */
    public int memorySize() {
        lock.lock();
        try {
            return memory.size();
        } finally {
            lock.unlock();
        }
    }

    private Optional<CacheEntry> readPersisted(String storageKey) {
        Optional<String> raw;
        try {
            raw = store.get(storageKey);
        } catch (RuntimeException ex) {
            LOGGER.warn("Persistent cache read failed for {}; treating as miss", storageKey, ex);
            return Optional.empty();
        }
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Optional<CacheEntry> decoded = decode(raw.get());
        if (decoded.isEmpty()) {
            LOGGER.warn("Ignoring unreadable persistent cache value for {}", storageKey);
        }
        return decoded;
    }

    private void dropExpired(String storageKey) {
        try {
            store.remove(storageKey);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to remove expired cache entry {}", storageKey, ex);
        }
    }

    static String encode(CacheEntry entry) {
        return entry.createdAt().toEpochMilli() + String.valueOf(SEPARATOR) + entry.value();
    }

    static Optional<CacheEntry> decode(String raw) {
        int separator = raw.indexOf(SEPARATOR);
        if (separator <= 0) {
            return Optional.empty();
        }
        try {
            long createdAt = Long.parseLong(raw.substring(0, separator));
            return Optional.of(CacheEntry.created(raw.substring(separator + 1), Instant.ofEpochMilli(createdAt)));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
