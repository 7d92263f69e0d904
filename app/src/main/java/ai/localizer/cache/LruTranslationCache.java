package ai.localizer.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded in-memory cache evicting the least recently accessed entry once capacity is exceeded.
 * Every operation runs under a single lock so promotion on read and eviction on write never
 * interleave.
 */
public class LruTranslationCache implements TranslationCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(LruTranslationCache.class);

    private final MemoryTier memory;
    private final Optional<Duration> ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public LruTranslationCache() {
        this(CachePolicy.DEFAULT_MAX_MEMORY_ENTRIES);
    }

    public LruTranslationCache(int maxEntries) {
        this(maxEntries, Optional.empty(), Clock.systemUTC());
    }

    public LruTranslationCache(int maxEntries, Optional<Duration> ttl, Clock clock) {
        this.memory = new MemoryTier(maxEntries);
        this.ttl = ttl == null ? Optional.empty() : ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<String> get(CacheKey key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            return memory.get(key.toStorageKey(), ttl, clock.instant()).map(CacheEntry::value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(CacheKey key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            long evictedBefore = memory.evictionCount();
            memory.put(key.toStorageKey(), CacheEntry.created(value, clock.instant()));
            long evicted = memory.evictionCount() - evictedBefore;
            if (evicted > 0) {
                LOGGER.debug("Evicted {} least recently used entries (capacity {})", evicted, memory.capacity());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(CacheKey key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            memory.remove(key.toStorageKey());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            memory.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return memory.size();
        } finally {
            lock.unlock();
        }
    }

    public long evictionCount() {
        lock.lock();
        try {
            return memory.evictionCount();
        } finally {
            lock.unlock();
        }
    }
}
