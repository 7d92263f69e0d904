package ai.localizer.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache configuration.
 *
 * @param maxMemoryEntries maximum number of entries held in memory, zero disables the memory tier
 * @param persist          whether entries are also written to a persistent store
 * @param ttl              time-to-live of an entry, empty means entries never expire
 * @param cacheFailures    whether a failed translation pins the original text in the cache
 */
public record CachePolicy(int maxMemoryEntries, boolean persist, Optional<Duration> ttl, boolean cacheFailures) {

    public static final int DEFAULT_MAX_MEMORY_ENTRIES = 1000;

    public static final CachePolicy DEFAULT = new CachePolicy(DEFAULT_MAX_MEMORY_ENTRIES, true, Optional.empty(), false);
    public static final CachePolicy MEMORY_ONLY = new CachePolicy(DEFAULT_MAX_MEMORY_ENTRIES, false, Optional.empty(), false);
    public static final CachePolicy NO_CACHE = new CachePolicy(0, false, Optional.empty(), false);

    public CachePolicy {
        if (maxMemoryEntries < 0) {
            throw new IllegalArgumentException("maxMemoryEntries must be zero or greater");
        }
        ttl = ttl == null ? Optional.empty() : ttl;
        ttl.ifPresent(value -> {
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException("ttl must be positive");
            }
        });
    }

    public boolean isNoOp() {
        return maxMemoryEntries == 0 && !persist;
    }

    public CachePolicy withTtl(Duration value) {
        return new CachePolicy(maxMemoryEntries, persist, Optional.ofNullable(value), cacheFailures);
    }

    public CachePolicy withMaxMemoryEntries(int value) {
        return new CachePolicy(value, persist, ttl, cacheFailures);
    }
}
