package ai.localizer.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A cached translation with the timestamps needed for recency eviction and expiry.
 */
public record CacheEntry(String value, Instant createdAt, Instant lastAccessedAt) {

    public CacheEntry {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(createdAt, "createdAt");
        lastAccessedAt = lastAccessedAt == null ? createdAt : lastAccessedAt;
    }

    public static CacheEntry created(String value, Instant now) {
        return new CacheEntry(value, now, now);
    }

    public CacheEntry touch(Instant now) {
        return new CacheEntry(value, createdAt, now);
    }

    public boolean isExpired(Optional<Duration> ttl, Instant now) {
        return ttl.map(limit -> !createdAt.plus(limit).isAfter(now)).orElse(false);
    }
}
