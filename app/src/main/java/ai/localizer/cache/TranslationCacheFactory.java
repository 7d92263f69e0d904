package ai.localizer.cache;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the cache implementation a {@link CachePolicy} asks for.
 */
public final class TranslationCacheFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationCacheFactory.class);

    private TranslationCacheFactory() {
    }

    public static TranslationCache create(CachePolicy policy, Optional<KeyValueStore> store) {
        return create(policy, store, Clock.systemUTC());
    }

    public static TranslationCache create(CachePolicy policy, Optional<KeyValueStore> store, Clock clock) {
        Objects.requireNonNull(policy, "policy");
        store = store == null ? Optional.empty() : store;
        if (policy.isNoOp()) {
            LOGGER.debug("Translation caching disabled by policy");
            return new NoOpTranslationCache();
        }
        if (policy.persist()) {
            if (store.isPresent()) {
                return new PersistentTranslationCache(store.get(), policy.maxMemoryEntries(), policy.ttl(), clock);
            }
            LOGGER.warn("Cache policy requests persistence but no store is configured; using memory only");
        }
        return new LruTranslationCache(policy.maxMemoryEntries(), policy.ttl(), clock);
    }
}
