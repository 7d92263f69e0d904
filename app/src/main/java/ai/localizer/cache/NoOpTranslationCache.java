package ai.localizer.cache;

import java.util.Optional;

/**
 * Cache that stores nothing; every lookup misses.
 */
public final class NoOpTranslationCache implements TranslationCache {

    @Override
    public Optional<String> get(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(CacheKey key, String value) {
    }

    @Override
    public void remove(CacheKey key) {
    }

    @Override
    public void clear() {
    }

    @Override
    public int size() {
        return 0;
    }
}
