package ai.localizer.cache;

import java.util.Optional;

/**
 * Key to translated-text store. Implementations must be safe for concurrent use.
 */
public interface TranslationCache {

    Optional<String> get(CacheKey key);

    /**
     * Stores {@code value}, silently replacing any previous value for the key.
     */
    void put(CacheKey key, String value);

    /**
     * Removes the entry for {@code key}; does nothing if absent.
     */
    void remove(CacheKey key);

    void clear();

    int size();
}
