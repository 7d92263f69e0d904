package ai.localizer.translate;

import ai.localizer.cache.CacheKey;
import ai.localizer.cache.LruTranslationCache;
import ai.localizer.cache.TranslationCache;
import ai.localizer.placeholder.PlaceholderMasker;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator adding a translation cache and placeholder protection in front of a delegate
 * {@link Translator}. Readiness and preparation go straight to the delegate.
 *
 * <p>Concurrent misses for the same key may each call the delegate; the last write wins.
 */
public class CachingTranslator implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CachingTranslator.class);

    private final Translator delegate;
    private final TranslationCache cache;
    private final PlaceholderMasker masker;
    private final boolean protectPlaceholders;
    private final boolean cacheFailures;

    public CachingTranslator(Translator delegate) {
        this(delegate, new LruTranslationCache(), true, false);
    }

    public CachingTranslator(Translator delegate, TranslationCache cache, boolean protectPlaceholders, boolean cacheFailures) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.masker = new PlaceholderMasker();
        this.protectPlaceholders = protectPlaceholders;
        this.cacheFailures = cacheFailures;
    }

    @Override
    public String translate(String text, String sourceLanguageTag, String targetLanguageTag, TranslationContext context) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sourceLanguageTag, "sourceLanguageTag");
        Objects.requireNonNull(targetLanguageTag, "targetLanguageTag");
        Objects.requireNonNull(context, "context");
        if (sourceLanguageTag.equalsIgnoreCase(targetLanguageTag) || text.isBlank()) {
            return text;
        }

        CacheKey key = CacheKey.create(text, sourceLanguageTag, targetLanguageTag, context);
        Optional<String> cached = cache.get(key);
        if (cached.isPresent()) {
            LOGGER.debug("Cache hit for {}", key.toStorageKey());
            return cached.get();
        }
        LOGGER.debug("Cache miss for {} ({} chars)", key.toStorageKey(), text.length());

        String translated;
        try {
            translated = protectPlaceholders
                    ? masker.translateWithProtection(text,
                            masked -> delegate.translate(masked, sourceLanguageTag, targetLanguageTag, context))
                    : delegate.translate(text, sourceLanguageTag, targetLanguageTag, context);
        } catch (TranslationException ex) {
            if (cacheFailures) {
                LOGGER.debug("Pinning original text for failed key {}", key.toStorageKey());
                cache.put(key, text);
            }
            throw ex;
        }
        if (translated == null) {
            throw new TranslationException("Translator returned no text for " + key.toStorageKey());
        }
        cache.put(key, translated);
        return translated;
    }

    @Override
    public boolean isReady(String sourceLanguageTag, String targetLanguageTag) {
        return delegate.isReady(sourceLanguageTag, targetLanguageTag);
    }

    @Override
    public PrepareResult prepare(String sourceLanguageTag, String targetLanguageTag) {
        return delegate.prepare(sourceLanguageTag, targetLanguageTag);
    }

    @Override
    public void close() {
        delegate.close();
    }

    public void clearCache() {
        cache.clear();
    }

    public int cacheSize() {
        return cache.size();
    }
}
