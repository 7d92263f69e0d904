package ai.localizer.localize;

import ai.localizer.cache.KeyValueStore;
import ai.localizer.cache.TranslationCache;
import ai.localizer.cache.TranslationCacheFactory;
import ai.localizer.translate.CachingTranslator;
import ai.localizer.translate.PrepareResult;
import ai.localizer.translate.TranslationContext;
import ai.localizer.translate.TranslationException;
import ai.localizer.translate.Translator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application-facing entry point: translates from the configured source language into the
 * currently selected target language through a cached, placeholder-safe translator.
 *
 * <p>{@link #translate(String, TranslationContext)} never throws; on any failure it logs and
 * returns the original text. Build one instance at startup and share it; closing it closes the
 * translator it was given.
 */
public class LocalizationService implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalizationService.class);
    private static final int DEFAULT_WORKERS = 4;

    private final LocalizationSettings settings;
    private final LanguageSelection languageSelection;
    private final TranslationCache cache;
    private final ExecutorService executor;
    private volatile CachingTranslator translator;

    public LocalizationService(LocalizationSettings settings, Translator translator, Optional<KeyValueStore> store) {
        this(settings, translator, store,
                new LanguageSelection(settings.supportedLanguages(), settings.sourceLanguageTag()));
    }

    public LocalizationService(LocalizationSettings settings, Translator translator, Optional<KeyValueStore> store,
                               LanguageSelection languageSelection) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.languageSelection = Objects.requireNonNull(languageSelection, "languageSelection");
        this.cache = TranslationCacheFactory.create(settings.cachePolicy(), store);
        this.executor = Executors.newFixedThreadPool(DEFAULT_WORKERS, workerThreads());
        this.translator = translator == null ? null : wrap(translator);
        LOGGER.info("Localization initialized: source={} target={} supported={}",
                settings.sourceLanguageTag(), languageSelection.current(), languageSelection.supportedTags().size());
    }

    public String translate(String text) {
        return translate(text, TranslationContext.UI);
    }

    /**
     * Translates {@code text} into the current target language, returning it unchanged when no
     * translator is configured, the languages match, or translation fails.
     */
    public String translate(String text, TranslationContext context) {
        if (text == null) {
            return "";
        }
        CachingTranslator active = translator;
        if (active == null) {
            LOGGER.warn("No translator configured, returning original text");
            return text;
        }
        String source = settings.sourceLanguageTag();
        String target = languageSelection.current();
        if (settings.matchPolicy().isSameLanguage(source, target)) {
            return text;
        }
        try {
            return active.translate(text, source, target, context == null ? TranslationContext.UI : context);
        } catch (RuntimeException ex) {
            LOGGER.error("Translation {} -> {} failed for text of {} chars; returning original",
                    source, target, text.length(), ex);
            return text;
        }
    }

    /**
     * Runs {@link #translate(String, TranslationContext)} on the service's worker pool. Cancelling
     * the returned future leaves the cache consistent.
     */
    public CompletableFuture<String> translateAsync(String text, TranslationContext context) {
        return CompletableFuture.supplyAsync(() -> translate(text, context), executor);
    }

    public boolean isReady() {
        CachingTranslator active = translator;
        if (active == null) {
            return false;
        }
        try {
            return active.isReady(settings.sourceLanguageTag(), languageSelection.current());
        } catch (RuntimeException ex) {
            LOGGER.warn("Readiness check failed", ex);
            return false;
        }
    }

    public PrepareResult prepare() {
        CachingTranslator active = translator;
        if (active == null) {
            return PrepareResult.ready();
        }
        String target = languageSelection.current();
        try {
            PrepareResult result = active.prepare(settings.sourceLanguageTag(), target);
            LOGGER.debug("Prepared {} -> {}: {}", settings.sourceLanguageTag(), target, result);
            return result == null ? PrepareResult.ready() : result;
        } catch (TranslationException ex) {
            return PrepareResult.failed(ex);
        } catch (RuntimeException ex) {
            return PrepareResult.failed(new TranslationException("Preparation failed: " + ex.getMessage(), ex));
        }
    }

    public CompletableFuture<PrepareResult> prepareAsync() {
        return CompletableFuture.supplyAsync(this::prepare, executor);
    }

    public void clearCache() {
        cache.clear();
        LOGGER.info("Translation cache cleared");
    }

    public int cacheSize() {
        return cache.size();
    }

    /**
     * Replaces the backing translator, keeping the existing cache. The previous translator is not
     * closed.
     */
    public void setTranslator(Translator replacement) {
        translator = wrap(Objects.requireNonNull(replacement, "replacement"));
    }

    public String currentLanguage() {
        return languageSelection.current();
    }

    public void selectLanguage(String languageTag) {
        languageSelection.select(languageTag);
    }

    public LanguageSelection languageSelection() {
        return languageSelection;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        CachingTranslator active = translator;
        if (active != null) {
            active.close();
        }
    }

    private CachingTranslator wrap(Translator delegate) {
        return new CachingTranslator(delegate, cache, settings.protectPlaceholders(), settings.cachePolicy().cacheFailures());
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "localizer-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
