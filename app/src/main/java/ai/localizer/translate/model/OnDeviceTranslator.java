package ai.localizer.translate.model;

import ai.localizer.translate.ModelDownloadException;
import ai.localizer.translate.ModelNotAvailableException;
import ai.localizer.translate.PrepareResult;
import ai.localizer.translate.TranslationContext;
import ai.localizer.translate.TranslationException;
import ai.localizer.translate.Translator;
import ai.localizer.translate.UnsupportedLanguageException;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translator running local models that have to be downloaded before use.
 *
 * <p>{@link #prepare(String, String)} downloads whatever the pair is missing. Concurrent
 * preparations of the same language share one download. Progress is published as
 * {@link DownloadState} transitions to registered listeners; removing a listener never affects
 * the download itself.
 */
public class OnDeviceTranslator implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(OnDeviceTranslator.class);
    private static final Duration DEFAULT_DOWNLOAD_TIMEOUT = Duration.ofMinutes(10);

    private final ModelRegistry registry;
    private final TranslationEngine engine;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Duration downloadTimeout;
    private final Map<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();
    private final List<DownloadStateListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile DownloadState downloadState = DownloadState.idle();

    public OnDeviceTranslator(ModelRegistry registry, TranslationEngine engine) {
        this(registry, engine, null, DEFAULT_DOWNLOAD_TIMEOUT);
    }

    /**
     * @param executor runs downloads and {@link #prepareAsync}; needs more than one thread. When
     *                 {@code null} the translator creates and owns one
     */
    public OnDeviceTranslator(ModelRegistry registry, TranslationEngine engine, Executor executor, Duration downloadTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.downloadTimeout = Objects.requireNonNull(downloadTimeout, "downloadTimeout");
        if (downloadTimeout.isNegative() || downloadTimeout.isZero()) {
            throw new IllegalArgumentException("downloadTimeout must be positive");
        }
        if (executor == null) {
            this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads());
            this.executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.executor = executor;
        }
    }

    @Override
    public String translate(String text, String sourceLanguageTag, String targetLanguageTag, TranslationContext context) {
        ensureOpen();
        if (text == null || text.isBlank()) {
            return text == null ? "" : text;
        }
        String sourceCode = requireSupported(sourceLanguageTag);
        String targetCode = requireSupported(targetLanguageTag);
        if (sourceCode.equals(targetCode)) {
            return text;
        }
        if (!registry.isDownloaded(sourceCode)) {
            throw new ModelNotAvailableException(sourceLanguageTag);
        }
        if (!registry.isDownloaded(targetCode)) {
            throw new ModelNotAvailableException(targetLanguageTag);
        }
        try {
            String translated = engine.translate(text, sourceCode, targetCode);
            if (translated == null) {
                throw new TranslationException("On-device engine returned no text");
            }
            return translated;
        } catch (TranslationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new TranslationException("On-device translation failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean isReady(String sourceLanguageTag, String targetLanguageTag) {
        if (closed.get() || !LanguageCodes.isSupported(sourceLanguageTag) || !LanguageCodes.isSupported(targetLanguageTag)) {
            return false;
        }
        try {
            return registry.isDownloaded(LanguageCodes.normalize(sourceLanguageTag))
                    && registry.isDownloaded(LanguageCodes.normalize(targetLanguageTag));
        } catch (RuntimeException ex) {
            LOGGER.warn("Model registry check failed for {} -> {}", sourceLanguageTag, targetLanguageTag, ex);
            return false;
        }
    }

    @Override
    public PrepareResult prepare(String sourceLanguageTag, String targetLanguageTag) {
        if (closed.get()) {
            return PrepareResult.failed(new TranslationException("Translator is closed"));
        }
        if (!LanguageCodes.isSupported(sourceLanguageTag)) {
            return PrepareResult.failed(new UnsupportedLanguageException(sourceLanguageTag));
        }
        if (!LanguageCodes.isSupported(targetLanguageTag)) {
            return PrepareResult.failed(new UnsupportedLanguageException(targetLanguageTag));
        }
        Set<String> missing = new LinkedHashSet<>();
        for (String code : List.of(LanguageCodes.normalize(sourceLanguageTag), LanguageCodes.normalize(targetLanguageTag))) {
            try {
                if (!registry.isDownloaded(code)) {
                    missing.add(code);
                }
            } catch (RuntimeException ex) {
                LOGGER.warn("Model registry check failed for {}", code, ex);
                return PrepareResult.failed(new ModelDownloadException(code, ex));
            }
        }
        if (missing.isEmpty()) {
            return PrepareResult.ready();
        }

        long deadline = System.nanoTime() + downloadTimeout.toNanos();
        for (String code : missing) {
            CompletableFuture<Void> download = downloadOnce(code);
            try {
                download.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                return PrepareResult.failed(new ModelDownloadException(code, cause));
            } catch (TimeoutException ex) {
                LOGGER.warn("Model download for {} did not finish within {}", code, downloadTimeout);
                return PrepareResult.failed(new ModelDownloadException(code, ex));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return PrepareResult.failed(new TranslationException("Preparation interrupted", ex));
            }
        }
        publish(new DownloadState.Complete());
        return PrepareResult.ready();
    }

    /**
     * Runs {@link #prepare(String, String)} on the download executor.
     */
    public CompletableFuture<PrepareResult> prepareAsync(String sourceLanguageTag, String targetLanguageTag) {
        return CompletableFuture.supplyAsync(() -> prepare(sourceLanguageTag, targetLanguageTag), executor);
    }

    public DownloadState downloadState() {
        return downloadState;
    }

    public void addDownloadStateListener(DownloadStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeDownloadStateListener(DownloadStateListener listener) {
        listeners.remove(listener);
    }

    public Set<String> downloadedModels() {
        return registry.downloadedModels();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        listeners.clear();
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
        LOGGER.debug("On-device translator closed");
    }

    private CompletableFuture<Void> downloadOnce(String code) {
        CompletableFuture<Void> created = new CompletableFuture<>();
        CompletableFuture<Void> existing = inFlight.putIfAbsent(code, created);
        if (existing != null) {
            LOGGER.debug("Joining in-flight model download for {}", code);
            return existing;
        }
        try {
            // A download that finished since the caller's check has already left the map.
            if (registry.isDownloaded(code)) {
                inFlight.remove(code, created);
                created.complete(null);
                return created;
            }
            executor.execute(() -> runDownload(code, created));
        } catch (RuntimeException ex) {
            inFlight.remove(code, created);
            created.completeExceptionally(ex);
        }
        return created;
    }

    private void runDownload(String code, CompletableFuture<Void> future) {
        LOGGER.info("Downloading language model {}", code);
        publish(new DownloadState.Downloading(0.0, code));
        try {
            registry.download(code, progress -> publish(new DownloadState.Downloading(progress, code)));
            inFlight.remove(code, future);
            LOGGER.info("Language model {} downloaded", code);
            future.complete(null);
        } catch (IOException | RuntimeException ex) {
            inFlight.remove(code, future);
            LOGGER.warn("Language model download failed for {}", code, ex);
            publish(new DownloadState.Failed(ex));
            future.completeExceptionally(ex);
        }
    }

    private void publish(DownloadState state) {
        downloadState = state;
        for (DownloadStateListener listener : listeners) {
            try {
                listener.onStateChanged(state);
            } catch (RuntimeException ex) {
                LOGGER.warn("Download state listener failed", ex);
            }
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new TranslationException("Translator is closed");
        }
    }

    private static String requireSupported(String languageTag) {
        if (!LanguageCodes.isSupported(languageTag)) {
            throw new UnsupportedLanguageException(languageTag);
        }
        return LanguageCodes.normalize(languageTag);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "model-download-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
