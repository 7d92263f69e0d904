package ai.localizer.translate.model;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleConsumer;

/**
 * Simulated model registry. Downloads finish in a fixed number of progress steps; languages
 * marked as failing raise an {@link IOException} instead.
 */
public class InMemoryModelRegistry implements ModelRegistry {

    private final Set<String> downloaded = ConcurrentHashMap.newKeySet();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final AtomicInteger downloadCount = new AtomicInteger();
    private final int steps;
    private final Duration stepDelay;

    public InMemoryModelRegistry() {
        this(4, Duration.ZERO);
    }

    public InMemoryModelRegistry(int steps, Duration stepDelay) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be at least 1");
        }
        this.steps = steps;
        this.stepDelay = Objects.requireNonNull(stepDelay, "stepDelay");
    }

    public InMemoryModelRegistry preinstall(String... languageCodes) {
        for (String code : languageCodes) {
            downloaded.add(LanguageCodes.normalize(code));
        }
        return this;
    }

    public InMemoryModelRegistry failDownloadsFor(String... languageCodes) {
        for (String code : languageCodes) {
            failing.add(LanguageCodes.normalize(code));
        }
        return this;
    }

    public int downloadCount() {
        return downloadCount.get();
    }

    @Override
    public boolean isDownloaded(String languageCode) {
        return downloaded.contains(languageCode);
    }

    @Override
    public void download(String languageCode, DoubleConsumer progressListener) throws IOException {
        downloadCount.incrementAndGet();
        if (failing.contains(languageCode)) {
            throw new IOException("Simulated download failure for " + languageCode);
        }
        for (int step = 1; step <= steps; step++) {
            pause();
            progressListener.accept((double) step / steps);
        }
        downloaded.add(languageCode);
    }

    @Override
    public Set<String> downloadedModels() {
        return Set.copyOf(downloaded);
    }

    private void pause() throws IOException {
        if (stepDelay.isZero()) {
            return;
        }
        try {
            Thread.sleep(stepDelay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted", ex);
        }
    }
}
