package ai.localizer.cache;

import static org.assertj.core.api.Assertions.assertThat;

import ai.localizer.translate.TranslationContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LruTranslationCacheTest {

    private static final CacheKey K1 = key("one");
    private static final CacheKey K2 = key("two");
    private static final CacheKey K3 = key("three");
    private static final CacheKey K4 = key("four");

    @Test
    @DisplayName("Evicts the oldest entry once capacity is exceeded")
    void evictsLeastRecentlyInserted() {
        LruTranslationCache cache = new LruTranslationCache(3);
        cache.put(K1, "uno");
        cache.put(K2, "dos");
        cache.put(K3, "tres");

        cache.put(K4, "cuatro");

        assertThat(cache.get(K1)).isEmpty();
        assertThat(cache.get(K2)).contains("dos");
        assertThat(cache.get(K3)).contains("tres");
        assertThat(cache.get(K4)).contains("cuatro");
        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.evictionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A read promotes the entry so the next eviction skips it")
    void readPromotesEntry() {
        LruTranslationCache cache = new LruTranslationCache(3);
        cache.put(K1, "uno");
        cache.put(K2, "dos");
        cache.put(K3, "tres");

        assertThat(cache.get(K1)).contains("uno");
        cache.put(K4, "cuatro");

        assertThat(cache.get(K1)).contains("uno");
        assertThat(cache.get(K2)).isEmpty();
    }

    @Test
    void overwritingKeepsSizeAndReturnsLatestValue() {
        LruTranslationCache cache = new LruTranslationCache(3);
        cache.put(K1, "uno");
        cache.put(K1, "UNO");

        assertThat(cache.get(K1)).contains("UNO");
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void removeAndClear() {
        LruTranslationCache cache = new LruTranslationCache(3);
        cache.put(K1, "uno");
        cache.put(K2, "dos");

        cache.remove(K1);
        assertThat(cache.get(K1)).isEmpty();
        assertThat(cache.size()).isEqualTo(1);

        cache.clear();
        assertThat(cache.size()).isZero();
        assertThat(cache.get(K2)).isEmpty();
    }

    @Test
    void zeroCapacityStoresNothing() {
        LruTranslationCache cache = new LruTranslationCache(0);
        cache.put(K1, "uno");

        assertThat(cache.get(K1)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void expiredEntriesAreMisses() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        LruTranslationCache cache = new LruTranslationCache(10, Optional.of(Duration.ofMinutes(5)), clock);
        cache.put(K1, "uno");

        clock.advance(Duration.ofMinutes(4));
        assertThat(cache.get(K1)).contains("uno");

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get(K1)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void concurrentAccessNeverExceedsCapacity() throws Exception {
        LruTranslationCache cache = new LruTranslationCache(50);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int worker = 0; worker < 8; worker++) {
                int offset = worker;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        CacheKey key = key("text-" + ((i * 8 + offset) % 200));
                        cache.put(key, "value-" + i);
                        cache.get(key);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(cache.size()).isLessThanOrEqualTo(50);
    }

    private static CacheKey key(String text) {
        return CacheKey.create(text, "en", "es", TranslationContext.UI);
    }
}
