package ai.localizer.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.localizer.translate.TranslationContext;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PersistentTranslationCacheTest {

    private static final CacheKey HELLO = CacheKey.create("Hello", "en", "es", TranslationContext.UI);
    private static final CacheKey BYE = CacheKey.create("Bye", "en", "es", TranslationContext.UI);

    @TempDir
    Path tempDir;

    @Test
    void writesThroughToStore() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        PersistentTranslationCache cache = new PersistentTranslationCache(store, 10);

        cache.put(HELLO, "Hola");

        assertThat(store.get(HELLO.toStorageKey())).hasValueSatisfying(raw -> assertThat(raw).endsWith("|Hola"));
        assertThat(cache.get(HELLO)).contains("Hola");
    }

    @Test
    void evictedEntriesAreReloadedFromStore() {
        PersistentTranslationCache cache = new PersistentTranslationCache(new InMemoryKeyValueStore(), 1);
        cache.put(HELLO, "Hola");
        cache.put(BYE, "Adios");

        assertThat(cache.memorySize()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(HELLO)).contains("Hola");
        assertThat(cache.memorySize()).isEqualTo(1);
    }

    @Test
    void survivesRestartOverFileStore() {
        Path file = tempDir.resolve("cache.properties");
        new PersistentTranslationCache(new FileKeyValueStore(file), 10).put(HELLO, "Hola | amigo");

        PersistentTranslationCache reopened = new PersistentTranslationCache(new FileKeyValueStore(file), 10);

        assertThat(reopened.memorySize()).isZero();
        assertThat(reopened.get(HELLO)).contains("Hola | amigo");
        assertThat(reopened.size()).isEqualTo(1);
    }

    @Test
    void readFailureDegradesToMiss() {
        PersistentTranslationCache cache = new PersistentTranslationCache(new FailingStore(), 10);

        assertThat(cache.get(HELLO)).isEmpty();
    }

    @Test
    void writeFailurePropagates() {
        PersistentTranslationCache cache = new PersistentTranslationCache(new FailingStore(), 10);

        assertThatThrownBy(() -> cache.put(HELLO, "Hola")).isInstanceOf(CacheStorageException.class);
        assertThat(cache.memorySize()).isZero();
    }

    @Test
    void unreadableValuesAreIgnored() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.put(HELLO.toStorageKey(), "not-a-timestamp");

        assertThat(new PersistentTranslationCache(store, 10).get(HELLO)).isEmpty();
    }

    @Test
    void expiredPersistedEntriesAreRemoved() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        new PersistentTranslationCache(store, 10, Optional.of(Duration.ofHours(1)), clock).put(HELLO, "Hola");

        clock.advance(Duration.ofHours(2));
        PersistentTranslationCache reopened = new PersistentTranslationCache(store, 10, Optional.of(Duration.ofHours(1)), clock);

        assertThat(reopened.get(HELLO)).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void clearEmptiesBothTiers() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        PersistentTranslationCache cache = new PersistentTranslationCache(store, 10);
        cache.put(HELLO, "Hola");
        cache.put(BYE, "Adios");

        cache.remove(BYE);
        assertThat(cache.size()).isEqualTo(1);

        cache.clear();
        assertThat(cache.size()).isZero();
        assertThat(cache.memorySize()).isZero();
        assertThat(cache.get(HELLO)).isEmpty();
    }

    @Test
    void failedRemoveAndClearKeepMemoryTierInStepWithStore() {
        ReadOnlyAfterWrites store = new ReadOnlyAfterWrites();
        PersistentTranslationCache cache = new PersistentTranslationCache(store, 10);
        cache.put(HELLO, "Hola");
        cache.put(BYE, "Adios");
        store.readOnly = true;

        assertThatThrownBy(() -> cache.remove(BYE)).isInstanceOf(CacheStorageException.class);
        assertThatThrownBy(cache::clear).isInstanceOf(CacheStorageException.class);

        assertThat(cache.memorySize()).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(HELLO)).contains("Hola");
        assertThat(cache.get(BYE)).contains("Adios");
    }

    @Test
    void encodedValueKeepsSeparatorsInsideTranslation() {
        CacheEntry entry = CacheEntry.created("a|b|c", Instant.ofEpochMilli(42));

        assertThat(PersistentTranslationCache.encode(entry)).isEqualTo("42|a|b|c");
        assertThat(PersistentTranslationCache.decode("42|a|b|c")).contains(entry);
    }

    private static final class ReadOnlyAfterWrites extends InMemoryKeyValueStore {

        private boolean readOnly;

        @Override
        public void remove(String key) {
            rejectWhenReadOnly();
            super.remove(key);
        }

        @Override
        public void clear() {
            rejectWhenReadOnly();
            super.clear();
        }

        private void rejectWhenReadOnly() {
            if (readOnly) {
                throw new CacheStorageException("store is read-only", null);
            }
        }
    }

    private static final class FailingStore implements KeyValueStore {

        @Override
        public Map<String, String> readAll() {
            throw new CacheStorageException("store offline", null);
        }

        @Override
        public Optional<String> get(String key) {
            throw new CacheStorageException("store offline", null);
        }

        @Override
        public void put(String key, String value) {
            throw new CacheStorageException("store offline", null);
        }

        @Override
        public void remove(String key) {
            throw new CacheStorageException("store offline", null);
        }

        @Override
        public void clear() {
            throw new CacheStorageException("store offline", null);
        }
    }
}
