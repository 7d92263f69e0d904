package ai.localizer.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.localizer.cache.CacheKey;
import ai.localizer.cache.LruTranslationCache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CachingTranslatorTest {

    @Test
    @DisplayName("Same source and target returns the input without calling the delegate")
    void sameLanguageShortCircuits() {
        RecordingTranslator delegate = new RecordingTranslator(text -> "translated");
        CachingTranslator translator = new CachingTranslator(delegate);

        assertThat(translator.translate("Hello", "en", "EN", TranslationContext.UI)).isEqualTo("Hello");
        assertThat(delegate.calls()).isZero();
        assertThat(translator.cacheSize()).isZero();
    }

    @Test
    void blankTextIsReturnedUnchanged() {
        RecordingTranslator delegate = new RecordingTranslator(text -> "x");
        CachingTranslator translator = new CachingTranslator(delegate);

        assertThat(translator.translate("   ", "en", "es", TranslationContext.UI)).isEqualTo("   ");
        assertThat(delegate.calls()).isZero();
    }

    @Test
    void secondCallIsServedFromCache() {
        RecordingTranslator delegate = new RecordingTranslator(text -> "Hola");
        CachingTranslator translator = new CachingTranslator(delegate);

        assertThat(translator.translate("Hello", "en", "es", TranslationContext.UI)).isEqualTo("Hola");
        delegate.respondWith(text -> "changed");
        assertThat(translator.translate("Hello", "en", "es", TranslationContext.UI)).isEqualTo("Hola");

        assertThat(delegate.calls()).isEqualTo(1);
        assertThat(translator.cacheSize()).isEqualTo(1);
    }

    @Test
    void contextIsPartOfCacheIdentity() {
        RecordingTranslator delegate = new RecordingTranslator(text -> "Guardar");
        CachingTranslator translator = new CachingTranslator(delegate);

        translator.translate("Save", "en", "es", TranslationContext.UI);
        translator.translate("Save", "en", "es", TranslationContext.SYSTEM);

        assertThat(delegate.calls()).isEqualTo(2);
    }

    @Test
    void placeholdersAreMaskedBeforeDelegateAndRestoredAfter() {
        RecordingTranslator delegate = new RecordingTranslator(masked -> masked.replace("Hello", "Hola"));
        CachingTranslator translator = new CachingTranslator(delegate);

        String result = translator.translate("Hello {name}, %d new", "en", "es", TranslationContext.UI);

        assertThat(delegate.received).singleElement().satisfies(sent ->
                assertThat(sent).doesNotContain("{name}").doesNotContain("%d"));
        assertThat(result).isEqualTo("Hola {name}, %d new");
    }

    @Test
    void protectionCanBeDisabled() {
        RecordingTranslator delegate = new RecordingTranslator(text -> text);
        CachingTranslator translator = new CachingTranslator(delegate, new LruTranslationCache(), false, false);

        translator.translate("Hello {name}", "en", "es", TranslationContext.UI);

        assertThat(delegate.received).containsExactly("Hello {name}");
    }

    @Test
    void failuresPropagateAndAreNotCached() {
        RecordingTranslator delegate = new RecordingTranslator(text -> {
            throw new TranslationException("engine down");
        });
        CachingTranslator translator = new CachingTranslator(delegate);

        assertThatThrownBy(() -> translator.translate("Hello", "en", "es", TranslationContext.UI))
                .isInstanceOf(TranslationException.class)
                .hasMessage("engine down");
        assertThat(translator.cacheSize()).isZero();

        delegate.respondWith(text -> "Hola");
        assertThat(translator.translate("Hello", "en", "es", TranslationContext.UI)).isEqualTo("Hola");
    }

    @Test
    void cachedFailuresPinTheOriginalText() {
        LruTranslationCache cache = new LruTranslationCache();
        RecordingTranslator delegate = new RecordingTranslator(text -> {
            throw new ModelNotAvailableException("es");
        });
        CachingTranslator translator = new CachingTranslator(delegate, cache, true, true);

        assertThatThrownBy(() -> translator.translate("Hello", "en", "es", TranslationContext.UI))
                .isInstanceOf(ModelNotAvailableException.class);

        assertThat(cache.get(CacheKey.create("Hello", "en", "es", TranslationContext.UI))).contains("Hello");
        assertThat(translator.translate("Hello", "en", "es", TranslationContext.UI)).isEqualTo("Hello");
        assertThat(delegate.calls()).isEqualTo(1);
    }

    @Test
    void nullDelegateResultIsAFailure() {
        CachingTranslator translator = new CachingTranslator(new RecordingTranslator(text -> null),
                new LruTranslationCache(), false, false);

        assertThatThrownBy(() -> translator.translate("Hello", "en", "es", TranslationContext.UI))
                .isInstanceOf(TranslationException.class);
        assertThat(translator.cacheSize()).isZero();
    }

    @Test
    void clearCacheForcesRetranslation() {
        RecordingTranslator delegate = new RecordingTranslator(text -> "Hola");
        CachingTranslator translator = new CachingTranslator(delegate);
        translator.translate("Hello", "en", "es", TranslationContext.UI);

        translator.clearCache();
        translator.translate("Hello", "en", "es", TranslationContext.UI);

        assertThat(delegate.calls()).isEqualTo(2);
    }

    @Test
    void closeReachesDelegate() {
        RecordingTranslator delegate = new RecordingTranslator(text -> text);

        new CachingTranslator(delegate).close();

        assertThat(delegate.closed).isTrue();
    }
}
