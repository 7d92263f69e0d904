package ai.localizer.translate.model;

/**
 * Runs a translation with models that are already present locally.
 */
@FunctionalInterface
public interface TranslationEngine {

    String translate(String text, String sourceLanguageCode, String targetLanguageCode);
}
