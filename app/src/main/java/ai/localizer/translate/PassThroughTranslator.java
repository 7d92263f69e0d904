package ai.localizer.translate;

/**
 * Translator used for dry-run scenarios that returns the source text without invoking any engine.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public String translate(String text, String sourceLanguageTag, String targetLanguageTag, TranslationContext context) {
        return text == null ? "" : text;
    }
}
