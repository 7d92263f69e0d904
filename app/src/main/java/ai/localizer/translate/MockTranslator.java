package ai.localizer.translate;

import java.util.Locale;

/**
 * Mock translator that tags the text with the target language, e.g. {@code [es] Hello}.
 */
public class MockTranslator implements Translator {

    @Override
    public String translate(String text, String sourceLanguageTag, String targetLanguageTag, TranslationContext context) {
        return "[" + targetLanguageTag.toLowerCase(Locale.ROOT) + "] " + text;
    }
}
