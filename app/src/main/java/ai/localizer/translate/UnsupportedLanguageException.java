package ai.localizer.translate;

/**
 * The engine cannot map a language tag to anything it understands. Never worth retrying.
 */
public class UnsupportedLanguageException extends TranslationException {

    private final String languageTag;

    public UnsupportedLanguageException(String languageTag) {
        super("Unsupported language: " + languageTag);
        this.languageTag = languageTag;
    }

    public String languageTag() {
        return languageTag;
    }
}
