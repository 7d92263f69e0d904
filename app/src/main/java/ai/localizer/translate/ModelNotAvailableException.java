package ai.localizer.translate;

/**
 * The engine supports the language but is not prepared for it yet; resolvable through
 * {@link Translator#prepare(String, String)}.
 */
public class ModelNotAvailableException extends TranslationException {

    private final String languageTag;

    public ModelNotAvailableException(String languageTag) {
        this(languageTag, "Language model not available for: " + languageTag, null);
    }

    public ModelNotAvailableException(String languageTag, String message, Throwable cause) {
        super(message, cause);
        this.languageTag = languageTag;
    }

    public String languageTag() {
        return languageTag;
    }
}
