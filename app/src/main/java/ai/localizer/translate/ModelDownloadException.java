package ai.localizer.translate;

/**
 * Warm-up for a language failed.
 */
public class ModelDownloadException extends TranslationException {

    private final String languageTag;

    public ModelDownloadException(String languageTag, Throwable cause) {
        super("Failed to download language model for: " + languageTag, cause);
        this.languageTag = languageTag;
    }

    public String languageTag() {
        return languageTag;
    }
}
