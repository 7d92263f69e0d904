package ai.localizer.translate;

/**
 * Runtime exception used to propagate translation failures, including transient engine errors.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
