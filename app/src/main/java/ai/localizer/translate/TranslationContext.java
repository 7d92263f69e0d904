package ai.localizer.translate;

/**
 * Provenance of a piece of text. Part of the cache identity and available to translators that
 * want to treat categories differently.
 */
public enum TranslationContext {
    /** Interface labels; short and often carrying placeholders. */
    UI,
    /** Payloads coming from a backend service. */
    BACKEND,
    /** Text written by end users. */
    USER_CONTENT,
    /** Errors, notifications and other system messages. */
    SYSTEM;

    public static TranslationContext from(String raw) {
        if (raw == null || raw.isBlank()) {
            return UI;
        }
        String normalized = raw.trim().replace('-', '_');
        for (TranslationContext context : values()) {
            if (context.name().equalsIgnoreCase(normalized)) {
                return context;
            }
        }
        throw new IllegalArgumentException("Unsupported translation context: " + raw);
    }
}
