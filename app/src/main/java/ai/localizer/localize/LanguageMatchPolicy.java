package ai.localizer.localize;

import java.util.Locale;

/**
 * Decides when a source and target tag are close enough that translation is skipped.
 */
public enum LanguageMatchPolicy {
    /** Case-insensitive equality of the full tag. */
    EXACT,
    /** Equality of the primary subtag: {@code en} matches {@code en-US} but not {@code eng}. */
    PRIMARY_SUBTAG;

    public boolean isSameLanguage(String sourceTag, String targetTag) {
        if (sourceTag == null || targetTag == null) {
            return false;
        }
        return switch (this) {
            case EXACT -> sourceTag.trim().equalsIgnoreCase(targetTag.trim());
            case PRIMARY_SUBTAG -> primarySubtag(sourceTag).equals(primarySubtag(targetTag));
        };
    }

    public static LanguageMatchPolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return EXACT;
        }
        String normalized = raw.trim().replace('-', '_');
        for (LanguageMatchPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unsupported language match policy: " + raw);
    }

    static String primarySubtag(String tag) {
        String trimmed = tag.trim().replace('_', '-');
        int separator = trimmed.indexOf('-');
        String primary = separator < 0 ? trimmed : trimmed.substring(0, separator);
        return primary.toLowerCase(Locale.ROOT);
    }
}
