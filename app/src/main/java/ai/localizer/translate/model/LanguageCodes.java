package ai.localizer.translate.model;

import java.util.Locale;
import java.util.Set;

/**
 * Language codes understood by on-device models. Tags are reduced to their primary subtag, so
 * {@code en-US} and {@code pt_BR} resolve to {@code en} and {@code pt}.
 */
public final class LanguageCodes {

    private static final Set<String> SUPPORTED = Set.of(
            "af", "ar", "be", "bg", "bn", "ca", "cs", "cy", "da", "de",
            "el", "en", "eo", "es", "et", "fa", "fi", "fr", "ga", "gl",
            "gu", "he", "hi", "hr", "ht", "hu", "id", "is", "it", "ja",
            "ka", "kn", "ko", "lt", "lv", "mk", "mr", "ms", "mt", "nl",
            "no", "pl", "pt", "ro", "ru", "sk", "sl", "sq", "sv", "sw",
            "ta", "te", "th", "tl", "tr", "uk", "ur", "vi", "zh");

    private LanguageCodes() {
    }

    public static String normalize(String languageTag) {
        if (languageTag == null) {
            return "";
        }
        String trimmed = languageTag.trim();
        int separator = indexOfSeparator(trimmed);
        String primary = separator < 0 ? trimmed : trimmed.substring(0, separator);
        return primary.toLowerCase(Locale.ROOT);
    }

    public static boolean isSupported(String languageTag) {
        return SUPPORTED.contains(normalize(languageTag));
    }

    public static Set<String> supportedLanguages() {
        return SUPPORTED;
    }

    private static int indexOfSeparator(String tag) {
        for (int i = 0; i < tag.length(); i++) {
            char ch = tag.charAt(i);
            if (ch == '-' || ch == '_') {
                return i;
            }
        }
        return -1;
    }
}
