package ai.localizer.localize;

import ai.localizer.cache.CachePolicy;
import java.util.List;
import java.util.Objects;

/**
 * Settings for a {@link LocalizationService}.
 *
 * @param sourceLanguageTag   language the application text is written in
 * @param supportedLanguages  target languages offered to the user, the source tag alone when empty
 * @param cachePolicy         how translations are cached
 * @param protectPlaceholders whether placeholders are masked before translation
 * @param matchPolicy         when source and target count as the same language
 */
public record LocalizationSettings(
        String sourceLanguageTag,
        List<String> supportedLanguages,
        CachePolicy cachePolicy,
        boolean protectPlaceholders,
        LanguageMatchPolicy matchPolicy
) {

    public LocalizationSettings {
        sourceLanguageTag = requireNonBlank(sourceLanguageTag, "sourceLanguageTag");
        supportedLanguages = supportedLanguages == null || supportedLanguages.isEmpty()
                ? List.of(sourceLanguageTag)
                : List.copyOf(supportedLanguages);
        cachePolicy = Objects.requireNonNull(cachePolicy, "cachePolicy");
        matchPolicy = matchPolicy == null ? LanguageMatchPolicy.EXACT : matchPolicy;
    }

    public static LocalizationSettings defaults(String sourceLanguageTag, List<String> supportedLanguages) {
        return new LocalizationSettings(sourceLanguageTag, supportedLanguages, CachePolicy.DEFAULT, true, LanguageMatchPolicy.EXACT);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
