package ai.localizer.config;

import ai.localizer.cache.CachePolicy;
import ai.localizer.localize.LanguageMatchPolicy;
import ai.localizer.localize.LocalizationSettings;
import ai.localizer.translate.TranslationContext;
import ai.localizer.translate.TranslationMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        String sourceLanguage,
        String targetLanguage,
        List<String> supportedLanguages,
        TranslationMode translationMode,
        TranslationContext context,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        CachePolicy cachePolicy,
        Optional<Path> cacheFile,
        boolean protectPlaceholders,
        LanguageMatchPolicy matchPolicy
) {

    public Config {
        sourceLanguage = requireNonBlank(sourceLanguage, "sourceLanguage");
        targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        context = context == null ? TranslationContext.UI : context;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        cachePolicy = Objects.requireNonNull(cachePolicy, "cachePolicy");
        cacheFile = cacheFile == null ? Optional.empty() : cacheFile;
        matchPolicy = matchPolicy == null ? LanguageMatchPolicy.EXACT : matchPolicy;
        supportedLanguages = withTarget(supportedLanguages, sourceLanguage, targetLanguage);
        if (cachePolicy.persist() && cacheFile.isEmpty()) {
            throw new IllegalArgumentException("cacheFile must be provided when the cache persists");
        }
    }

    public LocalizationSettings toLocalizationSettings() {
        return new LocalizationSettings(sourceLanguage, supportedLanguages, cachePolicy, protectPlaceholders, matchPolicy);
    }

    private static List<String> withTarget(List<String> supported, String source, String target) {
        List<String> result = new ArrayList<>();
        if (supported != null) {
            supported.stream()
                    .filter(value -> value != null && !value.isBlank())
                    .map(String::trim)
                    .filter(value -> result.stream().noneMatch(value::equalsIgnoreCase))
                    .forEach(result::add);
        }
        for (String required : List.of(source, target)) {
            if (result.stream().noneMatch(required::equalsIgnoreCase)) {
                result.add(required);
            }
        }
        return List.copyOf(result);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
