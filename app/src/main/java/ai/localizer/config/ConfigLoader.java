package ai.localizer.config;

import ai.localizer.cache.CachePolicy;
import ai.localizer.cli.CliArguments;
import ai.localizer.localize.LanguageMatchPolicy;
import ai.localizer.translate.TranslationContext;
import ai.localizer.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * CLI values win over the environment, which wins over defaults.
 */
public class ConfigLoader {

    static final String ENV_SOURCE_LANGUAGE = "SOURCE_LANGUAGE";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_SUPPORTED_LANGUAGES = "SUPPORTED_LANGUAGES";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_TRANSLATION_CONTEXT = "TRANSLATION_CONTEXT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_CACHE_MAX_ENTRIES = "CACHE_MAX_ENTRIES";
    static final String ENV_CACHE_PERSIST = "CACHE_PERSIST";
    static final String ENV_CACHE_FILE = "CACHE_FILE";
    static final String ENV_CACHE_TTL_SECONDS = "CACHE_TTL_SECONDS";
    static final String ENV_CACHE_FAILURES = "CACHE_FAILURES";
    static final String ENV_PROTECT_PLACEHOLDERS = "PROTECT_PLACEHOLDERS";
    static final String ENV_LANGUAGE_MATCH_POLICY = "LANGUAGE_MATCH_POLICY";

    private static final String DEFAULT_SOURCE_LANGUAGE = "en";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final Path DEFAULT_CACHE_FILE = Path.of(System.getProperty("user.home", "."),
            ".ai-text-localizer", "translation-cache.properties");

    private final EnvironmentReader environmentReader;
    private final Path defaultCacheFile;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, DEFAULT_CACHE_FILE);
    }

    public ConfigLoader(EnvironmentReader environmentReader, Path defaultCacheFile) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.defaultCacheFile = Objects.requireNonNull(defaultCacheFile, "defaultCacheFile");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        String sourceLanguage = firstNonBlank(arguments.sourceLanguage(), ENV_SOURCE_LANGUAGE)
                .orElse(DEFAULT_SOURCE_LANGUAGE);
        String targetLanguage = firstNonBlank(arguments.targetLanguage(), ENV_TARGET_LANGUAGE)
                .orElseThrow(() -> new IllegalArgumentException("target language must be provided (--target or "
                        + ENV_TARGET_LANGUAGE + ")"));
        List<String> supportedLanguages = arguments.supportedLanguages().isEmpty()
                ? environmentReader.find(ENV_SUPPORTED_LANGUAGES).map(ConfigLoader::parseList).orElse(List.of())
                : arguments.supportedLanguages();

        TranslationMode translationMode = arguments.translationMode() != null
                ? arguments.translationMode()
                : environmentReader.find(ENV_TRANSLATION_MODE).map(TranslationMode::from).orElse(TranslationMode.PRODUCTION);
        TranslationContext context = arguments.context() != null
                ? arguments.context()
                : environmentReader.find(ENV_TRANSLATION_CONTEXT).map(TranslationContext::from).orElse(TranslationContext.UI);
        LogFormat logFormat = arguments.logFormat() != null
                ? arguments.logFormat()
                : environmentReader.find(ENV_LOG_FORMAT).map(LogFormat::from).orElse(LogFormat.TEXT);
        LanguageMatchPolicy matchPolicy = arguments.matchPolicy() != null
                ? arguments.matchPolicy()
                : environmentReader.find(ENV_LANGUAGE_MATCH_POLICY).map(LanguageMatchPolicy::from).orElse(LanguageMatchPolicy.EXACT);

        LlmProvider provider = environmentReader.find(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = environmentReader.find(ENV_LLM_MODEL).orElse(provider.defaultModel());
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(environmentReader.find(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }
        Optional<String> geminiApiKey = environmentReader.find(ENV_GEMINI_API_KEY);
        if (translationMode == TranslationMode.PRODUCTION && provider == LlmProvider.GEMINI && geminiApiKey.isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini");
        }

        CachePolicy cachePolicy = resolveCachePolicy(arguments);
        Optional<Path> cacheFile = Optional.empty();
        if (cachePolicy.persist()) {
            cacheFile = Optional.of(Optional.ofNullable(arguments.cacheFile())
                    .or(() -> environmentReader.find(ENV_CACHE_FILE).map(Path::of))
                    .orElse(defaultCacheFile));
        }
        boolean protectPlaceholders = !arguments.noProtectPlaceholders()
                && environmentReader.find(ENV_PROTECT_PLACEHOLDERS).map(ConfigLoader::parseBoolean).orElse(true);

        return new Config(sourceLanguage, targetLanguage, supportedLanguages, translationMode, context, logFormat,
                new TranslatorConfig(provider, modelName, baseUrl), new Secrets(geminiApiKey),
                cachePolicy, cacheFile, protectPlaceholders, matchPolicy);
    }

    private CachePolicy resolveCachePolicy(CliArguments arguments) {
        int maxEntries = arguments.maxEntries() != null
                ? requireNonNegative(arguments.maxEntries(), "--max-entries")
                : environmentReader.find(ENV_CACHE_MAX_ENTRIES)
                        .map(raw -> requireNonNegative(parseInteger(raw, ENV_CACHE_MAX_ENTRIES), ENV_CACHE_MAX_ENTRIES))
                        .orElse(CachePolicy.DEFAULT_MAX_MEMORY_ENTRIES);
        boolean persist = !arguments.noPersist()
                && environmentReader.find(ENV_CACHE_PERSIST).map(ConfigLoader::parseBoolean).orElse(true);
        // Zero disables expiry.
        Optional<Duration> ttl = Optional.ofNullable(arguments.ttlSeconds())
                .map(seconds -> requireNonNegative(seconds, "--ttl-seconds"))
                .or(() -> environmentReader.find(ENV_CACHE_TTL_SECONDS)
                        .map(raw -> (long) requireNonNegative(parseInteger(raw, ENV_CACHE_TTL_SECONDS), ENV_CACHE_TTL_SECONDS)))
                .filter(seconds -> seconds > 0)
                .map(Duration::ofSeconds);
        boolean cacheFailures = arguments.cacheFailures()
                || environmentReader.find(ENV_CACHE_FAILURES).map(ConfigLoader::parseBoolean).orElse(false);
        return new CachePolicy(maxEntries, persist, ttl, cacheFailures);
    }

    private Optional<String> firstNonBlank(String cliValue, String envKey) {
        if (cliValue != null && !cliValue.isBlank()) {
            return Optional.of(cliValue.trim());
        }
        return environmentReader.find(envKey);
    }

    private static List<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String raw) {
        return raw.equalsIgnoreCase("true") || raw.equals("1") || raw.equalsIgnoreCase("yes");
    }

    private static int parseInteger(String raw, String name) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be zero or greater");
        }
        return value;
    }

    private static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be zero or greater");
        }
        return value;
    }
}
