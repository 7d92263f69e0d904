package ai.localizer.cli;

import ai.localizer.config.LogFormat;
import ai.localizer.localize.LanguageMatchPolicy;
import ai.localizer.translate.TranslationContext;
import ai.localizer.translate.TranslationMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-text-localizer", mixinStandardHelpOptions = true,
        description = "Translates text through a cached, placeholder-safe translation pipeline. "
                + "Reads texts from standard input when none are given.")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "TEXT", arity = "0..*", description = "Texts to translate")
    private List<String> texts = new ArrayList<>();

    @CommandLine.Option(names = "--source", description = "Source language tag (default: en)", paramLabel = "TAG")
    private String sourceLanguage;

    @CommandLine.Option(names = "--target", description = "Target language tag", paramLabel = "TAG")
    private String targetLanguage;

    @CommandLine.Option(names = "--supported", split = ",", description = "Comma separated supported language tags", paramLabel = "TAGS")
    private List<String> supportedLanguages = new ArrayList<>();

    @CommandLine.Option(names = "--context", converter = TranslationContextConverter.class,
            description = "Text context: ui, backend, user-content or system")
    private TranslationContext context;

    @CommandLine.Option(names = "--translation-mode", converter = TranslationModeConverter.class,
            description = "Translation execution mode: production, dry-run, or mock")
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class, description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = "--match-policy", converter = LanguageMatchPolicyConverter.class,
            description = "When source and target count as the same language: exact or primary-subtag")
    private LanguageMatchPolicy matchPolicy;

    @CommandLine.Option(names = "--cache-file", description = "Properties file backing the persistent cache", paramLabel = "FILE")
    private Path cacheFile;

    @CommandLine.Option(names = "--max-entries", description = "Maximum number of cached entries kept in memory", paramLabel = "COUNT")
    private Integer maxEntries;

    @CommandLine.Option(names = "--ttl-seconds", description = "Expire cached entries after this many seconds", paramLabel = "SECONDS")
    private Long ttlSeconds;

    @CommandLine.Option(names = "--no-persist", description = "Keep the cache in memory only")
    private boolean noPersist;

    @CommandLine.Option(names = "--cache-failures", description = "Remember failed translations as untranslated text")
    private boolean cacheFailures;

    @CommandLine.Option(names = "--no-protect-placeholders", description = "Send placeholders to the translator unmasked")
    private boolean noProtectPlaceholders;

    @CommandLine.Option(names = "--clear-cache", description = "Clear the translation cache before translating")
    private boolean clearCache;

    public List<String> texts() {
        return texts;
    }

    public String sourceLanguage() {
        return sourceLanguage;
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    public List<String> supportedLanguages() {
        return supportedLanguages;
    }

    public TranslationContext context() {
        return context;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public LanguageMatchPolicy matchPolicy() {
        return matchPolicy;
    }

    public Path cacheFile() {
        return cacheFile;
    }

    public Integer maxEntries() {
        return maxEntries;
    }

    public Long ttlSeconds() {
        return ttlSeconds;
    }

    public boolean noPersist() {
        return noPersist;
    }

    public boolean cacheFailures() {
        return cacheFailures;
    }

    public boolean noProtectPlaceholders() {
        return noProtectPlaceholders;
    }

    public boolean clearCache() {
        return clearCache;
    }
}
