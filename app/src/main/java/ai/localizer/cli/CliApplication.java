package ai.localizer.cli;

import ai.localizer.cache.CacheStorageException;
import ai.localizer.cache.FileKeyValueStore;
import ai.localizer.cache.KeyValueStore;
import ai.localizer.config.Config;
import ai.localizer.config.ConfigLoader;
import ai.localizer.config.Secrets;
import ai.localizer.config.SystemEnvironmentReader;
import ai.localizer.config.TranslatorConfig;
import ai.localizer.localize.LanguageSelection;
import ai.localizer.localize.LocalizationService;
import ai.localizer.logging.LoggingConfigurator;
import ai.localizer.translate.ChatModelTranslator;
import ai.localizer.translate.MockTranslator;
import ai.localizer.translate.PassThroughTranslator;
import ai.localizer.translate.PrepareResult;
import ai.localizer.translate.TranslationContext;
import ai.localizer.translate.Translator;
import ai.localizer.translate.TranslatorFactory;
import ai.localizer.translate.model.DownloadState;
import ai.localizer.translate.model.InMemoryModelRegistry;
import ai.localizer.translate.model.OnDeviceTranslator;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and localization service.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final Function<Config, TranslatorFactory> translatorFactories;
    private final Reader input;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::defaultTranslatorFactory,
                new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, Function<Config, TranslatorFactory> translatorFactories, Reader input) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.translatorFactories = Objects.requireNonNull(translatorFactories, "translatorFactories");
        this.input = Objects.requireNonNull(input, "input");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        return run(args, new CommandLine(new CliArguments()));
    }

    int run(String[] args, CommandLine commandLine) {
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        CliArguments cliArguments = commandLine.getCommand();
        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Translating {} -> {} in {} mode (context={}, cache={})",
                config.sourceLanguage(), config.targetLanguage(), config.translationMode(), config.context(),
                config.cacheFile().map(Object::toString).orElse("memory"));

        Translator translator;
        try {
            translator = translatorFactories.apply(config).select(config.translationMode());
        } catch (IllegalStateException ex) {
            LOGGER.error("Failed to create {} translator", config.translationMode(), ex);
            return EXIT_FAILURE;
        }
        if (translator instanceof OnDeviceTranslator onDevice) {
            onDevice.addDownloadStateListener(CliApplication::logDownloadState);
        }
        Optional<KeyValueStore> store;
        try {
            store = config.cacheFile().map(FileKeyValueStore::new);
        } catch (CacheStorageException ex) {
            LOGGER.error("Cannot open translation cache: {}", ex.getMessage(), ex);
            translator.close();
            return EXIT_FAILURE;
        }
        LanguageSelection selection = new LanguageSelection(config.supportedLanguages(), config.targetLanguage());

        try (LocalizationService service = new LocalizationService(config.toLocalizationSettings(), translator, store, selection)) {
            if (cliArguments.clearCache()) {
                service.clearCache();
            }
            if (!service.isReady()) {
                LOGGER.info("Translator not ready for {} -> {}; preparing", config.sourceLanguage(), config.targetLanguage());
                PrepareResult result = service.prepare();
                if (result instanceof PrepareResult.Failed failed) {
                    LOGGER.error("Preparation failed: {}", failed.error().getMessage(), failed.error());
                    return EXIT_FAILURE;
                }
            }
            PrintWriter out = commandLine.getOut();
            for (String text : resolveTexts(cliArguments)) {
                out.println(service.translate(text, config.context()));
            }
            out.flush();
            LOGGER.info("Translation cache now holds {} entries", service.cacheSize());
        }
        return 0;
    }

    private List<String> resolveTexts(CliArguments arguments) {
        if (!arguments.texts().isEmpty()) {
            return arguments.texts();
        }
        List<String> lines = new ArrayList<>();
        try {
            BufferedReader reader = new BufferedReader(input);
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read texts from standard input", ex);
        }
        return lines;
    }

    static TranslatorFactory defaultTranslatorFactory(Config config) {
        return new TranslatorFactory(
                () -> createProductionTranslator(config),
                PassThroughTranslator::new,
                () -> createMockTranslator(config));
    }

    private static Translator createProductionTranslator(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
        return new ChatModelTranslator(chatModel, translatorConfig.provider().name(), translatorConfig.modelName());
    }

    private static Translator createMockTranslator(Config config) {
        InMemoryModelRegistry registry = new InMemoryModelRegistry().preinstall(config.sourceLanguage());
        MockTranslator mock = new MockTranslator();
        return new OnDeviceTranslator(registry,
                (text, sourceCode, targetCode) -> mock.translate(text, sourceCode, targetCode, TranslationContext.UI));
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }

    private static void logDownloadState(DownloadState state) {
        if (state instanceof DownloadState.Downloading downloading) {
            LOGGER.info("Downloading model {}: {}%", downloading.languageCode(), Math.round(downloading.progress() * 100));
        } else if (state instanceof DownloadState.Failed failed) {
            LOGGER.warn("Model download failed: {}", failed.error().getMessage());
        } else if (state instanceof DownloadState.Complete) {
            LOGGER.info("Model download complete");
        }
    }
}
