package ai.localizer.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.localizer.config.ConfigLoader;
import ai.localizer.translate.PassThroughTranslator;
import ai.localizer.translate.PrepareResult;
import ai.localizer.translate.TranslationContext;
import ai.localizer.translate.TranslationException;
import ai.localizer.translate.Translator;
import ai.localizer.translate.TranslatorFactory;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    @Test
    void mockModeTranslatesArgumentsAndPersistsCache() {
        Path cacheFile = tempDir.resolve("cache.properties");
        CliApplication application = new CliApplication(loader(Map.of()), CliApplication::defaultTranslatorFactory,
                new StringReader(""));

        int exitCode = run(application, "--target", "es", "--translation-mode", "mock",
                "--cache-file", cacheFile.toString(), "Hello {name}", "Bye");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("[es] Hello {name}", "[es] Bye");
        assertThat(Files.exists(cacheFile)).isTrue();
    }

    @Test
    void readsTextsFromInputWhenNoneGiven() {
        CliApplication application = new CliApplication(loader(Map.of("TARGET_LANGUAGE", "fr")),
                config -> factory(new PassThroughTranslator()), new StringReader("One\nTwo\n"));

        int exitCode = run(application, "--translation-mode", "dry-run", "--no-persist");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("One", "Two");
    }

    @Test
    void missingTargetIsInvalidInput() {
        CliApplication application = new CliApplication(loader(Map.of()), CliApplication::defaultTranslatorFactory,
                new StringReader(""));

        int exitCode = run(application, "--no-persist", "Hello");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("target language must be provided");
    }

    @Test
    void unknownOptionPrintsUsage() {
        CliApplication application = new CliApplication(loader(Map.of()), CliApplication::defaultTranslatorFactory,
                new StringReader(""));

        int exitCode = run(application, "--bogus");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Usage:");
    }

    @Test
    void unsupportedLogFormatListsAcceptedValues() {
        CliApplication application = new CliApplication(loader(Map.of()), CliApplication::defaultTranslatorFactory,
                new StringReader(""));

        int exitCode = run(application, "--target", "fr", "--log-format", "yaml", "Hello");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString())
                .contains("--log-format")
                .contains("Unsupported log format: yaml")
                .contains("expected one of: text, json");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void failedPreparationExitsWithError() {
        Translator unprepared = new Translator() {
            @Override
            public String translate(String text, String sourceLanguageTag, String targetLanguageTag, TranslationContext context) {
                return text;
            }

            @Override
            public boolean isReady(String sourceLanguageTag, String targetLanguageTag) {
                return false;
            }

            @Override
            public PrepareResult prepare(String sourceLanguageTag, String targetLanguageTag) {
                return PrepareResult.failed(new TranslationException("no network"));
            }
        };
        CliApplication application = new CliApplication(loader(Map.of()), config -> factory(unprepared),
                new StringReader(""));

        int exitCode = run(application, "--target", "de", "--translation-mode", "mock", "--no-persist", "Hello");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    private int run(CliApplication application, String... args) {
        CommandLine commandLine = new CommandLine(new CliArguments());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return application.run(args, commandLine);
    }

    private ConfigLoader loader(Map<String, String> env) {
        return new ConfigLoader(key -> Optional.ofNullable(env.get(key)), tempDir.resolve("default-cache.properties"));
    }

    private static TranslatorFactory factory(Translator translator) {
        return new TranslatorFactory(() -> translator, () -> translator, () -> translator);
    }
}
