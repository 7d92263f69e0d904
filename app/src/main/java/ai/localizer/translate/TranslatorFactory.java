package ai.localizer.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides translator instances based on the desired execution mode. The production translator
 * is created lazily because building it may contact a remote model.
 */
public class TranslatorFactory {

    private final Supplier<Translator> productionTranslator;
    private final Supplier<Translator> dryRunTranslator;
    private final Supplier<Translator> mockTranslator;

    public TranslatorFactory(Supplier<Translator> productionTranslator,
                             Supplier<Translator> dryRunTranslator,
                             Supplier<Translator> mockTranslator) {
        this.productionTranslator = Objects.requireNonNull(productionTranslator, "productionTranslator");
        this.dryRunTranslator = Objects.requireNonNull(dryRunTranslator, "dryRunTranslator");
        this.mockTranslator = Objects.requireNonNull(mockTranslator, "mockTranslator");
    }

    public Translator select(TranslationMode mode) {
        Objects.requireNonNull(mode, "mode");
        return switch (mode) {
            case PRODUCTION -> productionTranslator.get();
            case DRY_RUN -> dryRunTranslator.get();
            case MOCK -> mockTranslator.get();
        };
    }
}
