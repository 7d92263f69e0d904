package ai.localizer.cli;

import ai.localizer.translate.TranslationMode;

public class TranslationModeConverter extends EnumOptionConverter<TranslationMode> {

    public TranslationModeConverter() {
        super(TranslationMode.class, TranslationMode::from);
    }
}
