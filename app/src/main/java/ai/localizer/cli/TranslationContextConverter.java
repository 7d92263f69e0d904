package ai.localizer.cli;

import ai.localizer.translate.TranslationContext;

public class TranslationContextConverter extends EnumOptionConverter<TranslationContext> {

    public TranslationContextConverter() {
        super(TranslationContext.class, TranslationContext::from);
    }
}
