package ai.localizer.cli;

import ai.localizer.localize.LanguageMatchPolicy;

public class LanguageMatchPolicyConverter extends EnumOptionConverter<LanguageMatchPolicy> {

    public LanguageMatchPolicyConverter() {
        super(LanguageMatchPolicy.class, LanguageMatchPolicy::from);
    }
}
