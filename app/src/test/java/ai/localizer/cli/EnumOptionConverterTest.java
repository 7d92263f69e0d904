package ai.localizer.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.localizer.config.LogFormat;
import ai.localizer.localize.LanguageMatchPolicy;
import ai.localizer.translate.TranslationContext;
import ai.localizer.translate.TranslationMode;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class EnumOptionConverterTest {

    @Test
    void acceptsHyphenatedAndMixedCaseSpellings() {
        assertThat(new TranslationModeConverter().convert("Dry-Run")).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(new TranslationContextConverter().convert("user-content")).isEqualTo(TranslationContext.USER_CONTENT);
        assertThat(new LanguageMatchPolicyConverter().convert("primary-subtag")).isEqualTo(LanguageMatchPolicy.PRIMARY_SUBTAG);
        assertThat(new LogFormatConverter().convert(" JSON ")).isEqualTo(LogFormat.JSON);
    }

    @Test
    void rejectedValueNamesEveryAcceptedSpelling() {
        assertThatThrownBy(() -> new TranslationModeConverter().convert("offline"))
                .isInstanceOf(CommandLine.TypeConversionException.class)
                .hasMessage("Unsupported translation mode: offline (expected one of: production, dry-run, mock)");
    }

    @Test
    void blankLogFormatIsRejected() {
        assertThatThrownBy(() -> new LogFormatConverter().convert(" "))
                .isInstanceOf(CommandLine.TypeConversionException.class)
                .hasMessageContaining("Log format must be provided");
    }

    @Test
    void contextChoicesFollowDeclarationOrder() {
        assertThat(new TranslationContextConverter().acceptedValues()).isEqualTo("ui, backend, user-content, system");
    }
}
