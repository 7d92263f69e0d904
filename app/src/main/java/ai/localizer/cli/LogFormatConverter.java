package ai.localizer.cli;

import ai.localizer.config.LogFormat;

/**
 * Parses {@code --log-format}.
 */
public class LogFormatConverter extends EnumOptionConverter<LogFormat> {

    public LogFormatConverter() {
        super(LogFormat.class, LogFormat::from);
    }
}
