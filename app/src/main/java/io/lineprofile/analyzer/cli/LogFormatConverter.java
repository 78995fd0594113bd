package io.lineprofile.analyzer.cli;

import io.lineprofile.analyzer.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses {@code --log-format} values, reporting unknown formats as invalid input.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage() + " (expected text or json)");
        }
    }
}
