package ai.localizer.cli;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import picocli.CommandLine;

/**
 * Base for options backed by an enum. Rejected values are reported as a picocli
 * {@link CommandLine.TypeConversionException} that lists the accepted spellings.
 */
abstract class EnumOptionConverter<E extends Enum<E>> implements CommandLine.ITypeConverter<E> {

    private final Class<E> type;
    private final Function<String, E> parser;

    protected EnumOptionConverter(Class<E> type, Function<String, E> parser) {
        this.type = Objects.requireNonNull(type, "type");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public E convert(String value) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage() + " (expected one of: " + acceptedValues() + ")");
        }
    }

    String acceptedValues() {
        return Arrays.stream(type.getEnumConstants())
                .map(constant -> constant.name().toLowerCase(Locale.ROOT).replace('_', '-'))
                .collect(Collectors.joining(", "));
    }
}
