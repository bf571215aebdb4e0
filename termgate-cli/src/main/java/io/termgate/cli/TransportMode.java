package io.termgate.cli;

import java.util.Arrays;
import java.util.Locale;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

public enum TransportMode {
    STDIO("stdio"),
    HTTP("http");

    private final String cliName;

    TransportMode(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    static final class Converter implements ITypeConverter<TransportMode> {
        @Override
        public TransportMode convert(String value) {
            String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                .filter(mode -> mode.cliName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new TypeConversionException("expected one of stdio, http but was '" + value + "'"));
        }
    }
}
