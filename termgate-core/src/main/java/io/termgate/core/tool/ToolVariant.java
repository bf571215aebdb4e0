package io.termgate.core.tool;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum ToolVariant {
    RETRIEVAL("retrieval"),
    GLOSSARY("glossary");

    private final String wireName;

    ToolVariant(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ToolVariant> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(variant -> variant.wireName.equals(normalized)).findFirst();
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(ToolVariant::wireName).toList();
    }
}
