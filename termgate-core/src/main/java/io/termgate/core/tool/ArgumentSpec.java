package io.termgate.core.tool;

public record ArgumentSpec(
    String name,
    ArgumentKind kind,
    boolean required,
    String description
) {
    public static ArgumentSpec required(String name, ArgumentKind kind, String description) {
        return new ArgumentSpec(name, kind, true, description);
    }

    public static ArgumentSpec optional(String name, ArgumentKind kind, String description) {
        return new ArgumentSpec(name, kind, false, description);
    }
}
