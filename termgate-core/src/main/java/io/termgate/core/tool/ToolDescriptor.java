package io.termgate.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ToolDescriptor(
    GlossaryTool tool,
    String name,
    String description,
    String rateLimitKey,
    List<ArgumentSpec> arguments,
    Map<String, Object> inputSchema
) {
    public ToolDescriptor {
        arguments = List.copyOf(arguments);
        inputSchema = Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
    }

    public UpstreamOperation operation() {
        return tool.operation();
    }

    public Optional<ArgumentSpec> argument(String argumentName) {
        return arguments.stream().filter(spec -> spec.name().equals(argumentName)).findFirst();
    }
}
