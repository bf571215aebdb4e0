package io.termgate.mcp.server;

import io.termgate.core.pipeline.InvocationPipeline;
import io.termgate.core.tool.ToolDescriptor;
import io.termgate.core.tool.UnknownToolException;
import io.termgate.mcp.server.model.ToolCallResponse;
import io.termgate.mcp.server.model.ToolDefinition;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class ToolRouter {
    private final InvocationPipeline pipeline;
    private final List<ToolDefinition> definitions;

    public ToolRouter(InvocationPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        List<ToolDefinition> all = new ArrayList<>();
        for (ToolDescriptor descriptor : pipeline.registry().all()) {
            all.add(new ToolDefinition(descriptor.name(), descriptor.description(), descriptor.inputSchema()));
        }
        all.sort(Comparator.comparing(ToolDefinition::name));
        this.definitions = List.copyOf(all);
    }

    public List<ToolDefinition> listTools() {
        return definitions;
    }

    public ToolCallResponse callTool(String toolName, Map<String, Object> arguments) {
        try {
            return ToolCallResponse.from(pipeline.invoke(toolName, arguments == null ? Map.of() : arguments));
        } catch (UnknownToolException e) {
            return ToolCallResponse.unknownTool(e.toolName());
        }
    }
}
