package io.termgate.core.tool;

import io.termgate.core.config.ConfigurationException;
import io.termgate.core.config.GatewaySettings;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

public final class ToolRegistry {
    private final Map<String, ToolDescriptor> tools;
    private final Map<String, Integer> rateLimitCapacities;

    private ToolRegistry(Map<String, ToolDescriptor> tools, Map<String, Integer> rateLimitCapacities) {
        this.tools = Collections.unmodifiableMap(tools);
        this.rateLimitCapacities = Map.copyOf(rateLimitCapacities);
    }

    /**
     * Builds the registry and checks per-tool rate limit overrides against it.
     *
     * @throws ConfigurationException if an override names a tool this deployment does not expose
     */
    public static ToolRegistry create(GatewaySettings settings) {
        Map<String, ToolDescriptor> tools = new LinkedHashMap<>();
        for (GlossaryTool tool : GlossaryTool.values()) {
            if (tool.variant() != settings.toolVariant()) {
                continue;
            }
            tools.put(tool.toolName(), new ToolDescriptor(
                tool,
                tool.toolName(),
                tool.description(),
                tool.toolName(),
                tool.arguments(),
                inputSchema(tool.arguments(), settings)
            ));
        }

        Map<String, Integer> capacities = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> override : settings.toolRateLimits().entrySet()) {
            ToolDescriptor descriptor = tools.get(override.getKey());
            if (descriptor == null) {
                throw new ConfigurationException(
                    "MCP_TOOL_RATE_LIMITS names tool '" + override.getKey() + "' which is not registered; available: "
                        + new TreeSet<>(tools.keySet())
                );
            }
            capacities.put(descriptor.rateLimitKey(), override.getValue());
        }
        return new ToolRegistry(tools, capacities);
    }

    public Optional<ToolDescriptor> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    public ToolDescriptor require(String name) {
        return find(name).orElseThrow(() -> new UnknownToolException(name));
    }

    public Collection<ToolDescriptor> all() {
        return tools.values();
    }

    public List<String> names() {
        return new ArrayList<>(tools.keySet());
    }

    public Map<String, Integer> rateLimitCapacities() {
        return rateLimitCapacities;
    }

    private static Map<String, Object> inputSchema(List<ArgumentSpec> arguments, GatewaySettings settings) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ArgumentSpec spec : arguments) {
            Map<String, Object> property = new LinkedHashMap<>();
            switch (spec.kind()) {
                case DATASET_ID -> {
                    property.put("type", "string");
                    property.put("pattern", settings.datasetIdPattern());
                }
                case FREE_TEXT -> {
                    property.put("type", "string");
                    property.put("maxLength", settings.maxQueryLength());
                }
                case TEXT_LIST -> {
                    property.put("type", "array");
                    property.put("items", Map.of("type", "string", "maxLength", settings.maxTermLength()));
                    property.put("maxItems", settings.maxTerms());
                }
                case INTEGER -> {
                    property.put("type", "integer");
                    property.put("minimum", 1);
                }
                case BOOLEAN -> property.put("type", "boolean");
                default -> throw new IllegalStateException("Unhandled argument kind " + spec.kind());
            }
            property.put("description", spec.description());
            properties.put(spec.name(), property);
            if (spec.required()) {
                required.add(spec.name());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        schema.put("additionalProperties", false);
        return schema;
    }
}
