package io.termgate.mcp.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.termgate.mcp.server.model.ToolCallResponse;
import io.termgate.mcp.server.model.ToolDefinition;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpProtocolHandler {
    private static final Logger LOG = LoggerFactory.getLogger(McpProtocolHandler.class);

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private final ToolRouter router;
    private final ObjectMapper mapper;
    private final String serverName;
    private final String serverVersion;

    public McpProtocolHandler(ToolRouter router, ObjectMapper mapper, String serverName, String serverVersion) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.serverName = serverName;
        this.serverVersion = serverVersion;
    }

    public Optional<String> handleLine(String line) {
        JsonNode message;
        try {
            message = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            LOG.debug("Rejecting unparseable JSON-RPC message: {}", e.getOriginalMessage());
            return Optional.of(write(error(NullNode.getInstance(), PARSE_ERROR, "Parse error")));
        }
        return handle(message).map(this::write);
    }

    public Optional<ObjectNode> handle(JsonNode message) {
        if (message == null || !message.isObject() || !message.path("method").isTextual()) {
            JsonNode id = message != null && message.has("id") ? message.get("id") : NullNode.getInstance();
            return Optional.of(error(id, INVALID_REQUEST, "Invalid Request"));
        }
        String method = message.get("method").asText();
        JsonNode id = message.get("id");
        JsonNode params = message.path("params");

        try {
            return switch (method) {
                case "initialize" -> reply(id, initialize(params));
                case "ping" -> reply(id, mapper.createObjectNode());
                case "tools/list" -> reply(id, listTools());
                case "tools/call" -> callTool(id, params);
                default -> id == null ? Optional.empty() : Optional.of(error(id, METHOD_NOT_FOUND, "Method not found: " + method));
            };
        } catch (RuntimeException e) {
            LOG.error("JSON-RPC method {} failed", method, e);
            return id == null ? Optional.empty() : Optional.of(error(id, INTERNAL_ERROR, "Internal error"));
        }
    }

    public ObjectNode error(JsonNode id, int code, String message) {
        ObjectNode response = envelope(id == null ? NullNode.getInstance() : id);
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return response;
    }

    private ObjectNode initialize(JsonNode params) {
        ObjectNode result = mapper.createObjectNode();
        String requested = params.path("protocolVersion").asText("");
        result.put("protocolVersion", requested.isBlank() ? PROTOCOL_VERSION : requested);
        result.putObject("capabilities").putObject("tools").put("listChanged", false);
        ObjectNode info = result.putObject("serverInfo");
        info.put("name", serverName);
        info.put("version", serverVersion);
        return result;
    }

    private ObjectNode listTools() {
        ObjectNode result = mapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        for (ToolDefinition definition : router.listTools()) {
            tools.add(mapper.valueToTree(definition));
        }
        return result;
    }

    private Optional<ObjectNode> callTool(JsonNode id, JsonNode params) {
        if (!params.path("name").isTextual()) {
            return rejectParams(id, "Missing tool name");
        }
        JsonNode rawArguments = params.path("arguments");
        if (!rawArguments.isMissingNode() && !rawArguments.isNull() && !rawArguments.isObject()) {
            return rejectParams(id, "Tool arguments must be an object");
        }
        Map<String, Object> arguments = rawArguments.isObject() ? mapper.convertValue(rawArguments, ARGUMENTS) : Map.of();
        ToolCallResponse response = router.callTool(params.get("name").asText(), arguments);
        if (response.isUnknownTool()) {
            return rejectParams(id, response.message());
        }

        ObjectNode result = mapper.createObjectNode();
        ObjectNode content = result.putArray("content").addObject();
        content.put("type", "text");
        content.put("text", response.ok() ? response.payload() : write(response.errorDocument()));
        result.put("isError", !response.ok());
        return reply(id, result);
    }

    private Optional<ObjectNode> rejectParams(JsonNode id, String message) {
        return id == null ? Optional.empty() : Optional.of(error(id, INVALID_PARAMS, message));
    }

    private Optional<ObjectNode> reply(JsonNode id, ObjectNode result) {
        if (id == null) {
            return Optional.empty();
        }
        ObjectNode response = envelope(id);
        response.set("result", result);
        return Optional.of(response);
    }

    private ObjectNode envelope(JsonNode id) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        return response;
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize JSON-RPC message", e);
        }
    }
}
