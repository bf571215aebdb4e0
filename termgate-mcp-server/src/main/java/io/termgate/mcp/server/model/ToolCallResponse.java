package io.termgate.mcp.server.model;

import io.termgate.core.audit.InvocationStatus;
import io.termgate.core.pipeline.ToolError;
import io.termgate.core.pipeline.ToolResult;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolCallResponse(
    String tool,
    String requestId,
    String status,
    String payload,
    String message,
    ToolError error
) {
    public static final String UNKNOWN_TOOL = "unknown_tool";

    public static ToolCallResponse from(ToolResult result) {
        String message = result.error() == null ? null : result.error().message();
        return new ToolCallResponse(
            result.tool(),
            result.requestId(),
            result.status().wireName(),
            result.payload(),
            message,
            result.error()
        );
    }

    public static ToolCallResponse unknownTool(String toolName) {
        return new ToolCallResponse(toolName, null, UNKNOWN_TOOL, null, "Unknown tool: " + toolName, null);
    }

    public boolean ok() {
        return InvocationStatus.SUCCESS.wireName().equals(status);
    }

    public boolean isUnknownTool() {
        return UNKNOWN_TOOL.equals(status);
    }

    public Map<String, Object> errorDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("tool", tool);
        document.put("status", status);
        if (requestId != null) {
            document.put("request_id", requestId);
        }
        document.put("message", message);
        if (error != null) {
            document.put("error", error);
        }
        return document;
    }
}
