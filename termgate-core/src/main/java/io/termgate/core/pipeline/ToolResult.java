package io.termgate.core.pipeline;

import io.termgate.core.audit.InvocationStatus;

public record ToolResult(
    String tool,
    String requestId,
    InvocationStatus status,
    String payload,
    ToolError error
) {
    public static ToolResult success(InvocationContext context, String payload) {
        return new ToolResult(context.toolName(), context.requestId(), InvocationStatus.SUCCESS, payload, null);
    }

    public static ToolResult failure(InvocationContext context, ToolError error) {
        return new ToolResult(context.toolName(), context.requestId(), error.status(), null, error);
    }

    public boolean ok() {
        return status == InvocationStatus.SUCCESS;
    }
}
