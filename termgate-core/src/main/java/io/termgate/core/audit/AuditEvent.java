package io.termgate.core.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"event", "tool", "status", "request_id", "duration_ms", "arguments", "timestamp", "error"})
public record AuditEvent(
    String event,
    String tool,
    InvocationStatus status,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("duration_ms") double durationMs,
    Map<String, Object> arguments,
    Instant timestamp,
    String error
) {
    public static final String TOOL_INVOCATION = "tool_invocation";

    public AuditEvent {
        event = event == null || event.isBlank() ? TOOL_INVOCATION : event;
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        durationMs = Math.round(durationMs * 100.0) / 100.0;
    }
}
