package io.termgate.core.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.termgate.core.audit.InvocationStatus;
import io.termgate.core.ratelimit.RateLimitDecision;
import io.termgate.core.upstream.UpstreamException;
import io.termgate.core.validation.FieldError;
import java.util.List;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolError(
    InvocationStatus status,
    String message,
    @JsonProperty("field_errors") List<FieldError> fieldErrors,
    @JsonProperty("upstream_status") Integer upstreamStatus,
    @JsonProperty("failure_kind") String failureKind,
    @JsonProperty("rate_limit_key") String rateLimitKey,
    @JsonProperty("retry_after_seconds") Double retryAfterSeconds
) {
    public static ToolError validation(List<FieldError> fieldErrors) {
        String summary = fieldErrors.stream()
            .map(error -> error.field() + " " + error.reason())
            .reduce((left, right) -> left + "; " + right)
            .orElse("invalid arguments");
        return new ToolError(InvocationStatus.VALIDATION_ERROR, "Invalid arguments: " + summary, List.copyOf(fieldErrors), null, null, null, null);
    }

    public static ToolError rateLimited(String toolName, RateLimitDecision decision) {
        double retryAfter = Math.ceil(decision.retryAfterSeconds() * 10.0) / 10.0;
        return new ToolError(
            InvocationStatus.RATE_LIMITED,
            "Rate limit exceeded for " + toolName + ". Try again in " + String.format(Locale.ROOT, "%.1f", retryAfter) + " seconds.",
            null,
            null,
            null,
            decision.key(),
            retryAfter
        );
    }

    public static ToolError upstream(UpstreamException failure) {
        return new ToolError(
            InvocationStatus.UPSTREAM_ERROR,
            failure.getMessage(),
            null,
            failure.statusCode() == 0 ? null : failure.statusCode(),
            failure.kind().name().toLowerCase(Locale.ROOT),
            null,
            null
        );
    }

    @JsonIgnore
    public boolean isTimeout() {
        return "timeout".equals(failureKind) || "cancelled".equals(failureKind);
    }
}
