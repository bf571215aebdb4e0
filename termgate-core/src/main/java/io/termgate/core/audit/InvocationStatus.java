package io.termgate.core.audit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InvocationStatus {
    SUCCESS("success"),
    VALIDATION_ERROR("validation_error"),
    RATE_LIMITED("rate_limited"),
    UPSTREAM_ERROR("upstream_error");

    private final String wireName;

    InvocationStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
