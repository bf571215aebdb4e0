package io.termgate.core.upstream;

import java.time.Duration;

public record RetryPolicy(int maxAttempts, Duration delay, Duration attemptTimeout) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        if (attemptTimeout == null || attemptTimeout.isZero() || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("attemptTimeout must be > 0");
        }
    }

    public boolean isRecoverableStatus(int statusCode) {
        return statusCode >= 500 && statusCode <= 599;
    }
}
