package io.termgate.core.ratelimit;

import java.time.Duration;

public record RateLimitDecision(String key, boolean admitted, Duration retryAfter) {
    public static RateLimitDecision admit(String key) {
        return new RateLimitDecision(key, true, Duration.ZERO);
    }

    public static RateLimitDecision reject(String key, Duration retryAfter) {
        return new RateLimitDecision(key, false, retryAfter);
    }

    public double retryAfterSeconds() {
        return retryAfter.toNanos() / 1_000_000_000d;
    }
}
