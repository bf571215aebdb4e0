package io.termgate.core.ratelimit;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket for a single key. Every read or write of {@code tokens} and
 * {@code lastRefillNanos} happens while holding {@link #lock()}.
 */
final class RateLimitState {
    private final String key;
    private final int capacity;
    private final Duration refillInterval;
    private final long intervalNanos;
    private final ReentrantLock lock;

    private double tokens;
    private long lastRefillNanos;

    RateLimitState(String key, int capacity, Duration refillInterval, long nowNanos) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (refillInterval.isZero() || refillInterval.isNegative()) {
            throw new IllegalArgumentException("refillInterval must be > 0");
        }
        this.key = key;
        this.capacity = capacity;
        this.refillInterval = refillInterval;
        this.intervalNanos = refillInterval.toNanos();
        this.lock = new ReentrantLock();
        this.tokens = capacity;
        this.lastRefillNanos = nowNanos;
    }

    ReentrantLock lock() {
        return lock;
    }

    RateLimitDecision tryConsume(long nowNanos) {
        refill(nowNanos);
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return RateLimitDecision.admit(key);
        }
        long waitNanos = (long) Math.ceil((1.0 - tokens) * intervalNanos / capacity);
        return RateLimitDecision.reject(key, Duration.ofNanos(Math.max(1L, waitNanos)));
    }

    double tokens(long nowNanos) {
        refill(nowNanos);
        return tokens;
    }

    int capacity() {
        return capacity;
    }

    Duration refillInterval() {
        return refillInterval;
    }

    private void refill(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + (double) elapsed * capacity / intervalNanos);
        lastRefillNanos = nowNanos;
    }
}
