package io.termgate.core.ratelimit;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Buckets are created lazily and never evicted. A rejected check leaves the token count untouched.
 */
public final class TokenBucketLimiter {
    private final int defaultCapacity;
    private final Duration refillInterval;
    private final Map<String, Integer> capacityOverrides;
    private final LongSupplier nanoTime;
    private final ConcurrentMap<String, RateLimitState> buckets = new ConcurrentHashMap<>();

    public TokenBucketLimiter(int defaultCapacity, Duration refillInterval, Map<String, Integer> capacityOverrides) {
        this(defaultCapacity, refillInterval, capacityOverrides, System::nanoTime);
    }

    public TokenBucketLimiter(
        int defaultCapacity,
        Duration refillInterval,
        Map<String, Integer> capacityOverrides,
        LongSupplier nanoTime
    ) {
        if (defaultCapacity <= 0) {
            throw new IllegalArgumentException("defaultCapacity must be > 0");
        }
        if (refillInterval == null || refillInterval.isZero() || refillInterval.isNegative()) {
            throw new IllegalArgumentException("refillInterval must be > 0");
        }
        if (nanoTime == null) {
            throw new IllegalArgumentException("nanoTime cannot be null");
        }
        this.defaultCapacity = defaultCapacity;
        this.refillInterval = refillInterval;
        this.capacityOverrides = capacityOverrides == null ? Map.of() : Map.copyOf(capacityOverrides);
        this.nanoTime = nanoTime;
    }

    public RateLimitDecision admit(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        RateLimitState state = bucket(key);
        ReentrantLock lock = state.lock();
        lock.lock();
        try {
            return state.tryConsume(nanoTime.getAsLong());
        } finally {
            lock.unlock();
        }
    }

    public OptionalDouble availableTokens(String key) {
        RateLimitState state = buckets.get(key);
        if (state == null) {
            return OptionalDouble.empty();
        }
        ReentrantLock lock = state.lock();
        lock.lock();
        try {
            return OptionalDouble.of(state.tokens(nanoTime.getAsLong()));
        } finally {
            lock.unlock();
        }
    }

    public int capacityFor(String key) {
        return capacityOverrides.getOrDefault(key, defaultCapacity);
    }

    public Duration refillInterval() {
        return refillInterval;
    }

    public int trackedKeys() {
        return buckets.size();
    }

    private RateLimitState bucket(String key) {
        RateLimitState existing = buckets.get(key);
        if (existing != null) {
            return existing;
        }
        return buckets.computeIfAbsent(key, k -> new RateLimitState(k, capacityFor(k), refillInterval, nanoTime.getAsLong()));
    }
}
