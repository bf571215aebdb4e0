package io.termgate.core.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record InvocationContext(
    String requestId,
    String toolName,
    Instant startTime,
    long startNanos,
    long deadlineNanos
) {
    static InvocationContext start(String toolName, Instant now, long nowNanos, Duration budget) {
        long deadline = budget == null || budget.isZero() ? Long.MAX_VALUE : saturatedAdd(nowNanos, budget.toNanos());
        return new InvocationContext(newRequestId(), toolName, now, nowNanos, deadline);
    }

    public double elapsedMillis(long nowNanos) {
        return (nowNanos - startNanos) / 1_000_000d;
    }

    static String newRequestId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return ((a ^ sum) & (b ^ sum)) < 0 ? Long.MAX_VALUE : sum;
    }
}
