package io.termgate.core.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TokenBucketLimiterTest {
    private final AtomicLong now = new AtomicLong(1_000_000_000L);

    @Test
    void rejectsOnceCapacityIsSpent() {
        TokenBucketLimiter limiter = new TokenBucketLimiter(10, Duration.ofSeconds(60), Map.of(), now::get);

        for (int i = 0; i < 10; i++) {
            assertThat(limiter.admit("search_glossary").admitted()).isTrue();
        }
        RateLimitDecision eleventh = limiter.admit("search_glossary");

        assertThat(eleventh.admitted()).isFalse();
        assertThat(eleventh.key()).isEqualTo("search_glossary");
        assertThat(eleventh.retryAfter()).isEqualTo(Duration.ofSeconds(6));
    }

    @Test
    void rejectionDoesNotConsumeTokens() {
        TokenBucketLimiter limiter = new TokenBucketLimiter(1, Duration.ofSeconds(10), Map.of(), now::get);
        limiter.admit("k");
        now.addAndGet(Duration.ofSeconds(5).toNanos());

        limiter.admit("k");
        limiter.admit("k");

        assertThat(limiter.availableTokens("k").getAsDouble()).isEqualTo(0.5);
    }

    @Test
    void refillsProportionallyToElapsedTime() {
        TokenBucketLimiter limiter = new TokenBucketLimiter(2, Duration.ofSeconds(2), Map.of(), now::get);
        limiter.admit("k");
        limiter.admit("k");
        assertThat(limiter.admit("k").admitted()).isFalse();

        now.addAndGet(Duration.ofSeconds(1).toNanos());

        assertThat(limiter.admit("k").admitted()).isTrue();
        assertThat(limiter.admit("k").admitted()).isFalse();

        now.addAndGet(Duration.ofHours(1).toNanos());
        assertThat(limiter.availableTokens("k").getAsDouble()).isEqualTo(2.0);
    }

    @Test
    void overridesApplyPerKeyAndKeysAreIndependent() {
        TokenBucketLimiter limiter = new TokenBucketLimiter(5, Duration.ofSeconds(60), Map.of("retrieve_docs", 1), now::get);

        assertThat(limiter.admit("retrieve_docs").admitted()).isTrue();
        assertThat(limiter.admit("retrieve_docs").admitted()).isFalse();
        assertThat(limiter.admit("search_glossary").admitted()).isTrue();
        assertThat(limiter.capacityFor("search_glossary")).isEqualTo(5);
        assertThat(limiter.availableTokens("unused")).isEmpty();
        assertThat(limiter.trackedKeys()).isEqualTo(2);
    }

    @Test
    void concurrentCallersNeverExceedCapacity() throws Exception {
        TokenBucketLimiter limiter = new TokenBucketLimiter(50, Duration.ofHours(1), Map.of());
        int threads = 8;
        int callsPerThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                results.add(executor.submit(() -> {
                    start.await();
                    int admitted = 0;
                    for (int i = 0; i < callsPerThread; i++) {
                        if (limiter.admit("shared").admitted()) {
                            admitted++;
                        }
                    }
                    return admitted;
                }));
            }
            start.countDown();

            int total = 0;
            for (Future<Integer> result : results) {
                total += result.get(10, TimeUnit.SECONDS);
            }
            assertThat(total).isEqualTo(50);
        } finally {
            executor.shutdownNow();
        }
    }
}
