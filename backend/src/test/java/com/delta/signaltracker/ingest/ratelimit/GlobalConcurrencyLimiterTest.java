package com.delta.signaltracker.ingest.ratelimit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobalConcurrencyLimiterTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void neverAdmitsMoreThanTheCeiling() throws Exception {
        GlobalConcurrencyLimiter limiter = new GlobalConcurrencyLimiter(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            String job = "job-" + i;
            futures.add(executor.submit(() -> {
                start.await();
                try (GlobalConcurrencyLimiter.Permit permit = limiter.acquire(job, Duration.ofSeconds(10))) {
                    int now = inFlight.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    Thread.sleep(20);
                    inFlight.decrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertThat(peak.get()).isLessThanOrEqualTo(2).isPositive();
        assertThat(limiter.stats().activeJobs()).isZero();
        assertThat(limiter.stats().availableSlots()).isEqualTo(2);
    }

    @Test
    void timesOutWhenNoSlotFreesUp() {
        GlobalConcurrencyLimiter limiter = new GlobalConcurrencyLimiter(1);
        try (GlobalConcurrencyLimiter.Permit held = limiter.acquire("holder", Duration.ofSeconds(1))) {
            assertThat(limiter.stats().activeJobNames()).containsExactly("holder");
            assertThatThrownBy(() -> limiter.acquire("waiter", Duration.ofMillis(50)))
                .isInstanceOf(RateLimitTimeoutException.class)
                .hasMessageContaining("waiter");
        }
        assertThat(limiter.stats().availableSlots()).isEqualTo(1);
    }

    @Test
    void closingTwiceReleasesOnce() {
        GlobalConcurrencyLimiter limiter = new GlobalConcurrencyLimiter(1);
        GlobalConcurrencyLimiter.Permit permit = limiter.acquire("job", Duration.ofMillis(10));
        permit.close();
        permit.close();

        assertThat(limiter.stats().availableSlots()).isEqualTo(1);
    }

    @Test
    void ceilingIsClampedToOne() {
        assertThat(new GlobalConcurrencyLimiter(0).maxConcurrent()).isEqualTo(1);
    }
}
