package com.delta.signaltracker.ingest.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caps the number of external calls in flight across every source. Shared by all runs;
 * admission returns a {@link Permit} that must be closed on every path.
 */
public class GlobalConcurrencyLimiter {
    private static final Logger log = LoggerFactory.getLogger(GlobalConcurrencyLimiter.class);
    private static final String LIMITER_KEY = "global";

    private final int maxConcurrent;
    private final long minDelayBetweenStartsMs;
    private final Semaphore semaphore;
    private final Object startLock = new Object();
    private final Map<Long, String> activeJobs = new ConcurrentHashMap<>();
    private final AtomicLong permitSequence = new AtomicLong();
    private Instant nextStartAllowed = Instant.EPOCH;

    public GlobalConcurrencyLimiter(int maxConcurrent) {
        this(maxConcurrent, 0);
    }

    public GlobalConcurrencyLimiter(int maxConcurrent, long minDelayBetweenStartsMs) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.minDelayBetweenStartsMs = Math.max(0, minDelayBetweenStartsMs);
        this.semaphore = new Semaphore(this.maxConcurrent);
        log.info(
            "Global concurrency limiter initialized: max_concurrent={} min_delay_between_starts_ms={}",
            this.maxConcurrent,
            this.minDelayBetweenStartsMs
        );
    }

    public Permit acquire(String jobName, Duration timeout) {
        long waitMs = timeout == null ? 0 : Math.max(0, timeout.toMillis());
        boolean acquired;
        try {
            acquired = semaphore.tryAcquire(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateLimitTimeoutException(LIMITER_KEY, timeout, "Interrupted while waiting for a global slot for " + jobName);
        }
        if (!acquired) {
            throw new RateLimitTimeoutException(
                LIMITER_KEY,
                timeout,
                "No global slot for " + jobName + " within " + waitMs + "ms (max_concurrent=" + maxConcurrent + ")"
            );
        }
        try {
            enforceStartDelay();
        } catch (InterruptedException e) {
            semaphore.release();
            Thread.currentThread().interrupt();
            throw new RateLimitTimeoutException(LIMITER_KEY, timeout, "Interrupted while spacing the start of " + jobName);
        }
        long permitId = permitSequence.incrementAndGet();
        activeJobs.put(permitId, jobName);
        log.debug("Job '{}' admitted, active {}/{}", jobName, activeJobs.size(), maxConcurrent);
        return new Permit(permitId, jobName, Instant.now());
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public Stats stats() {
        List<String> jobs = new ArrayList<>(activeJobs.values());
        return new Stats(maxConcurrent, jobs.size(), semaphore.availablePermits(), jobs);
    }

    private void enforceStartDelay() throws InterruptedException {
        if (minDelayBetweenStartsMs <= 0) {
            return;
        }
        synchronized (startLock) {
            Instant now = Instant.now();
            if (nextStartAllowed.isAfter(now)) {
                long sleepMs = Duration.between(now, nextStartAllowed).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            nextStartAllowed = Instant.now().plusMillis(minDelayBetweenStartsMs);
        }
    }

    public record Stats(int maxConcurrent, int activeJobs, int availableSlots, List<String> activeJobNames) {
    }

    public final class Permit implements AutoCloseable {
        private final long permitId;
        private final String jobName;
        private final Instant admittedAt;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(long permitId, String jobName, Instant admittedAt) {
            this.permitId = permitId;
            this.jobName = jobName;
            this.admittedAt = admittedAt;
        }

        public String jobName() {
            return jobName;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            activeJobs.remove(permitId);
            semaphore.release();
            log.debug(
                "Job '{}' released after {}ms, available {}/{}",
                jobName,
                Duration.between(admittedAt, Instant.now()).toMillis(),
                semaphore.availablePermits(),
                maxConcurrent
            );
        }
    }
}
