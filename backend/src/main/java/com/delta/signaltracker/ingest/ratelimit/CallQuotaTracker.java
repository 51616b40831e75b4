package com.delta.signaltracker.ingest.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Provider call quotas per agent key: calls per rolling hour and day, a minimum spacing
 * between calls, an optional random pause on top of it, and a cap on calls in flight
 * across all keys. Used by sources whose accounts get banned when they look automated.
 */
public class CallQuotaTracker {
    private static final Logger log = LoggerFactory.getLogger(CallQuotaTracker.class);
    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final int maxCallsPerHour;
    private final int maxCallsPerDay;
    private final Duration minDelayBetweenCalls;
    private final int maxConcurrentCalls;
    private final long randomDelayMinMs;
    private final long randomDelayMaxMs;
    private final Clock clock;
    private final Semaphore inFlight;
    private final Map<String, Deque<Instant>> calls = new HashMap<>();

    public CallQuotaTracker(int maxCallsPerHour, int maxCallsPerDay, Duration minDelayBetweenCalls) {
        this(maxCallsPerHour, maxCallsPerDay, minDelayBetweenCalls, 1, Duration.ZERO, Duration.ZERO, Clock.systemUTC());
    }

    public CallQuotaTracker(
        int maxCallsPerHour,
        int maxCallsPerDay,
        Duration minDelayBetweenCalls,
        int maxConcurrentCalls,
        Duration randomDelayMin,
        Duration randomDelayMax
    ) {
        this(
            maxCallsPerHour,
            maxCallsPerDay,
            minDelayBetweenCalls,
            maxConcurrentCalls,
            randomDelayMin,
            randomDelayMax,
            Clock.systemUTC()
        );
    }

    CallQuotaTracker(int maxCallsPerHour, int maxCallsPerDay, Duration minDelayBetweenCalls, Clock clock) {
        this(maxCallsPerHour, maxCallsPerDay, minDelayBetweenCalls, 1, Duration.ZERO, Duration.ZERO, clock);
    }

    CallQuotaTracker(
        int maxCallsPerHour,
        int maxCallsPerDay,
        Duration minDelayBetweenCalls,
        int maxConcurrentCalls,
        Duration randomDelayMin,
        Duration randomDelayMax,
        Clock clock
    ) {
        this.maxCallsPerHour = Math.max(1, maxCallsPerHour);
        this.maxCallsPerDay = Math.max(1, maxCallsPerDay);
        this.minDelayBetweenCalls = nonNegative(minDelayBetweenCalls);
        this.maxConcurrentCalls = Math.max(1, maxConcurrentCalls);
        this.randomDelayMinMs = nonNegative(randomDelayMin).toMillis();
        this.randomDelayMaxMs = Math.max(randomDelayMinMs, nonNegative(randomDelayMax).toMillis());
        this.clock = clock;
        this.inFlight = new Semaphore(this.maxConcurrentCalls, true);
    }

    /**
     * Waits up to the timeout for one of the in-flight call slots. The slot must be held
     * for the whole provider call and closed afterwards.
     *
     * @throws RateLimitTimeoutException when no slot frees up in time
     */
    public CallSlot acquireSlot(String key, Duration timeout) {
        long timeoutMs = timeout == null ? 0 : Math.max(0, timeout.toMillis());
        boolean acquired;
        try {
            acquired = inFlight.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateLimitTimeoutException(key, timeout, "Interrupted while waiting for a call slot for " + key);
        }
        if (!acquired) {
            throw new RateLimitTimeoutException(
                key,
                timeout,
                "No call slot for " + key + " within " + timeoutMs + "ms (" + maxConcurrentCalls + " in flight)"
            );
        }
        log.debug("Call slot acquired for {}, available {}/{}", key, inFlight.availablePermits(), maxConcurrentCalls);
        return new CallSlot(key);
    }

    public int availableSlots() {
        return inFlight.availablePermits();
    }

    /**
     * Reserves a call for the key. When a quota is exhausted nothing is reserved and the
     * admission carries the time until a call frees up. Otherwise the call is recorded at
     * the first instant the spacing allows, and the caller must wait
     * {@link Admission#delay()} (spacing plus the random pause) before calling.
     */
    public synchronized Admission admit(String key) {
        Instant now = clock.instant();
        Deque<Instant> history = calls.computeIfAbsent(key, ignored -> new ArrayDeque<>());
        while (!history.isEmpty() && !history.peekFirst().isAfter(now.minus(DAY))) {
            history.removeFirst();
        }
        if (history.size() >= maxCallsPerDay) {
            Duration retryAfter = Duration.between(now, history.peekFirst().plus(DAY));
            log.warn("Daily call quota reached for {} ({}/{}), retry after {}", key, history.size(), maxCallsPerDay, retryAfter);
            return Admission.denied(retryAfter);
        }
        Instant hourAgo = now.minus(HOUR);
        int lastHour = 0;
        Instant oldestInHour = null;
        for (Instant call : history) {
            if (call.isAfter(hourAgo)) {
                lastHour++;
                if (oldestInHour == null) {
                    oldestInHour = call;
                }
            }
        }
        if (lastHour >= maxCallsPerHour) {
            Duration retryAfter = Duration.between(now, oldestInHour.plus(HOUR));
            log.warn("Hourly call quota reached for {} ({}/{}), retry after {}", key, lastHour, maxCallsPerHour, retryAfter);
            return Admission.denied(retryAfter);
        }
        Instant slot = now;
        Instant last = history.peekLast();
        if (last != null && last.plus(minDelayBetweenCalls).isAfter(now)) {
            slot = last.plus(minDelayBetweenCalls);
        }
        history.addLast(slot);
        return Admission.granted(Duration.between(now, slot).plusMillis(randomDelayMs()));
    }

    public synchronized int callsInLastHour(String key) {
        Deque<Instant> history = calls.get(key);
        if (history == null) {
            return 0;
        }
        Instant hourAgo = clock.instant().minus(HOUR);
        int count = 0;
        for (Instant call : history) {
            if (call.isAfter(hourAgo)) {
                count++;
            }
        }
        return count;
    }

    private long randomDelayMs() {
        if (randomDelayMaxMs <= 0) {
            return 0;
        }
        if (randomDelayMaxMs == randomDelayMinMs) {
            return randomDelayMinMs;
        }
        return ThreadLocalRandom.current().nextLong(randomDelayMinMs, randomDelayMaxMs + 1);
    }

    private static Duration nonNegative(Duration value) {
        return value == null || value.isNegative() ? Duration.ZERO : value;
    }

    public final class CallSlot implements AutoCloseable {
        private final String key;
        private final AtomicBoolean released = new AtomicBoolean();

        private CallSlot(String key) {
            this.key = key;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            inFlight.release();
            log.debug("Call slot released for {}", key);
        }
    }

    public record Admission(boolean allowed, Duration delay) {
        static Admission granted(Duration delay) {
            return new Admission(true, delay);
        }

        static Admission denied(Duration retryAfter) {
            return new Admission(false, retryAfter);
        }
    }
}
