package com.delta.signaltracker.ingest.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket per source name. Buckets start full, refill continuously and never hold
 * more than their capacity. A source can additionally be put in backoff after the
 * provider signalled throttling.
 */
public class SourceThrottle {
    private static final Logger log = LoggerFactory.getLogger(SourceThrottle.class);

    private final BucketSettings defaults;
    private final Map<String, BucketSettings> overrides;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final Clock clock;

    public SourceThrottle(BucketSettings defaults, Map<String, BucketSettings> overrides) {
        this(defaults, overrides, Clock.systemUTC());
    }

    SourceThrottle(BucketSettings defaults, Map<String, BucketSettings> overrides, Clock clock) {
        this.defaults = defaults == null ? new BucketSettings(1, 1.0) : defaults;
        Map<String, BucketSettings> normalized = new ConcurrentHashMap<>();
        if (overrides != null) {
            overrides.forEach((source, settings) -> {
                if (source != null && settings != null) {
                    normalized.put(normalizeSource(source), settings);
                }
            });
        }
        this.overrides = normalized;
        this.clock = clock;
    }

    public boolean tryAcquire(String source) {
        Bucket bucket = bucketFor(source);
        synchronized (bucket) {
            Instant now = clock.instant();
            bucket.refill(now);
            if (bucket.millisUntilAvailable(now) > 0) {
                return false;
            }
            bucket.tokens -= 1.0;
            return true;
        }
    }

    /**
     * Blocks until a token is available and consumes it. Fails immediately when the next
     * token cannot arrive before the timeout.
     */
    public void acquire(String source, Duration timeout) {
        Bucket bucket = bucketFor(source);
        long timeoutNanos = timeout == null ? 0 : Math.max(0, timeout.toNanos());
        long deadline = System.nanoTime() + timeoutNanos;
        while (true) {
            long waitMs;
            synchronized (bucket) {
                Instant now = clock.instant();
                bucket.refill(now);
                waitMs = bucket.millisUntilAvailable(now);
                if (waitMs <= 0) {
                    bucket.tokens -= 1.0;
                    return;
                }
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (waitMs > remainingMs) {
                throw new RateLimitTimeoutException(
                    bucket.source,
                    timeout,
                    "Next token for '" + bucket.source + "' in " + waitMs + "ms exceeds remaining wait of "
                        + Math.max(0, remainingMs) + "ms"
                );
            }
            log.debug("Throttling '{}' for {}ms", bucket.source, waitMs);
            try {
                Thread.sleep(waitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RateLimitTimeoutException(bucket.source, timeout, "Interrupted while throttled on '" + bucket.source + "'");
            }
        }
    }

    /**
     * Blocks the source until now + duration. Never shortens an existing backoff.
     */
    public void backoff(String source, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return;
        }
        Bucket bucket = bucketFor(source);
        synchronized (bucket) {
            Instant candidate = clock.instant().plus(duration);
            if (bucket.backoffUntil == null || candidate.isAfter(bucket.backoffUntil)) {
                bucket.backoffUntil = candidate;
                log.info("Source '{}' backing off until {}", bucket.source, candidate);
            }
        }
    }

    public Stats stats(String source) {
        Bucket bucket = bucketFor(source);
        synchronized (bucket) {
            Instant now = clock.instant();
            bucket.refill(now);
            Instant backoffUntil = bucket.backoffUntil != null && bucket.backoffUntil.isAfter(now) ? bucket.backoffUntil : null;
            return new Stats(bucket.source, bucket.settings.capacity(), bucket.settings.refillPerSecond(), bucket.tokens, backoffUntil);
        }
    }

    public BucketSettings settingsFor(String source) {
        return overrides.getOrDefault(normalizeSource(source), defaults);
    }

    private Bucket bucketFor(String source) {
        String key = normalizeSource(source);
        return buckets.computeIfAbsent(key, ignored -> new Bucket(key, settingsFor(key), clock.instant()));
    }

    private static String normalizeSource(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source name is required");
        }
        return source.trim();
    }

    public record BucketSettings(int capacity, double refillPerSecond) {
        public BucketSettings {
            capacity = Math.max(1, capacity);
            if (Double.isNaN(refillPerSecond) || refillPerSecond <= 0) {
                throw new IllegalArgumentException("refillPerSecond must be positive, got " + refillPerSecond);
            }
        }
    }

    public record Stats(String source, int capacity, double refillPerSecond, double availableTokens, Instant backoffUntil) {
    }

    private static final class Bucket {
        private final String source;
        private final BucketSettings settings;
        private double tokens;
        private Instant lastRefill;
        private Instant backoffUntil;

        private Bucket(String source, BucketSettings settings, Instant createdAt) {
            this.source = source;
            this.settings = settings;
            this.tokens = settings.capacity();
            this.lastRefill = createdAt;
        }

        private void refill(Instant now) {
            if (!now.isAfter(lastRefill)) {
                return;
            }
            double elapsedSeconds = Duration.between(lastRefill, now).toNanos() / 1_000_000_000.0;
            tokens = Math.min(settings.capacity(), tokens + elapsedSeconds * settings.refillPerSecond());
            lastRefill = now;
        }

        private long millisUntilAvailable(Instant now) {
            if (backoffUntil != null && backoffUntil.isAfter(now)) {
                return Math.max(1, Duration.between(now, backoffUntil).toMillis());
            }
            if (tokens >= 1.0) {
                return 0;
            }
            double missing = 1.0 - tokens;
            return Math.max(1, (long) Math.ceil(missing / settings.refillPerSecond() * 1000.0));
        }
    }
}
