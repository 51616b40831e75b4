package com.delta.signaltracker.ingest.ratelimit;

import java.time.Duration;

public class RateLimitTimeoutException extends RuntimeException {
    private final String limiterKey;
    private final Duration timeout;

    public RateLimitTimeoutException(String limiterKey, Duration timeout, String message) {
        super(message);
        this.limiterKey = limiterKey;
        this.timeout = timeout;
    }

    public String limiterKey() {
        return limiterKey;
    }

    public Duration timeout() {
        return timeout;
    }
}
