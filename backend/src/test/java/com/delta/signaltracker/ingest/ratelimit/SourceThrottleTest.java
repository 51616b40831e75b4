package com.delta.signaltracker.ingest.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceThrottleTest {

    @Test
    void burstIsCappedAtCapacity() {
        MutableClock clock = new MutableClock();
        SourceThrottle throttle = new SourceThrottle(new SourceThrottle.BucketSettings(3, 1.0), Map.of(), clock);

        assertThat(throttle.tryAcquire("news")).isTrue();
        assertThat(throttle.tryAcquire("news")).isTrue();
        assertThat(throttle.tryAcquire("news")).isTrue();
        assertThat(throttle.tryAcquire("news")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(throttle.tryAcquire("news")).isTrue();
        assertThat(throttle.tryAcquire("news")).isFalse();
    }

    @Test
    void idleTimeNeverBanksMoreThanCapacity() {
        MutableClock clock = new MutableClock();
        SourceThrottle throttle = new SourceThrottle(new SourceThrottle.BucketSettings(2, 5.0), Map.of(), clock);
        throttle.tryAcquire("news");

        clock.advance(Duration.ofHours(1));

        assertThat(throttle.stats("news").availableTokens()).isEqualTo(2.0);
        assertThat(throttle.tryAcquire("news")).isTrue();
        assertThat(throttle.tryAcquire("news")).isTrue();
        assertThat(throttle.tryAcquire("news")).isFalse();
    }

    @Test
    void sourcesHaveIndependentBucketsAndOverrides() {
        MutableClock clock = new MutableClock();
        SourceThrottle throttle = new SourceThrottle(
            new SourceThrottle.BucketSettings(1, 1.0),
            Map.of(" linkedin ", new SourceThrottle.BucketSettings(2, 0.5)),
            clock
        );

        assertThat(throttle.settingsFor("linkedin").capacity()).isEqualTo(2);
        assertThat(throttle.tryAcquire("news")).isTrue();
        assertThat(throttle.tryAcquire("news")).isFalse();
        assertThat(throttle.tryAcquire("linkedin")).isTrue();
        assertThat(throttle.tryAcquire("linkedin")).isTrue();
        assertThat(throttle.tryAcquire("linkedin")).isFalse();
    }

    @Test
    void bucketKeysMatchRegistryNamesExactly() {
        SourceThrottle throttle = new SourceThrottle(new SourceThrottle.BucketSettings(1, 1.0), Map.of(), new MutableClock());

        assertThat(throttle.tryAcquire("News")).isTrue();
        assertThat(throttle.tryAcquire("news")).isTrue();
        assertThat(throttle.tryAcquire(" news ")).isFalse();
        assertThat(throttle.stats("News").availableTokens()).isZero();
    }

    @Test
    void acquireFailsFastWhenNextTokenIsBeyondTimeout() {
        MutableClock clock = new MutableClock();
        SourceThrottle throttle = new SourceThrottle(new SourceThrottle.BucketSettings(1, 0.01), Map.of(), clock);
        throttle.acquire("news", Duration.ofMillis(10));

        long started = System.nanoTime();
        assertThatThrownBy(() -> throttle.acquire("news", Duration.ofSeconds(2)))
            .isInstanceOf(RateLimitTimeoutException.class)
            .hasMessageContaining("news");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void backoffBlocksTheSourceAndNeverShrinks() {
        MutableClock clock = new MutableClock();
        SourceThrottle throttle = new SourceThrottle(new SourceThrottle.BucketSettings(5, 1.0), Map.of(), clock);

        throttle.backoff("news", Duration.ofSeconds(60));
        throttle.backoff("news", Duration.ofSeconds(5));

        assertThat(throttle.stats("news").backoffUntil()).isEqualTo(clock.instant().plusSeconds(60));
        assertThat(throttle.tryAcquire("news")).isFalse();
        assertThat(throttle.tryAcquire("other")).isTrue();

        clock.advance(Duration.ofSeconds(61));
        assertThat(throttle.tryAcquire("news")).isTrue();
        assertThat(throttle.stats("news").backoffUntil()).isNull();
    }

    @Test
    void nonPositiveRefillIsRejected() {
        assertThatThrownBy(() -> new SourceThrottle.BucketSettings(1, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
