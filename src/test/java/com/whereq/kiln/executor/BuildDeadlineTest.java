package com.whereq.kiln.executor;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class BuildDeadlineTest {

    @Test
    void capsStageLimitToRemainingTime() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        BuildDeadline deadline = BuildDeadline.after(Duration.ofMinutes(30), clock);

        assertThat(deadline.cap(Duration.ofMinutes(5))).isEqualTo(Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(28));
        assertThat(deadline.cap(Duration.ofMinutes(5))).isEqualTo(Duration.ofMinutes(2));
        assertThat(deadline.isExpired()).isFalse();
    }

    @Test
    void remainingNeverGoesNegative() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        BuildDeadline deadline = BuildDeadline.after(Duration.ofMinutes(1), clock);

        clock.advance(Duration.ofMinutes(3));

        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.cap(Duration.ofMinutes(5))).isEqualTo(Duration.ZERO);
        assertThat(deadline.getTimeout()).isEqualTo(Duration.ofMinutes(1));
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

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
