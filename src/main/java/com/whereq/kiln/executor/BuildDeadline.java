package com.whereq.kiln.executor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock cap shared by every stage of one build
 */
public final class BuildDeadline {

    private final Clock clock;
    private final Instant expiresAt;
    private final Duration timeout;

    private BuildDeadline(Clock clock, Duration timeout) {
        this.clock = clock;
        this.timeout = timeout;
        this.expiresAt = clock.instant().plus(timeout);
    }

    public static BuildDeadline after(Duration timeout) {
        return new BuildDeadline(Clock.systemUTC(), timeout);
    }

    static BuildDeadline after(Duration timeout, Clock clock) {
        return new BuildDeadline(clock, timeout);
    }

    /**
     * Time left, never negative
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return remaining().isZero();
    }

    /**
     * The smaller of a stage's own limit and the time left for the build
     */
    public Duration cap(Duration stageLimit) {
        Duration left = remaining();
        return stageLimit.compareTo(left) < 0 ? stageLimit : left;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
