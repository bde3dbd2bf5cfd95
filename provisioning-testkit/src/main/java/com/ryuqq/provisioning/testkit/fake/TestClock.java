package com.ryuqq.provisioning.testkit.fake;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Mutable {@link Clock} for tests.
 *
 * <p>Time only moves when the test says so ({@link #advance(Duration)}, {@link #set(Instant)}).
 * Setting an earlier instant is allowed so tests can simulate clock skew.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class TestClock extends Clock {

    /** Default start: 2024-01-01T09:00:00Z. */
    public static final Instant DEFAULT_START = Instant.parse("2024-01-01T09:00:00Z");

    private volatile Instant now;

    public TestClock() {
        this(DEFAULT_START);
    }

    public TestClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    public synchronized Instant advance(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        now = now.plus(duration);
        return now;
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now = instant;
    }

    @Override
    public Instant instant() {
        return now;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
