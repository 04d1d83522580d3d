package com.whereq.helios.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Test clock moved by hand, optionally ticking forward on every read
 */
public class MutableClock extends Clock {

    private final AtomicReference<Instant> now;

    private volatile Duration tickOnRead = Duration.ZERO;

    public MutableClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    public static MutableClock startingAt(String isoInstant) {
        return new MutableClock(Instant.parse(isoInstant));
    }

    public void advance(Duration duration) {
        now.updateAndGet(t -> t.plus(duration));
    }

    public void tickOnRead(Duration step) {
        this.tickOnRead = step;
    }

    @Override
    public Instant instant() {
        Duration step = tickOnRead;
        if (step.isZero()) {
            return now.get();
        }
        return now.getAndUpdate(t -> t.plus(step));
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
