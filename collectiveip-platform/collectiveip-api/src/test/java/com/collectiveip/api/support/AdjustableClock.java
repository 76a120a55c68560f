package com.collectiveip.api.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock shared between the test thread and the embedded server; only moves when advanced.
 */
public class AdjustableClock extends Clock {

    private volatile Instant instant;

    public AdjustableClock(Instant start) {
        this.instant = start;
    }

    public synchronized void advance(Duration duration) {
        instant = instant.plus(duration);
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
        return instant;
    }
}
