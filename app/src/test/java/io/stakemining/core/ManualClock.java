package io.stakemining.core;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Test clock that only moves when told to. */
public final class ManualClock extends Clock {
    private volatile Instant now;

    public ManualClock(long epochSecond) {
        this.now = Instant.ofEpochSecond(epochSecond);
    }

    public long epochSecond() {
        return now.getEpochSecond();
    }

    public void advanceSeconds(long seconds) {
        now = now.plusSeconds(seconds);
    }

    public void advanceHours(long hours) {
        advanceSeconds(hours * 3_600L);
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
