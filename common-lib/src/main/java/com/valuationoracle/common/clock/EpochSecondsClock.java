package com.valuationoracle.common.clock;

import java.time.Clock;

/**
 * {@link LogicalClock} counting whole seconds since the epoch, so the default staleness
 * window of 3600 units reads as one hour.
 */
public final class EpochSecondsClock implements LogicalClock {

    private final Clock clock;

    public EpochSecondsClock() {
        this(Clock.systemUTC());
    }

    public EpochSecondsClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long now() {
        return clock.instant().getEpochSecond();
    }
}
