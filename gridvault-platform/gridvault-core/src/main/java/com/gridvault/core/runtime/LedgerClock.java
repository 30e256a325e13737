package com.gridvault.core.runtime;

import java.time.Instant;

/**
 * Block timestamp source, in epoch seconds. Only moves when told to.
 */
public class LedgerClock {

    private long now;

    public LedgerClock() {
        this(Instant.now().getEpochSecond());
    }

    public LedgerClock(long epochSeconds) {
        if (epochSeconds < 0) {
            throw new IllegalArgumentException("Timestamp cannot be negative");
        }
        this.now = epochSeconds;
    }

    public long now() {
        return now;
    }

    public void advance(long seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Clock cannot move backwards");
        }
        now += seconds;
    }

    public void set(long epochSeconds) {
        if (epochSeconds < now) {
            throw new IllegalArgumentException("Clock cannot move backwards");
        }
        now = epochSeconds;
    }
}
