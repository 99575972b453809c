package io.stakemining.core.state;

/** Login-streak bookkeeping per caller. Only written when a session closes. */
public record StreakRecord(long lastFinishedAt, int consecutiveCount) {
    public static final StreakRecord NONE = new StreakRecord(0L, 0);

    public StreakRecord {
        if (consecutiveCount < 0) {
            throw new IllegalArgumentException("consecutiveCount must be >= 0");
        }
    }
}
