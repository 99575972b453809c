package io.stakemining.core.state;

import io.stakemining.core.protocol.Amounts;

/** Aggregate over all open sessions. */
public record PoolState(long activeSessions, long activeStake) {
    public static final PoolState EMPTY = new PoolState(0L, 0L);

    public PoolState {
        if (activeSessions < 0 || activeStake < 0) {
            throw new IllegalArgumentException("Pool counters must be >= 0");
        }
    }

    public PoolState admit(long stake) {
        return new PoolState(Math.addExact(activeSessions, 1L), Math.addExact(activeStake, stake));
    }

    /** Counters are floored at zero so accumulated drift can never make them negative. */
    public PoolState release(long stake) {
        return new PoolState(Amounts.saturatingSub(activeSessions, 1L), Amounts.saturatingSub(activeStake, stake));
    }
}
