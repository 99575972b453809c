package io.stakemining.core.state;

import io.stakemining.core.protocol.Fingerprint;

import java.util.List;
import java.util.Optional;

/**
 * Persistent ledgers of the mining pool: sessions by fingerprint, the caller index, streaks,
 * pending referrals and the pool aggregate.
 */
public interface MiningStateStore {

    Optional<SessionRecord> session(Fingerprint fingerprint);

    /** Fingerprint of the caller's open session, if any. */
    Optional<Fingerprint> activeFingerprint(String caller);

    /** Streak record for a caller; {@link StreakRecord#NONE} if the caller never closed a session. */
    StreakRecord streak(String caller);

    /** Open sessions naming {@code target} as referral that have not yet seen it start a session. */
    List<Fingerprint> pendingReferrals(String target);

    PoolState pool();

    /** Number of stored sessions with {@code openedAt != 0} (audit/tests). */
    long openSessionCount();

    /**
     * Apply all writes atomically.
     *
     * @return the inverse change set; applying it restores the state seen before this call
     */
    StateChanges apply(StateChanges changes);
}
