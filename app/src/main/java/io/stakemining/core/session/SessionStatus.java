package io.stakemining.core.session;

import io.stakemining.core.protocol.Fingerprint;

/** Read-only view of a caller's session; all fields but {@code phase} are empty when idle. */
public record SessionStatus(
        String caller,
        SessionPhase phase,
        Fingerprint fingerprint,
        long openedAt,
        long unlocksAt,
        long stakedAmount,
        String referralTarget
) {
    static SessionStatus idle(String caller) {
        return new SessionStatus(caller, SessionPhase.IDLE, null, 0L, 0L, 0L, null);
    }
}
