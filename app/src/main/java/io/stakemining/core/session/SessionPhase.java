package io.stakemining.core.session;

public enum SessionPhase {
    /** No open session. */
    IDLE,
    /** Session open, cooldown not yet elapsed. */
    COOLING_DOWN,
    /** Session open and closable. */
    CLAIMABLE
}
