package io.stakemining.core.state;

/**
 * One identity's mining session. {@code openedAt == 0} means no active session; stores never
 * persist such a record, they delete the entry instead.
 *
 * @param referralTarget   address nominated at open time, or {@code null}
 * @param owner            caller address that opened the session
 * @param referredOpenedAt first session start of the referral target after {@code openedAt}, 0 until it starts one
 */
public record SessionRecord(long openedAt, long stakedAmount, String referralTarget, String owner, long referredOpenedAt) {

    public SessionRecord(long openedAt, long stakedAmount, String referralTarget, String owner) {
        this(openedAt, stakedAmount, referralTarget, owner, 0L);
    }

    public boolean isOpen() {
        return openedAt != 0L;
    }

    public boolean hasReferral() {
        return referralTarget != null && !referralTarget.isBlank();
    }

    /** True while the referral target has not started a session since this one opened. */
    public boolean awaitingReferral() {
        return isOpen() && hasReferral() && referredOpenedAt == 0L;
    }

    public SessionRecord withReferredOpenedAt(long startedAt) {
        return new SessionRecord(openedAt, stakedAmount, referralTarget, owner, startedAt);
    }
}
