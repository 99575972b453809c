package io.stakemining.core.session;

import io.stakemining.core.protocol.Fingerprint;

/**
 * Emitted when a session closes. {@code totalReward} is what was transferred:
 * {@code payout + referralBonus + streakBonus}.
 */
public record SessionFinished(
        String caller,
        String referralTarget,
        Fingerprint fingerprint,
        long totalReward,
        long payout,
        long referralBonus,
        long streakBonus,
        int streakCount,
        boolean referralApplied,
        int rewardLevel,
        long stakedAmount,
        long finishedAt
) {
}
