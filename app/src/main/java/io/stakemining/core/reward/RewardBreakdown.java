package io.stakemining.core.reward;

/**
 * Result of pricing one session close. {@code payout} is the stake-adjusted reward and is
 * reported apart from the bonuses.
 */
public record RewardBreakdown(
        int rewardLevel,
        long payout,
        long referralBonus,
        long streakBonus,
        int newStreakCount,
        boolean referralApplied
) {
    public long total() {
        return Math.addExact(Math.addExact(payout, referralBonus), streakBonus);
    }
}
