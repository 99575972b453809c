package io.stakemining.core.reward;

/** Bounds on what a session staking {@code stakeAmount} can pay out. */
public record RewardRange(long stakeAmount, long minimum, long maximum, long maxReferralBonus, long streakBonus) {
}
