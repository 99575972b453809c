package io.stakemining.core.config;

import io.stakemining.core.protocol.Amounts;

/**
 * Tunable constants of the mining pool. Instances are immutable and validated on construction;
 * administrators replace the whole snapshot through {@link ConfigStore}.
 *
 * <p>Amounts are in minor units (8 decimals). {@code minReward} and {@code perLevelBonus} are the
 * reward-token payout per {@link Amounts#UNIT} staked.
 */
public record MiningConfig(
        long stakeMin,
        long stakeMax,
        long minReward,
        long perLevelBonus,
        int levelCount,
        int referralBonusBps,
        long cooldownSeconds,
        long streakWindowSeconds,
        long streakBonus,
        int safetyDiscountBps,
        int expectedReferralLoadBps
) {
    public static final long ONE_DAY_SECONDS = 86_400L;

    public MiningConfig {
        if (stakeMin <= 0) throw new IllegalArgumentException("stakeMin must be > 0");
        if (stakeMin > stakeMax) throw new IllegalArgumentException("stakeMin must be <= stakeMax");
        if (minReward < 0) throw new IllegalArgumentException("minReward must be >= 0");
        if (perLevelBonus < 0) throw new IllegalArgumentException("perLevelBonus must be >= 0");
        if (levelCount < 1) throw new IllegalArgumentException("levelCount must be >= 1");
        if (referralBonusBps < 0 || referralBonusBps > Amounts.BPS_DENOMINATOR) {
            throw new IllegalArgumentException("referralBonusBps must be within [0, 10000]");
        }
        if (cooldownSeconds < 0) throw new IllegalArgumentException("cooldownSeconds must be >= 0");
        if (streakWindowSeconds < 0) throw new IllegalArgumentException("streakWindowSeconds must be >= 0");
        if (streakBonus < 0) throw new IllegalArgumentException("streakBonus must be >= 0");
        if (safetyDiscountBps <= 0 || safetyDiscountBps >= Amounts.BPS_DENOMINATOR) {
            throw new IllegalArgumentException("safetyDiscountBps must be within (0, 10000)");
        }
        if (expectedReferralLoadBps < 0 || expectedReferralLoadBps >= Amounts.BPS_DENOMINATOR) {
            throw new IllegalArgumentException("expectedReferralLoadBps must be within [0, 10000)");
        }
        // top-level reward must stay representable
        Math.addExact(minReward, Math.multiplyExact(perLevelBonus, (long) (levelCount - 1)));
    }

    public static MiningConfig defaults() {
        return new MiningConfig(
                Amounts.UNIT,              // stake at least 1 token
                100 * Amounts.UNIT,        // and at most 100
                10_000_000L,               // 0.1 reward per staked token at level 0
                9_000_000L,                // +0.09 per level
                10,
                1_000,                     // 10% referral bonus
                ONE_DAY_SECONDS,
                2 * ONE_DAY_SECONDS,
                5_000_000L,                // 0.05 flat streak bonus
                9_000,
                5_000
        );
    }

    /** Reward per staked unit at the highest level. */
    public long topLevelReward() {
        return minReward + perLevelBonus * (levelCount - 1);
    }

    public MiningConfig withStakeBounds(long min, long max) {
        return new MiningConfig(min, max, minReward, perLevelBonus, levelCount, referralBonusBps,
                cooldownSeconds, streakWindowSeconds, streakBonus, safetyDiscountBps, expectedReferralLoadBps);
    }

    public MiningConfig withMinReward(long value) {
        return new MiningConfig(stakeMin, stakeMax, value, perLevelBonus, levelCount, referralBonusBps,
                cooldownSeconds, streakWindowSeconds, streakBonus, safetyDiscountBps, expectedReferralLoadBps);
    }

    public MiningConfig withPerLevelBonus(long value) {
        return new MiningConfig(stakeMin, stakeMax, minReward, value, levelCount, referralBonusBps,
                cooldownSeconds, streakWindowSeconds, streakBonus, safetyDiscountBps, expectedReferralLoadBps);
    }

    public MiningConfig withLevelCount(int value) {
        return new MiningConfig(stakeMin, stakeMax, minReward, perLevelBonus, value, referralBonusBps,
                cooldownSeconds, streakWindowSeconds, streakBonus, safetyDiscountBps, expectedReferralLoadBps);
    }

    public MiningConfig withReferralBonusBps(int value) {
        return new MiningConfig(stakeMin, stakeMax, minReward, perLevelBonus, levelCount, value,
                cooldownSeconds, streakWindowSeconds, streakBonus, safetyDiscountBps, expectedReferralLoadBps);
    }

    public MiningConfig withCooldownSeconds(long value) {
        return new MiningConfig(stakeMin, stakeMax, minReward, perLevelBonus, levelCount, referralBonusBps,
                value, streakWindowSeconds, streakBonus, safetyDiscountBps, expectedReferralLoadBps);
    }

    public MiningConfig withStreakWindowSeconds(long value) {
        return new MiningConfig(stakeMin, stakeMax, minReward, perLevelBonus, levelCount, referralBonusBps,
                cooldownSeconds, value, streakBonus, safetyDiscountBps, expectedReferralLoadBps);
    }

    public MiningConfig withStreakBonus(long value) {
        return new MiningConfig(stakeMin, stakeMax, minReward, perLevelBonus, levelCount, referralBonusBps,
                cooldownSeconds, streakWindowSeconds, value, safetyDiscountBps, expectedReferralLoadBps);
    }

    public MiningConfig withSafetyDiscountBps(int value) {
        return new MiningConfig(stakeMin, stakeMax, minReward, perLevelBonus, levelCount, referralBonusBps,
                cooldownSeconds, streakWindowSeconds, streakBonus, value, expectedReferralLoadBps);
    }

    public MiningConfig withExpectedReferralLoadBps(int value) {
        return new MiningConfig(stakeMin, stakeMax, minReward, perLevelBonus, levelCount, referralBonusBps,
                cooldownSeconds, streakWindowSeconds, streakBonus, safetyDiscountBps, value);
    }
}
