package io.stakemining.core.reward;

import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.protocol.Amounts;
import io.stakemining.core.state.PoolState;
import io.stakemining.core.state.SessionRecord;
import io.stakemining.core.state.StreakRecord;

import java.util.Objects;

/**
 * Pure reward pricing. Every input, configuration included, is passed explicitly.
 */
public final class RewardEngine {
    private RewardEngine() {}

    /**
     * Cyclic level from the number of open sessions, counting the session being priced.
     * Wraps instead of saturating: with 10 levels, 11 open sessions is level 0 again.
     */
    public static int rewardLevel(long activeSessions, int levelCount) {
        if (levelCount < 1) {
            throw new IllegalArgumentException("levelCount must be >= 1");
        }
        if (activeSessions <= 0) {
            return 0;
        }
        return (int) ((activeSessions - 1) % levelCount);
    }

    public static long baseReward(MiningConfig config, int level) {
        return Math.addExact(config.minReward(), Math.multiplyExact(config.perLevelBonus(), (long) level));
    }

    /** Strictly linear in stake: {@code baseReward * stakedAmount / UNIT}. */
    public static long stakeAdjustedReward(long baseReward, long stakedAmount) {
        return Amounts.mulDiv(baseReward, stakedAmount, Amounts.UNIT);
    }

    /**
     * A referral pays when the referred address started a session strictly inside
     * {@code (openedAt, openedAt + cooldown)} and is not the caller.
     *
     * @param referredOpenedAt first session start of the referral target after {@code openedAt}, 0 if none yet
     */
    public static boolean isReferralEligible(SessionRecord session, String caller, long referredOpenedAt, long cooldownSeconds) {
        if (session == null || !session.isOpen() || !session.hasReferral()) {
            return false;
        }
        if (Objects.equals(session.referralTarget(), caller)) {
            return false;
        }
        long windowEnd = Math.addExact(session.openedAt(), cooldownSeconds);
        return referredOpenedAt > session.openedAt() && referredOpenedAt < windowEnd;
    }

    public static long referralBonus(long stakeAdjustedReward, int referralBonusBps) {
        return Amounts.applyBps(stakeAdjustedReward, referralBonusBps);
    }

    /** Closing within {@code streakWindow} of the previous close (inclusive) extends the streak. */
    public static StreakOutcome evaluateStreak(StreakRecord previous, long now, MiningConfig config) {
        if (previous.lastFinishedAt() > 0 && now - previous.lastFinishedAt() <= config.streakWindowSeconds()) {
            return new StreakOutcome(Math.addExact(previous.consecutiveCount(), 1), config.streakBonus(), true);
        }
        return new StreakOutcome(1, 0L, false);
    }

    /**
     * Price a close.
     *
     * @param poolBeforeClose pool aggregate still including the closing session
     */
    public static RewardBreakdown price(MiningConfig config,
                                        PoolState poolBeforeClose,
                                        SessionRecord session,
                                        String caller,
                                        long referredOpenedAt,
                                        StreakRecord streak,
                                        long now) {
        int level = rewardLevel(poolBeforeClose.activeSessions(), config.levelCount());
        long payout = stakeAdjustedReward(baseReward(config, level), session.stakedAmount());
        boolean referral = isReferralEligible(session, caller, referredOpenedAt, config.cooldownSeconds());
        long referralBonus = referral ? referralBonus(payout, config.referralBonusBps()) : 0L;
        StreakOutcome streakOutcome = evaluateStreak(streak, now, config);
        return new RewardBreakdown(level, payout, referralBonus, streakOutcome.bonus(), streakOutcome.newCount(), referral);
    }

    public static RewardRange estimate(MiningConfig config, long stakeAmount) {
        if (stakeAmount < 0) {
            throw new IllegalArgumentException("stakeAmount must be >= 0");
        }
        long min = stakeAdjustedReward(config.minReward(), stakeAmount);
        long top = stakeAdjustedReward(config.topLevelReward(), stakeAmount);
        long maxReferral = referralBonus(top, config.referralBonusBps());
        long max = Math.addExact(Math.addExact(top, maxReferral), config.streakBonus());
        return new RewardRange(stakeAmount, min, max, maxReferral, config.streakBonus());
    }
}
