package io.stakemining.core.reward;

import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.protocol.Amounts;
import io.stakemining.core.state.PoolState;
import io.stakemining.core.state.SessionRecord;
import io.stakemining.core.state.StreakRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RewardEngineTest {

    private static final long T0 = 1_700_000_000L;
    private static final long HOUR = 3_600L;
    private final MiningConfig config = MiningConfig.defaults();

    @Test
    void levelsCycleThroughLevelCount() {
        int[] expected = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 0};
        for (int sessions = 1; sessions <= 11; sessions++) {
            assertEquals(expected[sessions - 1], RewardEngine.rewardLevel(sessions, 10), "sessions=" + sessions);
        }
        assertEquals(0, RewardEngine.rewardLevel(0, 10));
        assertEquals(0, RewardEngine.rewardLevel(7, 1));
    }

    @Test
    void singleSessionAtLevelZeroPaysMinReward() {
        SessionRecord session = new SessionRecord(T0, Amounts.UNIT, null, "alice");
        RewardBreakdown reward = RewardEngine.price(config, new PoolState(1, Amounts.UNIT), session, "alice", 0L,
                StreakRecord.NONE, T0 + 24 * HOUR);
        assertEquals(0, reward.rewardLevel());
        assertEquals(10_000_000L, reward.payout());
        assertEquals(10_000_000L, reward.total());
        assertFalse(reward.referralApplied());
        assertEquals(1, reward.newStreakCount());
    }

    @Test
    void elevenOpenSessionsWrapToLevelZero() {
        SessionRecord session = new SessionRecord(T0, Amounts.UNIT, null, "alice");
        RewardBreakdown reward = RewardEngine.price(config, new PoolState(11, 11 * Amounts.UNIT), session, "alice", 0L,
                StreakRecord.NONE, T0 + 24 * HOUR);
        assertEquals(0, reward.rewardLevel());
        assertEquals(10_000_000L, reward.payout());
    }

    @Test
    void payoutIsLinearInStake() {
        long base = RewardEngine.baseReward(config, 0);
        assertEquals(70_000_000L, RewardEngine.stakeAdjustedReward(base, 7 * Amounts.UNIT));
        for (int level = 0; level < config.levelCount(); level++) {
            long perUnit = RewardEngine.stakeAdjustedReward(RewardEngine.baseReward(config, level), Amounts.UNIT);
            long triple = RewardEngine.stakeAdjustedReward(RewardEngine.baseReward(config, level), 3 * Amounts.UNIT);
            assertEquals(3 * perUnit, triple);
        }
        assertEquals(0L, RewardEngine.stakeAdjustedReward(base, 0));
    }

    @Test
    void referralRequiresTargetStartInsideOpenWindow() {
        SessionRecord session = new SessionRecord(T0, Amounts.UNIT, "bob", "alice");
        long cooldown = config.cooldownSeconds();

        assertTrue(RewardEngine.isReferralEligible(session, "alice", T0 + HOUR, cooldown));
        assertTrue(RewardEngine.isReferralEligible(session, "alice", T0 + 1, cooldown));
        assertFalse(RewardEngine.isReferralEligible(session, "alice", T0, cooldown));
        assertFalse(RewardEngine.isReferralEligible(session, "alice", T0 + cooldown, cooldown));
        assertFalse(RewardEngine.isReferralEligible(session, "alice", T0 + 25 * HOUR, cooldown));
        assertFalse(RewardEngine.isReferralEligible(session, "alice", 0L, cooldown));
    }

    @Test
    void referralNeverPaysWithoutTargetOrToSelf() {
        long cooldown = config.cooldownSeconds();
        assertFalse(RewardEngine.isReferralEligible(new SessionRecord(T0, Amounts.UNIT, null, "alice"), "alice", T0 + HOUR, cooldown));
        assertFalse(RewardEngine.isReferralEligible(new SessionRecord(T0, Amounts.UNIT, "alice", "alice"), "alice", T0 + HOUR, cooldown));
        assertFalse(RewardEngine.isReferralEligible(new SessionRecord(0L, Amounts.UNIT, "bob", "alice"), "alice", T0 + HOUR, cooldown));
    }

    @Test
    void referralBonusIsShareOfStakeAdjustedReward() {
        SessionRecord session = new SessionRecord(T0, 2 * Amounts.UNIT, "bob", "alice");
        RewardBreakdown reward = RewardEngine.price(config, new PoolState(2, 3 * Amounts.UNIT), session, "alice", T0 + HOUR,
                StreakRecord.NONE, T0 + 24 * HOUR);
        assertEquals(1, reward.rewardLevel());
        assertEquals(38_000_000L, reward.payout());
        assertEquals(3_800_000L, reward.referralBonus());
        assertTrue(reward.referralApplied());
        assertEquals(41_800_000L, reward.total());
    }

    @Test
    void streakWindowIsInclusive() {
        StreakRecord previous = new StreakRecord(T0, 3);
        long window = config.streakWindowSeconds();

        StreakOutcome atEdge = RewardEngine.evaluateStreak(previous, T0 + window, config);
        assertTrue(atEdge.maintained());
        assertEquals(4, atEdge.newCount());
        assertEquals(config.streakBonus(), atEdge.bonus());

        StreakOutcome late = RewardEngine.evaluateStreak(previous, T0 + window + 1, config);
        assertFalse(late.maintained());
        assertEquals(1, late.newCount());
        assertEquals(0L, late.bonus());
    }

    @Test
    void firstCloseStartsStreakWithoutBonus() {
        StreakOutcome first = RewardEngine.evaluateStreak(StreakRecord.NONE, T0, config);
        assertEquals(1, first.newCount());
        assertEquals(0L, first.bonus());
    }

    @Test
    void estimateSpansLevelZeroToTopLevelWithBonuses() {
        RewardRange range = RewardEngine.estimate(config, Amounts.UNIT);
        assertEquals(10_000_000L, range.minimum());
        assertEquals(9_100_000L, range.maxReferralBonus());
        assertEquals(91_000_000L + 9_100_000L + 5_000_000L, range.maximum());
        assertThrows(IllegalArgumentException.class, () -> RewardEngine.estimate(config, -1));
    }
}
