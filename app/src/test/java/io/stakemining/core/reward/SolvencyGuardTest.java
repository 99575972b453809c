package io.stakemining.core.reward;

import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.protocol.Amounts;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SolvencyGuardTest {

    private final MiningConfig config = MiningConfig.defaults();

    @Test
    void reserveForOneUnitMatchesFormula() {
        // 0.91 top-level reward * 1.05 referral load * 0.9 discount
        assertEquals(85_995_000L, SolvencyGuard.requiredReserve(config, Amounts.UNIT));
        assertEquals(8_599_500_000L, SolvencyGuard.requiredReserve(config, 100 * Amounts.UNIT));
    }

    @Test
    void emptyPoolNeedsNoReserve() {
        assertEquals(0L, SolvencyGuard.requiredReserve(config, 0));
        assertEquals(0L, SolvencyGuard.requiredReserve(config, -5));
    }

    @Test
    void reserveIsMonotonicInStake() {
        long previous = 0;
        for (long stake = 1; stake <= 5_000; stake += 37) {
            long required = SolvencyGuard.requiredReserve(config, stake * 1_234_567L);
            assertTrue(required >= previous, "stake=" + stake);
            previous = required;
        }
    }

    @Test
    void reserveIncreasesWithReferralLoad() {
        long base = SolvencyGuard.requiredReserve(config.withExpectedReferralLoadBps(0), 10 * Amounts.UNIT);
        long loaded = SolvencyGuard.requiredReserve(config, 10 * Amounts.UNIT);
        assertEquals(819_000_000L, base);
        assertTrue(loaded > base);
    }

    @Test
    void hugeStakeSaturates() {
        MiningConfig rich = config.withMinReward(10 * Amounts.UNIT);
        assertEquals(Long.MAX_VALUE, SolvencyGuard.requiredReserve(rich, Long.MAX_VALUE));
    }

    @Test
    void admitsComparesAgainstBalance() {
        assertTrue(SolvencyGuard.admits(config, 85_995_000L, Amounts.UNIT));
        assertFalse(SolvencyGuard.admits(config, 85_994_999L, Amounts.UNIT));
    }
}
