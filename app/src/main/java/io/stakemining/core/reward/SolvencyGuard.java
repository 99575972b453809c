package io.stakemining.core.reward;

import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.protocol.Amounts;

import java.math.BigInteger;

/**
 * Minimum reward-token reserve the treasury must hold before admitting more stake.
 *
 * <pre>
 * worstCase = topLevelReward * T / UNIT
 * loaded    = worstCase * (1 + referralBps/10000 * expectedReferralLoadBps/10000)
 * required  = loaded * safetyDiscountBps / 10000
 * </pre>
 *
 * Evaluated as one exact fraction and floored, so the result is monotonic in {@code T}.
 * Results beyond {@code Long.MAX_VALUE} saturate.
 */
public final class SolvencyGuard {
    private static final BigInteger BPS = BigInteger.valueOf(Amounts.BPS_DENOMINATOR);
    private static final BigInteger BPS_SQUARED = BPS.multiply(BPS);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private SolvencyGuard() {}

    public static long requiredReserve(MiningConfig config, long totalActiveStake) {
        if (totalActiveStake <= 0) {
            return 0L;
        }
        BigInteger referralLoad = BPS_SQUARED.add(
                BigInteger.valueOf(config.referralBonusBps()).multiply(BigInteger.valueOf(config.expectedReferralLoadBps())));
        BigInteger numerator = BigInteger.valueOf(config.topLevelReward())
                .multiply(BigInteger.valueOf(totalActiveStake))
                .multiply(referralLoad)
                .multiply(BigInteger.valueOf(config.safetyDiscountBps()));
        BigInteger denominator = BigInteger.valueOf(Amounts.UNIT).multiply(BPS_SQUARED).multiply(BPS);
        BigInteger required = numerator.divide(denominator);
        return required.compareTo(LONG_MAX) > 0 ? Long.MAX_VALUE : required.longValue();
    }

    public static boolean admits(MiningConfig config, long treasuryBalance, long totalActiveStake) {
        return treasuryBalance >= requiredReserve(config, totalActiveStake);
    }
}
