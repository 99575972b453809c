package io.stakemining.core.admin;

import io.stakemining.core.config.ConfigStore;
import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.protocol.Address;
import io.stakemining.core.protocol.MiningError;
import io.stakemining.core.protocol.MiningException;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Bounded setters for the pool configuration. Only the administrator principal may call them;
 * every value is validated by {@link MiningConfig} before the new snapshot is published.
 */
public final class MiningAdmin {
    private static final Logger LOG = Logger.getLogger(MiningAdmin.class.getName());

    private final ConfigStore config;
    private volatile String administrator;

    public MiningAdmin(ConfigStore config, String administrator) {
        this.config = Objects.requireNonNull(config, "config");
        this.administrator = Address.require(administrator, "administrator");
    }

    public String administrator() {
        return administrator;
    }

    public MiningConfig current() {
        return config.get();
    }

    public synchronized void transferAdministration(String caller, String newAdministrator) {
        requireAdministrator(caller);
        if (!Address.isValid(newAdministrator)) {
            throw new MiningException(MiningError.INVALID_CONFIGURATION, "Invalid administrator address: " + newAdministrator);
        }
        administrator = newAdministrator;
        LOG.info(() -> "Administration transferred from " + caller + " to " + newAdministrator);
    }

    public MiningConfig setStakeBounds(String caller, long stakeMin, long stakeMax) {
        return change(caller, "stakeBounds=[" + stakeMin + "," + stakeMax + "]", c -> c.withStakeBounds(stakeMin, stakeMax));
    }

    public MiningConfig setMinReward(String caller, long minReward) {
        return change(caller, "minReward=" + minReward, c -> c.withMinReward(minReward));
    }

    public MiningConfig setPerLevelBonus(String caller, long perLevelBonus) {
        return change(caller, "perLevelBonus=" + perLevelBonus, c -> c.withPerLevelBonus(perLevelBonus));
    }

    public MiningConfig setLevelCount(String caller, int levelCount) {
        return change(caller, "levelCount=" + levelCount, c -> c.withLevelCount(levelCount));
    }

    public MiningConfig setReferralBonusBps(String caller, int bps) {
        return change(caller, "referralBonusBps=" + bps, c -> c.withReferralBonusBps(bps));
    }

    public MiningConfig setCooldown(String caller, long seconds) {
        return change(caller, "cooldownSeconds=" + seconds, c -> c.withCooldownSeconds(seconds));
    }

    public MiningConfig setStreakWindow(String caller, long seconds) {
        return change(caller, "streakWindowSeconds=" + seconds, c -> c.withStreakWindowSeconds(seconds));
    }

    public MiningConfig setStreakBonus(String caller, long bonus) {
        return change(caller, "streakBonus=" + bonus, c -> c.withStreakBonus(bonus));
    }

    public MiningConfig setSafetyDiscountBps(String caller, int bps) {
        return change(caller, "safetyDiscountBps=" + bps, c -> c.withSafetyDiscountBps(bps));
    }

    public MiningConfig setExpectedReferralLoadBps(String caller, int bps) {
        return change(caller, "expectedReferralLoadBps=" + bps, c -> c.withExpectedReferralLoadBps(bps));
    }

    private synchronized MiningConfig change(String caller, String description, UnaryOperator<MiningConfig> updater) {
        requireAdministrator(caller);
        try {
            MiningConfig updated = config.update(updater);
            LOG.info(() -> "Config updated by " + caller + ": " + description);
            return updated;
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new MiningException(MiningError.INVALID_CONFIGURATION, "Rejected " + description + ": " + e.getMessage(), e);
        }
    }

    private void requireAdministrator(String caller) {
        if (caller == null || !caller.equals(administrator)) {
            throw MiningException.notAdministrator(caller);
        }
    }
}
