package io.stakemining.core.admin;

import io.stakemining.core.config.ConfigStore;
import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.protocol.Amounts;
import io.stakemining.core.protocol.MiningError;
import io.stakemining.core.protocol.MiningException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MiningAdminTest {

    private final ConfigStore store = new ConfigStore(MiningConfig.defaults());
    private final MiningAdmin admin = new MiningAdmin(store, "pool-admin");

    @Test
    void administratorUpdatesPublishNewSnapshot() {
        MiningConfig updated = admin.setLevelCount("pool-admin", 5);
        assertEquals(5, updated.levelCount());
        assertEquals(5, store.get().levelCount());

        admin.setStakeBounds("pool-admin", 2 * Amounts.UNIT, 50 * Amounts.UNIT);
        admin.setReferralBonusBps("pool-admin", 2_000);
        admin.setCooldown("pool-admin", 7_200);
        MiningConfig current = admin.current();
        assertEquals(2 * Amounts.UNIT, current.stakeMin());
        assertEquals(50 * Amounts.UNIT, current.stakeMax());
        assertEquals(2_000, current.referralBonusBps());
        assertEquals(7_200, current.cooldownSeconds());
    }

    @Test
    void nonAdministratorIsRejected() {
        MiningException ex = assertThrows(MiningException.class, () -> admin.setMinReward("mallory", 1));
        assertEquals(MiningError.NOT_ADMINISTRATOR, ex.error());
        assertEquals(MiningError.Category.ACCESS, ex.error().category());
        assertEquals(MiningConfig.defaults(), store.get());
    }

    @Test
    void invalidValuesBecomeInvalidConfiguration() {
        MiningException inverted = assertThrows(MiningException.class,
                () -> admin.setStakeBounds("pool-admin", 10 * Amounts.UNIT, Amounts.UNIT));
        assertEquals(MiningError.INVALID_CONFIGURATION, inverted.error());

        MiningException noLevels = assertThrows(MiningException.class, () -> admin.setLevelCount("pool-admin", 0));
        assertEquals(MiningError.INVALID_CONFIGURATION, noLevels.error());

        MiningException overflow = assertThrows(MiningException.class,
                () -> admin.setPerLevelBonus("pool-admin", Long.MAX_VALUE));
        assertEquals(MiningError.INVALID_CONFIGURATION, overflow.error());

        assertEquals(MiningConfig.defaults(), store.get());
    }

    @Test
    void administrationCanBeHandedOver() {
        admin.transferAdministration("pool-admin", "new-admin");
        assertEquals("new-admin", admin.administrator());
        assertThrows(MiningException.class, () -> admin.setStreakBonus("pool-admin", 1));
        assertEquals(1, admin.setStreakBonus("new-admin", 1).streakBonus());

        MiningException bad = assertThrows(MiningException.class, () -> admin.transferAdministration("new-admin", "x"));
        assertEquals(MiningError.INVALID_CONFIGURATION, bad.error());
    }
}
