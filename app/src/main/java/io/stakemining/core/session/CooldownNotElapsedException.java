package io.stakemining.core.session;

import io.stakemining.core.protocol.MiningError;
import io.stakemining.core.protocol.MiningException;

public class CooldownNotElapsedException extends MiningException {
    private final long unlocksAt;

    public CooldownNotElapsedException(long unlocksAt, long now) {
        super(MiningError.COOLDOWN_NOT_ELAPSED, "Session unlocks at " + unlocksAt + " (now " + now + ")");
        this.unlocksAt = unlocksAt;
    }

    public long unlocksAt() { return unlocksAt; }
}
