package io.stakemining.core.session;

import io.stakemining.core.protocol.MiningError;
import io.stakemining.core.protocol.MiningException;

public class InvalidStakeAmountException extends MiningException {
    private final long amount;
    private final long min;
    private final long max;

    public InvalidStakeAmountException(long amount, long min, long max) {
        super(MiningError.INVALID_STAKE_AMOUNT, "Stake " + amount + " outside [" + min + ", " + max + "]");
        this.amount = amount;
        this.min = min;
        this.max = max;
    }

    public long amount() { return amount; }
    public long min() { return min; }
    public long max() { return max; }
}
