package io.stakemining.core.session;

import io.stakemining.core.protocol.MiningError;
import io.stakemining.core.protocol.MiningException;

/** The treasury cannot back another session right now; callers may retry later. */
public class InsufficientReserveException extends MiningException {
    private final long required;
    private final long available;

    public InsufficientReserveException(long required, long available) {
        super(MiningError.INSUFFICIENT_RESERVE, "Treasury holds " + available + " but " + required + " is required");
        this.required = required;
        this.available = available;
    }

    public long required() { return required; }
    public long available() { return available; }
}
