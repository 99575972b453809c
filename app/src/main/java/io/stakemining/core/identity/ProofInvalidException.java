package io.stakemining.core.identity;

import io.stakemining.core.protocol.MiningError;
import io.stakemining.core.protocol.MiningException;

public class ProofInvalidException extends MiningException {
    public ProofInvalidException(String message) {
        super(MiningError.PROOF_INVALID, message);
    }

    public ProofInvalidException(String message, Throwable cause) {
        super(MiningError.PROOF_INVALID, message, cause);
    }
}
