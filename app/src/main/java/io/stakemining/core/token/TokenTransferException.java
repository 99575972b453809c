package io.stakemining.core.token;

import io.stakemining.core.protocol.MiningError;
import io.stakemining.core.protocol.MiningException;

public class TokenTransferException extends MiningException {
    public TokenTransferException(String message) {
        super(MiningError.TRANSFER_FAILED, message);
    }
}
