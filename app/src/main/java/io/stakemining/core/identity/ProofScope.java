package io.stakemining.core.identity;

import io.stakemining.core.protocol.Hashes;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Binds proofs to one deployment and one action so they cannot be replayed elsewhere.
 */
public record ProofScope(String appId, String action, long groupId) {

    public ProofScope {
        if (appId == null || appId.isBlank()) throw new IllegalArgumentException("appId required");
        if (action == null) throw new IllegalArgumentException("action required");
    }

    public static ProofScope defaultScope() {
        return new ProofScope("app_stake_mining", "mine", 1L);
    }

    /** hashToField(hashToField(appId) || action) */
    public byte[] externalNullifierHash() {
        byte[] app = Hashes.hashToField(appId);
        byte[] act = action.getBytes(StandardCharsets.UTF_8);
        return Hashes.hashToField(ByteBuffer.allocate(app.length + act.length).put(app).put(act).array());
    }

    /** Signal hash binding a proof to the address that submits it. */
    public static byte[] signalHash(String caller) {
        return Hashes.hashToField(caller);
    }
}
