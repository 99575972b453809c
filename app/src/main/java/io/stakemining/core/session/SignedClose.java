package io.stakemining.core.session;

import io.stakemining.core.protocol.Keys;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Objects;

/**
 * Caller-signed request to close one specific session. The signature covers the pool, the caller,
 * the session's {@code openedAt} and a deadline, so it cannot close a later session of the same
 * caller or be redeemed after the deadline.
 */
public final class SignedClose {
    private static final byte[] ACTION = "close-session".getBytes(StandardCharsets.UTF_8);

    private final String caller;
    private final long sessionOpenedAt;
    private final long deadline;
    private final byte[] signature;
    private final PublicKey signer;

    public SignedClose(String caller, long sessionOpenedAt, long deadline, byte[] signature, PublicKey signer) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.sessionOpenedAt = sessionOpenedAt;
        this.deadline = deadline;
        this.signature = signature != null ? signature.clone() : new byte[0];
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    public static SignedClose sign(KeyPair callerKeys, String poolAddress, long sessionOpenedAt, long deadline) {
        String caller = Keys.deriveAddress(callerKeys.getPublic());
        byte[] message = closeBytes(poolAddress, caller, sessionOpenedAt, deadline);
        return new SignedClose(caller, sessionOpenedAt, deadline, Keys.sign(message, callerKeys.getPrivate()),
                callerKeys.getPublic());
    }

    static byte[] closeBytes(String poolAddress, String caller, long sessionOpenedAt, long deadline) {
        byte[] pool = poolAddress.getBytes(StandardCharsets.UTF_8);
        byte[] who = caller.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(ACTION.length + 4 + pool.length + 4 + who.length + 16)
                .put(ACTION)
                .putInt(pool.length).put(pool)
                .putInt(who.length).put(who)
                .putLong(sessionOpenedAt)
                .putLong(deadline)
                .array();
    }

    /** Why this request cannot close the given session at {@code now}, or {@code null} if it can. */
    String rejection(String poolAddress, long openedAt, long now) {
        if (!caller.equals(Keys.deriveAddress(signer))) {
            return "signer does not own the caller address";
        }
        if (now > deadline) {
            return "request expired at " + deadline;
        }
        if (openedAt != sessionOpenedAt) {
            return "request names a different session";
        }
        if (!Keys.verify(closeBytes(poolAddress, caller, sessionOpenedAt, deadline), signature, signer)) {
            return "bad signature";
        }
        return null;
    }

    public String caller() { return caller; }
    public long sessionOpenedAt() { return sessionOpenedAt; }
    public long deadline() { return deadline; }
    public byte[] signature() { return signature.clone(); }
    public PublicKey signer() { return signer; }

    @Override
    public String toString() {
        return "close(" + caller + ", openedAt=" + sessionOpenedAt + ", deadline=" + deadline + ")";
    }
}
