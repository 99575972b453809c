package io.stakemining.core.identity;

import io.stakemining.core.protocol.Fingerprint;

import java.util.Objects;

/** Proof material a participant submits when opening a session. */
public final class IdentityProof {
    private final byte[] root;
    private final Fingerprint fingerprint;
    private final byte[] proof;

    public IdentityProof(byte[] root, Fingerprint fingerprint, byte[] proof) {
        this.root = root != null ? root.clone() : new byte[0];
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.proof = proof != null ? proof.clone() : new byte[0];
    }

    public byte[] root() { return root.clone(); }
    public Fingerprint fingerprint() { return fingerprint; }
    public byte[] proof() { return proof.clone(); }
}
