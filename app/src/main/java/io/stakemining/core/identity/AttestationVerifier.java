package io.stakemining.core.identity;

import io.stakemining.core.protocol.Fingerprint;
import io.stakemining.core.protocol.Keys;

import java.nio.ByteBuffer;
import java.security.PublicKey;
import java.util.Objects;

/**
 * Verifier for local and test deployments: a "proof" is an ECDSA signature by a trusted
 * {@link IdentityIssuer} over every verification input. It stands in for the real oracle
 * and proves nothing about zero knowledge.
 */
public final class AttestationVerifier implements IdentityProofVerifier {
    private final PublicKey issuerKey;

    public AttestationVerifier(PublicKey issuerKey) {
        this.issuerKey = Objects.requireNonNull(issuerKey, "issuerKey");
    }

    @Override
    public void verifyProof(byte[] root, long groupId, byte[] signalHash, Fingerprint fingerprint,
                            byte[] externalNullifierHash, byte[] proof) {
        if (root == null || root.length == 0) {
            throw new ProofInvalidException("Missing identity root");
        }
        if (proof == null || proof.length == 0) {
            throw new ProofInvalidException("Missing identity proof");
        }
        byte[] message = attestationBytes(root, groupId, signalHash, fingerprint, externalNullifierHash);
        if (!Keys.verify(message, proof, issuerKey)) {
            throw new ProofInvalidException("Identity proof rejected for " + fingerprint);
        }
    }

    static byte[] attestationBytes(byte[] root, long groupId, byte[] signalHash, Fingerprint fingerprint,
                                   byte[] externalNullifierHash) {
        byte[] fp = fingerprint.bytes();
        ByteBuffer buf = ByteBuffer.allocate(4 + root.length + 8 + 4 + signalHash.length + fp.length
                + 4 + externalNullifierHash.length);
        buf.putInt(root.length).put(root);
        buf.putLong(groupId);
        buf.putInt(signalHash.length).put(signalHash);
        buf.put(fp);
        buf.putInt(externalNullifierHash.length).put(externalNullifierHash);
        return buf.array();
    }
}
