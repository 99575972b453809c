package io.stakemining.core.identity;

import io.stakemining.core.protocol.Fingerprint;
import io.stakemining.core.protocol.Hashes;
import io.stakemining.core.protocol.Keys;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PublicKey;

/**
 * Issues attestation proofs accepted by {@link AttestationVerifier}. Fingerprints are derived
 * from a person identifier and the scope, so one person gets one fingerprint per action.
 */
public final class IdentityIssuer {
    private final KeyPair keyPair;
    private final byte[] root;

    public IdentityIssuer(KeyPair keyPair, byte[] root) {
        this.keyPair = keyPair;
        this.root = root.clone();
    }

    public static IdentityIssuer generate() {
        return new IdentityIssuer(Keys.generate(), Hashes.hashToField("identity-root"));
    }

    public PublicKey publicKey() {
        return keyPair.getPublic();
    }

    public AttestationVerifier verifier() {
        return new AttestationVerifier(keyPair.getPublic());
    }

    public Fingerprint fingerprintFor(String personId, ProofScope scope) {
        byte[] person = personId.getBytes(StandardCharsets.UTF_8);
        byte[] scoped = scope.externalNullifierHash();
        byte[] input = new byte[person.length + scoped.length];
        System.arraycopy(person, 0, input, 0, person.length);
        System.arraycopy(scoped, 0, input, person.length, scoped.length);
        return new Fingerprint(Hashes.hashToField(input));
    }

    /** Proof for {@code personId} acting as {@code caller} within {@code scope}. */
    public IdentityProof issue(String personId, String caller, ProofScope scope) {
        Fingerprint fingerprint = fingerprintFor(personId, scope);
        byte[] message = AttestationVerifier.attestationBytes(root, scope.groupId(), ProofScope.signalHash(caller),
                fingerprint, scope.externalNullifierHash());
        return new IdentityProof(root, fingerprint, Keys.sign(message, keyPair.getPrivate()));
    }
}
