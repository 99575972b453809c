package io.stakemining.core.identity;

import io.stakemining.core.protocol.Fingerprint;

/**
 * Contract of the external proof-of-personhood oracle.
 */
public interface IdentityProofVerifier {

    /**
     * Verify that {@code fingerprint} belongs to a member of {@code groupId} under {@code root},
     * for the given signal and scope.
     *
     * @throws ProofInvalidException if the proof does not verify
     */
    void verifyProof(byte[] root,
                     long groupId,
                     byte[] signalHash,
                     Fingerprint fingerprint,
                     byte[] externalNullifierHash,
                     byte[] proof);

    /** Convenience overload for a caller-bound proof in the given scope. */
    default void verify(IdentityProof proof, String caller, ProofScope scope) {
        verifyProof(proof.root(), scope.groupId(), ProofScope.signalHash(caller), proof.fingerprint(),
                scope.externalNullifierHash(), proof.proof());
    }
}
