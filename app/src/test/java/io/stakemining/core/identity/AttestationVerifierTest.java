package io.stakemining.core.identity;

import io.stakemining.core.protocol.MiningError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttestationVerifierTest {

    private final IdentityIssuer issuer = IdentityIssuer.generate();
    private final ProofScope scope = ProofScope.defaultScope();

    @Test
    void acceptsProofForCallerAndScope() {
        IdentityProof proof = issuer.issue("person-1", "alice", scope);
        assertDoesNotThrow(() -> issuer.verifier().verify(proof, "alice", scope));
    }

    @Test
    void rejectsProofSubmittedByAnotherAddress() {
        IdentityProof proof = issuer.issue("person-1", "alice", scope);
        ProofInvalidException ex = assertThrows(ProofInvalidException.class,
                () -> issuer.verifier().verify(proof, "bob", scope));
        assertEquals(MiningError.PROOF_INVALID, ex.error());
    }

    @Test
    void rejectsProofFromAnotherAction() {
        ProofScope vote = new ProofScope(scope.appId(), "vote", scope.groupId());
        IdentityProof proof = issuer.issue("person-1", "alice", vote);
        assertThrows(ProofInvalidException.class, () -> issuer.verifier().verify(proof, "alice", scope));
    }

    @Test
    void rejectsUntrustedIssuerAndEmptyProof() {
        IdentityProof foreign = IdentityIssuer.generate().issue("person-1", "alice", scope);
        assertThrows(ProofInvalidException.class, () -> issuer.verifier().verify(foreign, "alice", scope));

        IdentityProof empty = new IdentityProof(new byte[] {1}, foreign.fingerprint(), new byte[0]);
        assertThrows(ProofInvalidException.class, () -> issuer.verifier().verify(empty, "alice", scope));
    }

    @Test
    void fingerprintIsStablePerPersonAndScope() {
        assertEquals(issuer.fingerprintFor("person-1", scope), IdentityIssuer.generate().fingerprintFor("person-1", scope));
        assertNotEquals(issuer.fingerprintFor("person-1", scope), issuer.fingerprintFor("person-2", scope));
        assertNotEquals(issuer.fingerprintFor("person-1", scope),
                issuer.fingerprintFor("person-1", new ProofScope(scope.appId(), "vote", 1)));
    }
}
