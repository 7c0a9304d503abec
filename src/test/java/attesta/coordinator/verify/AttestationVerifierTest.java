package attesta.coordinator.verify;

import attesta.coordinator.model.Attestation;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.model.VerificationReason;
import attesta.coordinator.model.VerificationVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AttestationVerifierTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private KeyPair keyPair;
    private KeyPair otherKeyPair;
    private AttestationVerifier verifier;
    private TrustPolicy policy;

    @BeforeEach
    void setUp() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("Ed25519");
        keyPair = generator.generateKeyPair();
        otherKeyPair = generator.generateKeyPair();

        StaticSignerKeyDirectory keys = new StaticSignerKeyDirectory()
                .register(SignerKey.of("enclave-a", keyPair.getPublic()))
                .register(SignerKey.of("enclave-rogue", otherKeyPair.getPublic()));
        verifier = new AttestationVerifier(keys, Clock.fixed(NOW, ZoneOffset.UTC));

        policy = TrustPolicy.builder()
                .allowSigner("enclave-a")
                .approveMeasurement("mr-good")
                .deprecateMeasurement("mr-old")
                .deprecatedConfidence(0.6)
                .maxStaleness(Duration.ofMinutes(10))
                .maxClockSkew(Duration.ofSeconds(30))
                .build();
    }

    private Attestation signed(KeyPair pair, String jobId, String measurement, String signer, Instant issuedAt)
            throws Exception {
        Attestation unsigned = new Attestation(jobId, measurement, signer, issuedAt, "abc123", null);
        return unsigned.withSignature(Signatures.sign(pair.getPrivate(), unsigned.signedPayload()));
    }

    @Test
    @DisplayName("A fresh attestation from a trusted signer with an approved measurement verifies at 1.0")
    void validAttestation() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-good", "enclave-a", NOW.minusSeconds(60));

        VerificationVerdict verdict = verifier.verify(att, policy);

        assertTrue(verdict.valid());
        assertEquals(VerificationReason.VERIFIED, verdict.reason());
        assertEquals(1.0, verdict.confidence());
    }

    @Test
    void missingAttestation() {
        VerificationVerdict verdict = verifier.verify(null, policy, NOW);

        assertFalse(verdict.valid());
        assertEquals(VerificationReason.MISSING_ATTESTATION, verdict.reason());
        assertEquals(0.0, verdict.confidence());
    }

    @Test
    void tamperedPayloadFailsSignature() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-good", "enclave-a", NOW);
        Attestation tampered = new Attestation("job-1", "mr-good", "enclave-a", NOW, "def456", att.signature());

        assertEquals(VerificationReason.SIGNATURE_INVALID, verifier.verify(tampered, policy, NOW).reason());
    }

    @Test
    void garbageSignatureFailsSignature() {
        Attestation att = new Attestation("job-1", "mr-good", "enclave-a", NOW, null, "not base64 !!");
        assertEquals(VerificationReason.SIGNATURE_INVALID, verifier.verify(att, policy, NOW).reason());

        Attestation unsigned = new Attestation("job-1", "mr-good", "enclave-a", NOW, null, null);
        assertEquals(VerificationReason.SIGNATURE_INVALID, verifier.verify(unsigned, policy, NOW).reason());
    }

    @Test
    void signatureByWrongKeyFails() throws Exception {
        // Claims enclave-a but signed with another key
        Attestation att = signed(otherKeyPair, "job-1", "mr-good", "enclave-a", NOW);
        assertEquals(VerificationReason.SIGNATURE_INVALID, verifier.verify(att, policy, NOW).reason());
    }

    @Test
    void unknownSignerKeyFailsSignature() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-good", "enclave-unknown", NOW);
        assertEquals(VerificationReason.SIGNATURE_INVALID, verifier.verify(att, policy, NOW).reason());
    }

    @Test
    @DisplayName("A well-signed attestation from a signer outside the policy is untrusted")
    void untrustedSigner() throws Exception {
        Attestation att = signed(otherKeyPair, "job-1", "mr-good", "enclave-rogue", NOW);
        assertEquals(VerificationReason.UNTRUSTED_SIGNER, verifier.verify(att, policy, NOW).reason());
    }

    @Test
    void unapprovedMeasurement() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-evil", "enclave-a", NOW);
        assertEquals(VerificationReason.MEASUREMENT_MISMATCH, verifier.verify(att, policy, NOW).reason());
    }

    @Test
    void deprecatedMeasurementVerifiesWithReducedConfidence() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-old", "enclave-a", NOW);

        VerificationVerdict verdict = verifier.verify(att, policy, NOW);

        assertTrue(verdict.valid());
        assertEquals(0.6, verdict.confidence(), 1e-9);
    }

    @Test
    void staleAttestation() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-good", "enclave-a", NOW.minus(Duration.ofMinutes(11)));
        assertEquals(VerificationReason.STALE_ATTESTATION, verifier.verify(att, policy, NOW).reason());
    }

    @Test
    void attestationExactlyAtWindowEdgeIsAccepted() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-good", "enclave-a", NOW.minus(Duration.ofMinutes(10)));
        assertTrue(verifier.verify(att, policy, NOW).valid());
    }

    @Test
    void futureAttestationWithinSkewIsAccepted() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-good", "enclave-a", NOW.plusSeconds(20));
        assertTrue(verifier.verify(att, policy, NOW).valid());
    }

    @Test
    void futureAttestationBeyondSkewIsStale() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-good", "enclave-a", NOW.plusSeconds(120));
        assertEquals(VerificationReason.STALE_ATTESTATION, verifier.verify(att, policy, NOW).reason());
    }

    @Test
    @DisplayName("Checks stop at the first failure: signature before signer before measurement before age")
    void checkOrder() throws Exception {
        Instant old = NOW.minus(Duration.ofDays(1));

        // Bad on every count: wrong key, untrusted, bad measurement, stale
        Attestation everythingWrong = signed(keyPair, "job-1", "mr-evil", "enclave-rogue", old);
        assertEquals(VerificationReason.SIGNATURE_INVALID, verifier.verify(everythingWrong, policy, NOW).reason());

        Attestation untrustedAndStale = signed(otherKeyPair, "job-1", "mr-evil", "enclave-rogue", old);
        assertEquals(VerificationReason.UNTRUSTED_SIGNER, verifier.verify(untrustedAndStale, policy, NOW).reason());

        Attestation badMeasurementAndStale = signed(keyPair, "job-1", "mr-evil", "enclave-a", old);
        assertEquals(VerificationReason.MEASUREMENT_MISMATCH,
                verifier.verify(badMeasurementAndStale, policy, NOW).reason());
    }

    @Test
    void verifyForRejectsAttestationOfAnotherJob() throws Exception {
        Attestation att = signed(keyPair, "job-2", "mr-good", "enclave-a", NOW);

        VerificationVerdict verdict = verifier.verifyFor("job-1", att, policy, NOW);

        assertFalse(verdict.valid());
        assertEquals(VerificationReason.SUBJECT_MISMATCH, verdict.reason());
        assertTrue(verifier.verifyFor("job-2", att, policy, NOW).valid());
    }

    @Test
    void verifyForWithoutAttestationIsMissing() {
        assertEquals(VerificationReason.MISSING_ATTESTATION, verifier.verifyFor("job-1", null, policy, NOW).reason());
    }

    @Test
    @DisplayName("Same inputs and instant always give the same verdict")
    void deterministic() throws Exception {
        Attestation att = signed(keyPair, "job-1", "mr-old", "enclave-a", NOW.minusSeconds(5));
        Instant at = NOW.plusSeconds(30);

        VerificationVerdict first = verifier.verify(att, policy, at);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, verifier.verify(att, policy, at));
        }
    }

    @Test
    void ecKeysAreSupported() throws Exception {
        KeyPair ec = KeyPairGenerator.getInstance("EC").generateKeyPair();
        StaticSignerKeyDirectory keys = new StaticSignerKeyDirectory().register(SignerKey.of("enclave-ec", ec.getPublic()));
        AttestationVerifier ecVerifier = new AttestationVerifier(keys, Clock.fixed(NOW, ZoneOffset.UTC));
        TrustPolicy ecPolicy = policy.toBuilder().allowSigner("enclave-ec").build();

        Attestation att = signed(ec, "job-1", "mr-good", "enclave-ec", NOW);

        assertTrue(ecVerifier.verify(att, ecPolicy).valid());
    }
}
