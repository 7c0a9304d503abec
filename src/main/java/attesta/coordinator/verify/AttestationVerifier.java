package attesta.coordinator.verify;

import attesta.coordinator.model.Attestation;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.model.VerificationReason;
import attesta.coordinator.model.VerificationVerdict;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks a TEE attestation against a trust policy.
 *
 * Checks run in order and stop at the first failure:
 * <ol>
 * <li>signature over the payload with the claimed signer's key</li>
 * <li>signer is in the policy's allowed set</li>
 * <li>measurement is approved (or deprecated-but-accepted)</li>
 * <li>issued within the staleness window of the verification time</li>
 * </ol>
 *
 * Pure with respect to its inputs: given the same attestation, policy and
 * verification instant the verdict is always the same.
 */
public class AttestationVerifier {

    private final SignerKeyDirectory keys;
    private final Clock clock;

    public AttestationVerifier(SignerKeyDirectory keys) {
        this(keys, Clock.systemUTC());
    }

    public AttestationVerifier(SignerKeyDirectory keys, Clock clock) {
        this.keys = keys;
        this.clock = clock;
    }

    public VerificationVerdict verify(Attestation attestation, TrustPolicy policy) {
        return verify(attestation, policy, clock.instant());
    }

    /**
     * Verify an attestation offered as proof for {@code jobId}. An attestation
     * naming a different job is rejected before any cryptographic check.
     */
    public VerificationVerdict verifyFor(String jobId, Attestation attestation, TrustPolicy policy,
            Instant verifiedAt) {
        if (attestation != null && !attestation.subjectJobId().equals(jobId)) {
            return VerificationVerdict.rejected(VerificationReason.SUBJECT_MISMATCH,
                    "attestation is for job " + attestation.subjectJobId() + ", not " + jobId);
        }
        return verify(attestation, policy, verifiedAt);
    }

    public VerificationVerdict verify(Attestation attestation, TrustPolicy policy, Instant verifiedAt) {
        if (attestation == null) {
            return VerificationVerdict.rejected(VerificationReason.MISSING_ATTESTATION, "no attestation supplied");
        }

        Optional<SignerKey> key = keys.find(attestation.signerIdentity());
        if (key.isEmpty()) {
            return VerificationVerdict.rejected(VerificationReason.SIGNATURE_INVALID,
                    "no public key on file for signer " + attestation.signerIdentity());
        }
        if (!Signatures.verify(key.get(), attestation.signedPayload(), attestation.signature())) {
            return VerificationVerdict.rejected(VerificationReason.SIGNATURE_INVALID,
                    "signature does not match payload for signer " + attestation.signerIdentity());
        }

        if (!policy.isTrustedSigner(attestation.signerIdentity())) {
            return VerificationVerdict.rejected(VerificationReason.UNTRUSTED_SIGNER,
                    "signer " + attestation.signerIdentity() + " is not in the trust policy");
        }

        double confidence;
        if (policy.isApproved(attestation.measurement())) {
            confidence = 1.0;
        } else if (policy.isDeprecated(attestation.measurement())) {
            confidence = policy.deprecatedConfidence();
        } else {
            return VerificationVerdict.rejected(VerificationReason.MEASUREMENT_MISMATCH,
                    "measurement " + attestation.measurement() + " is not approved");
        }

        Duration age = Duration.between(attestation.issuedAt(), verifiedAt);
        if (age.compareTo(policy.maxStaleness()) > 0) {
            return VerificationVerdict.rejected(VerificationReason.STALE_ATTESTATION,
                    "issued " + age.toSeconds() + "s before verification, window is "
                            + policy.maxStaleness().toSeconds() + "s");
        }
        if (age.isNegative() && age.negated().compareTo(policy.maxClockSkew()) > 0) {
            return VerificationVerdict.rejected(VerificationReason.STALE_ATTESTATION,
                    "issued " + age.negated().toSeconds() + "s in the future");
        }

        return VerificationVerdict.verified(confidence);
    }
}
