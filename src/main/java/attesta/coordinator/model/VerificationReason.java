package attesta.coordinator.model;

/**
 * Outcome codes of attestation verification. Checks run in declaration order
 * of the failure codes and stop at the first failure.
 */
public enum VerificationReason {
    VERIFIED,
    MISSING_ATTESTATION,
    SUBJECT_MISMATCH,
    SIGNATURE_INVALID,
    UNTRUSTED_SIGNER,
    MEASUREMENT_MISMATCH,
    STALE_ATTESTATION
}
