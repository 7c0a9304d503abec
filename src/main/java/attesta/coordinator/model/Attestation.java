package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * Signed claim from a TEE worker that {@code measurement} (the code identity)
 * produced the result of {@code subjectJobId}.
 *
 * <p>The signature covers {@link #signedPayload()}, a line-oriented canonical
 * encoding of every other field. {@code resultDigest} is optional; when set it is
 * the hex SHA-256 of the result bytes the worker serves for this job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Attestation(
        @JsonProperty("subjectJobId") String subjectJobId,
        @JsonProperty("measurement") String measurement,
        @JsonProperty("signerIdentity") String signerIdentity,
        @JsonProperty("issuedAt") Instant issuedAt,
        @JsonProperty("resultDigest") String resultDigest,
        @JsonProperty("signature") String signature) {

    static final String PAYLOAD_VERSION = "attesta.attestation.v1";

    public Attestation {
        Objects.requireNonNull(subjectJobId, "subjectJobId is required");
        Objects.requireNonNull(measurement, "measurement is required");
        Objects.requireNonNull(signerIdentity, "signerIdentity is required");
        Objects.requireNonNull(issuedAt, "issuedAt is required");
    }

    /**
     * Bytes the signature is computed over.
     */
    public byte[] signedPayload() {
        return payloadFor(subjectJobId, measurement, signerIdentity, issuedAt, resultDigest);
    }

    public static byte[] payloadFor(String subjectJobId, String measurement, String signerIdentity,
            Instant issuedAt, String resultDigest) {
        String canonical = PAYLOAD_VERSION + '\n'
                + subjectJobId + '\n'
                + measurement + '\n'
                + signerIdentity + '\n'
                + issuedAt.toEpochMilli() + '\n'
                + (resultDigest == null ? "" : resultDigest);
        return canonical.getBytes(StandardCharsets.UTF_8);
    }

    public Attestation withSignature(String signature) {
        return new Attestation(subjectJobId, measurement, signerIdentity, issuedAt, resultDigest, signature);
    }
}
