package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationVerdict(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("reason") VerificationReason reason,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("detail") String detail) {

    public static VerificationVerdict verified(double confidence) {
        return new VerificationVerdict(true, VerificationReason.VERIFIED, confidence, null);
    }

    public static VerificationVerdict rejected(VerificationReason reason, String detail) {
        return new VerificationVerdict(false, reason, 0.0, detail);
    }

    @Override
    public String toString() {
        return valid ? "VERIFIED(" + confidence + ")" : reason + (detail != null ? ": " + detail : "");
    }
}
