package attesta.coordinator.model;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Which attestations are acceptable: trusted signers, approved code
 * measurements, measurements that are deprecated but still accepted at
 * reduced confidence, and how old an attestation may be.
 */
public final class TrustPolicy {
    private final Set<String> allowedSigners;
    private final Set<String> approvedMeasurements;
    private final Set<String> deprecatedMeasurements;
    private final double deprecatedConfidence;
    private final Duration maxStaleness;
    private final Duration maxClockSkew;

    private TrustPolicy(Builder builder) {
        this.allowedSigners = Set.copyOf(builder.allowedSigners);
        this.approvedMeasurements = Set.copyOf(builder.approvedMeasurements);
        this.deprecatedMeasurements = Set.copyOf(builder.deprecatedMeasurements);
        this.deprecatedConfidence = builder.deprecatedConfidence;
        this.maxStaleness = Objects.requireNonNull(builder.maxStaleness, "maxStaleness is required");
        this.maxClockSkew = Objects.requireNonNull(builder.maxClockSkew, "maxClockSkew is required");
        if (deprecatedConfidence < 0.0 || deprecatedConfidence > 1.0) {
            throw new IllegalArgumentException("deprecatedConfidence must be within [0, 1]");
        }
        if (maxStaleness.isNegative() || maxClockSkew.isNegative()) {
            throw new IllegalArgumentException("staleness window and clock skew must not be negative");
        }
    }

    public Set<String> allowedSigners() {
        return allowedSigners;
    }

    public Set<String> approvedMeasurements() {
        return approvedMeasurements;
    }

    public Set<String> deprecatedMeasurements() {
        return deprecatedMeasurements;
    }

    public double deprecatedConfidence() {
        return deprecatedConfidence;
    }

    public Duration maxStaleness() {
        return maxStaleness;
    }

    public Duration maxClockSkew() {
        return maxClockSkew;
    }

    public boolean isTrustedSigner(String signer) {
        return allowedSigners.contains(signer);
    }

    public boolean isApproved(String measurement) {
        return approvedMeasurements.contains(measurement);
    }

    public boolean isDeprecated(String measurement) {
        return deprecatedMeasurements.contains(measurement);
    }

    public Builder toBuilder() {
        return new Builder()
                .allowedSigners(allowedSigners)
                .approvedMeasurements(approvedMeasurements)
                .deprecatedMeasurements(deprecatedMeasurements)
                .deprecatedConfidence(deprecatedConfidence)
                .maxStaleness(maxStaleness)
                .maxClockSkew(maxClockSkew);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<String> allowedSigners = new LinkedHashSet<>();
        private final Set<String> approvedMeasurements = new LinkedHashSet<>();
        private final Set<String> deprecatedMeasurements = new LinkedHashSet<>();
        private double deprecatedConfidence = 0.5;
        private Duration maxStaleness = Duration.ofHours(1);
        private Duration maxClockSkew = Duration.ofSeconds(30);

        public Builder allowedSigners(Collection<String> signers) {
            this.allowedSigners.addAll(signers);
            return this;
        }

        public Builder allowSigner(String signer) {
            this.allowedSigners.add(signer);
            return this;
        }

        public Builder approvedMeasurements(Collection<String> measurements) {
            this.approvedMeasurements.addAll(measurements);
            return this;
        }

        public Builder approveMeasurement(String measurement) {
            this.approvedMeasurements.add(measurement);
            return this;
        }

        public Builder deprecatedMeasurements(Collection<String> measurements) {
            this.deprecatedMeasurements.addAll(measurements);
            return this;
        }

        public Builder deprecateMeasurement(String measurement) {
            this.deprecatedMeasurements.add(measurement);
            return this;
        }

        public Builder deprecatedConfidence(double confidence) {
            this.deprecatedConfidence = confidence;
            return this;
        }

        public Builder maxStaleness(Duration maxStaleness) {
            this.maxStaleness = maxStaleness;
            return this;
        }

        public Builder maxClockSkew(Duration maxClockSkew) {
            this.maxClockSkew = maxClockSkew;
            return this;
        }

        public TrustPolicy build() {
            return new TrustPolicy(this);
        }
    }

    @Override
    public String toString() {
        return "TrustPolicy{signers=" + allowedSigners.size()
                + ", approved=" + approvedMeasurements.size()
                + ", deprecated=" + deprecatedMeasurements.size()
                + ", maxStaleness=" + maxStaleness + '}';
    }
}
