package attesta.coordinator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable snapshot of one partition job.
 * The job tracker is the only component that produces new snapshots.
 */
public final class Job {
    private final String id;
    private final String groupId;
    private final Partition partition;
    private final String environmentName;
    private final JobStatus status;
    private final FailureReason failureReason;
    private final String message; // audit trail for failures
    private final String workerHandle; // returned by dispatch
    private final Instant createdAt;
    private final Instant startTime;
    private final Instant endTime;
    private final Attestation attestation;
    private final String resultHandle;
    private final Map<String, Double> metrics;
    private final Long computeTimeMs;
    private final String output;
    private final Double verificationConfidence;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.groupId = Objects.requireNonNull(builder.groupId, "groupId is required");
        this.partition = Objects.requireNonNull(builder.partition, "partition is required");
        this.environmentName = Objects.requireNonNull(builder.environmentName, "environmentName is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.failureReason = builder.failureReason;
        this.message = builder.message;
        this.workerHandle = builder.workerHandle;
        this.createdAt = builder.createdAt;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.attestation = builder.attestation;
        this.resultHandle = builder.resultHandle;
        this.metrics = builder.metrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(builder.metrics));
        this.computeTimeMs = builder.computeTimeMs;
        this.output = builder.output;
        this.verificationConfidence = builder.verificationConfidence;
    }

    // Getters
    public String id() {
        return id;
    }

    public String groupId() {
        return groupId;
    }

    public Partition partition() {
        return partition;
    }

    public String environmentName() {
        return environmentName;
    }

    public JobStatus status() {
        return status;
    }

    public FailureReason failureReason() {
        return failureReason;
    }

    public String message() {
        return message;
    }

    public String workerHandle() {
        return workerHandle;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public Attestation attestation() {
        return attestation;
    }

    public String resultHandle() {
        return resultHandle;
    }

    public Map<String, Double> metrics() {
        return metrics;
    }

    public Long computeTimeMs() {
        return computeTimeMs;
    }

    public String output() {
        return output;
    }

    public Double verificationConfidence() {
        return verificationConfidence;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Compute time the worker declared, falling back to wall time between
     * dispatch and the terminal transition.
     */
    public long effectiveComputeTimeMs() {
        if (computeTimeMs != null) {
            return computeTimeMs;
        }
        if (startTime != null && endTime != null) {
            return Math.max(0, Duration.between(startTime, endTime).toMillis());
        }
        return 0;
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .groupId(groupId)
                .partition(partition)
                .environmentName(environmentName)
                .status(status)
                .failureReason(failureReason)
                .message(message)
                .workerHandle(workerHandle)
                .createdAt(createdAt)
                .startTime(startTime)
                .endTime(endTime)
                .attestation(attestation)
                .resultHandle(resultHandle)
                .metrics(metrics)
                .computeTimeMs(computeTimeMs)
                .output(output)
                .verificationConfidence(verificationConfidence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String groupId;
        private Partition partition;
        private String environmentName;
        private JobStatus status = JobStatus.PENDING;
        private FailureReason failureReason;
        private String message;
        private String workerHandle;
        private Instant createdAt;
        private Instant startTime;
        private Instant endTime;
        private Attestation attestation;
        private String resultHandle;
        private Map<String, Double> metrics;
        private Long computeTimeMs;
        private String output;
        private Double verificationConfidence;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder partition(Partition partition) {
            this.partition = partition;
            return this;
        }

        public Builder environmentName(String environmentName) {
            this.environmentName = environmentName;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder failureReason(FailureReason failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder workerHandle(String workerHandle) {
            this.workerHandle = workerHandle;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder attestation(Attestation attestation) {
            this.attestation = attestation;
            return this;
        }

        public Builder resultHandle(String resultHandle) {
            this.resultHandle = resultHandle;
            return this;
        }

        public Builder metrics(Map<String, Double> metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder computeTimeMs(Long computeTimeMs) {
            this.computeTimeMs = computeTimeMs;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder verificationConfidence(Double verificationConfidence) {
            this.verificationConfidence = verificationConfidence;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', partition=" + partition.index() + ", status=" + status
                + (failureReason != null ? ", reason=" + failureReason : "") + '}';
    }
}
