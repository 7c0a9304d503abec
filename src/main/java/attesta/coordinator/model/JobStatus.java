package attesta.coordinator.model;

/**
 * Lifecycle of a single partition job.
 *
 * PENDING -> DISPATCHED -> RUNNING -> {COMPLETED | FAILED}
 */
public enum JobStatus {
    /** Partition created, not yet handed to a worker */
    PENDING,
    /** Dispatch returned a handle, worker has not confirmed execution */
    DISPATCHED,
    /** Worker reports active execution */
    RUNNING,
    /** Worker reported success and the attestation verified */
    COMPLETED,
    /** Dispatch error, worker failure, timeout, cancel or rejected attestation */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a job may move from this status to {@code next}.
     * Status only moves forward; the single exception is COMPLETED -> FAILED,
     * used when a completed result does not survive attestation verification.
     */
    public boolean canAdvanceTo(JobStatus next) {
        if (next == null || this == FAILED) {
            return false;
        }
        if (this == COMPLETED) {
            return next == FAILED;
        }
        return next.ordinal() > this.ordinal();
    }
}
