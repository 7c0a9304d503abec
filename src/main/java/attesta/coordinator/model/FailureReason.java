package attesta.coordinator.model;

/**
 * Why a job ended up FAILED. Kept on the job as an audit trail.
 */
public enum FailureReason {
    DISPATCH_FAILURE,
    WORKER_FAILURE,
    VERIFICATION_FAILURE,
    TIMEOUT,
    CANCELLED
}
