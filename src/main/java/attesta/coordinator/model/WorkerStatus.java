package attesta.coordinator.model;

/**
 * Status vocabulary of the worker RPC.
 */
public enum WorkerStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED
}
