package attesta.coordinator.exception;

/**
 * Base type for every condition the orchestrator surfaces to its callers.
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
