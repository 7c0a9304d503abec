package attesta.coordinator.exception;

/**
 * A single partition could not be handed to its worker.
 * Absorbed into that job's state; never aborts the group.
 */
public class DispatchFailureException extends OrchestrationException {

    public DispatchFailureException(String message) {
        super(message);
    }

    public DispatchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
