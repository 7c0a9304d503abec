package attesta.coordinator.exception;

/**
 * Requested environment is unknown, or the requested resources exceed what it declares.
 */
public class EnvironmentUnsupportedException extends OrchestrationException {

    public EnvironmentUnsupportedException(String message) {
        super(message);
    }
}
