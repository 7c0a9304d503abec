package attesta.coordinator.exception;

/**
 * Bad caller input (partition config, compute config, metric names).
 * Raised before anything is dispatched.
 */
public class ConfigurationException extends OrchestrationException {

    public ConfigurationException(String message) {
        super(message);
    }
}
