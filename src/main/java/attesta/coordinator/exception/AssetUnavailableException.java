package attesta.coordinator.exception;

/**
 * The data asset service could not resolve, download or upload an asset.
 * Retryable by the caller.
 */
public class AssetUnavailableException extends OrchestrationException {

    public AssetUnavailableException(String message) {
        super(message);
    }

    public AssetUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
