package attesta.coordinator.exception;

public class UnknownGroupException extends OrchestrationException {

    public UnknownGroupException(String groupId) {
        super("Unknown job group: " + groupId);
    }
}
