package attesta.coordinator.exception;

/**
 * Aggregation was requested while some jobs of the group are still in flight.
 */
public class GroupNotTerminalException extends OrchestrationException {

    private final int pendingJobs;

    public GroupNotTerminalException(String groupId, int pendingJobs) {
        super("Group " + groupId + " still has " + pendingJobs + " non-terminal job(s)");
        this.pendingJobs = pendingJobs;
    }

    public int pendingJobs() {
        return pendingJobs;
    }
}
