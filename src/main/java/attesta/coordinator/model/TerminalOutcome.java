package attesta.coordinator.model;

import java.util.List;

/**
 * What a poll returns: the job snapshots at the moment polling stopped.
 */
public record TerminalOutcome(
        String groupId,
        List<Job> jobs,
        boolean timedOut,
        boolean cancelled) {

    public TerminalOutcome {
        jobs = List.copyOf(jobs);
    }

    public long completedCount() {
        return jobs.stream().filter(j -> j.status() == JobStatus.COMPLETED).count();
    }

    public long failedCount() {
        return jobs.stream().filter(j -> j.status() == JobStatus.FAILED).count();
    }

    /** Every job reached COMPLETED or FAILED */
    public boolean allTerminal() {
        return jobs.stream().allMatch(Job::isTerminal);
    }

    /** A group counts as successful when at least one job completed */
    public boolean succeeded() {
        return completedCount() > 0;
    }
}
