package attesta.coordinator.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a group, available whether or not it is terminal.
 */
public record GroupSnapshot(
        JobGroup group,
        List<Job> jobs,
        Instant takenAt) {

    public GroupSnapshot {
        jobs = List.copyOf(jobs);
    }

    public Map<JobStatus, Integer> countsByStatus() {
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, 0);
        }
        for (Job job : jobs) {
            counts.merge(job.status(), 1, Integer::sum);
        }
        return counts;
    }

    public boolean isTerminal() {
        return jobs.stream().allMatch(Job::isTerminal);
    }

    public int progressPercent() {
        if (jobs.isEmpty())
            return 0;
        long done = jobs.stream().filter(Job::isTerminal).count();
        return (int) (done * 100 / jobs.size());
    }
}
