package attesta.coordinator.store;

import attesta.coordinator.model.Job;
import attesta.coordinator.model.JobStatus;
import attesta.coordinator.repository.JobRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Arena storage: jobs indexed by id, plus a per-group index.
 */
public class InMemoryJobRepository implements JobRepository {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, List<String>> jobIdsByGroup = new ConcurrentHashMap<>();

    @Override
    public void save(Job job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Job already exists: " + job.id());
        }
        jobIdsByGroup.compute(job.groupId(), (g, ids) -> {
            List<String> next = ids == null ? new ArrayList<>() : new ArrayList<>(ids);
            next.add(job.id());
            return List.copyOf(next);
        });
    }

    @Override
    public boolean update(Job job) {
        return jobs.replace(job.id(), job) != null;
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<Job> findByGroupId(String groupId) {
        List<String> ids = jobIdsByGroup.getOrDefault(groupId, List.of());
        return ids.stream()
                .map(jobs::get)
                .sorted(Comparator.comparingInt(j -> j.partition().index()))
                .toList();
    }

    @Override
    public int countByStatus(JobStatus status) {
        return (int) jobs.values().stream().filter(j -> j.status() == status).count();
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID();
    }
}
