package attesta.coordinator.store;

import attesta.coordinator.model.JobGroup;
import attesta.coordinator.repository.GroupRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryGroupRepository implements GroupRepository {

    private final Map<String, JobGroup> groups = new ConcurrentHashMap<>();

    @Override
    public void save(JobGroup group) {
        if (groups.putIfAbsent(group.groupId(), group) != null) {
            throw new IllegalStateException("Group already exists: " + group.groupId());
        }
    }

    @Override
    public Optional<JobGroup> findById(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    @Override
    public List<JobGroup> findRecent(int limit) {
        return groups.values().stream()
                .sorted(Comparator.comparing(JobGroup::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList();
    }

    @Override
    public String generateId() {
        return "grp-" + UUID.randomUUID();
    }
}
