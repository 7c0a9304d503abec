package attesta.coordinator.repository;

import attesta.coordinator.model.JobGroup;

import java.util.List;
import java.util.Optional;

/**
 * Storage for job groups. Groups are written once and never modified.
 */
public interface GroupRepository {

    void save(JobGroup group);

    Optional<JobGroup> findById(String groupId);

    /**
     * Get recent groups, newest first.
     */
    List<JobGroup> findRecent(int limit);

    /**
     * Generate a new unique group ID like "grp-{uuid}".
     */
    String generateId();
}
