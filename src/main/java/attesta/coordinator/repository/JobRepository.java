package attesta.coordinator.repository;

import attesta.coordinator.model.Job;
import attesta.coordinator.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Storage for job snapshots. Writers must go through the job tracker, which
 * enforces the status state machine; repositories store what they are given.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Replace the stored snapshot of an existing job.
     *
     * @param job the new snapshot
     * @return true if the job existed
     */
    boolean update(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Get all jobs of a group, ordered by partition index.
     *
     * @param groupId the group ID
     * @return list of jobs
     */
    List<Job> findByGroupId(String groupId);

    /**
     * Count jobs in a status across all groups.
     */
    int countByStatus(JobStatus status);

    /**
     * Generate a new unique Job ID.
     *
     * @return unique ID like "job-{uuid}"
     */
    String generateId();
}
