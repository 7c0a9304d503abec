package attesta.coordinator.tracker;

import attesta.coordinator.exception.UnknownGroupException;
import attesta.coordinator.model.Attestation;
import attesta.coordinator.model.FailureReason;
import attesta.coordinator.model.GroupSnapshot;
import attesta.coordinator.model.Job;
import attesta.coordinator.model.JobGroup;
import attesta.coordinator.model.JobStatus;
import attesta.coordinator.repository.GroupRepository;
import attesta.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Owns job and group state. Every status change goes through here so the
 * forward-only state machine holds no matter how many poll threads race on
 * the same job. Updates to a job are serialized under one of a fixed set of
 * lock stripes.
 */
public class JobTracker {

    private static final Logger log = LoggerFactory.getLogger(JobTracker.class);
    private static final int LOCK_STRIPES = 64;

    private final JobRepository jobRepository;
    private final GroupRepository groupRepository;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public JobTracker(JobRepository jobRepository, GroupRepository groupRepository) {
        this(jobRepository, groupRepository, Clock.systemUTC());
    }

    public JobTracker(JobRepository jobRepository, GroupRepository groupRepository, Clock clock) {
        this.jobRepository = jobRepository;
        this.groupRepository = groupRepository;
        this.clock = clock;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    /**
     * Register a group and its PENDING jobs. Jobs are stored before the group
     * so a visible group always has all of its members.
     */
    public void createGroup(JobGroup group, List<Job> jobs) {
        for (Job job : jobs) {
            if (job.status() != JobStatus.PENDING) {
                throw new IllegalArgumentException("New job must be PENDING: " + job.id());
            }
            jobRepository.save(job);
        }
        groupRepository.save(group);
        log.info("Created group {} with {} jobs", group.groupId(), jobs.size());
    }

    public JobGroup group(String groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> new UnknownGroupException(groupId));
    }

    public List<JobGroup> recentGroups(int limit) {
        return groupRepository.findRecent(limit);
    }

    public List<Job> jobs(String groupId) {
        group(groupId);
        return jobRepository.findByGroupId(groupId);
    }

    public Optional<Job> job(String jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> nonTerminal(String groupId) {
        return jobs(groupId).stream().filter(j -> !j.isTerminal()).toList();
    }

    public GroupSnapshot snapshot(String groupId) {
        JobGroup group = group(groupId);
        return new GroupSnapshot(group, jobRepository.findByGroupId(groupId), clock.instant());
    }

    public int countByStatus(JobStatus status) {
        return jobRepository.countByStatus(status);
    }

    public String newGroupId() {
        return groupRepository.generateId();
    }

    public String newJobId() {
        return jobRepository.generateId();
    }

    public Instant now() {
        return clock.instant();
    }

    // --- Transitions ---

    public boolean markDispatched(String jobId, String workerHandle, Instant at) {
        return transition(jobId, JobStatus.DISPATCHED,
                b -> b.workerHandle(workerHandle).startTime(at));
    }

    public boolean markRunning(String jobId) {
        return transition(jobId, JobStatus.RUNNING, UnaryOperator.identity());
    }

    /**
     * Record a verified success.
     */
    public boolean markCompleted(String jobId, CompletedResult result) {
        return transition(jobId, JobStatus.COMPLETED, b -> b
                .attestation(result.attestation())
                .resultHandle(result.resultHandle())
                .metrics(result.metrics())
                .computeTimeMs(result.computeTimeMs())
                .output(result.output())
                .verificationConfidence(result.verificationConfidence())
                .endTime(result.completedAt()));
    }

    public boolean markFailed(String jobId, FailureReason reason, String message) {
        return markFailed(jobId, reason, message, null);
    }

    /**
     * Fail a job. The attestation, when given, is kept for audit.
     */
    public boolean markFailed(String jobId, FailureReason reason, String message, Attestation attestation) {
        Instant at = clock.instant();
        boolean applied = transition(jobId, JobStatus.FAILED, b -> {
            b.failureReason(reason).message(message).endTime(at);
            if (attestation != null) {
                b.attestation(attestation);
            }
            return b;
        });
        if (applied) {
            log.warn("Job {} failed ({}): {}", jobId, reason, message);
        }
        return applied;
    }

    /**
     * Move a COMPLETED job whose attestation no longer verifies to FAILED.
     * The original end time is kept.
     */
    public boolean demote(String jobId, String message) {
        Object lock = lockFor(jobId);
        synchronized (lock) {
            Job current = jobRepository.findById(jobId).orElse(null);
            if (current == null || current.status() != JobStatus.COMPLETED) {
                return false;
            }
            Job next = current.toBuilder()
                    .status(JobStatus.FAILED)
                    .failureReason(FailureReason.VERIFICATION_FAILURE)
                    .message(message)
                    .build();
            jobRepository.update(next);
        }
        log.warn("Job {} demoted to FAILED: {}", jobId, message);
        return true;
    }

    private boolean transition(String jobId, JobStatus next, UnaryOperator<Job.Builder> changes) {
        Object lock = lockFor(jobId);
        synchronized (lock) {
            Job current = jobRepository.findById(jobId).orElse(null);
            if (current == null) {
                log.warn("Transition to {} for unknown job {}", next, jobId);
                return false;
            }
            if (current.status() == JobStatus.COMPLETED && next == JobStatus.FAILED) {
                // only demote() may fail a completed job
                log.debug("Job {} already COMPLETED, ignoring {}", jobId, next);
                return false;
            }
            if (!current.status().canAdvanceTo(next)) {
                log.debug("Job {} is {}, ignoring transition to {}", jobId, current.status(), next);
                return false;
            }
            Job updated = changes.apply(current.toBuilder().status(next)).build();
            jobRepository.update(updated);
            log.debug("Job {} {} -> {}", jobId, current.status(), next);
            return true;
        }
    }

    private Object lockFor(String jobId) {
        return locks[Math.floorMod(jobId.hashCode(), locks.length)];
    }
}
