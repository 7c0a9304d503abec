package attesta.coordinator.tracker;

import attesta.coordinator.exception.UnknownGroupException;
import attesta.coordinator.model.FailureReason;
import attesta.coordinator.model.GroupSnapshot;
import attesta.coordinator.model.Job;
import attesta.coordinator.model.JobGroup;
import attesta.coordinator.model.JobStatus;
import attesta.coordinator.model.Partition;
import attesta.coordinator.model.RecordRange;
import attesta.coordinator.store.InMemoryGroupRepository;
import attesta.coordinator.store.InMemoryJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobTrackerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private JobTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new JobTracker(new InMemoryJobRepository(), new InMemoryGroupRepository(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private List<Job> createGroup(String groupId, int size) {
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            jobs.add(Job.builder()
                    .id(groupId + "-job-" + i)
                    .groupId(groupId)
                    .partition(new Partition("part-" + i, i, "ds-1", new RecordRange(i * 10L, i * 10L + 10)))
                    .environmentName("sklearn-cpu")
                    .createdAt(NOW)
                    .build());
        }
        tracker.createGroup(new JobGroup(groupId, jobs.stream().map(Job::id).toList(), NOW, "ds-1", "algo-1",
                "sklearn-cpu", List.of("accuracy")), jobs);
        return jobs;
    }

    private static CompletedResult result() {
        return new CompletedResult(null, "res-1", Map.of("accuracy", 0.9), 1200L, "{}", 1.0, NOW);
    }

    @Test
    void createAndQueryGroup() {
        createGroup("grp-1", 3);

        assertEquals(3, tracker.jobs("grp-1").size());
        assertEquals(3, tracker.nonTerminal("grp-1").size());
        assertEquals(List.of("accuracy"), tracker.group("grp-1").requestedMetrics());
        assertEquals(3, tracker.countByStatus(JobStatus.PENDING));
    }

    @Test
    void unknownGroupThrows() {
        assertThrows(UnknownGroupException.class, () -> tracker.group("grp-missing"));
        assertThrows(UnknownGroupException.class, () -> tracker.jobs("grp-missing"));
        assertThrows(UnknownGroupException.class, () -> tracker.snapshot("grp-missing"));
    }

    @Test
    void newJobsMustBePending() {
        Job running = Job.builder()
                .id("j-1").groupId("grp-x").environmentName("sklearn-cpu")
                .partition(new Partition("part-0", 0, "ds-1", new RecordRange(0, 1)))
                .status(JobStatus.RUNNING)
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> tracker.createGroup(new JobGroup("grp-x", List.of("j-1"), NOW, "ds-1", null, "sklearn-cpu",
                        List.of()), List.of(running)));
    }

    @Test
    @DisplayName("Happy path records handle, start time, result and end time")
    void happyPath() {
        createGroup("grp-1", 1);
        String id = "grp-1-job-0";

        assertTrue(tracker.markDispatched(id, "h-1", NOW));
        assertTrue(tracker.markRunning(id));
        assertTrue(tracker.markCompleted(id, result()));

        Job job = tracker.job(id).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals("h-1", job.workerHandle());
        assertEquals(NOW, job.startTime());
        assertEquals(NOW, job.endTime());
        assertEquals(0.9, job.metrics().get("accuracy"));
        assertEquals(1200L, job.effectiveComputeTimeMs());
        assertEquals(1.0, job.verificationConfidence());
    }

    @Test
    void statusNeverMovesBackward() {
        createGroup("grp-1", 1);
        String id = "grp-1-job-0";
        tracker.markDispatched(id, "h-1", NOW);
        tracker.markRunning(id);

        assertFalse(tracker.markDispatched(id, "h-2", NOW));
        assertFalse(tracker.markRunning(id));
        assertEquals("h-1", tracker.job(id).orElseThrow().workerHandle());
    }

    @Test
    void terminalJobsStayTerminal() {
        createGroup("grp-1", 2);
        tracker.markDispatched("grp-1-job-0", "h-0", NOW);
        tracker.markCompleted("grp-1-job-0", result());
        tracker.markFailed("grp-1-job-1", FailureReason.DISPATCH_FAILURE, "refused");

        assertFalse(tracker.markFailed("grp-1-job-0", FailureReason.TIMEOUT, "late"));
        assertFalse(tracker.markCompleted("grp-1-job-1", result()));
        assertFalse(tracker.markRunning("grp-1-job-1"));

        assertEquals(JobStatus.COMPLETED, tracker.job("grp-1-job-0").orElseThrow().status());
        Job failed = tracker.job("grp-1-job-1").orElseThrow();
        assertEquals(FailureReason.DISPATCH_FAILURE, failed.failureReason());
        assertEquals("refused", failed.message());
    }

    @Test
    void demoteMovesCompletedToFailedKeepingEndTime() {
        createGroup("grp-1", 2);
        tracker.markDispatched("grp-1-job-0", "h-0", NOW);
        tracker.markCompleted("grp-1-job-0", result());

        assertTrue(tracker.demote("grp-1-job-0", "MEASUREMENT_MISMATCH"));
        assertFalse(tracker.demote("grp-1-job-1", "not completed"));

        Job demoted = tracker.job("grp-1-job-0").orElseThrow();
        assertEquals(JobStatus.FAILED, demoted.status());
        assertEquals(FailureReason.VERIFICATION_FAILURE, demoted.failureReason());
        assertEquals(NOW, demoted.endTime());
    }

    @Test
    void unknownJobTransitionIsIgnored() {
        assertFalse(tracker.markRunning("job-nope"));
        assertFalse(tracker.markFailed("job-nope", FailureReason.CANCELLED, "x"));
    }

    @Test
    void snapshotCountsAndProgress() {
        createGroup("grp-1", 4);
        tracker.markDispatched("grp-1-job-0", "h-0", NOW);
        tracker.markCompleted("grp-1-job-0", result());
        tracker.markFailed("grp-1-job-1", FailureReason.WORKER_FAILURE, "oom");
        tracker.markDispatched("grp-1-job-2", "h-2", NOW);

        GroupSnapshot snapshot = tracker.snapshot("grp-1");

        assertFalse(snapshot.isTerminal());
        assertEquals(50, snapshot.progressPercent());
        assertEquals(1, snapshot.countsByStatus().get(JobStatus.COMPLETED));
        assertEquals(1, snapshot.countsByStatus().get(JobStatus.FAILED));
        assertEquals(1, snapshot.countsByStatus().get(JobStatus.DISPATCHED));
        assertEquals(1, snapshot.countsByStatus().get(JobStatus.PENDING));
        assertEquals(0, snapshot.countsByStatus().get(JobStatus.RUNNING));
    }

    @Test
    @DisplayName("Racing terminal transitions on one job: exactly one wins")
    void concurrentTerminalTransitions() throws Exception {
        createGroup("grp-1", 1);
        String id = "grp-1-job-0";
        tracker.markDispatched(id, "h-0", NOW);

        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            boolean complete = i % 2 == 0;
            outcomes.add(pool.submit(() -> {
                go.await();
                return complete
                        ? tracker.markCompleted(id, result())
                        : tracker.markFailed(id, FailureReason.TIMEOUT, "deadline");
            }));
        }
        go.countDown();

        int wins = 0;
        for (Future<Boolean> f : outcomes) {
            if (f.get(5, TimeUnit.SECONDS)) {
                wins++;
            }
        }
        pool.shutdown();

        assertEquals(1, wins);
        assertTrue(tracker.job(id).orElseThrow().isTerminal());
    }

    @Test
    void independentJobsUpdateInParallel() throws Exception {
        createGroup("grp-1", 50);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            String id = "grp-1-job-" + i;
            outcomes.add(pool.submit(() -> tracker.markDispatched(id, "h-" + id, NOW)
                    && tracker.markRunning(id)
                    && tracker.markCompleted(id, result())));
        }
        for (Future<Boolean> f : outcomes) {
            assertTrue(f.get(5, TimeUnit.SECONDS));
        }
        pool.shutdown();

        assertTrue(tracker.snapshot("grp-1").isTerminal());
        assertEquals(50, tracker.countByStatus(JobStatus.COMPLETED));
    }
}
