package attesta.coordinator.service;

import attesta.coordinator.exception.GroupNotTerminalException;
import attesta.coordinator.exception.UnknownGroupException;
import attesta.coordinator.model.AggregateResult;
import attesta.coordinator.model.ComputeConfig;
import attesta.coordinator.model.FailureReason;
import attesta.coordinator.model.Job;
import attesta.coordinator.model.JobStatus;
import attesta.coordinator.model.PartitionConfig;
import attesta.coordinator.model.PartitionOutput;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.simulation.SimulatedWorkerClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static attesta.coordinator.service.OrchestrationFixture.ALGORITHM;
import static attesta.coordinator.service.OrchestrationFixture.DATASET;
import static attesta.coordinator.service.OrchestrationFixture.ENVIRONMENT;
import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

    private OrchestrationFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    private String runGroup(SimulatedWorkerClient worker, int partitions, List<String> metrics) {
        fixture = new OrchestrationFixture(worker);
        String groupId = fixture.orchestrator.startGroup(DATASET, ALGORITHM,
                new ComputeConfig(null, null, metrics, Map.of()), ENVIRONMENT, PartitionConfig.equalSize(partitions));
        fixture.orchestrator.pollGroup(groupId);
        return groupId;
    }

    @Test
    @DisplayName("100 records in 4 partitions, one worker failure: 3 merged results, mean accuracy 0.9")
    void endToEndAggregate() {
        SimulatedWorkerClient worker = OrchestrationFixture.newWorker()
                .metrics(0, Map.of("accuracy", 0.90))
                .metrics(1, Map.of("accuracy", 0.92))
                .metrics(2, Map.of("accuracy", 0.88))
                .failPartition(3, "segfault");
        String groupId = runGroup(worker, 4, List.of("accuracy"));

        AggregateResult result = fixture.aggregator.aggregate(groupId);

        assertEquals(groupId, result.groupId());
        assertEquals(3, result.successCount());
        assertEquals(1, result.failedCount());
        assertEquals(4, result.groupSize());
        assertEquals(0.9, result.metrics().get("accuracy"), 1e-9);
        assertEquals(0.875, result.confidenceScore(), 1e-9);
        assertTrue(result.totalComputeTimeMs() >= 3);

        List<String> partitions = result.mergedResults().stream().map(PartitionOutput::partitionId).toList();
        assertEquals(List.of("part-0000", "part-0001", "part-0002"), partitions);
        for (PartitionOutput output : result.mergedResults()) {
            assertNotNull(output.output());
        }
    }

    @Test
    @DisplayName("Aggregating the same terminal group twice gives equal results")
    void aggregationIsIdempotent() {
        String groupId = runGroup(OrchestrationFixture.newWorker().failPartition(1, "boom"), 3, List.of("accuracy"));

        AggregateResult first = fixture.aggregator.aggregate(groupId);
        AggregateResult second = fixture.aggregator.aggregate(groupId);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Completed jobs that no longer verify are excluded and demoted")
    void revokedMeasurementIsExcluded() {
        String groupId = runGroup(OrchestrationFixture.newWorker(), 4, List.of("accuracy"));
        TrustPolicy revoked = TrustPolicy.builder()
                .allowSigner(fixture.worker.signerIdentity())
                .approveMeasurement("mr-next")
                .build();
        ResultAggregator strict = new ResultAggregator(fixture.tracker, fixture.verifier, revoked);

        AggregateResult result = strict.aggregate(groupId);

        assertEquals(0, result.successCount());
        assertEquals(4, result.failedCount());
        assertEquals(0.0, result.confidenceScore());
        assertTrue(result.mergedResults().isEmpty());
        assertTrue(result.metrics().isEmpty());
        for (Job job : fixture.tracker.jobs(groupId)) {
            assertEquals(JobStatus.FAILED, job.status());
            assertEquals(FailureReason.VERIFICATION_FAILURE, job.failureReason());
            assertTrue(job.message().contains("MEASUREMENT_MISMATCH"), job.message());
        }

        // Demotion sticks for every later aggregation
        assertEquals(0, fixture.aggregator.aggregate(groupId).successCount());
    }

    @Test
    void deprecatedMeasurementLowersConfidence() {
        String groupId = runGroup(OrchestrationFixture.newWorker()
                .measurement(0, OrchestrationFixture.DEPRECATED_MEASUREMENT), 2, List.of());

        AggregateResult result = fixture.aggregator.aggregate(groupId);

        // success fraction 1.0, mean confidence (0.5 + 1.0) / 2
        assertEquals(2, result.successCount());
        assertEquals(0.875, result.confidenceScore(), 1e-9);
    }

    @Test
    void nothingSucceeded() {
        String groupId = runGroup(OrchestrationFixture.newWorker()
                .failPartition(0, "a").failPartition(1, "b"), 2, List.of("accuracy"));

        AggregateResult result = fixture.aggregator.aggregate(groupId);

        assertEquals(0, result.successCount());
        assertEquals(2, result.failedCount());
        assertEquals(0.0, result.confidenceScore());
        assertEquals(0, result.totalComputeTimeMs());
    }

    @Test
    @DisplayName("A metric reported by only some partitions is averaged over those that have it")
    void partialMetricsAveragedOverReporters() {
        String groupId = runGroup(OrchestrationFixture.newWorker()
                .metrics(0, Map.of("loss", 0.4)), 3, List.of("accuracy"));

        AggregateResult result = fixture.aggregator.aggregate(groupId);

        assertEquals(0.4, result.metrics().get("loss"), 1e-9);
        assertEquals(0.9, result.metrics().get("accuracy"), 1e-9);
    }

    @Test
    void openGroupCannotBeAggregated() {
        fixture = new OrchestrationFixture(OrchestrationFixture.newWorker().neverFinish(0));
        String groupId = fixture.orchestrator.startGroup(DATASET, ALGORITHM, ComputeConfig.empty(), ENVIRONMENT,
                PartitionConfig.equalSize(2));

        GroupNotTerminalException e = assertThrows(GroupNotTerminalException.class,
                () -> fixture.aggregator.aggregate(groupId));
        assertEquals(2, e.pendingJobs());

        fixture.orchestrator.cancelGroup(groupId);
        assertEquals(2, fixture.aggregator.aggregate(groupId).failedCount());
    }

    @Test
    void unknownGroup() {
        fixture = new OrchestrationFixture(OrchestrationFixture.newWorker());
        assertThrows(UnknownGroupException.class, () -> fixture.aggregator.aggregate("grp-nope"));
    }

    @Test
    void confidenceScoreFormula() {
        assertEquals(0.0, ResultAggregator.confidenceScore(0, 4, 0.0));
        assertEquals(1.0, ResultAggregator.confidenceScore(4, 4, 4.0), 1e-9);
        assertEquals(0.5 * (0.5 + 0.75), ResultAggregator.confidenceScore(2, 4, 1.5), 1e-9);
    }
}
