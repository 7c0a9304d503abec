package attesta.coordinator.service;

import attesta.coordinator.exception.GroupNotTerminalException;
import attesta.coordinator.model.AggregateResult;
import attesta.coordinator.model.Job;
import attesta.coordinator.model.JobStatus;
import attesta.coordinator.model.PartitionOutput;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.model.VerificationVerdict;
import attesta.coordinator.tracker.JobTracker;
import attesta.coordinator.verify.AttestationVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the verified results of a terminal group.
 *
 * <p>Each completed job is verified again before it is counted, at the
 * instant it was originally verified, so repeated calls see the same verdicts.
 * A completed job that fails verification is demoted to FAILED in the tracker
 * and counted as a failure.
 */
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final JobTracker tracker;
    private final AttestationVerifier verifier;
    private final TrustPolicy trustPolicy;

    public ResultAggregator(JobTracker tracker, AttestationVerifier verifier, TrustPolicy trustPolicy) {
        this.tracker = tracker;
        this.verifier = verifier;
        this.trustPolicy = trustPolicy;
    }

    /**
     * @throws GroupNotTerminalException if any job is still open
     */
    public AggregateResult aggregate(String groupId) {
        List<Job> jobs = tracker.jobs(groupId);
        int open = (int) jobs.stream().filter(j -> !j.isTerminal()).count();
        if (open > 0) {
            throw new GroupNotTerminalException(groupId, open);
        }

        int successCount = 0;
        int failedCount = 0;
        long totalComputeTimeMs = 0;
        double confidenceSum = 0.0;
        List<PartitionOutput> merged = new ArrayList<>();
        Map<String, double[]> metricSums = new TreeMap<>(); // name -> {sum, count}

        for (Job job : jobs) {
            if (job.status() != JobStatus.COMPLETED) {
                failedCount++;
                continue;
            }

            Instant verifiedAt = job.endTime() != null ? job.endTime() : tracker.now();
            VerificationVerdict verdict = verifier.verifyFor(job.id(), job.attestation(), trustPolicy, verifiedAt);
            if (!verdict.valid()) {
                tracker.demote(job.id(), verdict.toString());
                failedCount++;
                continue;
            }

            successCount++;
            totalComputeTimeMs += job.effectiveComputeTimeMs();
            confidenceSum += verdict.confidence();
            merged.add(new PartitionOutput(job.partition().partitionId(), job.id(), job.output()));
            for (Map.Entry<String, Double> metric : job.metrics().entrySet()) {
                if (metric.getValue() == null || metric.getValue().isNaN()) {
                    continue;
                }
                double[] acc = metricSums.computeIfAbsent(metric.getKey(), k -> new double[2]);
                acc[0] += metric.getValue();
                acc[1] += 1;
            }
        }

        Map<String, Double> metrics = new TreeMap<>();
        metricSums.forEach((name, acc) -> metrics.put(name, acc[0] / acc[1]));

        double confidence = confidenceScore(successCount, jobs.size(), confidenceSum);

        log.info("Aggregated group {}: {} succeeded, {} failed, confidence {}", groupId, successCount,
                failedCount, String.format("%.3f", confidence));
        return new AggregateResult(groupId, successCount, failedCount, totalComputeTimeMs, merged, metrics,
                confidence);
    }

    /**
     * Mean of the success fraction and the mean verification confidence of the
     * successful jobs, in [0, 1]. Zero when nothing succeeded.
     */
    static double confidenceScore(int successCount, int groupSize, double confidenceSum) {
        if (successCount == 0 || groupSize == 0) {
            return 0.0;
        }
        double successFraction = (double) successCount / groupSize;
        double meanConfidence = confidenceSum / successCount;
        double score = (successFraction + meanConfidence) / 2.0;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
