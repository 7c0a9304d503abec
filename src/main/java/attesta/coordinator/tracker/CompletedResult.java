package attesta.coordinator.tracker;

import attesta.coordinator.model.Attestation;

import java.time.Instant;
import java.util.Map;

/**
 * Everything recorded on a job when it completes.
 */
public record CompletedResult(
        Attestation attestation,
        String resultHandle,
        Map<String, Double> metrics,
        Long computeTimeMs,
        String output,
        double verificationConfidence,
        Instant completedAt) {
}
