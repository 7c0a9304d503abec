package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One answer of the worker's status call. Attestation and result handle are
 * only expected on SUCCEEDED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerStatusReport(
        @JsonProperty("status") WorkerStatus status,
        @JsonProperty("attestation") Attestation attestation,
        @JsonProperty("resultHandle") String resultHandle,
        @JsonProperty("metrics") Map<String, Double> metrics,
        @JsonProperty("computeTimeMs") Long computeTimeMs,
        @JsonProperty("error") String error) {

    public static WorkerStatusReport queued() {
        return new WorkerStatusReport(WorkerStatus.QUEUED, null, null, null, null, null);
    }

    public static WorkerStatusReport running() {
        return new WorkerStatusReport(WorkerStatus.RUNNING, null, null, null, null, null);
    }

    public static WorkerStatusReport failed(String error) {
        return new WorkerStatusReport(WorkerStatus.FAILED, null, null, null, null, error);
    }

    public static WorkerStatusReport succeeded(Attestation attestation, String resultHandle,
            Map<String, Double> metrics, Long computeTimeMs) {
        return new WorkerStatusReport(WorkerStatus.SUCCEEDED, attestation, resultHandle, metrics, computeTimeMs, null);
    }

    public Map<String, Double> metricsOrEmpty() {
        return metrics == null ? Map.of() : metrics;
    }
}
