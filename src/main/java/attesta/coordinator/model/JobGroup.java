package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One logical distributed computation. Membership is fixed once dispatched.
 */
public record JobGroup(
        @JsonProperty("groupId") String groupId,
        @JsonProperty("jobIds") List<String> jobIds,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("datasetReference") String datasetReference,
        @JsonProperty("algorithmReference") String algorithmReference,
        @JsonProperty("environmentName") String environmentName,
        @JsonProperty("requestedMetrics") List<String> requestedMetrics) {

    public JobGroup {
        Objects.requireNonNull(groupId, "groupId is required");
        jobIds = List.copyOf(jobIds);
        requestedMetrics = requestedMetrics == null ? List.of() : List.copyOf(requestedMetrics);
    }

    public int size() {
        return jobIds.size();
    }
}
