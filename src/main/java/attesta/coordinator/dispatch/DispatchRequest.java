package attesta.coordinator.dispatch;

import attesta.coordinator.model.ComputeConfig;
import attesta.coordinator.model.EnvironmentSpec;
import attesta.coordinator.model.Partition;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything a worker needs to run one partition. {@code jobId} is the
 * subject the worker must name in its attestation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchRequest(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("groupId") String groupId,
        @JsonProperty("partition") Partition partition,
        @JsonProperty("environment") EnvironmentSpec environment,
        @JsonProperty("algorithmReference") String algorithmReference,
        @JsonProperty("computeConfig") ComputeConfig computeConfig) {
}
