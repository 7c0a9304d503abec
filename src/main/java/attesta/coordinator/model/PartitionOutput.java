package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PartitionOutput(
        @JsonProperty("partitionId") String partitionId,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("output") String output) {
}
