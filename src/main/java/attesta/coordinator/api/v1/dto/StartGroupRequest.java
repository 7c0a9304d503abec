package attesta.coordinator.api.v1.dto;

import attesta.coordinator.model.ComputeConfig;
import attesta.coordinator.model.PartitionConfig;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for starting a job group.
 * POST /api/v1/groups
 */
public record StartGroupRequest(
        @JsonProperty("datasetReference") String datasetReference,
        @JsonProperty("algorithmReference") String algorithmReference,
        @JsonProperty("environment") String environment,
        @JsonProperty("computeConfig") ComputeConfig computeConfig,
        @JsonProperty("partitionConfig") PartitionConfig partitionConfig) {

    /** Validate required fields */
    public void validate() {
        if (datasetReference == null || datasetReference.isBlank()) {
            throw new IllegalArgumentException("datasetReference is required");
        }
        if (environment == null || environment.isBlank()) {
            throw new IllegalArgumentException("environment is required");
        }
        if (partitionConfig == null) {
            throw new IllegalArgumentException("partitionConfig is required");
        }
    }
}
