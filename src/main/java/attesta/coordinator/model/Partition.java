package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One independent slice of a dataset. Immutable for the life of its group.
 */
public record Partition(
        @JsonProperty("partitionId") String partitionId,
        @JsonProperty("index") int index,
        @JsonProperty("datasetReference") String datasetReference,
        @JsonProperty("selector") RecordSelector selector) {

    public Partition {
        Objects.requireNonNull(partitionId, "partitionId is required");
        Objects.requireNonNull(datasetReference, "datasetReference is required");
        Objects.requireNonNull(selector, "selector is required");
    }
}
