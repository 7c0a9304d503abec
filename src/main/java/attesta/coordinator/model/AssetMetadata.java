package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * What the data asset service knows about a dataset or algorithm.
 * {@code recordCount} is null for assets that are not record-oriented.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetMetadata(
        @JsonProperty("reference") String reference,
        @JsonProperty("name") String name,
        @JsonProperty("recordCount") Long recordCount,
        @JsonProperty("attributes") Map<String, String> attributes) {

    public static AssetMetadata dataset(String reference, long recordCount) {
        return new AssetMetadata(reference, reference, recordCount, Map.of());
    }
}
