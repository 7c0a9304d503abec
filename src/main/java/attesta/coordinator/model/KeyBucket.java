package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Records whose {@code keyField} hashes into {@code bucket} out of {@code buckets}.
 */
public record KeyBucket(
        @JsonProperty("keyField") String keyField,
        @JsonProperty("bucket") int bucket,
        @JsonProperty("buckets") int buckets) implements RecordSelector {

    @Override
    public String describe() {
        return "hash(" + keyField + ") mod " + buckets + " == " + bucket;
    }
}
