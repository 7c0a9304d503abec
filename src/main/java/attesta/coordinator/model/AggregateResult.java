package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merged outcome of a terminal job group. Derived value; a fresh instance is
 * produced for every aggregation call.
 */
public record AggregateResult(
        @JsonProperty("groupId") String groupId,
        @JsonProperty("successCount") int successCount,
        @JsonProperty("failedCount") int failedCount,
        @JsonProperty("totalComputeTimeMs") long totalComputeTimeMs,
        @JsonProperty("mergedResults") List<PartitionOutput> mergedResults,
        @JsonProperty("metrics") Map<String, Double> metrics,
        @JsonProperty("confidenceScore") double confidenceScore) {

    public AggregateResult {
        mergedResults = List.copyOf(mergedResults);
        metrics = Collections.unmodifiableMap(new TreeMap<>(metrics));
    }

    public int groupSize() {
        return successCount + failedCount;
    }
}
