package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Partitioning options: strategy name, partition count, optional key field
 * (by_key) and explicit ranges (custom).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PartitionConfig(
        @JsonProperty("strategy") String strategy,
        @JsonProperty("numPartitions") Integer numPartitions,
        @JsonProperty("keyField") String keyField,
        @JsonProperty("ranges") List<RecordRange> ranges) {

    public static PartitionConfig equalSize(int numPartitions) {
        return new PartitionConfig(PartitionStrategy.EQUAL_SIZE.configName(), numPartitions, null, null);
    }

    public static PartitionConfig byKey(String keyField, int numPartitions) {
        return new PartitionConfig(PartitionStrategy.BY_KEY.configName(), numPartitions, keyField, null);
    }

    public static PartitionConfig custom(List<RecordRange> ranges) {
        return new PartitionConfig(PartitionStrategy.CUSTOM.configName(), ranges.size(), null, ranges);
    }
}
