package attesta.coordinator.partition;

import attesta.coordinator.exception.ConfigurationException;
import attesta.coordinator.model.AssetMetadata;
import attesta.coordinator.model.KeyBucket;
import attesta.coordinator.model.Partition;
import attesta.coordinator.model.PartitionConfig;
import attesta.coordinator.model.PartitionStrategy;
import attesta.coordinator.model.RecordRange;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits a dataset into independent partitions.
 *
 * <ul>
 * <li>{@code equal_size}: contiguous half-open ranges over the declared record
 * count. The first {@code count % k} partitions take one extra record, so
 * every record lands in exactly one partition.</li>
 * <li>{@code by_key}: {@code k} hash buckets over {@code keyField}.</li>
 * <li>{@code custom}: the caller's explicit ranges, checked for bounds and
 * overlap, returned in ascending order.</li>
 * </ul>
 *
 * Stateless; the same inputs always yield the same partitions.
 */
public final class Partitioner {

    public List<Partition> partition(AssetMetadata dataset, PartitionConfig config) {
        if (dataset == null || dataset.reference() == null || dataset.reference().isBlank()) {
            throw new ConfigurationException("dataset reference is required");
        }
        if (config == null) {
            throw new ConfigurationException("partition config is required");
        }

        PartitionStrategy strategy = PartitionStrategy.fromName(config.strategy());
        return switch (strategy) {
            case EQUAL_SIZE -> equalSize(dataset, requirePartitionCount(config));
            case BY_KEY -> byKey(dataset, config.keyField(), requirePartitionCount(config));
            case CUSTOM -> custom(dataset, config);
        };
    }

    private List<Partition> equalSize(AssetMetadata dataset, int k) {
        long total = requireRecordCount(dataset);
        if (k > total) {
            throw new ConfigurationException(
                    "num_partitions (" + k + ") exceeds record count (" + total + ") of " + dataset.reference());
        }

        long base = total / k;
        long remainder = total % k;

        List<Partition> partitions = new ArrayList<>(k);
        long start = 0;
        for (int i = 0; i < k; i++) {
            long size = base + (i < remainder ? 1 : 0);
            partitions.add(new Partition(partitionId(i), i, dataset.reference(), new RecordRange(start, start + size)));
            start += size;
        }
        return List.copyOf(partitions);
    }

    private List<Partition> byKey(AssetMetadata dataset, String keyField, int k) {
        if (keyField == null || keyField.isBlank()) {
            throw new ConfigurationException("key_field is required for the by_key strategy");
        }
        List<Partition> partitions = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            partitions.add(new Partition(partitionId(i), i, dataset.reference(), new KeyBucket(keyField, i, k)));
        }
        return List.copyOf(partitions);
    }

    private List<Partition> custom(AssetMetadata dataset, PartitionConfig config) {
        List<RecordRange> ranges = config.ranges();
        if (ranges == null || ranges.isEmpty()) {
            throw new ConfigurationException("custom strategy requires at least one range");
        }
        if (config.numPartitions() != null && config.numPartitions() != ranges.size()) {
            throw new ConfigurationException("num_partitions (" + config.numPartitions()
                    + ") does not match the number of custom ranges (" + ranges.size() + ")");
        }

        List<RecordRange> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparingLong(RecordRange::start));

        Long total = dataset.recordCount();
        RecordRange previous = null;
        for (RecordRange range : sorted) {
            if (range.size() == 0) {
                throw new ConfigurationException("custom range " + range.describe() + " is empty");
            }
            if (total != null && range.end() > total) {
                throw new ConfigurationException("custom range " + range.describe()
                        + " exceeds record count (" + total + ")");
            }
            if (previous != null && previous.overlaps(range)) {
                throw new ConfigurationException("custom ranges " + previous.describe() + " and "
                        + range.describe() + " overlap");
            }
            previous = range;
        }

        List<Partition> partitions = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            partitions.add(new Partition(partitionId(i), i, dataset.reference(), sorted.get(i)));
        }
        return List.copyOf(partitions);
    }

    private static int requirePartitionCount(PartitionConfig config) {
        Integer k = config.numPartitions();
        if (k == null || k < 1) {
            throw new ConfigurationException("num_partitions must be a positive integer, got " + k);
        }
        return k;
    }

    private static long requireRecordCount(AssetMetadata dataset) {
        Long count = dataset.recordCount();
        if (count == null || count < 0) {
            throw new ConfigurationException("dataset " + dataset.reference() + " declares no record count");
        }
        return count;
    }

    private static String partitionId(int index) {
        return String.format("part-%04d", index);
    }
}
