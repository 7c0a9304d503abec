package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Half-open record range {@code [start, end)}.
 */
public record RecordRange(
        @JsonProperty("start") long start,
        @JsonProperty("end") long end) implements RecordSelector {

    public RecordRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    @JsonIgnore
    public long size() {
        return end - start;
    }

    public boolean overlaps(RecordRange other) {
        return start < other.end && other.start < end;
    }

    @Override
    public String describe() {
        return "[" + start + ", " + end + ")";
    }
}
