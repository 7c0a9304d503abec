package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Which records of a dataset a partition covers: either a contiguous range
 * or a hash bucket over a key field.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RecordRange.class, name = "range"),
        @JsonSubTypes.Type(value = KeyBucket.class, name = "key_bucket")
})
public interface RecordSelector {

    /** Human-readable form, used in logs and worker payloads */
    String describe();
}
