package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resource amounts. As an environment entry these are declared capacities;
 * inside a compute config they are requested amounts, where null means
 * "not requested".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceRequirements(
        @JsonProperty("cpu") Integer cpu,
        @JsonProperty("memoryGb") Integer memoryGb,
        @JsonProperty("acceleratorCount") Integer acceleratorCount,
        @JsonProperty("acceleratorType") String acceleratorType) {

    public static ResourceRequirements cpuOnly(int cpu, int memoryGb) {
        return new ResourceRequirements(cpu, memoryGb, 0, null);
    }

    public static ResourceRequirements withAccelerator(int cpu, int memoryGb, int count, String type) {
        return new ResourceRequirements(cpu, memoryGb, count, type);
    }
}
