package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static catalog entry describing where a partition runs.
 */
public record EnvironmentSpec(
        @JsonProperty("name") String name,
        @JsonProperty("resources") ResourceRequirements resources,
        @JsonProperty("runtimeImage") String runtimeImage,
        @JsonProperty("runtimeConfig") Map<String, String> runtimeConfig,
        @JsonProperty("allowedFrameworks") List<String> allowedFrameworks) {

    public EnvironmentSpec {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(resources, "resources is required");
        runtimeConfig = runtimeConfig == null ? Map.of() : Map.copyOf(runtimeConfig);
        allowedFrameworks = allowedFrameworks == null ? List.of() : List.copyOf(allowedFrameworks);
    }
}
