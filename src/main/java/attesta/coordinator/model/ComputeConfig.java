package attesta.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * What the caller asks of an environment: resource amounts, framework,
 * metrics to derive from worker output and free-form algorithm parameters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComputeConfig(
        @JsonProperty("resources") ResourceRequirements resources,
        @JsonProperty("framework") String framework,
        @JsonProperty("metrics") List<String> metrics,
        @JsonProperty("parameters") Map<String, Object> parameters) {

    public static ComputeConfig empty() {
        return new ComputeConfig(null, null, List.of(), Map.of());
    }

    public static ComputeConfig ofResources(ResourceRequirements resources) {
        return new ComputeConfig(resources, null, List.of(), Map.of());
    }

    public List<String> metricsOrEmpty() {
        return metrics == null ? List.of() : metrics;
    }

    public Map<String, Object> parametersOrEmpty() {
        return parameters == null ? Map.of() : parameters;
    }
}
