package attesta.coordinator.api.v1.dto;

import attesta.coordinator.model.EnvironmentSpec;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for the environment catalog.
 * GET /api/v1/environments
 */
public record EnvironmentResponse(
        @JsonProperty("count") int count,
        @JsonProperty("environments") List<EnvironmentSpec> environments) {

    public static EnvironmentResponse of(List<EnvironmentSpec> environments) {
        return new EnvironmentResponse(environments.size(), environments);
    }
}
