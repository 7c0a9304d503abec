package attesta.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("storage") String storage,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("dispatchedJobs") Integer dispatchedJobs,
        @JsonProperty("runningJobs") Integer runningJobs) {
    public static HealthResponse healthy(String storage, String uptime, String version, int dispatchedJobs,
            int runningJobs) {
        return new HealthResponse("healthy", storage, uptime, version, dispatchedJobs, runningJobs);
    }

    public static HealthResponse unhealthy(String storage) {
        return new HealthResponse("unhealthy", storage, null, null, null, null);
    }
}
