package attesta.coordinator.api.v1.dto;

import attesta.coordinator.model.GroupSnapshot;
import attesta.coordinator.model.Job;
import attesta.coordinator.model.JobGroup;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a group snapshot.
 * GET /api/v1/groups/{groupId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupResponse(
        @JsonProperty("groupId") String groupId,
        @JsonProperty("datasetReference") String datasetReference,
        @JsonProperty("algorithmReference") String algorithmReference,
        @JsonProperty("environment") String environment,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("terminal") boolean terminal,
        @JsonProperty("progressPercent") int progressPercent,
        @JsonProperty("counts") Map<String, Integer> counts,
        @JsonProperty("jobs") List<JobView> jobs) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JobView(
            @JsonProperty("jobId") String jobId,
            @JsonProperty("partitionId") String partitionId,
            @JsonProperty("records") String records,
            @JsonProperty("status") String status,
            @JsonProperty("failureReason") String failureReason,
            @JsonProperty("message") String message,
            @JsonProperty("startTime") Instant startTime,
            @JsonProperty("endTime") Instant endTime,
            @JsonProperty("metrics") Map<String, Double> metrics,
            @JsonProperty("verificationConfidence") Double verificationConfidence) {

        static JobView from(Job job) {
            return new JobView(
                    job.id(),
                    job.partition().partitionId(),
                    job.partition().selector().describe(),
                    job.status().name(),
                    job.failureReason() != null ? job.failureReason().name() : null,
                    job.message(),
                    job.startTime(),
                    job.endTime(),
                    job.metrics().isEmpty() ? null : job.metrics(),
                    job.verificationConfidence());
        }
    }

    /** Create response from domain model */
    public static GroupResponse from(GroupSnapshot snapshot) {
        JobGroup group = snapshot.group();
        Map<String, Integer> counts = new LinkedHashMap<>();
        snapshot.countsByStatus().forEach((status, n) -> counts.put(status.name(), n));
        return new GroupResponse(
                group.groupId(),
                group.datasetReference(),
                group.algorithmReference(),
                group.environmentName(),
                group.createdAt(),
                snapshot.isTerminal(),
                snapshot.progressPercent(),
                counts,
                snapshot.jobs().stream().map(JobView::from).toList());
    }
}
