package attesta.coordinator.store;

import attesta.coordinator.model.Attestation;
import attesta.coordinator.model.FailureReason;
import attesta.coordinator.model.Job;
import attesta.coordinator.model.JobStatus;
import attesta.coordinator.model.Partition;
import attesta.coordinator.repository.JobRepository;
import attesta.coordinator.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository. Structured fields (partition,
 * attestation, metrics) are stored as JSON text.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final TypeReference<Map<String, Double>> METRICS_TYPE = new TypeReference<>() {
    };

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, group_id, partition_index, partition_json, environment_name, status,
                                      failure_reason, message, worker_handle, created_at, start_time, end_time,
                                      attestation, result_handle, metrics, compute_time_ms, output, verification_conf)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.id());
            ps.setString(2, job.groupId());
            ps.setInt(3, job.partition().index());
            ps.setString(4, Jsons.toJson(job.partition()));
            ps.setString(5, job.environmentName());
            bindMutable(ps, 6, job);

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public boolean update(Job job) {
        String sql = """
                    UPDATE jobs SET status = ?, failure_reason = ?, message = ?, worker_handle = ?,
                                    created_at = ?, start_time = ?, end_time = ?, attestation = ?,
                                    result_handle = ?, metrics = ?, compute_time_ms = ?, output = ?,
                                    verification_conf = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindMutable(ps, 1, job);
            ps.setString(14, job.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findByGroupId(String groupId) {
        String sql = "SELECT * FROM jobs WHERE group_id = ? ORDER BY partition_index";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, groupId);
            List<Job> jobs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapRow(rs));
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs for group: " + groupId, e);
        }
    }

    @Override
    public int countByStatus(JobStatus status) {
        String sql = "SELECT COUNT(*) FROM jobs WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs by status", e);
        }
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID();
    }

    // --- Helpers ---

    /**
     * Binds the 13 columns that change over a job's lifetime, starting at {@code from}.
     */
    private void bindMutable(PreparedStatement ps, int from, Job job) throws SQLException {
        ps.setString(from, job.status().name());
        ps.setString(from + 1, job.failureReason() != null ? job.failureReason().name() : null);
        ps.setString(from + 2, job.message());
        ps.setString(from + 3, job.workerHandle());
        ps.setTimestamp(from + 4, Timestamp.from(job.createdAt() != null ? job.createdAt() : Instant.now()));
        ps.setTimestamp(from + 5, toTimestamp(job.startTime()));
        ps.setTimestamp(from + 6, toTimestamp(job.endTime()));
        ps.setString(from + 7, job.attestation() != null ? Jsons.toJson(job.attestation()) : null);
        ps.setString(from + 8, job.resultHandle());
        ps.setString(from + 9, Jsons.toJson(job.metrics()));
        if (job.computeTimeMs() != null) {
            ps.setLong(from + 10, job.computeTimeMs());
        } else {
            ps.setNull(from + 10, Types.BIGINT);
        }
        ps.setString(from + 11, job.output());
        if (job.verificationConfidence() != null) {
            ps.setDouble(from + 12, job.verificationConfidence());
        } else {
            ps.setNull(from + 12, Types.DOUBLE);
        }
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        String failure = rs.getString("failure_reason");
        long computeTime = rs.getLong("compute_time_ms");
        Long computeTimeMs = rs.wasNull() ? null : computeTime;
        double confidence = rs.getDouble("verification_conf");
        Double verificationConfidence = rs.wasNull() ? null : confidence;

        return Job.builder()
                .id(rs.getString("id"))
                .groupId(rs.getString("group_id"))
                .partition(readJson(rs.getString("partition_json"), Partition.class))
                .environmentName(rs.getString("environment_name"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .failureReason(failure != null ? FailureReason.valueOf(failure) : null)
                .message(rs.getString("message"))
                .workerHandle(rs.getString("worker_handle"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startTime(toInstant(rs.getTimestamp("start_time")))
                .endTime(toInstant(rs.getTimestamp("end_time")))
                .attestation(readJson(rs.getString("attestation"), Attestation.class))
                .resultHandle(rs.getString("result_handle"))
                .metrics(readMetrics(rs.getString("metrics")))
                .computeTimeMs(computeTimeMs)
                .output(rs.getString("output"))
                .verificationConfidence(verificationConfidence)
                .build();
    }

    private <T> T readJson(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupt " + type.getSimpleName() + " column", e);
        }
    }

    private Map<String, Double> readMetrics(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return Jsons.mapper().readValue(json, METRICS_TYPE);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupt metrics column", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
