package attesta.coordinator.store;

import attesta.coordinator.model.JobGroup;
import attesta.coordinator.repository.GroupRepository;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of GroupRepository.
 */
public class JdbcGroupRepository implements GroupRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcGroupRepository.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final Database db;

    public JdbcGroupRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(JobGroup group) {
        String sql = """
                    INSERT INTO job_groups (id, job_ids, dataset_ref, algorithm_ref, environment_name,
                                            requested_metrics, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, group.groupId());
            ps.setString(2, Jsons.toJson(group.jobIds()));
            ps.setString(3, group.datasetReference());
            ps.setString(4, group.algorithmReference());
            ps.setString(5, group.environmentName());
            ps.setString(6, Jsons.toJson(group.requestedMetrics()));
            ps.setTimestamp(7, Timestamp.from(group.createdAt() != null ? group.createdAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved group: {} ({} jobs)", group.groupId(), group.size());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save group: " + group.groupId(), e);
        }
    }

    @Override
    public Optional<JobGroup> findById(String groupId) {
        String sql = "SELECT * FROM job_groups WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, groupId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find group: " + groupId, e);
        }
    }

    @Override
    public List<JobGroup> findRecent(int limit) {
        String sql = "SELECT * FROM job_groups ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<JobGroup> groups = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    groups.add(mapRow(rs));
                }
            }
            return groups;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent groups", e);
        }
    }

    @Override
    public String generateId() {
        return "grp-" + UUID.randomUUID();
    }

    private JobGroup mapRow(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        return new JobGroup(
                rs.getString("id"),
                readList(rs.getString("job_ids")),
                created != null ? created.toInstant() : null,
                rs.getString("dataset_ref"),
                rs.getString("algorithm_ref"),
                rs.getString("environment_name"),
                readList(rs.getString("requested_metrics")));
    }

    private List<String> readList(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return Jsons.mapper().readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupt list column", e);
        }
    }
}
