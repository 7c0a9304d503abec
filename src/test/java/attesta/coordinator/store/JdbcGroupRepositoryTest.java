package attesta.coordinator.store;

import attesta.coordinator.model.JobGroup;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcGroupRepositoryTest {

    private static Database db;
    private static JdbcGroupRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-groups;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        repo = new JdbcGroupRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanGroups() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_groups");
            conn.commit();
        }
    }

    private static JobGroup group(String id, Instant createdAt) {
        return new JobGroup(id, List.of(id + "-j0", id + "-j1"), createdAt, "ds-1", "algo-1", "sklearn-cpu",
                List.of("accuracy", "f1_score"));
    }

    @Test
    void saveAndFindById() {
        Instant created = Instant.parse("2024-05-01T12:00:00Z");
        repo.save(group("grp-1", created));

        JobGroup found = repo.findById("grp-1").orElseThrow();
        assertEquals(List.of("grp-1-j0", "grp-1-j1"), found.jobIds());
        assertEquals("ds-1", found.datasetReference());
        assertEquals("algo-1", found.algorithmReference());
        assertEquals("sklearn-cpu", found.environmentName());
        assertEquals(List.of("accuracy", "f1_score"), found.requestedMetrics());
        assertEquals(created, found.createdAt());
        assertEquals(2, found.size());
    }

    @Test
    void nullAlgorithmIsKept() {
        repo.save(new JobGroup("grp-2", List.of("j"), Instant.parse("2024-05-01T12:00:00Z"), "ds-1", null,
                "r-analytics", List.of()));

        JobGroup found = repo.findById("grp-2").orElseThrow();
        assertNull(found.algorithmReference());
        assertTrue(found.requestedMetrics().isEmpty());
    }

    @Test
    void findMissing() {
        assertTrue(repo.findById("grp-missing").isEmpty());
    }

    @Test
    void findRecentNewestFirst() {
        Instant base = Instant.parse("2024-05-01T12:00:00Z");
        repo.save(group("grp-old", base));
        repo.save(group("grp-new", base.plusSeconds(120)));
        repo.save(group("grp-mid", base.plusSeconds(60)));

        List<JobGroup> recent = repo.findRecent(2);
        assertEquals(List.of("grp-new", "grp-mid"), recent.stream().map(JobGroup::groupId).toList());
    }

    @Test
    void generatedIdsAreUnique() {
        String id = repo.generateId();
        assertTrue(id.startsWith("grp-"));
        assertEquals(id.substring(4), UUID.fromString(id.substring(4)).toString());
        assertNotEquals(id, repo.generateId());
    }
}
