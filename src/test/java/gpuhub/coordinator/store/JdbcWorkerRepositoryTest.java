package gpuhub.coordinator.store;

import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.model.WorkerStatus;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcWorkerRepositoryTest {

    private static Database db;
    private static JdbcWorkerRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-workers;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        repo = new JdbcWorkerRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanWorkers() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM workers");
            conn.commit();
        }
    }

    private static Worker worker(String id, Instant createdAt) {
        return Worker.builder()
                .id(id)
                .name("node " + id)
                .host("10.0.0.1")
                .port(2222)
                .gpuCount(4)
                .gpuModel("A100")
                .createdAt(createdAt)
                .build();
    }

    @Test
    void saveAndFind() {
        repo.save(worker("w-1", Instant.now()));

        Worker found = repo.findById("w-1").orElseThrow();
        assertEquals("10.0.0.1", found.host());
        assertEquals(2222, found.port());
        assertEquals(4, found.gpuCount());
        assertEquals("A100", found.gpuModel());
        assertEquals(WorkerStatus.OFFLINE, found.status());
        assertTrue(found.active());
        assertNull(found.lastProbedAt());
    }

    @Test
    void activeWorkersInRegistrationOrder() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        repo.save(worker("w-b", t0.plusSeconds(10)));
        repo.save(worker("w-a", t0.plusSeconds(20)));
        repo.save(worker("w-c", t0));
        repo.setActive("w-b", false);

        List<String> active = repo.findActive().stream().map(Worker::id).toList();
        assertEquals(List.of("w-c", "w-a"), active);
        assertEquals(3, repo.findAll().size());
    }

    @Test
    void updateStatusKeepsProbeTimeWhenNotGiven() {
        Instant probed = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        repo.save(worker("w-1", Instant.now()));

        assertTrue(repo.updateStatus("w-1", WorkerStatus.ONLINE, probed));
        assertTrue(repo.updateStatus("w-1", WorkerStatus.MAINTENANCE, null));

        Worker found = repo.findById("w-1").orElseThrow();
        assertEquals(WorkerStatus.MAINTENANCE, found.status());
        assertEquals(probed, found.lastProbedAt());
        assertEquals(1, repo.countByStatus(WorkerStatus.MAINTENANCE));
    }

    @Test
    void updateUnknownWorkerReturnsFalse() {
        assertFalse(repo.updateStatus("missing", WorkerStatus.ONLINE, Instant.now()));
        assertFalse(repo.setActive("missing", true));
        assertFalse(repo.delete("missing"));
    }

    @Test
    void deleteRemovesWorker() {
        repo.save(worker("w-1", Instant.now()));

        assertTrue(repo.delete("w-1"));
        assertTrue(repo.findById("w-1").isEmpty());
    }
}
