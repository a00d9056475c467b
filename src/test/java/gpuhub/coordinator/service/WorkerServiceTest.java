package gpuhub.coordinator.service;

import gpuhub.coordinator.TestAwait;
import gpuhub.coordinator.model.Job;
import gpuhub.coordinator.model.JobTransition;
import gpuhub.coordinator.model.Worker;
import gpuhub.coordinator.model.WorkerStatus;
import gpuhub.coordinator.store.Database;
import gpuhub.coordinator.store.JdbcJobRepository;
import gpuhub.coordinator.store.JdbcWorkerRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class WorkerServiceTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcWorkerRepository workers;

    private final Set<String> reachableHosts = ConcurrentHashMap.newKeySet();
    private WorkerService service;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-worker-service;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 8);
        jobs = new JdbcJobRepository(db);
        workers = new JdbcWorkerRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            st.execute("DELETE FROM workers");
            conn.commit();
        }
        reachableHosts.clear();
        service = new WorkerService(workers, new ResourceRegistry(workers, jobs),
                w -> reachableHosts.contains(w.host()));
    }

    @AfterEach
    void close() {
        service.close();
    }

    private Worker register(String host) {
        return service.registerWorker(new WorkerService.NewWorker(null, host, 2222, 2, "A100"));
    }

    @Test
    void registersOfflineWorkerWithDefaults() {
        Worker worker = service.registerWorker(new WorkerService.NewWorker(null, "gpu-01.lab", null, null, null));

        assertTrue(worker.id().startsWith("worker-"));
        assertEquals("gpu-01.lab", worker.name());
        assertEquals(22, worker.port());
        assertEquals(1, worker.gpuCount());
        assertEquals(WorkerStatus.OFFLINE, worker.status());
        assertTrue(worker.active());
        assertEquals(worker.id(), service.findById(worker.id()).orElseThrow().id());
    }

    @Test
    void invalidRegistrationIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.registerWorker(new WorkerService.NewWorker("n", " ", 22, 1, null)));
        assertThrows(IllegalArgumentException.class,
                () -> service.registerWorker(new WorkerService.NewWorker("n", "h", 0, 1, null)));
        assertThrows(IllegalArgumentException.class,
                () -> service.registerWorker(new WorkerService.NewWorker("n", "h", 65536, 1, null)));
        assertThrows(IllegalArgumentException.class,
                () -> service.registerWorker(new WorkerService.NewWorker("n", "h", 22, 0, null)));
        assertTrue(service.findAll().isEmpty());
    }

    @Test
    void pingPersistsReachability() {
        Worker worker = register("gpu-01");

        assertFalse(service.ping(worker.id()));
        assertEquals(WorkerStatus.OFFLINE, workers.findById(worker.id()).orElseThrow().status());

        reachableHosts.add("gpu-01");
        assertTrue(service.ping(worker.id()));
        Worker probed = workers.findById(worker.id()).orElseThrow();
        assertEquals(WorkerStatus.ONLINE, probed.status());
        assertNotNull(probed.lastProbedAt());

        assertThrows(NoSuchElementException.class, () -> service.ping("worker-missing"));
    }

    @Test
    void monitorProbesActiveWorkersOnly() {
        Worker up = register("gpu-01");
        Worker down = register("gpu-02");
        Worker disabled = register("gpu-03");
        service.setActive(disabled.id(), false);
        reachableHosts.add("gpu-01");
        reachableHosts.add("gpu-03");

        assertEquals(1, service.monitorAll());

        assertEquals(WorkerStatus.ONLINE, workers.findById(up.id()).orElseThrow().status());
        assertEquals(WorkerStatus.OFFLINE, workers.findById(down.id()).orElseThrow().status());
        assertNull(workers.findById(disabled.id()).orElseThrow().lastProbedAt());
    }

    @Test
    void maintenanceWindowEndsOnline() {
        Worker worker = register("gpu-01");

        Worker inMaintenance = service.scheduleMaintenance(worker.id(), Duration.ofMillis(300));
        assertEquals(WorkerStatus.MAINTENANCE, inMaintenance.status());

        assertEquals(0, service.monitorAll());
        assertEquals(WorkerStatus.MAINTENANCE, workers.findById(worker.id()).orElseThrow().status());

        TestAwait.until(Duration.ofSeconds(5), "maintenance over",
                () -> workers.findById(worker.id()).orElseThrow().status() == WorkerStatus.ONLINE);
    }

    @Test
    void newMaintenanceWindowReplacesPrevious() throws Exception {
        Worker worker = register("gpu-01");

        service.scheduleMaintenance(worker.id(), Duration.ofMillis(200));
        service.scheduleMaintenance(worker.id(), Duration.ofHours(1));
        Thread.sleep(500);

        assertEquals(WorkerStatus.MAINTENANCE, workers.findById(worker.id()).orElseThrow().status());
    }

    @Test
    void pingDuringMaintenanceKeepsStatus() {
        Worker worker = register("gpu-01");
        reachableHosts.add("gpu-01");
        service.scheduleMaintenance(worker.id(), Duration.ofHours(1));

        assertTrue(service.ping(worker.id()));
        Worker after = workers.findById(worker.id()).orElseThrow();
        assertEquals(WorkerStatus.MAINTENANCE, after.status());
        assertNotNull(after.lastProbedAt());
    }

    @Test
    void maintenanceRequiresPositiveWindow() {
        Worker worker = register("gpu-01");
        assertThrows(IllegalArgumentException.class, () -> service.scheduleMaintenance(worker.id(), Duration.ZERO));
        assertThrows(NoSuchElementException.class,
                () -> service.scheduleMaintenance("worker-missing", Duration.ofMinutes(1)));
    }

    @Test
    void busyWorkerCannotBeDeleted() {
        Worker worker = register("gpu-01");
        jobs.save(Job.builder().id("job-1").userId("u").title("t").jobType("training").build());
        jobs.applyTransition("job-1", JobTransition.running(worker.id(), Instant.now()));

        assertEquals(1, service.runningJobs(worker.id()));
        assertThrows(IllegalStateException.class, () -> service.deleteWorker(worker.id()));

        jobs.applyTransition("job-1", JobTransition.completed(null, Instant.now()));
        service.deleteWorker(worker.id());
        assertTrue(service.findById(worker.id()).isEmpty());
    }

    @Test
    void setActiveTogglesWorker() {
        Worker worker = register("gpu-01");

        assertFalse(service.setActive(worker.id(), false).active());
        assertTrue(service.setActive(worker.id(), true).active());
        assertThrows(NoSuchElementException.class, () -> service.setActive("worker-missing", true));
    }
}
