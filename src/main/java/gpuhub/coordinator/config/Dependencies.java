package gpuhub.coordinator.config;

import gpuhub.coordinator.api.v1.HealthController;
import gpuhub.coordinator.api.v1.JobController;
import gpuhub.coordinator.api.v1.WorkerController;
import gpuhub.coordinator.execution.ExecutionEngine;
import gpuhub.coordinator.execution.RoutineRegistry;
import gpuhub.coordinator.probe.AvailabilityProber;
import gpuhub.coordinator.probe.BoundedAvailabilityProber;
import gpuhub.coordinator.probe.TcpAvailabilityProber;
import gpuhub.coordinator.repository.JobRepository;
import gpuhub.coordinator.repository.WorkerRepository;
import gpuhub.coordinator.scheduler.JobReaper;
import gpuhub.coordinator.scheduler.JobSupervisor;
import gpuhub.coordinator.scheduler.Scheduler;
import gpuhub.coordinator.server.RouterHandler;
import gpuhub.coordinator.service.Allocator;
import gpuhub.coordinator.service.JobService;
import gpuhub.coordinator.service.ResourceRegistry;
import gpuhub.coordinator.service.StateReconciler;
import gpuhub.coordinator.service.WorkerService;
import gpuhub.coordinator.store.Database;
import gpuhub.coordinator.store.JdbcJobRepository;
import gpuhub.coordinator.store.JdbcWorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // backlog sweep, worker monitor, job reaper
 * JobService jobService = deps.jobService();
 * // ... use services ...
 * deps.close(); // drains running jobs, then cleans up
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final WorkerRepository workerRepository;

    // Scheduling core
    private final BoundedAvailabilityProber prober;
    private final ResourceRegistry resourceRegistry;
    private final Allocator allocator;
    private final StateReconciler reconciler;
    private final RoutineRegistry routineRegistry;
    private final ExecutionEngine executionEngine;
    private final JobSupervisor supervisor;
    private final JobReaper jobReaper;

    // Services
    private final JobService jobService;
    private final WorkerService workerService;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;
    private final WorkerController workerController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, AvailabilityProber probe) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.workerRepository = new JdbcWorkerRepository(database);

        // Scheduling core
        this.prober = new BoundedAvailabilityProber(probe, config.probeTimeout());
        this.resourceRegistry = new ResourceRegistry(workerRepository, jobRepository);
        this.allocator = new Allocator(resourceRegistry, prober, workerRepository);
        this.reconciler = new StateReconciler(jobRepository);
        this.routineRegistry = RoutineRegistry.withDefaults(
                config.trainingStepDuration(), config.inferenceStepDuration(), config.fileStepDuration());
        this.executionEngine = new ExecutionEngine(routineRegistry);
        this.supervisor = new JobSupervisor(jobRepository, allocator, executionEngine, reconciler, config);
        this.jobReaper = new JobReaper(jobRepository, supervisor, reconciler, config);

        // Services
        this.jobService = new JobService(jobRepository, supervisor, reconciler, config);
        this.workerService = new WorkerService(workerRepository, resourceRegistry, prober);

        // Controllers
        this.healthController = new HealthController(database, jobService, workerRepository, supervisor);
        this.jobController = new JobController(jobService);
        this.workerController = new WorkerController(workerService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, probing workers over TCP.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, new TcpAvailabilityProber(config.probeTimeout()));
    }

    /**
     * Create dependencies with a custom reachability check (used by tests).
     */
    public static Dependencies create(CoordinatorConfig config, AvailabilityProber prober) {
        return new Dependencies(config, prober);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public WorkerRepository workerRepository() {
        return workerRepository;
    }

    public ResourceRegistry resourceRegistry() {
        return resourceRegistry;
    }

    public Allocator allocator() {
        return allocator;
    }

    public StateReconciler reconciler() {
        return reconciler;
    }

    public RoutineRegistry routineRegistry() {
        return routineRegistry;
    }

    public ExecutionEngine executionEngine() {
        return executionEngine;
    }

    public JobSupervisor supervisor() {
        return supervisor;
    }

    public JobReaper jobReaper() {
        return jobReaper;
    }

    public JobService jobService() {
        return jobService;
    }

    public WorkerService workerService() {
        return workerService;
    }

    // Controller getters
    public HealthController healthController() {
        return healthController;
    }

    public JobController jobController() {
        return jobController;
    }

    public WorkerController workerController() {
        return workerController;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(jobController)
                    .registerController(workerController);
            log.info("RouterHandler created with {} controllers", 3);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(supervisor, jobReaper, workerService::monitorAll, config);
        }
        return scheduler;
    }

    /**
     * Start the background scheduler.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop background sweeps first so nothing is resubmitted while draining
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            supervisor.shutdown();
        } catch (Exception e) {
            log.warn("Error shutting down supervisor: {}", e.getMessage());
        }

        workerService.close();
        prober.close();

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
