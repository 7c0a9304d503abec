package attesta.coordinator.config;

import attesta.coordinator.api.v1.EnvironmentController;
import attesta.coordinator.api.v1.GroupController;
import attesta.coordinator.api.v1.HealthController;
import attesta.coordinator.dispatch.ComputeDispatcher;
import attesta.coordinator.dispatch.WorkerClient;
import attesta.coordinator.external.DataAssetService;
import attesta.coordinator.external.LedgerSubmissionService;
import attesta.coordinator.partition.Partitioner;
import attesta.coordinator.repository.GroupRepository;
import attesta.coordinator.repository.JobRepository;
import attesta.coordinator.server.RouterHandler;
import attesta.coordinator.service.LedgerSettlement;
import attesta.coordinator.service.Orchestrator;
import attesta.coordinator.service.ResultAggregator;
import attesta.coordinator.store.Database;
import attesta.coordinator.store.InMemoryGroupRepository;
import attesta.coordinator.store.InMemoryJobRepository;
import attesta.coordinator.store.JdbcGroupRepository;
import attesta.coordinator.store.JdbcJobRepository;
import attesta.coordinator.tracker.JobTracker;
import attesta.coordinator.verify.AttestationVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(config, settings, workerClient, dataAssets, ledger);
 * String groupId = deps.orchestrator().startGroup(...);
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final IniSettings settings;
    private final Database database; // null for in-memory storage
    private final JobRepository jobRepository;
    private final GroupRepository groupRepository;
    private final JobTracker tracker;
    private final ComputeDispatcher dispatcher;
    private final AttestationVerifier verifier;
    private final Orchestrator orchestrator;
    private final ResultAggregator aggregator;
    private final LedgerSettlement settlement;
    private final DataAssetService dataAssets;

    // Controllers
    private final HealthController healthController;
    private final GroupController groupController;
    private final EnvironmentController environmentController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config,
            IniSettings settings,
            WorkerClient workerClient,
            DataAssetService dataAssets,
            LedgerSubmissionService ledger) {
        this.config = config;
        this.settings = settings;
        this.dataAssets = dataAssets;

        log.info("Initializing dependencies with config: {}", config);

        // Storage
        if (config.hasDatabase()) {
            this.database = new Database(config);
            this.jobRepository = new JdbcJobRepository(database);
            this.groupRepository = new JdbcGroupRepository(database);
        } else {
            this.database = null;
            this.jobRepository = new InMemoryJobRepository();
            this.groupRepository = new InMemoryGroupRepository();
        }

        // Services
        this.tracker = new JobTracker(jobRepository, groupRepository);
        this.dispatcher = new ComputeDispatcher(workerClient, config.submitTimeout(), config.statusTimeout());
        this.verifier = new AttestationVerifier(settings.signerKeys());
        this.orchestrator = new Orchestrator(tracker, new Partitioner(), dispatcher, verifier,
                settings.trustPolicy(), settings.environments(), dataAssets, config);
        this.aggregator = new ResultAggregator(tracker, verifier, settings.trustPolicy());
        this.settlement = new LedgerSettlement(ledger, config.paymentPremium());

        // Controllers (public API)
        this.healthController = new HealthController(database, tracker);
        this.groupController = new GroupController(orchestrator, aggregator);
        this.environmentController = new EnvironmentController(settings.environments());

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(CoordinatorConfig config,
            IniSettings settings,
            WorkerClient workerClient,
            DataAssetService dataAssets,
            LedgerSubmissionService ledger) {
        return new Dependencies(config, settings, workerClient, dataAssets, ledger);
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public IniSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public JobTracker tracker() {
        return tracker;
    }

    public ComputeDispatcher dispatcher() {
        return dispatcher;
    }

    public AttestationVerifier verifier() {
        return verifier;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public ResultAggregator aggregator() {
        return aggregator;
    }

    public LedgerSettlement settlement() {
        return settlement;
    }

    public DataAssetService dataAssets() {
        return dataAssets;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(environmentController)
                    .registerController(groupController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        orchestrator.close();
        dispatcher.close();

        if (database != null) {
            try {
                database.close();
            } catch (RuntimeException e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
