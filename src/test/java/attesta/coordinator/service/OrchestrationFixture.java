package attesta.coordinator.service;

import attesta.coordinator.config.CoordinatorConfig;
import attesta.coordinator.dispatch.ComputeDispatcher;
import attesta.coordinator.dispatch.WorkerClient;
import attesta.coordinator.external.CatalogDataAssetService;
import attesta.coordinator.model.AssetMetadata;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.partition.Partitioner;
import attesta.coordinator.simulation.SimulatedWorkerClient;
import attesta.coordinator.store.InMemoryGroupRepository;
import attesta.coordinator.store.InMemoryJobRepository;
import attesta.coordinator.tracker.JobTracker;
import attesta.coordinator.verify.AttestationVerifier;
import attesta.coordinator.verify.StaticSignerKeyDirectory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Wires an orchestrator and aggregator around a simulated worker, with
 * in-memory storage and short poll timings.
 */
final class OrchestrationFixture implements AutoCloseable {

    static final String DATASET = "ds-100";
    static final String ALGORITHM = "algo-classifier";
    static final String ENVIRONMENT = "sklearn-cpu";
    static final String DEPRECATED_MEASUREMENT = "mr-deprecated";

    final SimulatedWorkerClient worker;
    final JobTracker tracker;
    final ComputeDispatcher dispatcher;
    final AttestationVerifier verifier;
    final TrustPolicy policy;
    final CatalogDataAssetService assets;
    final CoordinatorConfig config;
    final Orchestrator orchestrator;
    final ResultAggregator aggregator;

    OrchestrationFixture(SimulatedWorkerClient worker) {
        this(worker, worker, Duration.ofSeconds(2));
    }

    OrchestrationFixture(SimulatedWorkerClient worker, WorkerClient client, Duration statusTimeout) {
        this.worker = worker;
        this.config = CoordinatorConfig.defaults()
                .withPollInterval(Duration.ofMillis(50))
                .withPollTimeout(Duration.ofSeconds(5))
                .withStatusTimeout(statusTimeout)
                .withSubmitTimeout(Duration.ofSeconds(2));
        this.tracker = new JobTracker(new InMemoryJobRepository(), new InMemoryGroupRepository());
        this.dispatcher = new ComputeDispatcher(client, config.submitTimeout(), config.statusTimeout());
        this.verifier = new AttestationVerifier(new StaticSignerKeyDirectory().register(worker.signerKey()));
        this.policy = TrustPolicy.builder()
                .allowSigner(worker.signerIdentity())
                .approveMeasurement(worker.measurement())
                .deprecateMeasurement(DEPRECATED_MEASUREMENT)
                .deprecatedConfidence(0.5)
                .build();
        this.assets = new CatalogDataAssetService(Path.of("target", "test-assets"))
                .register(AssetMetadata.dataset(DATASET, 100))
                .register(new AssetMetadata(ALGORITHM, "classifier", null, Map.of()));
        this.orchestrator = new Orchestrator(tracker, new Partitioner(), dispatcher, verifier, policy,
                EnvironmentCatalog.defaults(), assets, config);
        this.aggregator = new ResultAggregator(tracker, verifier, policy);
    }

    static SimulatedWorkerClient newWorker() {
        return new SimulatedWorkerClient("enclave-test", "mr-approved");
    }

    @Override
    public void close() {
        orchestrator.close();
        dispatcher.close();
    }
}
