package attesta;

import attesta.coordinator.config.AttestaIniLoader;
import attesta.coordinator.config.CoordinatorConfig;
import attesta.coordinator.config.Dependencies;
import attesta.coordinator.config.IniSettings;
import attesta.coordinator.dispatch.HttpWorkerClient;
import attesta.coordinator.dispatch.WorkerClient;
import attesta.coordinator.exception.ConfigurationException;
import attesta.coordinator.external.CatalogDataAssetService;
import attesta.coordinator.model.AggregateResult;
import attesta.coordinator.model.AssetMetadata;
import attesta.coordinator.model.ComputeConfig;
import attesta.coordinator.model.PartitionConfig;
import attesta.coordinator.model.TerminalOutcome;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.server.CoordinatorNettyServer;
import attesta.coordinator.service.SettlementOutcome;
import attesta.coordinator.simulation.InMemoryLedgerService;
import attesta.coordinator.simulation.SimulatedWorkerClient;
import attesta.coordinator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.math.BigDecimal;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * <pre>
 * java -jar attesta-coordinator.jar [--config attesta.ini] [--port 8080] [--simulate]
 * </pre>
 *
 * {@code --simulate} replaces the remote worker with an in-process one and runs
 * one demo group end-to-end before serving.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String SIM_SIGNER = "sim-enclave";
    private static final String SIM_MEASUREMENT = "sim-measurement-v1";
    private static final String SIM_DATASET = "sim-dataset";

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        boolean simulate = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--simulate" -> simulate = true;
                case "--config" -> config.withConfigFile(argValue(args, ++i, "--config"));
                case "--port" -> config.withServerPort(Integer.parseInt(argValue(args, ++i, "--port")));
                default -> throw new ConfigurationException("Unknown argument: " + args[i]);
            }
        }

        IniSettings settings = config.configFile() != null
                ? AttestaIniLoader.load(new File(config.configFile()), config)
                : IniSettings.defaults(config);

        CatalogDataAssetService dataAssets = new CatalogDataAssetService(Path.of("data"));
        settings.datasets().forEach(dataAssets::register);
        InMemoryLedgerService ledger = new InMemoryLedgerService();

        WorkerClient worker;
        if (simulate) {
            SimulatedWorkerClient sim = new SimulatedWorkerClient(SIM_SIGNER, SIM_MEASUREMENT)
                    .completionDelay(Duration.ofSeconds(2))
                    .failRate(0.1);
            settings.signerKeys().register(sim.signerKey());
            TrustPolicy policy = settings.trustPolicy().toBuilder()
                    .allowSigner(SIM_SIGNER)
                    .approveMeasurement(SIM_MEASUREMENT)
                    .build();
            settings = new IniSettings(settings.config(), policy, settings.signerKeys(), settings.environments(),
                    settings.datasets());
            dataAssets.register(AssetMetadata.dataset(SIM_DATASET, 1000));
            config.withPollInterval(Duration.ofSeconds(1)).withPollTimeout(Duration.ofSeconds(30));
            worker = sim;
            log.info("Simulation mode: in-process worker {} ({})", SIM_SIGNER, SIM_MEASUREMENT);
        } else {
            if (config.workerUrl() == null) {
                throw new ConfigurationException("ATTESTA_WORKER_URL is required unless --simulate is given");
            }
            worker = new HttpWorkerClient(URI.create(config.workerUrl()), config.statusTimeout());
        }

        Dependencies deps = Dependencies.create(config, settings, worker, dataAssets, ledger);
        CoordinatorNettyServer server = new CoordinatorNettyServer(deps.routerHandler());
        server.start(config.serverHost(), config.serverPort());

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            shutdown.countDown();
        }, "attesta-shutdown"));

        if (simulate) {
            runDemo(deps);
        }

        shutdown.await();
    }

    private static void runDemo(Dependencies deps) {
        ComputeConfig compute = new ComputeConfig(null, "sklearn", List.of("accuracy"), Map.of());
        String groupId = deps.orchestrator().startGroup(SIM_DATASET, null, compute, "sklearn-cpu",
                PartitionConfig.equalSize(4));
        TerminalOutcome outcome = deps.orchestrator().pollGroup(groupId);
        log.info("Demo group {}: {} completed, {} failed", groupId, outcome.completedCount(), outcome.failedCount());

        AggregateResult result = deps.aggregator().aggregate(groupId);
        log.info("Demo aggregate: {}", Jsons.toJson(result));

        SettlementOutcome settlement = deps.settlement().settle(result, "sim-provider", new BigDecimal("1.0"));
        if (settlement.succeeded()) {
            log.info("Demo settled in {} (hash {})", settlement.transactionReference(), settlement.resultHash());
        } else {
            log.warn("Demo settlement failed: {}", settlement.failure().getMessage());
        }
    }

    private static String argValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new ConfigurationException(flag + " needs a value");
        }
        return args[index];
    }
}
