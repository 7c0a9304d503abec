package attesta.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings (null URL keeps the tracker in memory)
    private String databaseUrl = null;
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Polling settings
    private Duration pollInterval = Duration.ofSeconds(30);
    private Duration pollTimeout = Duration.ofHours(1);
    private Duration statusTimeout = Duration.ofSeconds(10);
    private Duration submitTimeout = Duration.ofSeconds(30);

    // Settlement: surcharge on the base fee for distributed compute
    private double paymentPremium = 0.2;

    // External wiring
    private String configFile = null;
    private String workerUrl = null;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String dbUrl = System.getenv("ATTESTA_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("ATTESTA_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String interval = System.getenv("ATTESTA_POLL_INTERVAL_MS");
        if (interval != null && !interval.isBlank()) {
            config.pollInterval = Duration.ofMillis(Long.parseLong(interval));
        }

        String timeout = System.getenv("ATTESTA_POLL_TIMEOUT_MS");
        if (timeout != null && !timeout.isBlank()) {
            config.pollTimeout = Duration.ofMillis(Long.parseLong(timeout));
        }

        String statusTimeout = System.getenv("ATTESTA_STATUS_TIMEOUT_MS");
        if (statusTimeout != null && !statusTimeout.isBlank()) {
            config.statusTimeout = Duration.ofMillis(Long.parseLong(statusTimeout));
        }

        String configFile = System.getenv("ATTESTA_CONFIG_FILE");
        if (configFile != null && !configFile.isBlank()) {
            config.configFile = configFile;
        }

        String workerUrl = System.getenv("ATTESTA_WORKER_URL");
        if (workerUrl != null && !workerUrl.isBlank()) {
            config.workerUrl = workerUrl;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public boolean hasDatabase() {
        return databaseUrl != null && !databaseUrl.isBlank();
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration pollTimeout() {
        return pollTimeout;
    }

    public Duration statusTimeout() {
        return statusTimeout;
    }

    public Duration submitTimeout() {
        return submitTimeout;
    }

    public double paymentPremium() {
        return paymentPremium;
    }

    public String configFile() {
        return configFile;
    }

    public String workerUrl() {
        return workerUrl;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public CoordinatorConfig withPollTimeout(Duration timeout) {
        this.pollTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withStatusTimeout(Duration timeout) {
        this.statusTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withSubmitTimeout(Duration timeout) {
        this.submitTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withPaymentPremium(double premium) {
        this.paymentPremium = premium;
        return this;
    }

    public CoordinatorConfig withConfigFile(String path) {
        this.configFile = path;
        return this;
    }

    public CoordinatorConfig withWorkerUrl(String url) {
        this.workerUrl = url;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + (hasDatabase() ? databaseUrl : "in-memory") + '\'' +
                ", serverPort=" + serverPort +
                ", pollInterval=" + pollInterval +
                ", pollTimeout=" + pollTimeout +
                ", statusTimeout=" + statusTimeout +
                ", workerUrl=" + workerUrl +
                '}';
    }
}
