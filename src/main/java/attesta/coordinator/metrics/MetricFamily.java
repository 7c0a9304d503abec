package attesta.coordinator.metrics;

public enum MetricFamily {
    CLASSIFICATION,
    REGRESSION
}
