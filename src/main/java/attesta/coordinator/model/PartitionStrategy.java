package attesta.coordinator.model;

import attesta.coordinator.exception.ConfigurationException;

import java.util.Locale;

public enum PartitionStrategy {
    EQUAL_SIZE("equal_size"),
    BY_KEY("by_key"),
    CUSTOM("custom");

    private final String configName;

    PartitionStrategy(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static PartitionStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            return EQUAL_SIZE;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (PartitionStrategy s : values()) {
            if (s.configName.equals(normalized)) {
                return s;
            }
        }
        throw new ConfigurationException("Unrecognized partitioning strategy: " + name);
    }
}
