package attesta.coordinator.service;

import attesta.coordinator.exception.ConfigurationException;
import attesta.coordinator.exception.EnvironmentUnsupportedException;
import attesta.coordinator.model.ComputeConfig;
import attesta.coordinator.model.EnvironmentSpec;
import attesta.coordinator.model.ResourceRequirements;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named execution environments a group may run in. Entries are static once
 * the coordinator is up; lookups happen on every {@code startGroup}.
 */
public class EnvironmentCatalog {

    private final Map<String, EnvironmentSpec> environments = new LinkedHashMap<>();

    public static EnvironmentCatalog empty() {
        return new EnvironmentCatalog();
    }

    /**
     * The built-in catalog: two GPU deep learning images, a CPU
     * scikit-learn image and an R analytics image. None allow network access.
     */
    public static EnvironmentCatalog defaults() {
        EnvironmentCatalog catalog = new EnvironmentCatalog();
        catalog.register(new EnvironmentSpec(
                "pytorch-gpu",
                ResourceRequirements.withAccelerator(8, 32, 1, "NVIDIA-T4"),
                "oceanprotocol/pytorch:latest",
                Map.of("cuda_version", "11.4", "pytorch_version", "1.9", "allow_network", "false"),
                List.of("pytorch", "torchvision")));
        catalog.register(new EnvironmentSpec(
                "tensorflow-gpu",
                ResourceRequirements.withAccelerator(8, 32, 1, "NVIDIA-T4"),
                "oceanprotocol/tensorflow:latest",
                Map.of("cuda_version", "11.4", "tensorflow_version", "2.6", "allow_network", "false"),
                List.of("tensorflow", "keras")));
        catalog.register(new EnvironmentSpec(
                "sklearn-cpu",
                ResourceRequirements.cpuOnly(16, 64),
                "oceanprotocol/sklearn:latest",
                Map.of("sklearn_version", "0.24", "allow_network", "false"),
                List.of("sklearn", "pandas", "numpy")));
        catalog.register(new EnvironmentSpec(
                "r-analytics",
                ResourceRequirements.cpuOnly(8, 32),
                "oceanprotocol/r-analytics:latest",
                Map.of("r_version", "4.1", "allow_network", "false"),
                List.of("r-base", "tidyverse", "caret")));
        return catalog;
    }

    public EnvironmentCatalog register(EnvironmentSpec spec) {
        environments.put(spec.name(), spec);
        return this;
    }

    public Optional<EnvironmentSpec> find(String name) {
        return Optional.ofNullable(environments.get(name));
    }

    public List<EnvironmentSpec> all() {
        return new ArrayList<>(environments.values());
    }

    public int size() {
        return environments.size();
    }

    /**
     * Check a request against an environment's declared capacity.
     *
     * @return the environment to dispatch to
     * @throws EnvironmentUnsupportedException if the name is unknown, a requested
     *         amount exceeds capacity, or the framework is not installed
     * @throws ConfigurationException if a requested amount is negative
     */
    public EnvironmentSpec validate(String name, ComputeConfig computeConfig) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("environment name is required");
        }
        EnvironmentSpec env = find(name)
                .orElseThrow(() -> new EnvironmentUnsupportedException("Unknown environment: " + name));
        if (computeConfig == null) {
            return env;
        }

        ResourceRequirements requested = computeConfig.resources();
        if (requested != null) {
            ResourceRequirements capacity = env.resources();
            checkAmount(name, "cpu", requested.cpu(), capacity.cpu());
            checkAmount(name, "memoryGb", requested.memoryGb(), capacity.memoryGb());
            checkAmount(name, "acceleratorCount", requested.acceleratorCount(), capacity.acceleratorCount());

            String type = requested.acceleratorType();
            if (type != null && requested.acceleratorCount() != null && requested.acceleratorCount() > 0
                    && !type.equalsIgnoreCase(capacity.acceleratorType())) {
                throw new EnvironmentUnsupportedException(
                        "Environment " + name + " has no " + type + " accelerator");
            }
        }

        String framework = computeConfig.framework();
        if (framework != null && !framework.isBlank()
                && env.allowedFrameworks().stream().noneMatch(f -> f.equalsIgnoreCase(framework))) {
            throw new EnvironmentUnsupportedException(
                    "Framework " + framework + " is not available in " + name + " " + env.allowedFrameworks());
        }
        return env;
    }

    private static void checkAmount(String env, String field, Integer requested, Integer capacity) {
        if (requested == null) {
            return;
        }
        if (requested < 0) {
            throw new ConfigurationException(field + " must not be negative: " + requested);
        }
        int available = capacity == null ? 0 : capacity;
        if (requested > available) {
            throw new EnvironmentUnsupportedException(
                    "Environment " + env + " offers " + field + "=" + available + ", requested " + requested);
        }
    }
}
