package attesta.coordinator.config;

import attesta.coordinator.exception.ConfigurationException;
import attesta.coordinator.model.AssetMetadata;
import attesta.coordinator.model.EnvironmentSpec;
import attesta.coordinator.model.ResourceRequirements;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.service.EnvironmentCatalog;
import attesta.coordinator.verify.SignerKey;
import attesta.coordinator.verify.Signatures;
import attesta.coordinator.verify.StaticSignerKeyDirectory;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads coordinator settings from an INI file.
 * Sections: [POLL], [TRUST], [SIGNER &lt;identity&gt;], [ENV &lt;name&gt;], [DATASET &lt;reference&gt;].
 * Every section is optional.
 */
public final class AttestaIniLoader {

    private static final Logger log = LoggerFactory.getLogger(AttestaIniLoader.class);

    private static final String SIGNER_PREFIX = "SIGNER ";
    private static final String ENV_PREFIX = "ENV ";
    private static final String DATASET_PREFIX = "DATASET ";
    private static final String RUNTIME_PREFIX = "runtime.";

    private AttestaIniLoader() {
    }

    /**
     * @param base config to apply [POLL] overrides to
     * @throws ConfigurationException if the file cannot be read or a value is malformed
     */
    public static IniSettings load(File file, CoordinatorConfig base) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file " + file + ": " + e.getMessage());
        }

        CoordinatorConfig config = applyPoll(ini.get("POLL"), base);
        TrustPolicy policy = trustPolicy(ini.get("TRUST"));

        StaticSignerKeyDirectory keys = new StaticSignerKeyDirectory();
        EnvironmentCatalog catalog = EnvironmentCatalog.defaults();
        List<AssetMetadata> datasets = new ArrayList<>();

        for (String name : ini.keySet()) {
            Profile.Section section = ini.get(name);
            if (name.startsWith(SIGNER_PREFIX)) {
                keys.register(signerKey(name.substring(SIGNER_PREFIX.length()).trim(), section));
            } else if (name.startsWith(ENV_PREFIX)) {
                catalog.register(environment(name.substring(ENV_PREFIX.length()).trim(), section));
            } else if (name.startsWith(DATASET_PREFIX)) {
                datasets.add(dataset(name.substring(DATASET_PREFIX.length()).trim(), section));
            }
        }

        log.info("Loaded {}: {} signer keys, {} environments, {} datasets, {}", file.getName(), keys.size(),
                catalog.size(), datasets.size(), policy);
        return new IniSettings(config, policy, keys, catalog, datasets);
    }

    // ===== sections =====

    private static CoordinatorConfig applyPoll(Profile.Section poll, CoordinatorConfig config) {
        if (poll == null) {
            return config;
        }
        Long interval = optLong(poll, "interval_ms");
        if (interval != null) {
            config.withPollInterval(Duration.ofMillis(interval));
        }
        Long timeout = optLong(poll, "timeout_ms");
        if (timeout != null) {
            config.withPollTimeout(Duration.ofMillis(timeout));
        }
        Long statusTimeout = optLong(poll, "status_timeout_ms");
        if (statusTimeout != null) {
            config.withStatusTimeout(Duration.ofMillis(statusTimeout));
        }
        return config;
    }

    private static TrustPolicy trustPolicy(Profile.Section trust) {
        TrustPolicy.Builder builder = TrustPolicy.builder();
        if (trust == null) {
            return builder.build();
        }
        builder.allowedSigners(list(opt(trust, "allowed_signers")))
                .approvedMeasurements(list(opt(trust, "approved_measurements")))
                .deprecatedMeasurements(list(opt(trust, "deprecated_measurements")));

        String confidence = opt(trust, "deprecated_confidence");
        if (confidence != null) {
            double value = parseDouble("deprecated_confidence", confidence);
            if (value < 0.0 || value > 1.0) {
                throw new ConfigurationException("deprecated_confidence must be within [0, 1]: " + value);
            }
            builder.deprecatedConfidence(value);
        }
        Long staleness = optLong(trust, "max_staleness_seconds");
        if (staleness != null) {
            builder.maxStaleness(Duration.ofSeconds(staleness));
        }
        Long skew = optLong(trust, "max_clock_skew_seconds");
        if (skew != null) {
            builder.maxClockSkew(Duration.ofSeconds(skew));
        }
        return builder.build();
    }

    private static SignerKey signerKey(String identity, Profile.Section section) {
        String keyAlgorithm = opt(section, "key_algorithm", "Ed25519");
        String encoded = opt(section, "public_key");
        if (encoded == null) {
            throw new ConfigurationException("Signer " + identity + " has no public_key");
        }
        try {
            PublicKey key = Signatures.decodePublicKey(keyAlgorithm, encoded);
            String algorithm = opt(section, "signature_algorithm", Signatures.defaultAlgorithmFor(key.getAlgorithm()));
            return new SignerKey(identity, algorithm, key);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new ConfigurationException("Signer " + identity + " has an invalid public_key: " + e.getMessage());
        }
    }

    private static EnvironmentSpec environment(String name, Profile.Section section) {
        Integer acceleratorCount = optInt(section, "accelerator_count");
        ResourceRequirements resources = new ResourceRequirements(
                optInt(section, "cpu"),
                optInt(section, "memory_gb"),
                acceleratorCount != null ? acceleratorCount : 0,
                opt(section, "accelerator_type"));

        Map<String, String> runtime = new LinkedHashMap<>();
        for (String key : section.keySet()) {
            if (key.startsWith(RUNTIME_PREFIX)) {
                runtime.put(key.substring(RUNTIME_PREFIX.length()), section.get(key).trim());
            }
        }
        runtime.putIfAbsent("allow_network", "false");

        return new EnvironmentSpec(name, resources, opt(section, "image"), runtime,
                list(opt(section, "frameworks")));
    }

    private static AssetMetadata dataset(String reference, Profile.Section section) {
        Long count = optLong(section, "record_count");
        Map<String, String> attributes = new LinkedHashMap<>();
        String path = opt(section, "path");
        if (path != null) {
            attributes.put("path", path);
        }
        return new AssetMetadata(reference, opt(section, "name", reference), count, attributes);
    }

    // ===== helpers =====

    private static String opt(Profile.Section s, String key) {
        if (s == null) {
            return null;
        }
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static Integer optInt(Profile.Section s, String key) {
        Long v = optLong(s, key);
        return v == null ? null : Math.toIntExact(v);
    }

    private static Long optLong(Profile.Section s, String key) {
        String v = opt(s, key);
        if (v == null) {
            return null;
        }
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer: " + v);
        }
    }

    private static double parseDouble(String key, String v) {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number: " + v);
        }
    }

    private static List<String> list(String csv) {
        if (csv == null) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
