package attesta.coordinator.config;

import attesta.coordinator.model.AssetMetadata;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.service.EnvironmentCatalog;
import attesta.coordinator.verify.StaticSignerKeyDirectory;

import java.util.List;

/**
 * Everything an INI file contributes besides plain {@link CoordinatorConfig} values.
 */
public record IniSettings(
        CoordinatorConfig config,
        TrustPolicy trustPolicy,
        StaticSignerKeyDirectory signerKeys,
        EnvironmentCatalog environments,
        List<AssetMetadata> datasets) {

    public IniSettings {
        datasets = List.copyOf(datasets);
    }

    /** No file: built-in environments, an empty trust policy and no signer keys */
    public static IniSettings defaults(CoordinatorConfig config) {
        return new IniSettings(config, TrustPolicy.builder().build(), new StaticSignerKeyDirectory(),
                EnvironmentCatalog.defaults(), List.of());
    }
}
