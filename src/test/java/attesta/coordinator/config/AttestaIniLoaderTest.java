package attesta.coordinator.config;

import attesta.coordinator.exception.ConfigurationException;
import attesta.coordinator.model.AssetMetadata;
import attesta.coordinator.model.EnvironmentSpec;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.verify.SignerKey;
import attesta.coordinator.verify.Signatures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AttestaIniLoaderTest {

    @TempDir
    Path tempDir;

    private File resource(String name) throws Exception {
        return new File(getClass().getResource("/" + name).toURI());
    }

    private File write(String content) throws Exception {
        Path file = tempDir.resolve("attesta.ini");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    void loadsPollOverrides() throws Exception {
        IniSettings settings = AttestaIniLoader.load(resource("attesta-test.ini"), CoordinatorConfig.defaults());

        CoordinatorConfig config = settings.config();
        assertEquals(Duration.ofMillis(250), config.pollInterval());
        assertEquals(Duration.ofMillis(5000), config.pollTimeout());
        assertEquals(Duration.ofMillis(400), config.statusTimeout());
        assertEquals(8080, config.serverPort());
    }

    @Test
    void loadsTrustPolicy() throws Exception {
        TrustPolicy policy = AttestaIniLoader.load(resource("attesta-test.ini"), CoordinatorConfig.defaults())
                .trustPolicy();

        assertEquals(Set.of("enclave-a", "enclave-b"), policy.allowedSigners());
        assertTrue(policy.isApproved("mr-2024-01"));
        assertTrue(policy.isDeprecated("mr-2023-09"));
        assertEquals(0.6, policy.deprecatedConfidence(), 1e-9);
        assertEquals(Duration.ofSeconds(600), policy.maxStaleness());
        assertEquals(Duration.ofSeconds(10), policy.maxClockSkew());
    }

    @Test
    void environmentsExtendBuiltInCatalog() throws Exception {
        IniSettings settings = AttestaIniLoader.load(resource("attesta-test.ini"), CoordinatorConfig.defaults());

        assertEquals(5, settings.environments().size());
        EnvironmentSpec env = settings.environments().find("sklearn-small").orElseThrow();
        assertEquals(2, env.resources().cpu());
        assertEquals(4, env.resources().memoryGb());
        assertEquals(0, env.resources().acceleratorCount());
        assertEquals("registry.local/sklearn:1.4", env.runtimeImage());
        assertEquals(List.of("sklearn", "numpy"), env.allowedFrameworks());
        assertEquals("3.11", env.runtimeConfig().get("python_version"));
        assertEquals("false", env.runtimeConfig().get("allow_network"));
    }

    @Test
    void loadsDatasets() throws Exception {
        List<AssetMetadata> datasets = AttestaIniLoader.load(resource("attesta-test.ini"),
                CoordinatorConfig.defaults()).datasets();

        assertEquals(1, datasets.size());
        assertEquals("titanic", datasets.get(0).reference());
        assertEquals("Titanic passengers", datasets.get(0).name());
        assertEquals(891L, datasets.get(0).recordCount());
    }

    @Test
    void loadsSignerKeys() throws Exception {
        KeyPair pair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        File file = write("[SIGNER enclave-a]\npublic_key = " + Signatures.encodePublicKey(pair.getPublic()) + "\n");

        IniSettings settings = AttestaIniLoader.load(file, CoordinatorConfig.defaults());

        SignerKey key = settings.signerKeys().find("enclave-a").orElseThrow();
        assertEquals("Ed25519", key.signatureAlgorithm());
        assertEquals(pair.getPublic(), key.publicKey());
        assertTrue(settings.signerKeys().find("enclave-b").isEmpty());
    }

    @Test
    void emptyFileGivesDefaults() throws Exception {
        IniSettings settings = AttestaIniLoader.load(write(""), CoordinatorConfig.defaults());

        assertEquals(Duration.ofSeconds(30), settings.config().pollInterval());
        assertTrue(settings.trustPolicy().allowedSigners().isEmpty());
        assertEquals(4, settings.environments().size());
        assertEquals(0, settings.signerKeys().size());
    }

    @Test
    void missingFile() {
        assertThrows(ConfigurationException.class,
                () -> AttestaIniLoader.load(tempDir.resolve("absent.ini").toFile(), CoordinatorConfig.defaults()));
    }

    @Test
    void malformedValues() throws Exception {
        assertThrows(ConfigurationException.class, () -> AttestaIniLoader.load(
                write("[POLL]\ninterval_ms = soon\n"), CoordinatorConfig.defaults()));
        assertThrows(ConfigurationException.class, () -> AttestaIniLoader.load(
                write("[TRUST]\ndeprecated_confidence = 1.5\n"), CoordinatorConfig.defaults()));
        assertThrows(ConfigurationException.class, () -> AttestaIniLoader.load(
                write("[SIGNER enclave-x]\nkey_algorithm = Ed25519\n"), CoordinatorConfig.defaults()));
        assertThrows(ConfigurationException.class, () -> AttestaIniLoader.load(
                write("[SIGNER enclave-x]\npublic_key = bm90IGEga2V5\n"), CoordinatorConfig.defaults()));
    }
}
