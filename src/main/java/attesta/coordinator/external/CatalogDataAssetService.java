package attesta.coordinator.external;

import attesta.coordinator.exception.AssetUnavailableException;
import attesta.coordinator.model.AssetMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Data asset service over a local catalog: metadata registered up front
 * (from configuration or tests), content kept as files under a root directory.
 */
public class CatalogDataAssetService implements DataAssetService {

    private static final Logger log = LoggerFactory.getLogger(CatalogDataAssetService.class);

    private final Map<String, AssetMetadata> catalog = new ConcurrentHashMap<>();
    private final Map<String, Path> content = new ConcurrentHashMap<>();
    private final Path root;

    public CatalogDataAssetService(Path root) {
        this.root = root;
    }

    /**
     * Register metadata. A {@code path} attribute makes the asset downloadable
     * from that file.
     */
    public CatalogDataAssetService register(AssetMetadata metadata) {
        catalog.put(metadata.reference(), metadata);
        if (metadata.attributes() != null && metadata.attributes().containsKey("path")) {
            content.put(metadata.reference(), Path.of(metadata.attributes().get("path")));
        }
        log.debug("Registered asset {} (records={})", metadata.reference(), metadata.recordCount());
        return this;
    }

    @Override
    public AssetMetadata resolve(String reference) {
        AssetMetadata metadata = reference == null ? null : catalog.get(reference);
        if (metadata == null) {
            throw new AssetUnavailableException("Asset not found: " + reference);
        }
        return metadata;
    }

    @Override
    public Path download(String reference) {
        resolve(reference);
        Path path = content.get(reference);
        if (path == null || !Files.exists(path)) {
            throw new AssetUnavailableException("Asset " + reference + " has no downloadable content");
        }
        return path;
    }

    @Override
    public String upload(Path localHandle, AssetMetadata metadata) {
        String reference = metadata.reference() != null
                ? metadata.reference()
                : "asset-" + UUID.randomUUID();
        try {
            Files.createDirectories(root);
            Path target = root.resolve(reference.replaceAll("[^A-Za-z0-9._-]", "_"));
            Files.copy(localHandle, target, StandardCopyOption.REPLACE_EXISTING);
            content.put(reference, target);
        } catch (IOException e) {
            throw new AssetUnavailableException("Failed to upload asset " + reference, e);
        }
        catalog.put(reference, new AssetMetadata(reference, metadata.name(), metadata.recordCount(),
                metadata.attributes()));
        log.info("Uploaded asset {}", reference);
        return reference;
    }
}
