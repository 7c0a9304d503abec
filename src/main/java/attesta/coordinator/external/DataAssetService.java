package attesta.coordinator.external;

import attesta.coordinator.exception.AssetUnavailableException;
import attesta.coordinator.model.AssetMetadata;

import java.nio.file.Path;

/**
 * Resolves, downloads and publishes datasets by reference.
 * Every failure surfaces as {@link AssetUnavailableException}.
 */
public interface DataAssetService {

    AssetMetadata resolve(String reference) throws AssetUnavailableException;

    /**
     * @return local path holding the asset's content
     */
    Path download(String reference) throws AssetUnavailableException;

    /**
     * @return reference of the newly published asset
     */
    String upload(Path localHandle, AssetMetadata metadata) throws AssetUnavailableException;
}
