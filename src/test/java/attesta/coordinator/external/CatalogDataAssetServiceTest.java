package attesta.coordinator.external;

import attesta.coordinator.exception.AssetUnavailableException;
import attesta.coordinator.model.AssetMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CatalogDataAssetServiceTest {

    @TempDir
    Path dir;

    private CatalogDataAssetService assets;

    @BeforeEach
    void setUp() {
        assets = new CatalogDataAssetService(dir.resolve("published"));
    }

    @Test
    void downloadReturnsRegisteredFile() throws IOException {
        Path csv = Files.writeString(dir.resolve("titanic.csv"), "id,survived\n1,0\n", StandardCharsets.UTF_8);
        assets.register(new AssetMetadata("titanic", "Titanic", 1L, Map.of("path", csv.toString())));

        Path downloaded = assets.download("titanic");

        assertEquals(csv, downloaded);
        assertEquals("id,survived\n1,0\n", Files.readString(downloaded, StandardCharsets.UTF_8));
    }

    @Test
    void downloadOfUnknownAssetFails() {
        assertThrows(AssetUnavailableException.class, () -> assets.download("nope"));
    }

    @Test
    void downloadWithoutContentFails() {
        assets.register(AssetMetadata.dataset("metadata-only", 10));
        assertThrows(AssetUnavailableException.class, () -> assets.download("metadata-only"));

        assets.register(new AssetMetadata("gone", "gone", 1L,
                Map.of("path", dir.resolve("missing.csv").toString())));
        assertThrows(AssetUnavailableException.class, () -> assets.download("gone"));
    }

    @Test
    void uploadCopiesFileAndRegistersIt() throws IOException {
        Path local = Files.writeString(dir.resolve("clean.csv"), "a,b\n1,2\n", StandardCharsets.UTF_8);

        String reference = assets.upload(local, new AssetMetadata("clean/v1", "clean", 1L, Map.of()));

        assertEquals("clean/v1", reference);
        assertEquals(1L, assets.resolve(reference).recordCount());
        Path stored = assets.download(reference);
        assertNotEquals(local, stored);
        assertTrue(stored.startsWith(dir.resolve("published")));
        assertEquals("clean_v1", stored.getFileName().toString());
        assertEquals("a,b\n1,2\n", Files.readString(stored, StandardCharsets.UTF_8));
    }

    @Test
    void uploadWithoutReferenceGeneratesOne() throws IOException {
        Path local = Files.writeString(dir.resolve("x.bin"), "x", StandardCharsets.UTF_8);

        String reference = assets.upload(local, new AssetMetadata(null, "x", null, Map.of()));

        assertTrue(reference.startsWith("asset-"));
        assertEquals("x", assets.resolve(reference).name());
    }

    @Test
    void uploadOfMissingFileFails() {
        assertThrows(AssetUnavailableException.class,
                () -> assets.upload(dir.resolve("absent.csv"), AssetMetadata.dataset("absent", 1)));
        assertThrows(AssetUnavailableException.class, () -> assets.resolve("absent"));
    }
}
