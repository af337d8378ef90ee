package com.streamfirst.scenesearch.boot;

import com.streamfirst.scenesearch.adapters.InMemoryCatalogAdapter;
import com.streamfirst.scenesearch.adapters.catalog.FixedBackoffRetry;
import com.streamfirst.scenesearch.adapters.catalog.JsonHttpClient;
import com.streamfirst.scenesearch.adapters.safe.SafeManifestReader;
import com.streamfirst.scenesearch.adapters.safe.SafeSceneIdentifier;
import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.ports.ReferenceCatalogPort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SceneSearchConfigurationTest {

    private static final String NAME =
            "S1A_IW_GRDH_1SDV_20210101T050000_20210101T050025_035948_0434D8_1A2B.SAFE";
    private static final String FIRST_PROCESSING =
            "S1A_IW_GRDH_1SDV_20210101T050025_20210101T050050_035948_0434D8_3C4D.SAFE";
    private static final String REPROCESSED =
            "S1A_IW_GRDH_1SDV_20210101T050025_20210101T050050_035948_0434D8_9F9F.SAFE";

    private final SceneSearchConfiguration configuration = new SceneSearchConfiguration();

    @TempDir
    Path dir;

    private static Path writeSafe(Path parent, String name, String processingStart) throws IOException {
        Path safe = Files.createDirectories(parent.resolve(name));
        Files.writeString(
                safe.resolve("manifest.safe"),
                "<?xml version=\"1.0\"?><manifest><processing start=\"" + processingStart + "\"/>"
                        + "<sliceNumber>1</sliceNumber><totalSlices>1</totalSlices></manifest>");
        return safe;
    }

    private static InMemoryCatalogAdapter localCatalog(Path sceneDir) {
        return SceneSearchConfiguration.localCatalog(
                sceneDir, new SafeSceneIdentifier(), new SafeManifestReader());
    }

    @Test
    void localCatalogIndexesSafeDirectories() throws IOException {
        writeSafe(dir.resolve("2021/01"), NAME, "2021-01-01T06:00:00.000000");
        Files.createDirectories(dir.resolve("2021/01/unrelated"));

        InMemoryCatalogAdapter catalog = localCatalog(dir);

        assertThat(catalog.getSceneCount()).isEqualTo(1);
        assertThat(catalog.selectProperty(SceneQuery.all(), ReferenceCatalogPort.SCENE_NAME))
                .containsExactly(NAME.replace(".SAFE", ""));
    }

    @Test
    void localCatalogKeepsOnlyTheLatestProcessing() throws IOException {
        writeSafe(dir, FIRST_PROCESSING, "2021-01-01T06:00:10.000000");
        Path latest = writeSafe(dir.resolve("reprocessed"), REPROCESSED, "2021-03-15T12:00:00.000000");
        writeSafe(dir, NAME, "2021-01-01T06:00:00.000000");

        InMemoryCatalogAdapter catalog = localCatalog(dir);

        assertThat(catalog.getSceneCount()).isEqualTo(2);
        assertThat(catalog.select(SceneQuery.all()))
                .hasSize(2)
                .contains(latest.toAbsolutePath().normalize().toString())
                .noneMatch(location -> location.endsWith(FIRST_PROCESSING));
    }

    @Test
    void localCatalogNeedsADirectory() {
        assertThatThrownBy(() -> localCatalog(null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("scene-dir");
    }

    @Test
    void stacCannotServeAsReference() {
        SceneSearchProperties properties = new SceneSearchProperties();
        properties.setReference(SceneSearchProperties.CatalogKind.STAC);
        JsonHttpClient http = configuration.jsonHttpClient(properties);
        FixedBackoffRetry retry = configuration.catalogRetry(properties);

        assertThatThrownBy(
                        () ->
                                configuration.referenceCatalog(
                                        properties, http, retry, new SafeManifestReader(), new SafeSceneIdentifier()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void tileGridFileIsRequired() {
        assertThatThrownBy(() -> configuration.tileGrid(new SceneSearchProperties()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("tile-grid.file");
    }

    @Test
    void referenceCatalogDefaultsToAsf() {
        SceneSearchProperties properties = new SceneSearchProperties();

        ReferenceCatalogPort reference =
                configuration.referenceCatalog(
                        properties,
                        configuration.jsonHttpClient(properties),
                        configuration.catalogRetry(properties),
                        new SafeManifestReader(),
                        new SafeSceneIdentifier());

        assertThat(reference.getClass().getSimpleName()).isEqualTo("AsfCatalogAdapter");
        reference.close();
    }
}
