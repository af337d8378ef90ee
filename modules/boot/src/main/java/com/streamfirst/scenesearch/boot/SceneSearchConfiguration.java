package com.streamfirst.scenesearch.boot;

import com.streamfirst.scenesearch.adapters.InMemoryCatalogAdapter;
import com.streamfirst.scenesearch.adapters.InMemoryTileGridAdapter;
import com.streamfirst.scenesearch.adapters.catalog.DuplicateResolver;
import com.streamfirst.scenesearch.adapters.catalog.FixedBackoffRetry;
import com.streamfirst.scenesearch.adapters.catalog.JsonHttpClient;
import com.streamfirst.scenesearch.adapters.catalog.asf.AsfCatalogAdapter;
import com.streamfirst.scenesearch.adapters.catalog.stac.StacCatalogAdapter;
import com.streamfirst.scenesearch.adapters.safe.SafeManifestReader;
import com.streamfirst.scenesearch.adapters.safe.SafeSceneIdentifier;
import com.streamfirst.scenesearch.application.CompletenessVerifier;
import com.streamfirst.scenesearch.application.SceneSelector;
import com.streamfirst.scenesearch.application.SelectionRequest;
import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneSearchException;
import com.streamfirst.scenesearch.domain.SelectionResult;
import com.streamfirst.scenesearch.ports.CatalogPort;
import com.streamfirst.scenesearch.ports.ProcessingTimeReader;
import com.streamfirst.scenesearch.ports.ReferenceCatalogPort;
import com.streamfirst.scenesearch.ports.SceneIdentifierPort;
import com.streamfirst.scenesearch.ports.TileGridPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the catalog, tile grid and scene adapters selected in {@link SceneSearchProperties} into
 * the selection and verification services.
 */
@Slf4j
@Configuration
public class SceneSearchConfiguration {

    /** Depth below the local scene directory searched for SAFE products. */
    static final int LOCAL_SCAN_DEPTH = 3;

    // --- Infrastructure ---

    @Bean
    public JsonHttpClient jsonHttpClient(SceneSearchProperties properties) {
        SceneSearchProperties.Http http = properties.getHttp();
        return new JsonHttpClient(http.getConnectTimeout(), http.getReadTimeout());
    }

    @Bean
    public FixedBackoffRetry catalogRetry(SceneSearchProperties properties) {
        SceneSearchProperties.Retry retry = properties.getRetry();
        return new FixedBackoffRetry(retry.getMaxAttempts(), retry.getDelay());
    }

    @Bean
    public ProcessingTimeReader processingTimeReader() {
        return new SafeManifestReader();
    }

    @Bean
    public SceneIdentifierPort sceneIdentifier() {
        return new SafeSceneIdentifier();
    }

    @Bean
    public TileGridPort tileGrid(SceneSearchProperties properties) {
        SceneSearchProperties.TileGrid grid = properties.getTileGrid();
        if (grid.getFile() == null) {
            throw new ConfigurationException("scene-search.tile-grid.file is not set");
        }
        return InMemoryTileGridAdapter.fromGeoJson(grid.getFile(), grid.getIdProperty());
    }

    // --- Catalogs ---

    @Bean
    public CatalogPort primaryCatalog(
            SceneSearchProperties properties,
            JsonHttpClient http,
            FixedBackoffRetry retry,
            ProcessingTimeReader processingTimes,
            SceneIdentifierPort identifier) {
        log.info("Primary catalog backend: {}", properties.getCatalog());
        return switch (properties.getCatalog()) {
            case STAC -> {
                SceneSearchProperties.Stac stac = properties.getStac();
                if (stac.getUrl() == null) {
                    throw new ConfigurationException("scene-search.stac.url is not set");
                }
                yield new StacCatalogAdapter(
                        stac.getUrl(),
                        stac.getCollections(),
                        http,
                        retry,
                        processingTimes,
                        stac.getPageSize());
            }
            case LOCAL -> localCatalog(properties.getLocal().getSceneDir(), identifier, processingTimes);
            case ASF -> new AsfCatalogAdapter(properties.getAsf().getEndpoint(), http, retry);
        };
    }

    @Bean
    public ReferenceCatalogPort referenceCatalog(
            SceneSearchProperties properties,
            JsonHttpClient http,
            FixedBackoffRetry retry,
            ProcessingTimeReader processingTimes,
            SceneIdentifierPort identifier) {
        log.info("Reference catalog backend: {}", properties.getReference());
        return switch (properties.getReference()) {
            case ASF -> new AsfCatalogAdapter(properties.getAsf().getEndpoint(), http, retry);
            case LOCAL -> localCatalog(properties.getLocal().getSceneDir(), identifier, processingTimes);
            case STAC -> throw new ConfigurationException(
                    "a STAC catalog cannot serve as reference catalog, use ASF or LOCAL");
        };
    }

    // --- Application services ---

    @Bean
    public SceneSelector sceneSelector(
            @Qualifier("primaryCatalog") CatalogPort catalog,
            TileGridPort tileGrid,
            SceneIdentifierPort identifier) {
        return new SceneSelector(catalog, tileGrid, identifier);
    }

    @Bean
    public CompletenessVerifier completenessVerifier(
            @Qualifier("primaryCatalog") CatalogPort catalog,
            @Qualifier("referenceCatalog") ReferenceCatalogPort reference,
            SceneIdentifierPort identifier) {
        return new CompletenessVerifier(catalog, reference, identifier);
    }

    // --- Execution ---

    @Bean
    public CommandLineRunner sceneSearchRunner(
            SceneSearchProperties properties,
            SceneSelector selector,
            CompletenessVerifier verifier,
            SceneIdentifierPort identifier) {
        return args -> {
            SelectionRequest request = properties.toRequest();
            SelectionResult result = selector.select(request);
            if (properties.isCheckCompleteness() && !result.isEmpty()) {
                List<Scene> scenes = identifier.identify(result.scenes());
                verifier.verify(scenes);
            }
            result.scenes().forEach(scene -> System.out.println("scene " + scene));
            result.tiles().forEach(tile -> System.out.println("tile  " + tile));
        };
    }

    /**
     * Indexes the SAFE products below {@code sceneDir} into an in-process catalog. Of several
     * processings of one acquisition only the latest processed copy is indexed.
     */
    public static InMemoryCatalogAdapter localCatalog(
            Path sceneDir, SceneIdentifierPort identifier, ProcessingTimeReader processingTimes) {
        if (sceneDir == null) {
            throw new ConfigurationException("scene-search.local.scene-dir is not set");
        }
        List<String> locations;
        try (Stream<Path> paths = Files.walk(sceneDir, LOCAL_SCAN_DEPTH)) {
            locations =
                    paths.filter(Files::isDirectory)
                            .filter(p -> p.getFileName().toString().endsWith(".SAFE"))
                            .map(p -> p.toAbsolutePath().normalize().toString())
                            .toList();
        } catch (IOException e) {
            throw new SceneSearchException("cannot index scene directory " + sceneDir, e);
        }
        List<String> latest = new DuplicateResolver(processingTimes).resolve(locations);
        log.info(
                "Indexed {} of {} SAFE product(s) below {}", latest.size(), locations.size(), sceneDir);
        return new InMemoryCatalogAdapter(identifier.identify(latest));
    }
}
