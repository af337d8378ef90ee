package com.streamfirst.scenesearch.boot;

import com.streamfirst.scenesearch.adapters.InMemoryTileGridAdapter;
import com.streamfirst.scenesearch.adapters.catalog.FixedBackoffRetry;
import com.streamfirst.scenesearch.adapters.catalog.asf.AsfCatalogAdapter;
import com.streamfirst.scenesearch.application.SelectionRequest;
import com.streamfirst.scenesearch.domain.AreaOfInterest;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.domain.SceneTimes;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code scene-search} prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "scene-search")
public class SceneSearchProperties {

    /** Backend of the primary catalog. */
    private CatalogKind catalog = CatalogKind.STAC;

    /** Backend of the catalog used to cross-check data-take completeness. */
    private CatalogKind reference = CatalogKind.ASF;

    /** Verify data-take completeness of the selected scenes after selection. */
    private boolean checkCompleteness = true;

    private final Stac stac = new Stac();
    private final Local local = new Local();
    private final Asf asf = new Asf();
    private final Retry retry = new Retry();
    private final Http http = new Http();
    private final TileGrid tileGrid = new TileGrid();
    private final Query query = new Query();
    private final Aoi aoi = new Aoi();

    public enum CatalogKind {
        STAC,
        LOCAL,
        ASF
    }

    @Getter
    @Setter
    public static class Stac {
        private URI url;
        private List<String> collections = new ArrayList<>();
        private int pageSize = 100;
    }

    /** Directory tree of SAFE products indexed into an in-process catalog. */
    @Getter
    @Setter
    public static class Local {
        private Path sceneDir;
    }

    @Getter
    @Setter
    public static class Asf {
        private URI endpoint = AsfCatalogAdapter.DEFAULT_ENDPOINT;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = FixedBackoffRetry.DEFAULT_MAX_ATTEMPTS;
        private Duration delay = FixedBackoffRetry.DEFAULT_DELAY;
    }

    @Getter
    @Setter
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class TileGrid {
        /** GeoJSON feature collection of the grid cells */
        private Path file;
        private String idProperty = InMemoryTileGridAdapter.DEFAULT_ID_PROPERTY;
    }

    @Getter
    @Setter
    public static class Query {
        private List<String> sensors = new ArrayList<>();
        private List<String> products = new ArrayList<>();
        private List<String> acquisitionModes = new ArrayList<>();

        /** {@code yyyyMMdd'T'HHmmss} or ISO-8601 */
        private String mindate;
        private String maxdate;

        private boolean dateStrict = true;
        private List<Integer> frameNumbers = new ArrayList<>();
        private boolean checkExist = true;
    }

    /** At most one of {@code tiles} and {@code wkt} may be set. */
    @Getter
    @Setter
    public static class Aoi {
        private List<String> tiles = new ArrayList<>();
        private String wkt;
    }

    /**
     * The configured search parameters.
     *
     * @throws com.streamfirst.scenesearch.domain.ConfigurationException on malformed dates or a
     *     date range ending before it starts
     */
    public SceneQuery toQuery() {
        return SceneQuery.builder()
                .sensors(query.getSensors())
                .products(query.getProducts())
                .acquisitionModes(query.getAcquisitionModes())
                .mindate(query.getMindate() == null ? null : SceneTimes.parse(query.getMindate()))
                .maxdate(query.getMaxdate() == null ? null : SceneTimes.parse(query.getMaxdate()))
                .dateStrict(query.isDateStrict())
                .frameNumbers(query.getFrameNumbers())
                .checkExist(query.isCheckExist())
                .build();
    }

    public SelectionRequest toRequest() {
        List<String> tiles = aoi.getTiles().isEmpty() ? null : aoi.getTiles();
        AreaOfInterest area = aoi.getWkt() == null ? null : AreaOfInterest.fromWkt(aoi.getWkt());
        return new SelectionRequest(toQuery(), tiles, area);
    }
}
