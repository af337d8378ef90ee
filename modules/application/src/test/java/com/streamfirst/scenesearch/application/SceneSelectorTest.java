package com.streamfirst.scenesearch.application;

import com.streamfirst.scenesearch.adapters.InMemoryCatalogAdapter;
import com.streamfirst.scenesearch.adapters.InMemoryTileGridAdapter;
import com.streamfirst.scenesearch.domain.AreaOfInterest;
import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.domain.SelectionResult;
import com.streamfirst.scenesearch.domain.TimeWindow;
import com.streamfirst.scenesearch.ports.CatalogPort;
import com.streamfirst.scenesearch.ports.SceneIdentifierPort;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.streamfirst.scenesearch.application.TestScenes.T0;
import static com.streamfirst.scenesearch.application.TestScenes.box;
import static com.streamfirst.scenesearch.application.TestScenes.slice;
import static com.streamfirst.scenesearch.application.TestScenes.tile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Selection over a three-slice data-take crossing tiles A and B, plus one unrelated S1B scene on
 * tile C.
 */
@Slf4j
class SceneSelectorTest {

    private final Scene first = slice(0, 1, 3, box(10.2, 45.2, 10.8, 45.8));
    private final Scene second = slice(1, 2, 3, box(11.2, 45.2, 11.8, 45.8));
    private final Scene third = slice(2, 3, 3, box(10.5, 45.2, 11.5, 45.8));
    private final Scene other = TestScenes.scene("S1B", 144, 1, 1, box(20.2, 0.2, 20.8, 0.8));

    private InMemoryCatalogAdapter catalog;
    private InMemoryTileGridAdapter grid;
    private SceneSelector selector;

    private final SceneIdentifierPort noIdentification =
            locations -> {
                throw new AssertionError("catalog provides records, nothing to identify");
            };

    @BeforeEach
    void setUp() {
        catalog = new InMemoryCatalogAdapter(List.of(first, second, third, other));
        grid =
                new InMemoryTileGridAdapter(
                        List.of(
                                tile("A", 10, 45, 11, 46),
                                tile("B", 11, 45, 12, 46),
                                tile("C", 20, 0, 21, 1)));
        selector = new SceneSelector(catalog, grid, noIdentification);
    }

    @Test
    void explicitTilesAreSearchedOneByOne() {
        SelectionResult result =
                selector.select(SelectionRequest.ofTiles(SceneQuery.all(), List.of("B", "C")));

        assertThat(result.tiles()).containsExactly("B", "C");
        assertThat(result.scenes())
                .containsExactly(second.getLocation(), third.getLocation(), other.getLocation());
        assertThat(catalog.getQueries()).hasSize(2).allMatch(SceneQuery::hasSpatialFilter);
    }

    @Test
    void areaOfInterestGivesOverlappingTiles() {
        AreaOfInterest area = AreaOfInterest.of(box(10.1, 45.1, 10.3, 45.3));

        SelectionResult result =
                selector.select(SelectionRequest.ofGeometry(SceneQuery.builder().sensor("S1A").build(), area));

        assertThat(result.tiles()).containsExactly("A");
        assertThat(result.scenes()).containsExactly(first.getLocation());
        assertThat(catalog.getQueries()).hasSize(1);
        assertThat(catalog.getQueries().get(0).getSpatialFilter()).isEqualTo(area);
    }

    @Test
    void projectedAreaOfInterestIsSearchedInLonLat() {
        // UTM 32N, roughly 10.15E..10.41E and 45.19N..45.41N
        Geometry utm = new GeometryFactory().toGeometry(new Envelope(590000, 610000, 5005000, 5030000));
        utm.setSRID(32632);

        SelectionResult result =
                selector.select(
                        SelectionRequest.ofGeometry(
                                SceneQuery.builder().sensor("S1A").build(), AreaOfInterest.of(utm)));

        assertThat(result.tiles()).containsExactly("A");
        assertThat(result.scenes()).containsExactly(first.getLocation());
        AreaOfInterest searched = catalog.getQueries().get(0).getSpatialFilter();
        assertThat(searched.isGeographic()).isTrue();
        assertThat(searched.extent().xmin()).isBetween(10.0, 10.3);
    }

    @Test
    void footprintsWidenTheSearchToDataTakeNeighbors() {
        SceneQuery query =
                SceneQuery.builder()
                        .sensor("S1A")
                        .mindate(second.getStart())
                        .maxdate(second.getStop())
                        .build();

        SelectionResult result = selector.select(SelectionRequest.ofFootprints(query));

        assertThat(result.tiles()).containsExactly("B");
        assertThat(result.scenes()).containsExactly(second.getLocation(), third.getLocation());

        List<SceneQuery> queries = catalog.getQueries();
        assertThat(queries).hasSize(2);
        assertThat(queries.get(0).hasSpatialFilter()).isFalse();
        assertThat(queries.get(1).getMindate()).isEqualTo(second.getStart().minusMinutes(1));
        assertThat(queries.get(1).getMaxdate()).isEqualTo(second.getStop().plusMinutes(1));
    }

    @Test
    void emptyInitialSearchGivesEmptyResult() {
        SceneQuery query = SceneQuery.builder().sensor("S1C").build();

        SelectionResult result = selector.select(SelectionRequest.ofFootprints(query));

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.tiles()).isEmpty();
        assertThat(catalog.getQueries()).hasSize(1);
    }

    @Test
    void selectionIsIdempotent() {
        SelectionRequest request = SelectionRequest.ofFootprints(SceneQuery.builder().sensor("S1A").build());

        SelectionResult once = selector.select(request);
        SelectionResult twice = selector.select(request);

        assertThat(twice).isEqualTo(once);
        assertThat(once.scenes()).isSorted().doesNotHaveDuplicates();
    }

    @Test
    void stripmapModeIsExpandedBeforeSearching() {
        SceneQuery query = SceneQuery.builder().acquisitionMode("SM").build();

        selector.select(SelectionRequest.ofTiles(query, List.of("A")));

        assertThat(catalog.getQueries().get(0).getAcquisitionModes())
                .containsExactlyInAnyOrder("S1", "S2", "S3", "S4", "S5", "S6");
    }

    @Test
    void bareLocationsAreIdentifiedForFootprints() {
        Map<String, Scene> byLocation =
                List.of(first, second, third, other).stream()
                        .collect(Collectors.toMap(Scene::getLocation, Function.identity()));
        List<String> identified = new ArrayList<>();
        SceneIdentifierPort identifier =
                locations -> {
                    identified.addAll(locations);
                    return locations.stream().map(byLocation::get).toList();
                };
        CatalogPort locationsOnly =
                new CatalogPort() {
                    @Override
                    public List<String> select(SceneQuery query) {
                        return catalog.select(query);
                    }

                    @Override
                    public void close() {
                        catalog.close();
                    }
                };

        SelectionResult result =
                new SceneSelector(locationsOnly, grid, identifier)
                        .select(SelectionRequest.ofFootprints(SceneQuery.builder().sensor("S1B").build()));

        assertThat(identified).containsExactly(other.getLocation());
        assertThat(result.tiles()).containsExactly("C");
        assertThat(result.scenes()).containsExactly(other.getLocation());
    }

    @Test
    void tilesAndGeometryAreMutuallyExclusive() {
        AreaOfInterest area = AreaOfInterest.of(box(10, 45, 11, 46));

        assertThatThrownBy(() -> new SelectionRequest(SceneQuery.all(), List.of("A"), area))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> SelectionRequest.ofTiles(SceneQuery.all(), List.of()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void unknownTileIsAConfigurationError() {
        assertThatThrownBy(() -> selector.select(SelectionRequest.ofTiles(SceneQuery.all(), List.of("Z"))))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void windowAndMergeHelpers() {
        TimeWindow window = SceneSelector.deriveWindow(List.of(third, first), Duration.ofMinutes(1));

        assertThat(window.start()).isEqualTo(T0.minusMinutes(1));
        assertThat(window.stop()).isEqualTo(third.getStop().plusMinutes(1));
        assertThat(SceneSelector.merge(List.of(List.of("b", "a"), List.of("c", "a"))))
                .containsExactly("a", "b", "c");
        log.info("Derived window {}", window);
    }
}
