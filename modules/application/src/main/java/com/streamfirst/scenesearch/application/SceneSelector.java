package com.streamfirst.scenesearch.application;

import com.streamfirst.scenesearch.domain.AreaOfInterest;
import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.domain.SelectionResult;
import com.streamfirst.scenesearch.domain.Tile;
import com.streamfirst.scenesearch.domain.TimeWindow;
import com.streamfirst.scenesearch.ports.CatalogPort;
import com.streamfirst.scenesearch.ports.SceneIdentifierPort;
import com.streamfirst.scenesearch.ports.TileGridPort;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;

/**
 * Central scene search: selects the scenes to process together with the tiles to generate
 * products for.
 *
 * <p>The tile list is either the list given in the request, the tiles overlapping the requested
 * area of interest, or, without any spatial constraint, the tiles overlapping an initial search
 * result. In the latter case the search runs in two phases:
 *
 * <ol>
 *   <li>search with all other parameters and derive the tiles overlapping the scene footprints
 *   <li>widen the time range of that result by one minute on both ends and search again once per
 *       tile
 * </ol>
 *
 * <p>As a consequence the neighbors of the initially found scenes are returned too, since they
 * overlap the same tiles and are needed to cover them completely. Tiles are derived from the first
 * phase only.
 */
@Slf4j
@RequiredArgsConstructor
public class SceneSelector {

    /** Padding of the phase-two time window. */
    public static final Duration DATA_TAKE_PAD = Duration.ofMinutes(1);

    private final CatalogPort catalog;
    private final TileGridPort tileGrid;
    private final SceneIdentifierPort identifier;

    /**
     * Runs the selection.
     *
     * @return sorted, duplicate-free scene locations and the tile ids
     */
    public SelectionResult select(SelectionRequest request) {
        SceneQuery query = request.query().expandStripmap();
        SelectionResult result;
        if (request.hasTiles()) {
            result = selectByTiles(query, request.aoiTiles());
        } else if (request.hasGeometry()) {
            result = selectByArea(query, request.aoiGeometry());
        } else {
            result = selectByFootprints(query);
        }
        log.info(
                "Selected {} scene(s) covering {} tile(s)", result.scenes().size(), result.tiles().size());
        return result;
    }

    private SelectionResult selectByTiles(SceneQuery query, List<String> tileIds) {
        List<Tile> tiles = tileGrid.tilesFromIds(tileIds);
        return new SelectionResult(searchPerTile(query, tiles), tileIds);
    }

    private SelectionResult selectByArea(SceneQuery query, AreaOfInterest aoi) {
        AreaOfInterest area = aoi.geographic();
        List<Tile> tiles = tileGrid.tilesOverlapping(List.of(area.geometry()));
        List<String> scenes = catalog.select(query.withSpatialFilter(area));
        return new SelectionResult(merge(List.of(scenes)), tileIds(tiles));
    }

    private SelectionResult selectByFootprints(SceneQuery query) {
        Phase1Result phase1 = phase1(query);
        if (phase1.scenes().isEmpty()) {
            log.info("Initial search found no scenes");
            return SelectionResult.empty();
        }
        if (phase1.tiles().isEmpty()) {
            log.warn("None of the {} initially found scene(s) overlaps a tile", phase1.scenes().size());
            return SelectionResult.empty();
        }
        TimeWindow window = deriveWindow(phase1.scenes(), DATA_TAKE_PAD);
        log.debug(
                "Searching {} tile(s) between {} and {}",
                phase1.tiles().size(),
                window.start(),
                window.stop());
        List<String> scenes = searchPerTile(query.withDateWindow(window), phase1.tiles());
        return new SelectionResult(scenes, tileIds(phase1.tiles()));
    }

    /** Searches without spatial constraint and derives the tiles touched by the result. */
    Phase1Result phase1(SceneQuery query) {
        List<Scene> scenes = SceneRecords.select(catalog, identifier, query.withSpatialFilter(null));
        List<Geometry> footprints =
                scenes.stream().map(Scene::getFootprint).filter(Objects::nonNull).toList();
        List<Tile> tiles = footprints.isEmpty() ? List.of() : tileGrid.tilesOverlapping(footprints);
        log.debug("Initial search found {} scene(s) on {} tile(s)", scenes.size(), tiles.size());
        return new Phase1Result(scenes, tiles);
    }

    private List<String> searchPerTile(SceneQuery query, List<Tile> tiles) {
        List<List<String>> selections = new ArrayList<>(tiles.size());
        for (Tile tile : tiles) {
            List<String> found = catalog.select(query.withSpatialFilter(tile.area()));
            log.debug("Tile {}: {} scene(s)", tile.id(), found.size());
            selections.add(found);
        }
        return merge(selections);
    }

    /**
     * The time range spanned by the scenes, widened by {@code pad} on both ends.
     *
     * @throws IllegalArgumentException if {@code scenes} is empty
     */
    public static TimeWindow deriveWindow(List<Scene> scenes, Duration pad) {
        LocalDateTime start =
                scenes.stream()
                        .map(Scene::getStart)
                        .min(Comparator.naturalOrder())
                        .orElseThrow(() -> new IllegalArgumentException("no scenes to derive a window from"));
        LocalDateTime stop = scenes.stream().map(Scene::getStop).max(Comparator.naturalOrder()).get();
        return TimeWindow.of(start, stop).buffered(pad);
    }

    /** Union of several selections, sorted and free of duplicates. */
    public static List<String> merge(Collection<List<String>> selections) {
        TreeSet<String> union = new TreeSet<>();
        selections.forEach(union::addAll);
        return List.copyOf(union);
    }

    private static List<String> tileIds(List<Tile> tiles) {
        return tiles.stream().map(Tile::id).toList();
    }

    /** Outcome of the unconstrained first search. */
    public record Phase1Result(List<Scene> scenes, List<Tile> tiles) {}
}
