package com.streamfirst.scenesearch.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.Tile;
import com.streamfirst.scenesearch.ports.TileGridPort;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

/** Tile grid held in memory, optionally loaded from a GeoJSON feature collection. */
@Slf4j
public class InMemoryTileGridAdapter implements TileGridPort {

    /** Feature property holding the tile id in MGRS grid exports. */
    public static final String DEFAULT_ID_PROPERTY = "Name";

    private final Map<String, Tile> tiles = new ConcurrentSkipListMap<>();

    public InMemoryTileGridAdapter() {}

    public InMemoryTileGridAdapter(Collection<Tile> initial) {
        initial.forEach(this::register);
    }

    /**
     * Loads a grid from a GeoJSON FeatureCollection in EPSG:4326.
     *
     * @param file the GeoJSON file
     * @param idProperty feature property holding the tile id
     * @throws ConfigurationException if a feature has no id or an unreadable geometry
     */
    public static InMemoryTileGridAdapter fromGeoJson(Path file, String idProperty) {
        JsonNode collection;
        try {
            collection = new ObjectMapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read tile grid " + file, e);
        }
        var reader = new GeoJsonReader(new GeometryFactory(new PrecisionModel(), 4326));
        var grid = new InMemoryTileGridAdapter();
        for (JsonNode feature : collection.path("features")) {
            String id = feature.path("properties").path(idProperty).asText("");
            if (id.isBlank()) {
                throw new ConfigurationException("tile feature without " + idProperty + " in " + file);
            }
            try {
                grid.register(new Tile(id, reader.read(feature.path("geometry").toString())));
            } catch (ParseException e) {
                throw new ConfigurationException("invalid geometry for tile " + id + " in " + file, e);
            }
        }
        log.info("Loaded {} tile(s) from {}", grid.getTileCount(), file);
        return grid;
    }

    public void register(Tile tile) {
        tiles.put(tile.id(), tile);
    }

    @Override
    public List<Tile> tilesFromIds(List<String> tileIds) {
        List<Tile> result = new ArrayList<>(tileIds.size());
        for (String id : tileIds) {
            Tile tile = tiles.get(id);
            if (tile == null) {
                throw new ConfigurationException("unknown tile " + id);
            }
            result.add(tile);
        }
        return result;
    }

    @Override
    public List<Tile> tilesOverlapping(List<Geometry> geometries) {
        List<Tile> result =
                tiles.values().stream()
                        .filter(tile -> overlapsAny(tile, geometries))
                        .toList();
        log.debug("{} tile(s) overlap {} geometries", result.size(), geometries.size());
        return result;
    }

    private static boolean overlapsAny(Tile tile, List<Geometry> geometries) {
        for (Geometry geometry : geometries) {
            if (geometry != null && tile.geometry().intersects(geometry)) {
                return true;
            }
        }
        return false;
    }

    public int getTileCount() {
        return tiles.size();
    }
}
