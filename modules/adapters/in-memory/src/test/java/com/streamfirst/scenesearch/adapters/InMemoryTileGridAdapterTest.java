package com.streamfirst.scenesearch.adapters;

import com.streamfirst.scenesearch.domain.AreaOfInterest;
import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.Tile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTileGridAdapterTest {

    private static final String GRID = """
            {"type": "FeatureCollection", "features": [
              {"type": "Feature", "properties": {"Name": "32TNT"},
               "geometry": {"type": "Polygon", "coordinates": [[[10, 46], [11, 46], [11, 47], [10, 47], [10, 46]]]}},
              {"type": "Feature", "properties": {"Name": "32TNS"},
               "geometry": {"type": "Polygon", "coordinates": [[[10, 45], [11, 45], [11, 46], [10, 46], [10, 45]]]}},
              {"type": "Feature", "properties": {"Name": "33TUM"},
               "geometry": {"type": "Polygon", "coordinates": [[[12, 45], [13, 45], [13, 46], [12, 46], [12, 45]]]}}
            ]}
            """;

    @TempDir
    Path dir;

    private InMemoryTileGridAdapter load() throws IOException {
        Path file = dir.resolve("grid.geojson");
        Files.writeString(file, GRID);
        return InMemoryTileGridAdapter.fromGeoJson(file, InMemoryTileGridAdapter.DEFAULT_ID_PROPERTY);
    }

    @Test
    void loadsTilesFromGeoJson() throws IOException {
        InMemoryTileGridAdapter grid = load();

        assertThat(grid.getTileCount()).isEqualTo(3);
        List<Tile> tiles = grid.tilesFromIds(List.of("32TNT", "32TNS"));
        assertThat(tiles).extracting(Tile::id).containsExactly("32TNT", "32TNS");
        assertThat(tiles.get(0).geometry().getArea()).isEqualTo(1.0);
    }

    @Test
    void overlappingTilesAreSortedById() throws IOException {
        InMemoryTileGridAdapter grid = load();
        var footprint = AreaOfInterest.fromWkt("POLYGON ((10.2 45.5, 10.8 45.5, 10.8 46.5, 10.2 46.5, 10.2 45.5))");

        List<Tile> tiles = grid.tilesOverlapping(List.of(footprint.geometry()));

        assertThat(tiles).extracting(Tile::id).containsExactly("32TNS", "32TNT");
        assertThat(grid.tilesOverlapping(List.of())).isEmpty();
    }

    @Test
    void unknownTileIdIsAConfigurationError() throws IOException {
        InMemoryTileGridAdapter grid = load();

        assertThatThrownBy(() -> grid.tilesFromIds(List.of("32TNT", "99XXX")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("99XXX");
    }

    @Test
    void featureWithoutIdIsRejected() throws IOException {
        Path file = dir.resolve("broken.geojson");
        Files.writeString(file, GRID);

        assertThatThrownBy(() -> InMemoryTileGridAdapter.fromGeoJson(file, "tile_id"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("tile_id");
    }
}
