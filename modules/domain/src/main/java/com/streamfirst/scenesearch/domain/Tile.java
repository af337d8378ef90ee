package com.streamfirst.scenesearch.domain;

import java.util.Objects;
import org.locationtech.jts.geom.Geometry;

/**
 * A cell of the processing tile grid.
 *
 * @param id grid cell identifier, e.g. the MGRS tile name {@code 32UPC}
 * @param geometry cell outline in EPSG:4326
 */
public record Tile(String id, Geometry geometry) {
    public Tile {
        Objects.requireNonNull(id, "Tile id cannot be null");
        Objects.requireNonNull(geometry, "Tile geometry cannot be null");
    }

    public AreaOfInterest area() {
        return AreaOfInterest.of(geometry);
    }
}
