package com.streamfirst.scenesearch.ports;

import com.streamfirst.scenesearch.domain.Tile;
import java.util.List;
import org.locationtech.jts.geom.Geometry;

/** Access to the processing tile grid. The grid itself is defined elsewhere. */
public interface TileGridPort {

    /**
     * Looks up tiles by id.
     *
     * @return the tiles in the order of {@code tileIds}
     * @throws com.streamfirst.scenesearch.domain.ConfigurationException for unknown ids
     */
    List<Tile> tilesFromIds(List<String> tileIds);

    /**
     * Finds every tile overlapping at least one of the geometries.
     *
     * @param geometries areas in EPSG:4326
     * @return the overlapping tiles sorted by id
     */
    List<Tile> tilesOverlapping(List<Geometry> geometries);
}
