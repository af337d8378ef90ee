package com.streamfirst.scenesearch.application;

import com.streamfirst.scenesearch.domain.AreaOfInterest;
import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.SceneQuery;
import java.util.List;
import java.util.Objects;

/**
 * Input of a selection run: the search parameters plus at most one spatial constraint.
 *
 * @param query search parameters; a spatial filter set here is replaced by the selection
 * @param aoiTiles explicit tile ids, or null
 * @param aoiGeometry explicit area of interest, or null
 */
public record SelectionRequest(SceneQuery query, List<String> aoiTiles, AreaOfInterest aoiGeometry) {

    public SelectionRequest {
        Objects.requireNonNull(query, "Query cannot be null");
        if (aoiTiles != null && aoiGeometry != null) {
            throw new ConfigurationException("define either AOI tiles or an AOI geometry, not both");
        }
        if (aoiTiles != null) {
            if (aoiTiles.isEmpty()) {
                throw new ConfigurationException("AOI tile list is empty");
            }
            aoiTiles = List.copyOf(aoiTiles);
        }
    }

    public static SelectionRequest ofTiles(SceneQuery query, List<String> tileIds) {
        return new SelectionRequest(query, tileIds, null);
    }

    public static SelectionRequest ofGeometry(SceneQuery query, AreaOfInterest area) {
        return new SelectionRequest(query, null, area);
    }

    /** Tiles are derived from the footprints of an initial search. */
    public static SelectionRequest ofFootprints(SceneQuery query) {
        return new SelectionRequest(query, null, null);
    }

    public boolean hasTiles() {
        return aoiTiles != null;
    }

    public boolean hasGeometry() {
        return aoiGeometry != null;
    }
}
