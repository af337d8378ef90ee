package com.streamfirst.scenesearch.application;

import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.ports.CatalogPort;
import com.streamfirst.scenesearch.ports.SceneIdentifierPort;
import java.util.List;

/** Selects full scene records, identifying bare locations when the catalog has no records. */
final class SceneRecords {

    private SceneRecords() {}

    static List<Scene> select(
            CatalogPort catalog, SceneIdentifierPort identifier, SceneQuery query) {
        if (catalog.providesSceneRecords()) {
            return catalog.selectScenes(query);
        }
        List<String> locations = catalog.select(query);
        return locations.isEmpty() ? List.of() : identifier.identify(locations);
    }
}
