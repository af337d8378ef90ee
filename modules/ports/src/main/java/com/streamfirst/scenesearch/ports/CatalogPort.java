package com.streamfirst.scenesearch.ports;

import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneQuery;
import java.util.List;

/**
 * Port for scene catalogs. Implementations translate a {@link SceneQuery} into their backend's
 * filter syntax and answer with scene locations.
 *
 * <p>A catalog connection is opened when the adapter is constructed and released by {@link
 * #close()}; adapters are meant to be used with try-with-resources. Calls block until the backend
 * answers or the adapter's retry bound is exhausted.
 */
public interface CatalogPort extends AutoCloseable {

    /**
     * Selects scenes matching the query.
     *
     * @param query the search parameters
     * @return scene locations, sorted and free of duplicates
     * @throws com.streamfirst.scenesearch.domain.TransientCatalogException if the backend keeps
     *     failing after all retries
     * @throws com.streamfirst.scenesearch.domain.MissingLocalDataException if the query requests an
     *     existence check and a referenced scene is absent locally
     */
    List<String> select(SceneQuery query);

    /**
     * Whether {@link #selectScenes(SceneQuery)} is supported, i.e. the backend already delivers fully
     * populated scene records and locations need not be identified separately.
     */
    default boolean providesSceneRecords() {
        return false;
    }

    /**
     * Selects scenes matching the query as full records, sorted by location.
     *
     * @throws UnsupportedOperationException unless {@link #providesSceneRecords()} is true
     */
    default List<Scene> selectScenes(SceneQuery query) {
        throw new UnsupportedOperationException(
                getClass().getSimpleName() + " does not provide scene records");
    }

    /** Releases the catalog connection. Further calls fail with {@link IllegalStateException}. */
    @Override
    void close();
}
