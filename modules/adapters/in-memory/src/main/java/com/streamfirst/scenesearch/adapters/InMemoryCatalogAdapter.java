package com.streamfirst.scenesearch.adapters;

import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.domain.SceneTimes;
import com.streamfirst.scenesearch.ports.ReferenceCatalogPort;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory scene catalog, the local counterpart of the remote catalogs. Holds scene records and
 * filters them with the same semantics as the STAC filter translation. Like a local scene
 * database it does not check whether scene files exist.
 *
 * <p>Also serves as reference catalog, answering the property names used by the ASF adapter.
 */
@Slf4j
public class InMemoryCatalogAdapter implements ReferenceCatalogPort {

    private final Map<String, Scene> scenes = new ConcurrentHashMap<>();
    private final List<SceneQuery> queries = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public InMemoryCatalogAdapter() {}

    public InMemoryCatalogAdapter(Collection<Scene> initial) {
        initial.forEach(this::register);
    }

    /** Adds a scene, replacing any scene registered under the same location. */
    public void register(Scene scene) {
        scenes.put(scene.getLocation(), scene);
        log.debug("Registered scene {}", scene.getName());
    }

    public void remove(String location) {
        if (scenes.remove(location) != null) {
            log.debug("Removed scene {}", location);
        }
    }

    @Override
    public List<String> select(SceneQuery query) {
        return selectScenes(query).stream().map(Scene::getLocation).toList();
    }

    @Override
    public boolean providesSceneRecords() {
        return true;
    }

    @Override
    public List<Scene> selectScenes(SceneQuery query) {
        if (closed) {
            throw new IllegalStateException("catalog is closed");
        }
        queries.add(query);
        List<Scene> result =
                scenes.values().stream()
                        .filter(scene -> matches(scene, query))
                        .sorted(Comparator.comparing(Scene::getLocation))
                        .toList();
        log.debug("Found {} scene(s) matching query", result.size());
        return result;
    }

    @Override
    public List<String> selectProperty(SceneQuery query, String property) {
        List<String> values = new ArrayList<>();
        for (Scene scene : selectScenes(query)) {
            values.add(property(scene, property));
        }
        values.sort(Comparator.naturalOrder());
        return values;
    }

    @Override
    public List<List<String>> selectProperties(SceneQuery query, List<String> properties) {
        List<List<String>> tuples = new ArrayList<>();
        for (Scene scene : selectScenes(query)) {
            tuples.add(properties.stream().map(p -> property(scene, p)).toList());
        }
        tuples.sort(ReferenceCatalogPort::compareTuples);
        return tuples;
    }

    @Override
    public void close() {
        closed = true;
    }

    /** Whether a scene satisfies every active constraint of the query. */
    static boolean matches(Scene scene, SceneQuery query) {
        if (!query.getSensors().isEmpty() && !query.getSensors().contains(scene.getSensor())) {
            return false;
        }
        if (!query.getProducts().isEmpty() && !query.getProducts().contains(scene.getProduct())) {
            return false;
        }
        if (!query.getAcquisitionModes().isEmpty()
                && !query.getAcquisitionModes().contains(scene.getAcquisitionMode())) {
            return false;
        }
        if (!query.getFrameNumbers().isEmpty()
                && !query.getFrameNumbers().contains(scene.getFrameNumber())) {
            return false;
        }
        if (query.getMindate() != null) {
            var bound = query.isDateStrict() ? scene.getStart() : scene.getStop();
            if (bound.isBefore(query.getMindate())) {
                return false;
            }
        }
        if (query.getMaxdate() != null) {
            var bound = query.isDateStrict() ? scene.getStop() : scene.getStart();
            if (bound.isAfter(query.getMaxdate())) {
                return false;
            }
        }
        return !query.hasSpatialFilter()
                || query.getSpatialFilter().boundingBoxIntersects(scene.getFootprint());
    }

    private static String property(Scene scene, String property) {
        return switch (property) {
            case SCENE_NAME -> scene.getName().replaceFirst("\\.SAFE$", "");
            case URL -> scene.getLocation();
            case "startTime" -> SceneTimes.iso(scene.getStart());
            case "stopTime" -> SceneTimes.iso(scene.getStop());
            case "platform" -> scene.getSensor().replace("S1", "Sentinel-1");
            case "processingLevel" -> scene.getProduct();
            case "beamModeType" -> scene.getAcquisitionMode();
            default -> throw new ConfigurationException("unknown scene property " + property);
        };
    }

    /** Queries received so far, in order. Useful for testing. */
    public List<SceneQuery> getQueries() {
        return List.copyOf(queries);
    }

    public int getSceneCount() {
        return scenes.size();
    }

    /** Clears all scenes and recorded queries. Useful for testing. */
    public void clear() {
        log.info("Clearing in-memory catalog");
        scenes.clear();
        queries.clear();
    }
}
