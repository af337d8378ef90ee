package com.streamfirst.scenesearch.adapters.safe;

import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneName;
import com.streamfirst.scenesearch.ports.SceneIdentifierPort;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;

/**
 * Identifies unpacked Sentinel-1 SAFE products. Sensor, mode, product, times and orbit come from
 * the product name; slice position, pass, relative orbit and footprint from {@code manifest.safe}.
 */
@Slf4j
public class SafeSceneIdentifier implements SceneIdentifierPort {

    private static final GeometryFactory GEOMETRIES = new GeometryFactory(new PrecisionModel(), 4326);

    @Override
    public List<Scene> identify(Collection<String> locations) {
        List<Scene> scenes = new ArrayList<>(locations.size());
        for (String location : locations) {
            scenes.add(identify(location));
        }
        scenes.sort(Comparator.comparing(Scene::getStart).thenComparing(Scene::getLocation));
        log.debug("Identified {} scene(s)", scenes.size());
        return scenes;
    }

    Scene identify(String location) {
        SceneName name = SceneName.parse(location);
        SafeManifest manifest = SafeManifest.read(location);
        return Scene.builder()
                .location(location)
                .sensor(name.sensor())
                .product(name.product())
                .acquisitionMode(name.acquisitionMode())
                .start(name.start())
                .stop(name.stop())
                .absoluteOrbit(name.absoluteOrbit())
                .frameNumber(name.dataTakeId())
                .polarizations(name.polarizations())
                .orbitDirection(manifest.text("pass").map(p -> p.substring(0, 1)).orElse(null))
                .relativeOrbit(
                        manifest
                                .first("relativeOrbitNumber", "start")
                                .map(e -> Integer.parseInt(e.getTextContent().trim()))
                                .orElse(0))
                .footprint(manifest.text("coordinates").map(SafeSceneIdentifier::footprint).orElse(null))
                .sliceNumber(manifest.integer("sliceNumber").orElse(Scene.UNKNOWN))
                .totalSlices(manifest.integer("totalSlices").orElse(Scene.UNKNOWN))
                .build();
    }

    /** Parses GML coordinates, given as space-separated {@code lat,lon} pairs. */
    static Geometry footprint(String gmlCoordinates) {
        List<Coordinate> coords = new ArrayList<>();
        for (String pair : gmlCoordinates.trim().split("\\s+")) {
            String[] latLon = pair.split(",");
            coords.add(new Coordinate(Double.parseDouble(latLon[1]), Double.parseDouble(latLon[0])));
        }
        if (!coords.get(0).equals2D(coords.get(coords.size() - 1))) {
            coords.add(coords.get(0));
        }
        return GEOMETRIES.createPolygon(coords.toArray(new Coordinate[0]));
    }
}
