package com.streamfirst.scenesearch.adapters.catalog.asf;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamfirst.scenesearch.domain.CatalogRequestException;
import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneTimes;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

/** Maps ASF search GeoJSON features to scene records. ASF does not report slice positions. */
final class AsfSceneMapper {

    private static final Pattern PRODUCT = Pattern.compile("GRD|SLC|SM|OCN");
    private static final GeometryFactory GEOMETRIES = new GeometryFactory(new PrecisionModel(), 4326);

    private AsfSceneMapper() {}

    static Scene toScene(JsonNode feature) {
        JsonNode p = feature.path("properties");
        String level = text(p, "processingLevel");
        Matcher product = PRODUCT.matcher(level);
        if (!product.find()) {
            throw new CatalogRequestException("unsupported ASF processing level " + level);
        }
        String direction = p.path("flightDirection").asText("");
        return Scene.builder()
                .location(text(p, "url"))
                .sensor(text(p, "platform").replace("entinel-", ""))
                .product(product.group())
                .acquisitionMode(text(p, "beamModeType"))
                .start(time(p, "startTime"))
                .stop(time(p, "stopTime"))
                .orbitDirection(direction.isEmpty() ? null : direction.substring(0, 1))
                .absoluteOrbit(p.path("orbit").asInt())
                .relativeOrbit(p.path("pathNumber").asInt())
                .frameNumber(p.path("frameNumber").asInt())
                .polarizations(Arrays.asList(p.path("polarization").asText("").split("\\+")))
                .footprint(footprint(feature.path("geometry")))
                .sliceNumber(Scene.UNKNOWN)
                .totalSlices(Scene.UNKNOWN)
                .build();
    }

    static LocalDateTime time(JsonNode properties, String name) {
        return SceneTimes.parse(text(properties, name)).truncatedTo(ChronoUnit.SECONDS);
    }

    private static String text(JsonNode properties, String name) {
        JsonNode value = properties.get(name);
        if (value == null || value.isNull()) {
            throw new CatalogRequestException("ASF feature lacks property " + name);
        }
        return value.asText();
    }

    /** The feature geometry, any GeoJSON type; null if the feature has none. */
    static Geometry footprint(JsonNode geometry) {
        if (geometry.isMissingNode() || geometry.isNull()) {
            return null;
        }
        try {
            return new GeoJsonReader(GEOMETRIES).read(geometry.toString());
        } catch (ParseException | IllegalArgumentException e) {
            throw new CatalogRequestException("invalid ASF footprint " + geometry, e);
        }
    }
}
