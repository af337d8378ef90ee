package com.streamfirst.scenesearch.adapters.catalog.stac;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.Extent;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.domain.SceneTimes;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Translates a {@link SceneQuery} into a CQL2-JSON filter over the STAC item properties
 * {@code platform}, {@code start_datetime}, {@code end_datetime}, {@code sar:instrument_mode},
 * {@code sar:product_type} and the custom {@code s1:datatake}.
 *
 * <p>All active clauses are combined with {@code and}; multiple values of one field with {@code
 * or}.
 */
public final class StacFilterTranslator {

    static final String PLATFORM = "platform";
    static final String START = "start_datetime";
    static final String END = "end_datetime";
    static final String MODE = "sar:instrument_mode";
    static final String PRODUCT = "sar:product_type";
    static final String DATATAKE = "s1:datatake";
    static final String GEOMETRY = "geometry";

    private static final Map<String, String> PLATFORMS =
            Map.of(
                    "S1A", "sentinel-1a",
                    "S1B", "sentinel-1b",
                    "S1C", "sentinel-1c");

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private StacFilterTranslator() {}

    /**
     * Builds the filter tree. A query without constraints yields an {@code and} node with no
     * arguments.
     *
     * @throws ConfigurationException for sensors without a STAC platform name
     */
    public static ObjectNode toCql2(SceneQuery query) {
        List<ObjectNode> clauses = new ArrayList<>();
        anyOf(PLATFORM, query.getSensors(), StacFilterTranslator::platform).ifPresent(clauses::add);
        anyOf(PRODUCT, query.getProducts(), Function.identity()).ifPresent(clauses::add);
        anyOf(MODE, query.getAcquisitionModes(), Function.identity()).ifPresent(clauses::add);

        // non-strict swaps the bound properties so that overlapping acquisitions qualify
        if (query.getMindate() != null) {
            String property = query.isDateStrict() ? START : END;
            clauses.add(compare(">=", property, query.getMindate()));
        }
        if (query.getMaxdate() != null) {
            String property = query.isDateStrict() ? END : START;
            clauses.add(compare("<=", property, query.getMaxdate()));
        }

        anyOf(DATATAKE, query.getFrameNumbers(), id -> String.format("%06X", id))
                .ifPresent(clauses::add);

        if (query.hasSpatialFilter()) {
            clauses.add(intersects(query.getSpatialFilter().geographic().extent()));
        }
        return op("and", clauses);
    }

    /** The STAC platform name for a sensor code such as {@code S1A}. */
    public static String platform(String sensor) {
        String platform = PLATFORMS.get(sensor);
        if (platform == null) {
            throw new ConfigurationException(
                    "unsupported sensor " + sensor + ", expected one of " + PLATFORMS.keySet());
        }
        return platform;
    }

    private static <T> Optional<ObjectNode> anyOf(
            String property, Collection<T> values, Function<T, String> encoder) {
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        List<ObjectNode> args = new ArrayList<>();
        for (T value : values) {
            ObjectNode eq = JSON.objectNode().put("op", "=");
            eq.putArray("args").add(property(property)).add(encoder.apply(value));
            args.add(eq);
        }
        return Optional.of(args.size() == 1 ? args.get(0) : op("or", args));
    }

    private static ObjectNode compare(String operator, String property, LocalDateTime time) {
        ObjectNode node = JSON.objectNode().put("op", operator);
        ArrayNode args = node.putArray("args");
        args.add(property(property));
        args.addObject().put("timestamp", SceneTimes.iso(time));
        return node;
    }

    private static ObjectNode intersects(Extent ext) {
        ObjectNode node = JSON.objectNode().put("op", "s_intersects");
        ArrayNode args = node.putArray("args");
        args.add(property(GEOMETRY));
        ObjectNode polygon = args.addObject().put("type", "Polygon");
        ArrayNode ring = polygon.putArray("coordinates").addArray();
        ring.addArray().add(ext.xmin()).add(ext.ymin());
        ring.addArray().add(ext.xmin()).add(ext.ymax());
        ring.addArray().add(ext.xmax()).add(ext.ymax());
        ring.addArray().add(ext.xmax()).add(ext.ymin());
        ring.addArray().add(ext.xmin()).add(ext.ymin());
        return node;
    }

    private static ObjectNode property(String name) {
        return JSON.objectNode().put("property", name);
    }

    private static ObjectNode op(String operator, List<ObjectNode> args) {
        ObjectNode node = JSON.objectNode().put("op", operator);
        node.putArray("args").addAll(args);
        return node;
    }
}
