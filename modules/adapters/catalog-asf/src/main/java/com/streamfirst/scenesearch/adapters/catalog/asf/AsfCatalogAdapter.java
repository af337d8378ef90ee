package com.streamfirst.scenesearch.adapters.catalog.asf;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamfirst.scenesearch.adapters.catalog.FixedBackoffRetry;
import com.streamfirst.scenesearch.adapters.catalog.JsonHttpClient;
import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.domain.SceneTimes;
import com.streamfirst.scenesearch.ports.ReferenceCatalogPort;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Reference catalog adapter for the Alaska Satellite Facility (ASF) search API.
 *
 * <p>Intended for cross-checking a primary catalog: it answers with download URLs, raw metadata
 * properties or scene records, never with local paths. Data-take filtering is not supported.
 */
@Slf4j
public class AsfCatalogAdapter implements ReferenceCatalogPort {

    public static final URI DEFAULT_ENDPOINT =
            URI.create("https://api.daac.asf.alaska.edu/services/search/param");

    static final List<String> GRD_LEVELS = List.of("GRD_HD", "GRD_MD", "GRD_MS", "GRD_HS", "GRD_FD");

    private final URI endpoint;
    private final JsonHttpClient http;
    private final FixedBackoffRetry retry;
    private volatile boolean closed;

    public AsfCatalogAdapter(URI endpoint, JsonHttpClient http, FixedBackoffRetry retry) {
        this.endpoint = endpoint;
        this.http = http;
        this.retry = retry;
        log.info("Using ASF search endpoint {}", endpoint);
    }

    @Override
    public List<String> select(SceneQuery query) {
        return selectProperty(query, URL).stream().distinct().toList();
    }

    @Override
    public boolean providesSceneRecords() {
        return true;
    }

    @Override
    public List<Scene> selectScenes(SceneQuery query) {
        return features(query).stream()
                .map(AsfSceneMapper::toScene)
                .sorted(Comparator.comparing(Scene::getLocation))
                .toList();
    }

    @Override
    public List<String> selectProperty(SceneQuery query, String property) {
        List<String> values = new ArrayList<>();
        for (JsonNode feature : features(query)) {
            values.add(property(feature, property));
        }
        values.sort(Comparator.naturalOrder());
        return values;
    }

    @Override
    public List<List<String>> selectProperties(SceneQuery query, List<String> properties) {
        List<List<String>> tuples = new ArrayList<>();
        for (JsonNode feature : features(query)) {
            List<String> tuple = new ArrayList<>(properties.size());
            for (String property : properties) {
                tuple.add(property(feature, property));
            }
            tuples.add(List.copyOf(tuple));
        }
        tuples.sort(ReferenceCatalogPort::compareTuples);
        return tuples;
    }

    @Override
    public void close() {
        closed = true;
    }

    List<JsonNode> features(SceneQuery query) {
        if (closed) {
            throw new IllegalStateException("ASF catalog adapter is closed");
        }
        URI uri = searchUri(query);
        JsonNode result = retry.call("searching ASF", () -> http.get(uri));

        List<JsonNode> features = new ArrayList<>();
        for (JsonNode feature : result.path("features")) {
            if (!query.isDateStrict() || withinStrictWindow(feature, query)) {
                features.add(feature);
            }
        }
        log.debug("ASF returned {} feature(s) for {}", features.size(), uri);
        return features;
    }

    URI searchUri(SceneQuery query) {
        if (!query.getFrameNumbers().isEmpty()) {
            throw new ConfigurationException("the ASF catalog cannot filter by data-take id");
        }
        Map<String, String> params = new LinkedHashMap<>();
        if (!query.getSensors().isEmpty()) {
            List<String> platforms =
                    query.getSensors().stream().map(s -> s.replace("S1", "Sentinel-1")).toList();
            params.put("platform", join(platforms));
        }
        if (!query.getProducts().isEmpty()) {
            params.put("processingLevel", join(processingLevels(query.getProducts())));
        }
        if (!query.getAcquisitionModes().isEmpty()) {
            params.put("beamMode", join(beamModes(query.getAcquisitionModes())));
        }
        if (query.getMindate() != null) {
            params.put("start", SceneTimes.iso(query.getMindate()));
        }
        if (query.getMaxdate() != null) {
            params.put("end", SceneTimes.iso(query.getMaxdate()));
        }
        if (query.hasSpatialFilter()) {
            params.put("intersectsWith", query.getSpatialFilter().geographic().toWkt());
        }
        params.put("output", "geojson");

        String queryString =
                params.entrySet().stream()
                        .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                        .collect(Collectors.joining("&"));
        return URI.create(endpoint + "?" + queryString);
    }

    static List<String> processingLevels(Set<String> products) {
        Set<String> levels = new LinkedHashSet<>();
        for (String product : products) {
            if (product.equals("GRD")) {
                levels.addAll(GRD_LEVELS);
            } else {
                levels.add(product);
            }
        }
        return List.copyOf(levels);
    }

    static List<String> beamModes(Set<String> modes) {
        Set<String> beams = new LinkedHashSet<>();
        for (String mode : modes) {
            if (mode.equals("SM")) {
                beams.addAll(SceneQuery.STRIPMAP_BEAMS);
            } else {
                beams.add(mode);
            }
        }
        return List.copyOf(beams);
    }

    private static boolean withinStrictWindow(JsonNode feature, SceneQuery query) {
        JsonNode properties = feature.path("properties");
        LocalDateTime start = AsfSceneMapper.time(properties, "startTime");
        LocalDateTime stop = AsfSceneMapper.time(properties, "stopTime");
        boolean afterMin = query.getMindate() == null || !start.isBefore(query.getMindate());
        boolean beforeMax = query.getMaxdate() == null || !stop.isAfter(query.getMaxdate());
        return afterMin && beforeMax;
    }

    private static String property(JsonNode feature, String name) {
        JsonNode value = feature.path("properties").get(name);
        if (value == null) {
            throw new ConfigurationException("unknown ASF property " + name);
        }
        return value.isNull() ? "" : value.asText();
    }

    private static String join(List<String> values) {
        return String.join(",", values);
    }
}
