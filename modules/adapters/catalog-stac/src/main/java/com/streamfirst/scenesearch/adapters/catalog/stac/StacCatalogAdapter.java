package com.streamfirst.scenesearch.adapters.catalog.stac;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.streamfirst.scenesearch.adapters.catalog.DuplicateResolver;
import com.streamfirst.scenesearch.adapters.catalog.FixedBackoffRetry;
import com.streamfirst.scenesearch.adapters.catalog.JsonHttpClient;
import com.streamfirst.scenesearch.domain.CatalogRequestException;
import com.streamfirst.scenesearch.domain.ConfigurationException;
import com.streamfirst.scenesearch.domain.MissingLocalDataException;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.domain.SceneSearchException;
import com.streamfirst.scenesearch.ports.CatalogPort;
import com.streamfirst.scenesearch.ports.ProcessingTimeReader;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Catalog adapter for a STAC API with the filter extension (CQL2-JSON).
 *
 * <p>Scenes are expected to be stored locally as unpacked {@code .SAFE} directories; the location
 * of an item is taken from the href of its first asset, cut after the {@code .SAFE} suffix.
 * Reprocessed duplicates are reduced to the latest processed product.
 */
@Slf4j
public class StacCatalogAdapter implements CatalogPort {

    private static final String SAFE_SUFFIX = ".SAFE";
    private static final int DEFAULT_PAGE_SIZE = 100;

    private final URI url;
    private final List<String> collections;
    private final JsonHttpClient http;
    private final FixedBackoffRetry retry;
    private final DuplicateResolver duplicates;
    private final int pageSize;
    private final URI searchEndpoint;
    private volatile boolean closed;

    /**
     * Opens the catalog, retrying transient failures.
     *
     * @param url the catalog landing page
     * @param collections the collections to search, at least one
     * @throws ConfigurationException if no usable collection name is given
     */
    public StacCatalogAdapter(
            URI url,
            List<String> collections,
            JsonHttpClient http,
            FixedBackoffRetry retry,
            ProcessingTimeReader processingTimes) {
        this(url, collections, http, retry, processingTimes, DEFAULT_PAGE_SIZE);
    }

    public StacCatalogAdapter(
            URI url,
            List<String> collections,
            JsonHttpClient http,
            FixedBackoffRetry retry,
            ProcessingTimeReader processingTimes,
            int pageSize) {
        if (collections == null
                || collections.isEmpty()
                || collections.stream().anyMatch(c -> c == null || c.isBlank())) {
            throw new ConfigurationException(
                    "collections must be a non-empty list of collection names: " + collections);
        }
        this.url = url;
        this.collections = List.copyOf(collections);
        this.http = http;
        this.retry = retry;
        this.duplicates = new DuplicateResolver(processingTimes);
        this.pageSize = pageSize;
        this.searchEndpoint = retry.call("opening catalog " + url, this::openCatalog);
        log.info("Opened STAC catalog {} (collections {})", url, this.collections);
    }

    @Override
    public List<String> select(SceneQuery query) {
        ensureOpen();
        ObjectNode body = searchBody(query);
        log.debug("Searching {} with {}", searchEndpoint, body);

        List<JsonNode> items = retry.call("searching catalog " + url, () -> fetchAll(body));

        List<String> locations = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            locations.add(resolveLocation(item, query.isCheckExist()));
        }
        List<String> selection = duplicates.resolve(locations);
        log.debug(
                "Catalog {} returned {} item(s), {} scene(s) selected", url, items.size(), selection.size());
        return selection;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("Closed STAC catalog {}", url);
        }
    }

    ObjectNode searchBody(SceneQuery query) {
        ObjectNode body = http.mapper().createObjectNode();
        var names = body.putArray("collections");
        for (String collection : collections) {
            names.add(collection);
        }
        body.put("limit", pageSize);
        ObjectNode filter = StacFilterTranslator.toCql2(query);
        if (!filter.path("args").isEmpty()) {
            body.put("filter-lang", "cql2-json");
            body.set("filter", filter);
        }
        return body;
    }

    private URI openCatalog() {
        JsonNode landing = http.get(url);
        if (!landing.isObject()) {
            throw new CatalogRequestException("no STAC landing page at " + url);
        }
        return link(landing, "search", true)
                .orElseGet(() -> URI.create(stripSlash(url.toString()) + "/search"));
    }

    private List<JsonNode> fetchAll(ObjectNode body) {
        List<JsonNode> items = new ArrayList<>();
        JsonNode page = http.post(searchEndpoint, body);
        ObjectNode currentBody = body;
        while (true) {
            page.path("features").forEach(items::add);
            JsonNode next = linkNode(page, "next", false).orElse(null);
            if (next == null) {
                return items;
            }
            URI href = searchEndpoint.resolve(next.path("href").asText());
            if ("POST".equalsIgnoreCase(next.path("method").asText("GET"))) {
                currentBody = nextBody(currentBody, next);
                page = http.post(href, currentBody);
            } else {
                page = http.get(href);
            }
        }
    }

    private ObjectNode nextBody(ObjectNode current, JsonNode next) {
        JsonNode body = next.path("body");
        if (!body.isObject()) {
            return current;
        }
        if (next.path("merge").asBoolean(false)) {
            ObjectNode merged = current.deepCopy();
            merged.setAll((ObjectNode) body);
            return merged;
        }
        return (ObjectNode) body;
    }

    /** Local path of the scene an item refers to. */
    String resolveLocation(JsonNode item, boolean checkExist) {
        JsonNode assets = item.path("assets");
        Iterator<Map.Entry<String, JsonNode>> fields = assets.fields();
        if (!fields.hasNext()) {
            throw new CatalogRequestException("item " + item.path("id").asText() + " has no assets");
        }
        String href = fields.next().getValue().path("href").asText("");
        if (href.isBlank()) {
            throw new CatalogRequestException(
                    "first asset of item " + item.path("id").asText() + " has no href");
        }
        int suffix = href.indexOf(SAFE_SUFFIX);
        String location = suffix >= 0 ? href.substring(0, suffix + SAFE_SUFFIX.length()) : href;
        location = location.replaceFirst("^file://", "");

        Path path = Path.of(location);
        if (Files.exists(path)) {
            try {
                return path.toRealPath().toString();
            } catch (IOException e) {
                throw new SceneSearchException("cannot resolve " + location, e);
            }
        }
        if (checkExist) {
            throw new MissingLocalDataException(location);
        }
        return location;
    }

    private Optional<URI> link(JsonNode node, String rel, boolean preferPost) {
        return linkNode(node, rel, preferPost).map(l -> url.resolve(l.path("href").asText()));
    }

    private static Optional<JsonNode> linkNode(JsonNode node, String rel, boolean preferPost) {
        JsonNode match = null;
        for (JsonNode link : node.path("links")) {
            if (!rel.equals(link.path("rel").asText())) {
                continue;
            }
            if (match == null) {
                match = link;
            }
            if (preferPost && "POST".equalsIgnoreCase(link.path("method").asText())) {
                return Optional.of(link);
            }
        }
        return Optional.ofNullable(match);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("catalog " + url + " is closed");
        }
    }

    private static String stripSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
