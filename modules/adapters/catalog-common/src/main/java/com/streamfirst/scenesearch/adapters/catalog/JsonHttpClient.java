package com.streamfirst.scenesearch.adapters.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.scenesearch.domain.CatalogRequestException;
import com.streamfirst.scenesearch.domain.SceneSearchException;
import com.streamfirst.scenesearch.domain.TransientCatalogException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Minimal JSON-over-HTTP client shared by the catalog adapters.
 *
 * <p>I/O failures and the statuses 408, 429 and 5xx raise {@link TransientCatalogException}; other
 * non-2xx statuses and unreadable bodies raise {@link CatalogRequestException}.
 */
@Slf4j
public final class JsonHttpClient {

    private static final int MAX_ERROR_BODY = 500;

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Duration readTimeout;

    public JsonHttpClient(Duration connectTimeout, Duration readTimeout) {
        this.client =
                HttpClient.newBuilder()
                        .connectTimeout(connectTimeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build();
        this.mapper = new ObjectMapper();
        this.readTimeout = readTimeout;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode get(URI uri) {
        var request =
                HttpRequest.newBuilder(uri)
                        .timeout(readTimeout)
                        .header("Accept", "application/json, application/geo+json")
                        .GET()
                        .build();
        return send(request);
    }

    public JsonNode post(URI uri, JsonNode body) {
        String payload;
        try {
            payload = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new CatalogRequestException("cannot serialize request body for " + uri, e);
        }
        var request =
                HttpRequest.newBuilder(uri)
                        .timeout(readTimeout)
                        .header("Accept", "application/json, application/geo+json")
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(payload))
                        .build();
        return send(request);
    }

    private JsonNode send(HttpRequest request) {
        log.debug("{} {}", request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = client.send(request, BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientCatalogException(
                    request.method() + " " + request.uri() + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SceneSearchException("interrupted during " + request.uri(), e);
        }

        int status = response.statusCode();
        if (status == 408 || status == 429 || status >= 500) {
            throw new TransientCatalogException(
                    "HTTP " + status + " from " + request.uri() + ": " + abbreviate(response.body()));
        }
        if (status < 200 || status >= 300) {
            throw new CatalogRequestException(
                    "HTTP " + status + " from " + request.uri() + ": " + abbreviate(response.body()));
        }
        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new CatalogRequestException("invalid JSON from " + request.uri(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
