package com.streamfirst.scenesearch.domain;

/**
 * A catalog backend failed in a way that may succeed on a later attempt (connection problems,
 * timeouts, server-side errors). Retried by the catalog adapters up to their attempt bound.
 */
public class TransientCatalogException extends SceneSearchException {

    public TransientCatalogException(String message) {
        super(message);
    }

    public TransientCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
