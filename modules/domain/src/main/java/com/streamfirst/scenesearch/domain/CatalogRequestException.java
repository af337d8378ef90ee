package com.streamfirst.scenesearch.domain;

/** The catalog rejected a request or answered with something that cannot be read. Never retried. */
public class CatalogRequestException extends SceneSearchException {

    public CatalogRequestException(String message) {
        super(message);
    }

    public CatalogRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
