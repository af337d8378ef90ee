package com.streamfirst.scenesearch.domain;

/**
 * Base type for every failure raised while searching catalogs, selecting scenes or verifying
 * data-take completeness. All subtypes are unchecked and propagate to the caller.
 */
public class SceneSearchException extends RuntimeException {

    public SceneSearchException(String message) {
        super(message);
    }

    public SceneSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
