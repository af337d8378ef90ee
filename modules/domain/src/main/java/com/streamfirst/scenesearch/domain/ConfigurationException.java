package com.streamfirst.scenesearch.domain;

/** Invalid input shape: unknown sensor codes, bad collections, unsupported spatial filters etc. */
public class ConfigurationException extends SceneSearchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
