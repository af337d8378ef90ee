package com.streamfirst.scenesearch.domain;

import lombok.Getter;

/** A scene referenced by a catalog does not exist on local storage. */
@Getter
public class MissingLocalDataException extends SceneSearchException {

    private final String location;

    public MissingLocalDataException(String location) {
        super("scene does not exist locally: " + location);
        this.location = location;
    }
}
