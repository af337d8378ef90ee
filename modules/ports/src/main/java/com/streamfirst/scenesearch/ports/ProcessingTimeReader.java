package com.streamfirst.scenesearch.ports;

import java.time.LocalDateTime;

/**
 * Reads the time at which a scene product was processed. Used to pick the latest of several
 * reprocessed copies of the same acquisition.
 */
@FunctionalInterface
public interface ProcessingTimeReader {

    /**
     * @param location local path of the scene product
     * @return the declared processing start time
     * @throws com.streamfirst.scenesearch.domain.SceneSearchException if the product metadata cannot
     *     be read
     */
    LocalDateTime processingStart(String location);
}
