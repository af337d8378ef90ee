package com.streamfirst.scenesearch.domain;

import java.util.List;

/**
 * The processing work-list produced by a selection run.
 *
 * @param scenes scene locations, sorted and free of duplicates
 * @param tiles ids of the tiles to generate products for
 */
public record SelectionResult(List<String> scenes, List<String> tiles) {
    public SelectionResult {
        scenes = List.copyOf(scenes);
        tiles = List.copyOf(tiles);
    }

    public static SelectionResult empty() {
        return new SelectionResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return scenes.isEmpty();
    }
}
