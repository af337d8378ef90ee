package com.streamfirst.scenesearch.application;

/**
 * Which data-take neighbors a scene is expected to have.
 *
 * @param predecessor a scene is expected directly before this one
 * @param successor a scene is expected directly after this one
 */
public record ExpectedNeighbors(boolean predecessor, boolean successor) {

    /** Expectation from the slice position: slice 1 has no predecessor, the last no successor. */
    public static ExpectedNeighbors fromSlices(int sliceNumber, int totalSlices) {
        return new ExpectedNeighbors(sliceNumber != 1, sliceNumber != totalSlices);
    }

    /** Number of scenes in the group of this scene and its expected neighbors. */
    public int groupSize() {
        return 1 + (predecessor ? 1 : 0) + (successor ? 1 : 0);
    }
}
