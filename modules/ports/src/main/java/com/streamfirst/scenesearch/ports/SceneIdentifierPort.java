package com.streamfirst.scenesearch.ports;

import com.streamfirst.scenesearch.domain.Scene;
import java.util.Collection;
import java.util.List;

/** Reads scene metadata from scene locations. */
public interface SceneIdentifierPort {

    /**
     * Identifies the scenes at the given locations.
     *
     * @return one record per location, sorted by acquisition start
     * @throws com.streamfirst.scenesearch.domain.ConfigurationException if a location is not a
     *     recognized scene
     */
    List<Scene> identify(Collection<String> locations);
}
