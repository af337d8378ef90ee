package com.streamfirst.scenesearch.ports;

import com.streamfirst.scenesearch.domain.SceneQuery;
import java.util.List;

/**
 * A catalog used to cross-check a primary catalog, e.g. the ASF archive. Besides locations and
 * records it can answer with raw metadata properties.
 */
public interface ReferenceCatalogPort extends CatalogPort {

    /** Property holding the product name without extension. */
    String SCENE_NAME = "sceneName";

    /** Property holding the download URL. */
    String URL = "url";

    /**
     * Selects one metadata property per matching scene.
     *
     * @return the property values, sorted
     * @throws com.streamfirst.scenesearch.domain.ConfigurationException for unknown property names
     */
    List<String> selectProperty(SceneQuery query, String property);

    /**
     * Selects several metadata properties per matching scene.
     *
     * @return one tuple per scene with values in the order of {@code properties}, sorted by {@link
     *     #compareTuples}
     */
    List<List<String>> selectProperties(SceneQuery query, List<String> properties);

    /**
     * Lexicographic order of property tuples: values are compared pairwise, the first difference
     * decides, and of two tuples with a common prefix the shorter comes first.
     */
    static int compareTuples(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
