package com.streamfirst.scenesearch.application;

import com.streamfirst.scenesearch.domain.CompletenessException;
import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneName;
import com.streamfirst.scenesearch.domain.SceneQuery;
import com.streamfirst.scenesearch.domain.TimeWindow;
import com.streamfirst.scenesearch.ports.CatalogPort;
import com.streamfirst.scenesearch.ports.ReferenceCatalogPort;
import com.streamfirst.scenesearch.ports.SceneIdentifierPort;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks that every scene's data-take predecessor and successor can be found in the primary
 * catalog, unless the scene sits at the start or end of its data-take.
 *
 * <p>A neighbor is only reported missing if the reference catalog confirms it exists, so that gaps
 * in the acquisition plan itself are not mistaken for missing downloads.
 */
@Slf4j
@RequiredArgsConstructor
public class CompletenessVerifier {

    /** Seconds added on both ends of a scene's window to reach its neighbors. */
    public static final int NEIGHBOR_BUFFER_SECONDS = 2;

    private final CatalogPort catalog;
    private final ReferenceCatalogPort reference;
    private final SceneIdentifierPort identifier;

    /**
     * Verifies all scenes and reports every gap at once.
     *
     * @throws CompletenessException naming each scene with a missing predecessor and/or successor
     */
    public void verify(List<Scene> scenes) {
        List<String> missing = new ArrayList<>();
        for (Scene scene : scenes) {
            check(scene).ifPresent(missing::add);
        }
        if (!missing.isEmpty()) {
            log.warn("{} of {} scene(s) miss data-take neighbors", missing.size(), scenes.size());
            throw new CompletenessException(missing);
        }
        log.info("Data-take neighbors complete for {} scene(s)", scenes.size());
    }

    /**
     * Locations of the scenes acquired directly before and after the given one in its data-take.
     */
    public List<String> collectNeighbors(Scene scene) {
        SceneQuery query = neighborQuery(scene);
        List<String> neighbors = new ArrayList<>(catalog.select(query));
        neighbors.remove(scene.getLocation());
        return neighbors;
    }

    /** The report line for a scene with missing neighbors, empty if the scene is fine. */
    Optional<String> check(Scene scene) {
        SceneQuery query = neighborQuery(scene);

        ReferenceGroup ref = null;
        ExpectedNeighbors expected;
        if (scene.isUnsliced()) {
            ref = referenceGroup(query);
            expected = ref.expectedFor(scene);
        } else {
            expected = ExpectedNeighbors.fromSlices(scene.getSliceNumber(), scene.getTotalSlices());
        }

        List<Scene> group = SceneRecords.select(catalog, identifier, query);
        if (group.size() >= expected.groupSize()) {
            return Optional.empty();
        }
        log.debug(
                "Found {} of {} expected scene(s) around {}",
                group.size(),
                expected.groupSize(),
                scene.getName());

        if (ref == null) {
            ref = referenceGroup(query);
        }
        if (ref.isEmpty()) {
            log.warn("Reference catalog knows no scenes around {}, cannot cross-check", scene.getName());
            return Optional.empty();
        }

        LocalDateTime startMin =
                group.stream().map(Scene::getStart).min(Comparator.naturalOrder()).orElse(scene.getStart());
        LocalDateTime stopMax =
                group.stream().map(Scene::getStop).max(Comparator.naturalOrder()).orElse(scene.getStop());

        List<String> missing = new ArrayList<>(2);
        if (expected.predecessor() && ref.startMin().isBefore(startMin)) {
            missing.add("predecessor");
        }
        if (expected.successor() && ref.stopMax().isAfter(stopMax)) {
            missing.add("successor");
        }
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(" and ", missing) + " acquisition for scene " + scene.getName());
    }

    private static SceneQuery neighborQuery(Scene scene) {
        TimeWindow window = scene.getWindow().buffered(NEIGHBOR_BUFFER_SECONDS);
        return SceneQuery.sameDataTake(scene, window);
    }

    private ReferenceGroup referenceGroup(SceneQuery query) {
        LocalDateTime startMin = null;
        LocalDateTime stopMax = null;
        for (String name : reference.selectProperty(query, ReferenceCatalogPort.SCENE_NAME)) {
            SceneName parsed = SceneName.parse(name);
            if (startMin == null || parsed.start().isBefore(startMin)) {
                startMin = parsed.start();
            }
            if (stopMax == null || parsed.stop().isAfter(stopMax)) {
                stopMax = parsed.stop();
            }
        }
        return new ReferenceGroup(startMin, stopMax);
    }

    /** Time extent of the reference catalog's scenes around a scene; both null when empty. */
    record ReferenceGroup(LocalDateTime startMin, LocalDateTime stopMax) {

        boolean isEmpty() {
            return startMin == null;
        }

        /**
         * Data-take boundaries as seen by the reference catalog: the scene has no predecessor if it
         * starts the group and no successor if it ends it.
         */
        ExpectedNeighbors expectedFor(Scene scene) {
            if (isEmpty()) {
                log.warn("No reference scenes around {}, expecting both neighbors", scene.getName());
                return new ExpectedNeighbors(true, true);
            }
            return new ExpectedNeighbors(
                    !scene.getStart().equals(startMin), !scene.getStop().equals(stopMax));
        }
    }
}
