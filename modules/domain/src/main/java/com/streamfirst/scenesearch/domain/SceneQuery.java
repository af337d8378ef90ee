package com.streamfirst.scenesearch.domain;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Catalog-independent scene search parameters. Every field is optional; unset fields do not
 * constrain the search.
 *
 * <p>Date semantics depend on {@link #isDateStrict()}:
 *
 * <ul>
 *   <li>strict: {@code start >= mindate} and {@code stop <= maxdate}
 *   <li>not strict: {@code stop >= mindate} and {@code start <= maxdate}, so acquisitions merely
 *       overlapping the window qualify as well
 * </ul>
 */
@Value
public class SceneQuery {

    /** Beams that make up the stripmap (SM) acquisition mode. */
    public static final List<String> STRIPMAP_BEAMS = List.of("S1", "S2", "S3", "S4", "S5", "S6");

    Set<String> sensors;
    Set<String> products;
    Set<String> acquisitionModes;
    LocalDateTime mindate;
    LocalDateTime maxdate;
    boolean dateStrict;
    AreaOfInterest spatialFilter;

    /** Data-take ids in decimal representation */
    Set<Integer> frameNumbers;

    /** Whether catalog-referenced scenes must exist on local storage */
    boolean checkExist;

    @Builder(toBuilder = true)
    private SceneQuery(
            @Singular Set<String> sensors,
            @Singular Set<String> products,
            @Singular Set<String> acquisitionModes,
            LocalDateTime mindate,
            LocalDateTime maxdate,
            Boolean dateStrict,
            AreaOfInterest spatialFilter,
            @Singular Set<Integer> frameNumbers,
            Boolean checkExist) {
        if (mindate != null && maxdate != null && mindate.isAfter(maxdate)) {
            throw new ConfigurationException("mindate " + mindate + " is after maxdate " + maxdate);
        }
        this.sensors = sensors;
        this.products = products;
        this.acquisitionModes = acquisitionModes;
        this.mindate = mindate;
        this.maxdate = maxdate;
        this.dateStrict = dateStrict == null || dateStrict;
        this.spatialFilter = spatialFilter;
        this.frameNumbers = frameNumbers;
        this.checkExist = checkExist == null || checkExist;
    }

    /** A query without any constraint. */
    public static SceneQuery all() {
        return builder().build();
    }

    /** The neighbor query for a scene: same sensor, product and mode within the given window. */
    public static SceneQuery sameDataTake(Scene scene, TimeWindow window) {
        return builder()
                .sensor(scene.getSensor())
                .product(scene.getProduct())
                .acquisitionMode(scene.getAcquisitionMode())
                .mindate(window.start())
                .maxdate(window.stop())
                .dateStrict(false)
                .build();
    }

    public SceneQuery withDateWindow(TimeWindow window) {
        return toBuilder().mindate(window.start()).maxdate(window.stop()).build();
    }

    public SceneQuery withSpatialFilter(AreaOfInterest area) {
        return toBuilder().spatialFilter(area).build();
    }

    /** Replaces the {@code SM} mode by the individual stripmap beams {@code S1}..{@code S6}. */
    public SceneQuery expandStripmap() {
        if (!acquisitionModes.contains("SM")) {
            return this;
        }
        Set<String> modes = new LinkedHashSet<>();
        for (String mode : acquisitionModes) {
            if (mode.equals("SM")) {
                modes.addAll(STRIPMAP_BEAMS);
            } else {
                modes.add(mode);
            }
        }
        return toBuilder().clearAcquisitionModes().acquisitionModes(modes).build();
    }

    public boolean hasSpatialFilter() {
        return spatialFilter != null;
    }
}
