package com.streamfirst.scenesearch.domain;

import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;
import org.locationtech.jts.geom.Geometry;

/**
 * Metadata of a single Sentinel-1 acquisition as known to a catalog. Scenes are transient query
 * results and identified by their location.
 */
@Value
@EqualsAndHashCode(of = "location")
public class Scene {

    /** Sentinel used for slice fields a catalog does not report. */
    public static final int UNKNOWN = -1;

    /** Local path or URL of the product */
    @NonNull String location;

    /** Platform code, e.g. S1A */
    @NonNull String sensor;

    /** Product type, e.g. GRD or SLC */
    @NonNull String product;

    /** Beam mode, e.g. IW, EW or S1..S6 */
    @NonNull String acquisitionMode;

    @NonNull LocalDateTime start;
    @NonNull LocalDateTime stop;

    /** A(scending) or D(escending) */
    String orbitDirection;

    int absoluteOrbit;
    int relativeOrbit;

    /** Data-take id in decimal representation */
    int frameNumber;

    @NonNull List<String> polarizations;

    /** Footprint in EPSG:4326, null if unknown */
    Geometry footprint;

    int sliceNumber;
    int totalSlices;

    @Builder(toBuilder = true)
    private Scene(
            @NonNull String location,
            @NonNull String sensor,
            @NonNull String product,
            @NonNull String acquisitionMode,
            @NonNull LocalDateTime start,
            @NonNull LocalDateTime stop,
            String orbitDirection,
            int absoluteOrbit,
            int relativeOrbit,
            int frameNumber,
            List<String> polarizations,
            Geometry footprint,
            Integer sliceNumber,
            Integer totalSlices) {
        if (stop.isBefore(start)) {
            throw new ConfigurationException(
                    "scene " + location + " stops (" + stop + ") before it starts (" + start + ")");
        }
        this.location = location;
        this.sensor = sensor;
        this.product = product;
        this.acquisitionMode = acquisitionMode;
        this.start = start;
        this.stop = stop;
        this.orbitDirection = orbitDirection;
        this.absoluteOrbit = absoluteOrbit;
        this.relativeOrbit = relativeOrbit;
        this.frameNumber = frameNumber;
        this.polarizations = polarizations == null ? List.of() : List.copyOf(polarizations);
        this.footprint = footprint;
        this.sliceNumber = sliceNumber == null ? UNKNOWN : sliceNumber;
        this.totalSlices = totalSlices == null ? UNKNOWN : totalSlices;
    }

    /** File name part of the location. */
    public String getName() {
        return SceneName.basename(location);
    }

    public TimeWindow getWindow() {
        return TimeWindow.of(start, stop);
    }

    /**
     * True if the slice position cannot tell where the scene sits in its data-take: the
     * near-real-time slicing signal (slice 0 of 0) or slice fields the catalog does not report.
     */
    public boolean isUnsliced() {
        return sliceNumber <= 0 || totalSlices <= 0;
    }

    @Override
    public String toString() {
        return "Scene{" + getName() + ", slice=" + sliceNumber + "/" + totalSlices + '}';
    }
}
