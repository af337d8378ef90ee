package com.streamfirst.scenesearch.application;

import com.streamfirst.scenesearch.domain.AreaOfInterest;
import com.streamfirst.scenesearch.domain.Scene;
import com.streamfirst.scenesearch.domain.SceneTimes;
import com.streamfirst.scenesearch.domain.Tile;
import org.locationtech.jts.geom.Geometry;

import java.time.LocalDateTime;
import java.util.Locale;

/** Scene and tile fixtures: 25 second IW slices of one S1A data-take. */
final class TestScenes {

    static final LocalDateTime T0 = LocalDateTime.of(2021, 1, 1, 5, 0, 0);
    static final int SLICE_SECONDS = 25;

    private TestScenes() {}

    static Geometry box(double xmin, double ymin, double xmax, double ymax) {
        return AreaOfInterest.fromWkt(
                        String.format(
                                Locale.ROOT,
                                "POLYGON ((%f %f, %f %f, %f %f, %f %f, %f %f))",
                                xmin, ymin, xmax, ymin, xmax, ymax, xmin, ymax, xmin, ymin))
                .geometry();
    }

    static Tile tile(String id, double xmin, double ymin, double xmax, double ymax) {
        return new Tile(id, box(xmin, ymin, xmax, ymax));
    }

    /**
     * The {@code index}-th slice of the data-take, starting at {@code T0 + index * 25s}.
     *
     * @param slice slice number, 0 for the unsliced signal
     * @param total total slices, 0 for the unsliced signal
     */
    static Scene slice(int index, int slice, int total, Geometry footprint) {
        return scene("S1A", index, slice, total, footprint);
    }

    static Scene scene(String sensor, int index, int slice, int total, Geometry footprint) {
        LocalDateTime start = T0.plusSeconds((long) index * SLICE_SECONDS);
        LocalDateTime stop = start.plusSeconds(SLICE_SECONDS);
        String name =
                String.format(
                        "%s_IW_GRDH_1SDV_%s_%s_035948_0434D8_%04X.SAFE",
                        sensor, SceneTimes.compact(start), SceneTimes.compact(stop), index);
        return Scene.builder()
                .location("/data/s1/" + name)
                .sensor(sensor)
                .product("GRD")
                .acquisitionMode("IW")
                .start(start)
                .stop(stop)
                .absoluteOrbit(35948)
                .frameNumber(0x0434D8)
                .footprint(footprint)
                .sliceNumber(slice)
                .totalSlices(total)
                .build();
    }
}
