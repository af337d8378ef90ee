package com.streamfirst.scenesearch.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SceneTest {

    private static final String LOCATION =
            "/data/S1A_IW_GRDH_1SDV_20210101T050000_20210101T050025_035948_0434D8_1A2B.SAFE";
    private static final LocalDateTime T = LocalDateTime.of(2021, 1, 1, 5, 0, 0);

    private static Scene.SceneBuilder scene() {
        return Scene.builder()
                .location(LOCATION)
                .sensor("S1A")
                .product("GRD")
                .acquisitionMode("IW")
                .start(T)
                .stop(T.plusSeconds(25));
    }

    @Test
    void stopBeforeStartIsRejected() {
        assertThatThrownBy(() -> scene().stop(T.minusSeconds(1)).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("before it starts");
    }

    @Test
    void missingSliceFieldsCountAsUnsliced() {
        Scene scene = scene().build();

        assertThat(scene.getSliceNumber()).isEqualTo(Scene.UNKNOWN);
        assertThat(scene.isUnsliced()).isTrue();
        assertThat(scene().sliceNumber(0).totalSlices(0).build().isUnsliced()).isTrue();
        assertThat(scene().sliceNumber(2).totalSlices(5).build().isUnsliced()).isFalse();
    }

    @Test
    void scenesAreIdentifiedByLocation() {
        Scene a = scene().relativeOrbit(15).build();
        Scene b = scene().relativeOrbit(16).build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.getName()).endsWith("_1A2B.SAFE");
        assertThat(a.getWindow()).isEqualTo(TimeWindow.of(T, T.plusSeconds(25)));
        assertThat(a.getPolarizations()).isEmpty();
    }
}
