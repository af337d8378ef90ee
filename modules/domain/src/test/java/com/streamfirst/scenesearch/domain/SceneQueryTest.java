package com.streamfirst.scenesearch.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SceneQueryTest {

    private static final LocalDateTime T = LocalDateTime.of(2021, 1, 1, 5, 0, 0);

    @Test
    void defaultsAreStrictAndCheckExistence() {
        SceneQuery query = SceneQuery.all();

        assertThat(query.isDateStrict()).isTrue();
        assertThat(query.isCheckExist()).isTrue();
        assertThat(query.getSensors()).isEmpty();
        assertThat(query.hasSpatialFilter()).isFalse();
    }

    @Test
    void mindateAfterMaxdateIsRejected() {
        assertThatThrownBy(() -> SceneQuery.builder().mindate(T).maxdate(T.minusDays(1)).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("mindate");
    }

    @Test
    void stripmapIsExpandedToItsBeams() {
        SceneQuery query = SceneQuery.builder().acquisitionMode("SM").acquisitionMode("IW").build();

        assertThat(query.expandStripmap().getAcquisitionModes())
                .containsExactlyInAnyOrder("S1", "S2", "S3", "S4", "S5", "S6", "IW");
        SceneQuery plain = SceneQuery.builder().acquisitionMode("EW").build();
        assertThat(plain.expandStripmap()).isSameAs(plain);
    }

    @Test
    void sameDataTakeQueryIsNotStrict() {
        Scene scene =
                Scene.builder()
                        .location("/data/S1A_IW_GRDH_1SDV_20210101T050000_20210101T050025_035948_0434D8_1A2B.SAFE")
                        .sensor("S1A")
                        .product("GRD")
                        .acquisitionMode("IW")
                        .start(T)
                        .stop(T.plusSeconds(25))
                        .build();

        SceneQuery query = SceneQuery.sameDataTake(scene, scene.getWindow().buffered(2));

        assertThat(query.isDateStrict()).isFalse();
        assertThat(query.getSensors()).containsExactly("S1A");
        assertThat(query.getProducts()).containsExactly("GRD");
        assertThat(query.getAcquisitionModes()).containsExactly("IW");
        assertThat(query.getMindate()).isEqualTo(T.minusSeconds(2));
        assertThat(query.getMaxdate()).isEqualTo(T.plusSeconds(27));
    }

    @Test
    void withersKeepOtherFields() {
        AreaOfInterest area = AreaOfInterest.fromWkt("POLYGON ((0 0, 1 0, 1 1, 0 1, 0 0))");
        SceneQuery query = SceneQuery.builder().sensor("S1B").dateStrict(false).build();

        SceneQuery narrowed =
                query.withSpatialFilter(area).withDateWindow(TimeWindow.of(T, T.plusHours(1)));

        assertThat(narrowed.getSensors()).containsExactly("S1B");
        assertThat(narrowed.isDateStrict()).isFalse();
        assertThat(narrowed.getSpatialFilter()).isEqualTo(area);
        assertThat(narrowed.getMaxdate()).isEqualTo(T.plusHours(1));
        assertThat(narrowed.withSpatialFilter(null).hasSpatialFilter()).isFalse();
    }
}
