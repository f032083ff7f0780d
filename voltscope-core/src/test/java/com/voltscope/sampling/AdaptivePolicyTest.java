package com.voltscope.sampling;

import static org.assertj.core.api.Assertions.assertThat;

import com.voltscope.sampling.LttbSamplerTest.Reading;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AdaptivePolicyTest {

    private static final PointAccessor<Reading> ACCESSOR = PointAccessor.of(Reading::time, Reading::value);

    @Test
    void defaultsAreFiveHundredAndThreeHundred() {
        AdaptivePolicy policy = AdaptivePolicy.defaults();

        assertThat(policy.threshold()).isEqualTo(500);
        assertThat(policy.targetPoints()).isEqualTo(300);
    }

    @Test
    void seriesAtThresholdPassesThrough() {
        List<Reading> data = LttbSamplerTest.series(500);

        assertThat(AdaptivePolicy.defaults().apply(data, ACCESSOR)).isSameAs(data);
    }

    @Test
    void seriesJustAboveThresholdIsReducedToTarget() {
        List<Reading> data = LttbSamplerTest.series(501);

        assertThat(AdaptivePolicy.defaults().apply(data, ACCESSOR)).hasSize(300);
    }

    @Test
    void targetAboveLengthLeavesSeriesUnchanged() {
        List<Reading> data = LttbSamplerTest.series(150);

        assertThat(new AdaptivePolicy(100, 200).apply(data, ACCESSOR)).isSameAs(data);
    }

    @Test
    void resolvesKeysForFieldAddressedRecords() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Reading r : LttbSamplerTest.series(40)) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("time", r.time());
            m.put("value", r.value());
            rows.add(m);
        }

        List<Map<String, Object>> sampled = new AdaptivePolicy(30, 10).apply(rows, FieldView.ofMaps(), null, null);

        assertThat(sampled).hasSize(10);
        assertThat(sampled.get(0)).isSameAs(rows.get(0));
        assertThat(sampled.get(9)).isSameAs(rows.get(39));
    }

    @Test
    void clampsTargetBelowThree() {
        assertThat(new AdaptivePolicy(500, 0).targetPoints()).isEqualTo(3);
        assertThat(new AdaptivePolicy(500, -7).targetPoints()).isEqualTo(3);
        assertThat(new AdaptivePolicy(5, 1).apply(LttbSamplerTest.series(10), ACCESSOR)).hasSize(3);
    }

    @Test
    void acceptsAnyThreshold() {
        List<Reading> data = LttbSamplerTest.series(10);
        List<Reading> empty = List.of();

        assertThat(new AdaptivePolicy(0, 5).apply(data, ACCESSOR)).hasSize(5);
        assertThat(new AdaptivePolicy(-1, 4).apply(data, ACCESSOR)).hasSize(4);
        assertThat(new AdaptivePolicy(0, 5).apply(empty, ACCESSOR)).isSameAs(empty);
    }
}
