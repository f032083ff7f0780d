package com.voltscope.sampling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voltscope.sampling.ResolutionException.KeyRole;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class KeyResolverTest {

    private final FieldView<Map<String, Object>> maps = FieldView.ofMaps();

    @Test
    void infersTimeAndFirstNumericField() {
        Map<String, Object> record = record("time", 1_714_557_600_000L, "value", 12.4);

        assertThat(KeyResolver.resolve(maps, record, null, null)).isEqualTo(new SeriesKeys("time", "value"));
    }

    @Test
    void prefersTimeOverTimestamp() {
        Map<String, Object> record = record("timestamp", "2024-05-01T10:00:00Z", "time", 1L, "voltage", 12.0);

        assertThat(KeyResolver.resolve(maps, record, null, null).xKey()).isEqualTo("time");
    }

    @Test
    void fallsBackToTimestamp() {
        Map<String, Object> record = record("timestamp", "2024-05-01T10:00:00Z", "voltage", 12.0);

        assertThat(KeyResolver.resolve(maps, record, null, null)).isEqualTo(SeriesKeys.BATTERY_VOLTAGE);
    }

    @Test
    void firstNumericFieldInDeclarationOrderWins() {
        Map<String, Object> voltageFirst =
                record("timestamp", "2024-05-01T10:00:00Z", "voltage", 12.0, "temperature", 25.0);
        Map<String, Object> temperatureFirst =
                record("timestamp", "2024-05-01T10:00:00Z", "temperature", 25.0, "voltage", 12.0);

        assertThat(KeyResolver.resolve(maps, voltageFirst, null, null).yKey()).isEqualTo("voltage");
        assertThat(KeyResolver.resolve(maps, temperatureFirst, null, null).yKey()).isEqualTo("temperature");
    }

    @Test
    void skipsNonNumericFields() {
        Map<String, Object> record =
                record("cell", "A1", "healthy", true, "time", 5L, "reading", "12.0", "current", 1.5);

        assertThat(KeyResolver.resolve(maps, record, null, null)).isEqualTo(new SeriesKeys("time", "current"));
    }

    @Test
    void explicitKeysWin() {
        Map<String, Object> record = record("time", 1L, "voltage", 12.0, "temperature", 25.0);

        assertThat(KeyResolver.resolve(maps, record, "time", "temperature"))
                .isEqualTo(new SeriesKeys("time", "temperature"));
    }

    @Test
    void missingXFieldFails() {
        Map<String, Object> record = record("ts", 1L, "voltage", 12.0);

        assertThatThrownBy(() -> KeyResolver.resolve(maps, record, null, null))
                .isInstanceOf(ResolutionException.class)
                .satisfies(e -> {
                    ResolutionException re = (ResolutionException) e;
                    assertThat(re.role()).isEqualTo(KeyRole.X);
                    assertThat(re.candidates()).containsExactly("time", "timestamp");
                });
    }

    @Test
    void missingNumericFieldFails() {
        Map<String, Object> record = record("time", 1L, "label", "idle");

        assertThatThrownBy(() -> KeyResolver.resolve(maps, record, null, null))
                .isInstanceOf(ResolutionException.class)
                .extracting(e -> ((ResolutionException) e).role())
                .isEqualTo(KeyRole.Y);
    }

    @Test
    void explicitKeyAbsentFromRecordFails() {
        Map<String, Object> record = record("time", 1L, "voltage", 12.0);

        assertThatThrownBy(() -> KeyResolver.resolve(maps, record, "ts", null))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("'ts'");
        assertThatThrownBy(() -> KeyResolver.resolve(maps, record, null, "current"))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("'current'");
    }

    @Test
    void resolvesJsonRecordsInDocumentOrder() throws Exception {
        JsonNode node = new ObjectMapper()
                .readTree("{\"ts\":\"2024-05-01T10:00:00Z\",\"label\":\"pack\",\"current\":1.5,\"voltage\":12}");

        assertThat(KeyResolver.resolve(FieldView.ofJson(), node, "ts", null))
                .isEqualTo(new SeriesKeys("ts", "current"));
    }

    private static Map<String, Object> record(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }
}
