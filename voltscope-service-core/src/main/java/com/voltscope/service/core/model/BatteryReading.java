package com.voltscope.service.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.voltscope.sampling.FieldView;
import com.voltscope.sampling.PointAccessor;
import com.voltscope.sampling.TimestampCoercion;
import java.util.List;

/**
 * One row of an uploaded battery log. The timestamp is kept as ingested (an ISO-8601 string); charts coerce it to
 * epoch millis without touching the reading.
 */
@JsonInclude(Include.NON_NULL)
public record BatteryReading(String timestamp, double voltage, double temperature) {

    public static final String TIMESTAMP = "timestamp";
    public static final String VOLTAGE = "voltage";
    public static final String TEMPERATURE = "temperature";

    /** Voltage over time, timestamps coerced to epoch millis. */
    public static final PointAccessor<BatteryReading> VOLTAGE_SERIES =
            PointAccessor.of(r -> TimestampCoercion.parseEpochMillis(r.timestamp()), BatteryReading::voltage);

    public static final PointAccessor<BatteryReading> TEMPERATURE_SERIES =
            PointAccessor.of(r -> TimestampCoercion.parseEpochMillis(r.timestamp()), BatteryReading::temperature);

    private static final List<String> FIELDS = List.of(TIMESTAMP, VOLTAGE, TEMPERATURE);

    /** Name-based view over the reading's fields, in declaration order, for callers that address series by key. */
    public static final FieldView<BatteryReading> FIELD_VIEW = new FieldView<>() {
        @Override
        public List<String> fieldNames(BatteryReading record) {
            return FIELDS;
        }

        @Override
        public Object value(BatteryReading record, String key) {
            return switch (key) {
                case TIMESTAMP -> record.timestamp();
                case VOLTAGE -> record.voltage();
                case TEMPERATURE -> record.temperature();
                default -> null;
            };
        }
    };
}
