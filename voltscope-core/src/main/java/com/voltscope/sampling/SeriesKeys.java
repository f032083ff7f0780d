package com.voltscope.sampling;

/**
 * The pair of field names a series is plotted from. Metric-specific charts are instances of this type rather than
 * separate sampling code paths.
 */
public record SeriesKeys(String xKey, String yKey) {

    public static final SeriesKeys BATTERY_VOLTAGE = new SeriesKeys("timestamp", "voltage");
    public static final SeriesKeys BATTERY_TEMPERATURE = new SeriesKeys("timestamp", "temperature");

    /** Builds an accessor reading these fields through {@code view}, coercing timestamps to epoch millis. */
    public <T> PointAccessor<T> accessor(FieldView<T> view) {
        return PointAccessor.of(
                r -> TimestampCoercion.toEpochMillis(view.value(r, xKey)),
                r -> TimestampCoercion.toMetric(view.value(r, yKey)));
    }
}
