package com.voltscope.service.core.chart;

import com.voltscope.sampling.SeriesKeys;

/** Per-call overrides for a chart series. Null fields fall back to the configured defaults. */
public record ChartSeriesRequest(String xKey, String yKey, Integer threshold, Integer targetPoints) {

    public static ChartSeriesRequest defaults() {
        return new ChartSeriesRequest(null, null, null, null);
    }

    public static ChartSeriesRequest of(SeriesKeys keys) {
        return new ChartSeriesRequest(keys.xKey(), keys.yKey(), null, null);
    }
}
