package com.voltscope.service.core.chart;

import com.voltscope.sampling.AdaptivePolicy;
import com.voltscope.sampling.FieldView;
import com.voltscope.sampling.MarkerPolicy;
import com.voltscope.sampling.PointAccessor;
import com.voltscope.service.core.config.SamplingProperties;
import com.voltscope.service.core.model.BatteryReading;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Turns a full series of readings into what a chart draws: a possibly downsampled series plus a marker hint. */
@Service
public class ChartSeriesService {

    private static final Logger log = LoggerFactory.getLogger(ChartSeriesService.class);

    private final SamplingProperties properties;
    private final AdaptivePolicy defaultPolicy;

    public ChartSeriesService(SamplingProperties properties) {
        this.properties = properties;
        this.defaultPolicy = properties.toPolicy();
        log.info(
                "Chart sampling configured: threshold={}, targetPoints={}, defaultXKey={}, defaultYKey={}",
                defaultPolicy.threshold(),
                defaultPolicy.targetPoints(),
                properties.getDefaultXKey(),
                properties.getDefaultYKey());
    }

    public <T> ChartSeries<T> prepare(List<T> readings, PointAccessor<? super T> accessor) {
        return prepare(readings, accessor, ChartSeriesRequest.defaults());
    }

    public <T> ChartSeries<T> prepare(
            List<T> readings, PointAccessor<? super T> accessor, ChartSeriesRequest request) {
        Objects.requireNonNull(readings, "readings");
        AdaptivePolicy policy = policyFor(request);
        return toSeries(readings, policy.apply(readings, accessor), policy);
    }

    public <T> ChartSeries<T> prepare(List<T> readings, FieldView<T> view, ChartSeriesRequest request) {
        Objects.requireNonNull(readings, "readings");
        ChartSeriesRequest effective = request != null ? request : ChartSeriesRequest.defaults();
        String xKey = effective.xKey() != null ? effective.xKey() : properties.getDefaultXKey();
        String yKey = effective.yKey() != null ? effective.yKey() : properties.getDefaultYKey();
        AdaptivePolicy policy = policyFor(effective);
        return toSeries(readings, policy.apply(readings, view, xKey, yKey), policy);
    }

    public ChartSeries<BatteryReading> prepareVoltage(List<BatteryReading> readings) {
        return prepare(readings, BatteryReading.VOLTAGE_SERIES);
    }

    public ChartSeries<BatteryReading> prepareTemperature(List<BatteryReading> readings) {
        return prepare(readings, BatteryReading.TEMPERATURE_SERIES);
    }

    private AdaptivePolicy policyFor(ChartSeriesRequest request) {
        if (request == null || (request.threshold() == null && request.targetPoints() == null)) {
            return defaultPolicy;
        }
        int threshold = request.threshold() != null ? request.threshold() : defaultPolicy.threshold();
        int targetPoints = request.targetPoints() != null ? request.targetPoints() : defaultPolicy.targetPoints();
        return new AdaptivePolicy(threshold, targetPoints);
    }

    private <T> ChartSeries<T> toSeries(List<T> original, List<T> points, AdaptivePolicy policy) {
        ChartSeries<T> series =
                new ChartSeries<>(points, original.size(), MarkerPolicy.shouldShowMarkers(original.size()));
        if (series.isReduced()) {
            log.debug(
                    "Chart series reduced {} -> {} points ({}% reduction, threshold={})",
                    series.originalCount(),
                    series.sampledCount(),
                    series.reductionPercent(),
                    policy.threshold());
        }
        return series;
    }
}
