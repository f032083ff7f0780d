package com.voltscope.sampling;

import java.util.List;

/**
 * Decides when to sample and how hard: series longer than {@code threshold} are reduced to {@code targetPoints}, all
 * others pass through untouched. A target below {@value SampleRequest#MIN_THRESHOLD} is clamped up.
 */
public record AdaptivePolicy(int threshold, int targetPoints) {

    public static final int DEFAULT_THRESHOLD = 500;
    public static final int DEFAULT_TARGET_POINTS = 300;

    public AdaptivePolicy {
        targetPoints = Math.max(SampleRequest.MIN_THRESHOLD, targetPoints);
    }

    public static AdaptivePolicy defaults() {
        return new AdaptivePolicy(DEFAULT_THRESHOLD, DEFAULT_TARGET_POINTS);
    }

    public boolean shouldSample(int length) {
        return length > threshold;
    }

    public <T> List<T> apply(List<T> data, PointAccessor<? super T> accessor) {
        if (!shouldSample(data.size())) {
            return data;
        }
        return LttbSampler.downsample(data, targetPoints, accessor);
    }

    public <T> List<T> apply(List<T> data, FieldView<T> view, String xKey, String yKey) {
        if (!shouldSample(data.size())) {
            return data;
        }
        return LttbSampler.downsample(data, new SampleRequest(targetPoints, xKey, yKey), view);
    }
}
