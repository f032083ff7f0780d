package com.voltscope.sampling;

/**
 * Per-call sampling configuration. A threshold below {@value #MIN_THRESHOLD} is clamped up, never rejected; keys are
 * optional and inferred when absent.
 */
public record SampleRequest(int threshold, String xKey, String yKey) {

    public static final int MIN_THRESHOLD = 3;

    public SampleRequest {
        threshold = Math.max(MIN_THRESHOLD, threshold);
    }

    public static SampleRequest of(int threshold) {
        return new SampleRequest(threshold, null, null);
    }

    public static SampleRequest of(int threshold, SeriesKeys keys) {
        return new SampleRequest(threshold, keys.xKey(), keys.yKey());
    }
}
