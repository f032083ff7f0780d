package com.voltscope.sampling;

/** Whether a chart should draw a marker on every point. Keyed on the original, pre-sampling length. */
public final class MarkerPolicy {

    public static final int MAX_MARKED_POINTS = 100;

    private MarkerPolicy() {}

    public static boolean shouldShowMarkers(int originalLength) {
        return originalLength <= MAX_MARKED_POINTS;
    }
}
