package com.voltscope.service.core.chart;

import java.util.List;

/**
 * Points a renderer should draw, together with the size of the series they were taken from. {@code points} may be the
 * original list itself; exact tabulation must use the original readings, never this view.
 */
public record ChartSeries<T>(List<T> points, int originalCount, boolean showMarkers) {

    public int sampledCount() {
        return points.size();
    }

    public boolean isReduced() {
        return sampledCount() < originalCount;
    }

    /** Share of the original points dropped, rounded to a whole percent. */
    public long reductionPercent() {
        if (originalCount == 0) {
            return 0;
        }
        return Math.round(100.0 * (1.0 - (double) sampledCount() / originalCount));
    }
}
