package com.voltscope.sampling;

import java.util.List;

/**
 * Picks the point of a bucket that spans the largest triangle with the previously selected point and the centroid of
 * the following bucket. The area is a relevance score only: x and y are in unrelated units.
 */
public final class TriangleAreaSelector {

    private TriangleAreaSelector() {}

    /** Centroid of {@code range}. An empty range yields {@link Point#ORIGIN}. */
    public static <T> Point average(List<T> data, Bucket range, PointAccessor<? super T> accessor) {
        if (range.isEmpty()) {
            return Point.ORIGIN;
        }
        double sumX = 0;
        double sumY = 0;
        for (int j = range.start(); j < range.end(); j++) {
            T record = data.get(j);
            sumX += accessor.x(record);
            sumY += accessor.y(record);
        }
        return new Point(sumX / range.size(), sumY / range.size());
    }

    public static double area(Point previous, Point candidate, Point average) {
        return Math.abs((previous.x() - average.x()) * (candidate.y() - previous.y())
                        - (previous.x() - candidate.x()) * (average.y() - previous.y()))
                * 0.5;
    }

    /**
     * Index in {@code bucket} with the strictly greatest area; ties keep the earliest index. Falls back to the first
     * index of the bucket when no area is comparable (all {@code NaN}).
     */
    public static <T> int select(
            List<T> data, Bucket bucket, Point previous, Point average, PointAccessor<? super T> accessor) {
        if (bucket.isEmpty()) {
            throw new IllegalArgumentException("Cannot select from an empty bucket " + bucket);
        }
        double maxArea = -1;
        int selected = bucket.start();
        for (int j = bucket.start(); j < bucket.end(); j++) {
            double area = area(previous, accessor.point(data.get(j)), average);
            if (area > maxArea) {
                maxArea = area;
                selected = j;
            }
        }
        return selected;
    }
}
