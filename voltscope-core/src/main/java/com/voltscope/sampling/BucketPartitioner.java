package com.voltscope.sampling;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the interior indices {@code [1, n - 1)} of a series into {@code t - 2} contiguous buckets, one per interior
 * output slot.
 *
 * <p>Boundaries are floored from the real-valued width {@code (n - 2) / (t - 2)}, so neighbouring buckets can differ in
 * size by one element.
 */
public final class BucketPartitioner {

    private BucketPartitioner() {}

    public static Bucket bucket(int index, int length, int threshold) {
        checkArguments(length, threshold);
        return new Bucket(boundary(index, length, threshold), boundary(index + 1, length, threshold));
    }

    /**
     * Range averaged to build the third triangle vertex for bucket {@code index}: the next bucket, clipped to the
     * data.
     */
    public static Bucket averagingRange(int index, int length, int threshold) {
        checkArguments(length, threshold);
        int end = Math.min(boundary(index + 2, length, threshold), length);
        int start = Math.min(boundary(index + 1, length, threshold), end);
        return new Bucket(start, end);
    }

    public static List<Bucket> partition(int length, int threshold) {
        checkArguments(length, threshold);
        List<Bucket> buckets = new ArrayList<>(threshold - 2);
        for (int i = 0; i < threshold - 2; i++) {
            buckets.add(bucket(i, length, threshold));
        }
        return buckets;
    }

    /**
     * {@code floor(index * width) + 1}, computed on integers so the last boundary lands exactly on {@code length - 1}.
     */
    private static int boundary(int index, int length, int threshold) {
        return (int) ((long) index * (length - 2) / (threshold - 2)) + 1;
    }

    private static void checkArguments(int length, int threshold) {
        if (threshold < SampleRequest.MIN_THRESHOLD) {
            throw new IllegalArgumentException("threshold must be at least 3, was " + threshold);
        }
        if (length < 2) {
            throw new IllegalArgumentException("length must be at least 2, was " + length);
        }
    }
}
