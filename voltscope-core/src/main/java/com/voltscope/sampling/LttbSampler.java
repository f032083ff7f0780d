package com.voltscope.sampling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Largest-Triangle-Three-Buckets downsampling.
 *
 * <p>Series at or below the threshold are returned as-is. Larger series are reduced to exactly {@code threshold}
 * records: the first and last records, plus one record per interior bucket. The result references the input's
 * records in their original order; the input is never modified.
 */
public final class LttbSampler {

    private static final Logger log = LoggerFactory.getLogger(LttbSampler.class);

    private LttbSampler() {}

    public static <T> List<T> downsample(List<T> data, int threshold, PointAccessor<? super T> accessor) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(accessor, "accessor");
        int target = Math.max(SampleRequest.MIN_THRESHOLD, threshold);
        if (data.size() <= target) {
            return data;
        }
        return reduce(data, target, accessor);
    }

    /** Samples records addressed by field name; keys are resolved once, from the first record. */
    public static <T> List<T> downsample(List<T> data, SampleRequest request, FieldView<T> view) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(view, "field view");
        if (data.size() <= request.threshold()) {
            return data;
        }
        SeriesKeys keys = KeyResolver.resolve(view, data.get(0), request.xKey(), request.yKey());
        log.debug("Resolved series keys x={} y={}", keys.xKey(), keys.yKey());
        return reduce(data, request.threshold(), keys.accessor(view));
    }

    private static <T> List<T> reduce(List<T> data, int threshold, PointAccessor<? super T> accessor) {
        int length = data.size();
        List<T> sampled = new ArrayList<>(threshold);
        sampled.add(data.get(0));

        Point previous = accessor.point(data.get(0));
        for (int i = 0; i < threshold - 2; i++) {
            Bucket bucket = BucketPartitioner.bucket(i, length, threshold);
            Point average =
                    TriangleAreaSelector.average(data, BucketPartitioner.averagingRange(i, length, threshold), accessor);
            int selected = TriangleAreaSelector.select(data, bucket, previous, average, accessor);
            T record = data.get(selected);
            sampled.add(record);
            previous = accessor.point(record);
        }

        sampled.add(data.get(length - 1));
        log.debug("LTTB reduced {} points to {}", length, sampled.size());
        return Collections.unmodifiableList(sampled);
    }
}
