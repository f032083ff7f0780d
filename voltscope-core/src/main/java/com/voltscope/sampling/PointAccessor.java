package com.voltscope.sampling;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Declared geometry of a record: where it sits on the x axis and what it measures on the y axis.
 *
 * @param <T> record type
 */
public interface PointAccessor<T> {

    double x(T record);

    double y(T record);

    default Point point(T record) {
        return new Point(x(record), y(record));
    }

    static <T> PointAccessor<T> of(ToDoubleFunction<? super T> x, ToDoubleFunction<? super T> y) {
        Objects.requireNonNull(x, "x accessor");
        Objects.requireNonNull(y, "y accessor");
        return new PointAccessor<>() {
            @Override
            public double x(T record) {
                return x.applyAsDouble(record);
            }

            @Override
            public double y(T record) {
                return y.applyAsDouble(record);
            }
        };
    }
}
