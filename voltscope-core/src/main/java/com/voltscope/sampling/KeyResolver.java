package com.voltscope.sampling;

import com.voltscope.sampling.ResolutionException.KeyRole;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Works out which fields of a record supply the x and y coordinates when the caller has not declared a
 * {@link PointAccessor}.
 *
 * <p>The x field is the explicit key, else {@code time}, else {@code timestamp}. The y field is the explicit key,
 * else the first numeric field after skipping the x field, in the record's declaration order.
 */
public final class KeyResolver {

    public static final List<String> DEFAULT_X_KEYS = List.of("time", "timestamp");

    private KeyResolver() {}

    public static <T> SeriesKeys resolve(FieldView<T> view, T sample, String xKey, String yKey) {
        Objects.requireNonNull(view, "field view");
        Objects.requireNonNull(sample, "sample record");
        String x = resolveX(view, sample, xKey);
        String y = resolveY(view, sample, yKey, x);
        return new SeriesKeys(x, y);
    }

    static <T> String resolveX(FieldView<T> view, T sample, String explicitKey) {
        if (isSupplied(explicitKey)) {
            if (!view.hasField(sample, explicitKey)) {
                throw new ResolutionException(
                        KeyRole.X, List.of(explicitKey), "x key '" + explicitKey + "' is not present in the record");
            }
            return explicitKey;
        }
        for (String candidate : DEFAULT_X_KEYS) {
            if (view.hasField(sample, candidate)) {
                return candidate;
            }
        }
        throw new ResolutionException(
                KeyRole.X, DEFAULT_X_KEYS, "No x key supplied and the record has neither 'time' nor 'timestamp'");
    }

    static <T> String resolveY(FieldView<T> view, T sample, String explicitKey, String xKey) {
        if (isSupplied(explicitKey)) {
            if (!view.hasField(sample, explicitKey)) {
                throw new ResolutionException(
                        KeyRole.Y, List.of(explicitKey), "y key '" + explicitKey + "' is not present in the record");
            }
            return explicitKey;
        }
        List<String> scanned = new ArrayList<>();
        for (String name : view.fieldNames(sample)) {
            if (name.equals(xKey)) {
                continue;
            }
            scanned.add(name);
            if (view.value(sample, name) instanceof Number) {
                return name;
            }
        }
        throw new ResolutionException(KeyRole.Y, scanned, "No y key supplied and the record has no numeric field");
    }

    private static boolean isSupplied(String key) {
        return key != null && !key.isBlank();
    }
}
