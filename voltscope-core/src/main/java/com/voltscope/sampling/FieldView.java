package com.voltscope.sampling;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;

/**
 * Name-based read access to a record's fields, used when a series is described by key names instead of a declared
 * {@link PointAccessor}.
 *
 * @param <T> record type
 */
public interface FieldView<T> {

    /** Field names in the record's natural declaration order. */
    List<String> fieldNames(T record);

    /**
     * Value stored under {@code key}, or {@code null} when absent. Scalars come back as plain Java values
     * ({@link Number}, {@link String}, {@link Boolean}).
     */
    Object value(T record, String key);

    default boolean hasField(T record, String key) {
        return fieldNames(record).contains(key);
    }

    static <V> FieldView<Map<String, V>> ofMaps() {
        return new MapFieldView<>();
    }

    static FieldView<JsonNode> ofJson() {
        return JsonNodeFieldView.INSTANCE;
    }
}
