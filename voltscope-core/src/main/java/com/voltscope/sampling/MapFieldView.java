package com.voltscope.sampling;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Field view over map-shaped records. Declaration order is the map's iteration order. */
final class MapFieldView<V> implements FieldView<Map<String, V>> {

    @Override
    public List<String> fieldNames(Map<String, V> record) {
        return new ArrayList<>(record.keySet());
    }

    @Override
    public Object value(Map<String, V> record, String key) {
        return record.get(key);
    }

    @Override
    public boolean hasField(Map<String, V> record, String key) {
        return record.containsKey(key);
    }
}
