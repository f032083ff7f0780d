package com.voltscope.sampling;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** Field view over Jackson object nodes. Declaration order is the order fields appeared in the document. */
final class JsonNodeFieldView implements FieldView<JsonNode> {

    static final JsonNodeFieldView INSTANCE = new JsonNodeFieldView();

    private JsonNodeFieldView() {}

    @Override
    public List<String> fieldNames(JsonNode record) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = record.fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        return names;
    }

    @Override
    public Object value(JsonNode record, String key) {
        JsonNode node = record.get(key);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node;
    }

    @Override
    public boolean hasField(JsonNode record, String key) {
        return record.has(key);
    }
}
