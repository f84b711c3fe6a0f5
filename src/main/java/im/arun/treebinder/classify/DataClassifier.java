package im.arun.treebinder.classify;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.treebinder.model.DataKind;
import im.arun.treebinder.model.DataNode;
import im.arun.treebinder.model.ListNode;
import im.arun.treebinder.model.RecordNode;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural classification of arbitrary input values.
 * <p>
 * Keyed, string-indexed values ({@link RecordNode}, JSON objects, maps) are
 * records; ordered, integer-indexed values ({@link ListNode}, JSON arrays,
 * iterables, arrays) are lists; everything else is a scalar. Stateless.
 */
public class DataClassifier {

    public DataKind classify(Object value) {
        if (value instanceof DataNode) {
            return ((DataNode) value).kind();
        }
        if (value instanceof JsonNode) {
            JsonNode node = (JsonNode) value;
            if (node.isObject()) {
                return DataKind.RECORD;
            }
            return node.isArray() ? DataKind.LIST : DataKind.SCALAR;
        }
        if (value instanceof Map) {
            return DataKind.RECORD;
        }
        if (value instanceof Iterable || (value != null && value.getClass().isArray())) {
            return DataKind.LIST;
        }
        return DataKind.SCALAR;
    }

    /**
     * Ordered fields of a record value; empty for anything else.
     */
    public Map<String, Object> fields(Object value) {
        if (value instanceof RecordNode) {
            return new LinkedHashMap<>(((RecordNode) value).getFields());
        }
        if (value instanceof JsonNode && ((JsonNode) value).isObject()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = ((JsonNode) value).fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                fields.put(entry.getKey(), entry.getValue());
            }
            return fields;
        }
        if (value instanceof Map) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                fields.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return fields;
        }
        return Collections.emptyMap();
    }

    /**
     * Ordered elements of a list value; empty for anything else.
     */
    public List<Object> items(Object value) {
        if (value instanceof ListNode) {
            return new ArrayList<>(((ListNode) value).getItems());
        }
        if (value instanceof JsonNode && ((JsonNode) value).isArray()) {
            List<Object> items = new ArrayList<>();
            ((JsonNode) value).elements().forEachRemaining(items::add);
            return items;
        }
        if (value instanceof Iterable) {
            List<Object> items = new ArrayList<>();
            ((Iterable<?>) value).forEach(items::add);
            return items;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        return Collections.emptyList();
    }
}
