package im.arun.treebinder.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keyed record with insertion-ordered, unique string keys.
 * Equality is identity so that self-referencing records can be built.
 */
public class RecordNode extends DataNode {

    private final Map<String, DataNode> fields = new LinkedHashMap<>();

    @Override
    public DataKind kind() {
        return DataKind.RECORD;
    }

    /**
     * Add or replace a field. Replacing keeps the key's original position.
     */
    public RecordNode put(String key, DataNode value) {
        if (key == null) {
            throw new IllegalArgumentException("Record keys must not be null");
        }
        fields.put(key, value);
        return this;
    }

    public RecordNode put(String key, Object scalarValue) {
        return put(key, scalarValue instanceof DataNode ? (DataNode) scalarValue : new ScalarNode(scalarValue));
    }

    public DataNode get(String key) {
        return fields.get(key);
    }

    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    public int size() {
        return fields.size();
    }

    public Map<String, DataNode> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return "RecordNode(keys=" + fields.keySet() + ")";
    }
}
