package im.arun.treebinder.model;

import java.util.Arrays;
import java.util.List;

/**
 * Caller-supplied input value: a scalar, an ordered list or a keyed record.
 * Nodes may be nested and mixed arbitrarily; the binder only reads them.
 */
public abstract class DataNode {

    public abstract DataKind kind();

    public static ScalarNode scalar(Object value) {
        return new ScalarNode(value);
    }

    public static ListNode list(DataNode... items) {
        return new ListNode(Arrays.asList(items));
    }

    public static ListNode list(List<? extends DataNode> items) {
        return new ListNode(items);
    }

    public static RecordNode record() {
        return new RecordNode();
    }
}
