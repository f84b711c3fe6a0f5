package im.arun.treebinder.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, integer-indexed sequence of nodes.
 * Equality is identity so that self-referencing lists can be built.
 */
public class ListNode extends DataNode {

    private final List<DataNode> items = new ArrayList<>();

    public ListNode() {
    }

    public ListNode(List<? extends DataNode> items) {
        this.items.addAll(items);
    }

    @Override
    public DataKind kind() {
        return DataKind.LIST;
    }

    public ListNode add(DataNode item) {
        items.add(item);
        return this;
    }

    public DataNode get(int index) {
        return items.get(index);
    }

    public void set(int index, DataNode item) {
        items.set(index, item);
    }

    public int size() {
        return items.size();
    }

    public List<DataNode> getItems() {
        return Collections.unmodifiableList(items);
    }

    @Override
    public String toString() {
        return "ListNode(size=" + items.size() + ")";
    }
}
