package im.arun.treebinder.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered record of the labels a batch replace overwrote.
 * Rolling back restores every recorded label verbatim.
 */
public class Transaction {

    private final String description;
    private final List<LabelChange> changes = new ArrayList<>();

    public Transaction(String description) {
        this.description = description;
    }

    public void record(LabelChange change) {
        changes.add(change);
    }

    public List<LabelChange> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    public String getDescription() {
        return description;
    }

    public int size() {
        return changes.size();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Override
    public String toString() {
        return "Transaction(" + description + ", changes=" + changes.size() + ")";
    }
}
