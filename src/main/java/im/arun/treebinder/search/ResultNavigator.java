package im.arun.treebinder.search;

import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.surface.TreeSurface;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Cursor over a match list with wraparound in both directions.
 * Moving over an empty list returns empty and changes nothing.
 */
public class ResultNavigator {

    private final TreeSurface surface;
    private final boolean selectOnMove;
    private List<NodeId> results = Collections.emptyList();
    private int cursor = -1;

    public ResultNavigator() {
        this(null, false);
    }

    /**
     * @param surface      surface to focus the current match on, may be null
     * @param selectOnMove whether every cursor move selects the node
     */
    public ResultNavigator(TreeSurface surface, boolean selectOnMove) {
        this.surface = surface;
        this.selectOnMove = selectOnMove && surface != null;
    }

    /**
     * Replace the results and put the cursor on the first one.
     */
    public void setResults(List<NodeId> matches) {
        results = matches == null ? Collections.emptyList() : new ArrayList<>(matches);
        cursor = results.isEmpty() ? -1 : 0;
        current().ifPresent(this::focus);
    }

    public Optional<NodeId> next() {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        cursor = (cursor + 1) % results.size();
        return moved();
    }

    public Optional<NodeId> previous() {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        cursor = (cursor - 1 + results.size()) % results.size();
        return moved();
    }

    public Optional<NodeId> current() {
        return cursor < 0 ? Optional.empty() : Optional.of(results.get(cursor));
    }

    /**
     * One-based position of the cursor, 0 when there are no results.
     */
    public int position() {
        return cursor + 1;
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public List<NodeId> getResults() {
        return Collections.unmodifiableList(results);
    }

    private Optional<NodeId> moved() {
        NodeId id = results.get(cursor);
        focus(id);
        return Optional.of(id);
    }

    private void focus(NodeId id) {
        if (selectOnMove && surface.contains(id)) {
            surface.select(id);
        }
    }
}
