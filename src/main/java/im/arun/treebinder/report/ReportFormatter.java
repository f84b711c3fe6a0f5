package im.arun.treebinder.report;

import im.arun.treebinder.model.BindStats;
import im.arun.treebinder.model.LabelChange;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.surface.TreeSurface;
import im.arun.treebinder.util.TreeWalker;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain-text summaries for message-box style front ends.
 */
public class ReportFormatter {

    private static final String ARROW = " → ";
    private static final String CRUMB = " > ";

    public String matchCount(int count) {
        if (count == 0) {
            return "No matches found";
        }
        return count == 1 ? "Found 1 match" : "Found " + count + " matches";
    }

    public String position(int position, int total) {
        if (total == 0) {
            return "No matches";
        }
        return "Match " + position + " of " + total;
    }

    public String replaced(int count) {
        return count == 1 ? "Replaced 1 label" : "Replaced " + count + " labels";
    }

    public String rollback(boolean reverted, int count) {
        if (!reverted) {
            return "Nothing to undo";
        }
        return count == 1 ? "Reverted 1 label" : "Reverted " + count + " labels";
    }

    public String change(LabelChange change) {
        return change.getOldLabel() + ARROW + change.getNewLabel();
    }

    /**
     * One {@code old → new} line per change, or a short notice when empty.
     */
    public String preview(List<LabelChange> changes) {
        if (changes.isEmpty()) {
            return "Nothing to replace";
        }
        return changes.stream()
            .map(this::change)
            .collect(Collectors.joining("\n"));
    }

    public String bindSummary(BindStats stats) {
        StringBuilder sb = new StringBuilder("Bound ").append(stats.getNodeCount()).append(" nodes");
        if (stats.getCyclicReferences() > 0) {
            sb.append(", ").append(stats.getCyclicReferences()).append(" cyclic references");
        }
        if (stats.getFormatFailures() > 0) {
            sb.append(", ").append(stats.getFormatFailures()).append(" unrepresentable values");
        }
        return sb.toString();
    }

    public String breadcrumb(TreeSurface surface, NodeId id) {
        return String.join(CRUMB, TreeWalker.ancestry(surface, id));
    }

    /**
     * Indented rendering of a subtree, two spaces per level.
     */
    public String outline(TreeSurface surface, NodeId rootId) {
        StringBuilder sb = new StringBuilder();
        appendOutline(surface, rootId, 0, sb);
        return sb.toString();
    }

    private void appendOutline(TreeSurface surface, NodeId id, int depth, StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append("  ".repeat(depth)).append(surface.getLabel(id).orElse(""));
        for (NodeId child : TreeWalker.children(surface, id)) {
            appendOutline(surface, child, depth + 1, sb);
        }
    }
}
