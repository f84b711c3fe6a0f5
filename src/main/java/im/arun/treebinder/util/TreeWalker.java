package im.arun.treebinder.util;

import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.surface.TreeSurface;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Traversal helpers over a {@link TreeSurface}.
 * All walks are iterative pre-order: a node before its children, children
 * left to right, so deep trees cannot overflow the call stack.
 */
public final class TreeWalker {

    private TreeWalker() {}

    /**
     * Descendants of {@code rootId} in pre-order, excluding {@code rootId} itself.
     */
    public static List<NodeId> descendants(TreeSurface surface, NodeId rootId) {
        List<NodeId> result = new ArrayList<>();
        walk(surface, rootId, false, result::add);
        return result;
    }

    /**
     * {@code rootId} followed by its descendants in pre-order.
     */
    public static List<NodeId> subtree(TreeSurface surface, NodeId rootId) {
        List<NodeId> result = new ArrayList<>();
        walk(surface, rootId, true, result::add);
        return result;
    }

    public static void walk(TreeSurface surface, NodeId rootId, boolean includeRoot, Consumer<NodeId> visitor) {
        if (rootId == null || !surface.contains(rootId)) {
            return;
        }
        if (includeRoot) {
            visitor.accept(rootId);
        }

        // Stack holds the next sibling to visit at each open depth
        Deque<NodeId> pending = new ArrayDeque<>();
        surface.firstChild(rootId).ifPresent(pending::push);
        while (!pending.isEmpty()) {
            NodeId current = pending.pop();
            visitor.accept(current);
            surface.nextSibling(current).ifPresent(pending::push);
            surface.firstChild(current).ifPresent(pending::push);
        }
    }

    public static List<NodeId> children(TreeSurface surface, NodeId parentId) {
        List<NodeId> result = new ArrayList<>();
        Optional<NodeId> child = surface.firstChild(parentId);
        while (child.isPresent()) {
            result.add(child.get());
            child = surface.nextSibling(child.get());
        }
        return result;
    }

    public static boolean isLeaf(TreeSurface surface, NodeId id) {
        return surface.firstChild(id).isEmpty();
    }

    /**
     * Labels from the top of the tree down to {@code id}, inclusive.
     */
    public static List<String> ancestry(TreeSurface surface, NodeId id) {
        List<String> labels = new ArrayList<>();
        Optional<NodeId> current = Optional.ofNullable(id);
        while (current.isPresent() && surface.contains(current.get())) {
            labels.add(0, surface.getLabel(current.get()).orElse(""));
            current = surface.getParent(current.get());
        }
        return labels;
    }
}
