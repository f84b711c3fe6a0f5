package im.arun.treebinder.surface;

import im.arun.treebinder.model.MarkStyle;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.model.TreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Headless {@link TreeSurface} backed by a map of {@link TreeNode}s.
 * Used by the command-line front end and as the model behind a real widget.
 * Not thread-safe; one surface belongs to one session.
 */
public class InMemoryTreeSurface implements TreeSurface {

    private static final AtomicLong SESSIONS = new AtomicLong();

    private final long sessionId = SESSIONS.incrementAndGet();
    private final Map<NodeId, TreeNode> nodes = new LinkedHashMap<>();
    private final List<NodeId> roots = new ArrayList<>();
    // position of each node within its parent's child list; children are append-only
    private final Map<NodeId, Integer> siblingIndex = new LinkedHashMap<>();
    private long nextSerial = 1;
    private NodeId selected;

    @Override
    public long sessionId() {
        return sessionId;
    }

    @Override
    public NodeId insert(String label, NodeId parentId) {
        TreeNode parent = null;
        if (parentId != null) {
            parent = nodes.get(parentId);
            if (parent == null) {
                throw new IllegalArgumentException("Unknown parent node: " + parentId);
            }
        }
        NodeId id = new NodeId(sessionId, nextSerial++);
        nodes.put(id, new TreeNode(id, label, parentId));
        List<NodeId> siblings = parent != null ? parent.getChildIds() : roots;
        siblingIndex.put(id, siblings.size());
        siblings.add(id);
        return id;
    }

    @Override
    public void clear() {
        nodes.clear();
        roots.clear();
        siblingIndex.clear();
        selected = null;
    }

    @Override
    public void setLabel(NodeId id, String text) {
        require(id).setLabel(text);
    }

    @Override
    public Optional<String> getLabel(NodeId id) {
        return node(id).map(TreeNode::getLabel);
    }

    @Override
    public Optional<NodeId> getParent(NodeId id) {
        return node(id).map(TreeNode::getParentId);
    }

    @Override
    public Optional<NodeId> firstChild(NodeId id) {
        return node(id)
            .filter(n -> !n.getChildIds().isEmpty())
            .map(n -> n.getChildIds().get(0));
    }

    @Override
    public Optional<NodeId> nextSibling(NodeId id) {
        TreeNode node = nodes.get(id);
        if (node == null) {
            return Optional.empty();
        }
        List<NodeId> siblings = node.getParentId() == null
            ? roots
            : nodes.get(node.getParentId()).getChildIds();
        int index = siblingIndex.get(id);
        if (index + 1 >= siblings.size()) {
            return Optional.empty();
        }
        return Optional.of(siblings.get(index + 1));
    }

    @Override
    public void mark(NodeId id, MarkStyle style) {
        require(id).getMarks().add(style);
    }

    @Override
    public void unmark(NodeId id, MarkStyle style) {
        require(id).getMarks().remove(style);
    }

    @Override
    public boolean isMarked(NodeId id, MarkStyle style) {
        return node(id).map(n -> n.getMarks().contains(style)).orElse(false);
    }

    @Override
    public void select(NodeId id) {
        require(id);
        if (selected != null && nodes.containsKey(selected)) {
            nodes.get(selected).getMarks().remove(MarkStyle.SELECTED);
        }
        selected = id;
        nodes.get(id).getMarks().add(MarkStyle.SELECTED);
    }

    @Override
    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    public Optional<NodeId> getSelected() {
        return Optional.ofNullable(selected);
    }

    public List<NodeId> getChildren(NodeId id) {
        return node(id)
            .map(n -> Collections.unmodifiableList(n.getChildIds()))
            .orElse(Collections.emptyList());
    }

    public List<NodeId> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    public int size() {
        return nodes.size();
    }

    private Optional<TreeNode> node(NodeId id) {
        return Optional.ofNullable(id == null ? null : nodes.get(id));
    }

    private TreeNode require(NodeId id) {
        TreeNode node = id == null ? null : nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }
}
