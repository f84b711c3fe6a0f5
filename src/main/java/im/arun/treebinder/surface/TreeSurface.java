package im.arun.treebinder.surface;

import im.arun.treebinder.model.MarkStyle;
import im.arun.treebinder.model.NodeId;

import java.util.Optional;

/**
 * Capabilities the core needs from a tree display control.
 * <p>
 * Implementations issue ids that are unique for the lifetime of the surface
 * and tagged with {@link #sessionId()}. Navigation methods return empty when
 * the id is unknown or the relation does not exist.
 */
public interface TreeSurface {

    long sessionId();

    NodeId insert(String label, NodeId parentId);

    /**
     * Remove all nodes. Previously issued ids become unknown.
     */
    void clear();

    void setLabel(NodeId id, String text);

    Optional<String> getLabel(NodeId id);

    Optional<NodeId> getParent(NodeId id);

    Optional<NodeId> firstChild(NodeId id);

    Optional<NodeId> nextSibling(NodeId id);

    void mark(NodeId id, MarkStyle style);

    void unmark(NodeId id, MarkStyle style);

    boolean isMarked(NodeId id, MarkStyle style);

    /**
     * Focus the node, scrolling it into view.
     */
    void select(NodeId id);

    boolean contains(NodeId id);
}
