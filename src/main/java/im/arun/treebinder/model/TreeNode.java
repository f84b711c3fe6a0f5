package im.arun.treebinder.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A node held by a display surface.
 * {@code childIds} keeps insertion order and is never re-sorted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TreeNode {

    private NodeId id;

    private String label;

    private NodeId parentId;

    private List<NodeId> childIds = new ArrayList<>();

    private Set<MarkStyle> marks = EnumSet.noneOf(MarkStyle.class);

    public TreeNode(NodeId id, String label, NodeId parentId) {
        this.id = id;
        this.label = label;
        this.parentId = parentId;
    }
}
