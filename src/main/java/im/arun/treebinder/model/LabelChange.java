package im.arun.treebinder.model;

import lombok.Value;

/**
 * One label rewrite: the node, its label before and after.
 */
@Value
public class LabelChange {
    NodeId nodeId;
    String oldLabel;
    String newLabel;
}
