package im.arun.treebinder.model;

/**
 * Visual mark flags a surface can toggle on a node.
 */
public enum MarkStyle {
    HIGHLIGHT,
    SELECTED
}
