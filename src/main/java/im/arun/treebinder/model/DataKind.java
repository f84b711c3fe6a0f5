package im.arun.treebinder.model;

/**
 * Structural shape of an input value.
 */
public enum DataKind {
    SCALAR,
    LIST,
    RECORD
}
