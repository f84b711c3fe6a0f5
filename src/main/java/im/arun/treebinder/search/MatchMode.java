package im.arun.treebinder.search;

/**
 * How a search term is compared against a node label.
 */
public enum MatchMode {
    CONTAINS,
    PREFIX,
    SUFFIX,
    EXACT,
    /** Term is a {@link java.util.regex.Pattern}, found anywhere in the label. */
    PATTERN
}
