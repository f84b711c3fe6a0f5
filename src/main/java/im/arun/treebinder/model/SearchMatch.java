package im.arun.treebinder.model;

import lombok.Value;

/**
 * A node whose label satisfied a search predicate.
 */
@Value
public class SearchMatch {
    NodeId nodeId;
    String label;
}
