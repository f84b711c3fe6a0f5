package im.arun.treebinder.model;

import lombok.Value;

/**
 * Counters for one bind pass. {@code nodeCount} includes the synthetic root.
 */
@Value
public class BindStats {
    int nodeCount;
    int cyclicReferences;
    int formatFailures;
}
