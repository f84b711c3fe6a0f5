package im.arun.treebinder.search;

import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.surface.TreeSurface;
import im.arun.treebinder.util.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Flat view of the nodes whose labels satisfy a predicate.
 * <p>
 * Each rebuild clears the target surface and inserts one synthetic root with the
 * matching labels directly beneath it, in search order. With no matches the
 * root holds a single "no matches" leaf. Filtered ids map back to the source
 * nodes through {@link #originalOf}.
 */
public class FilterView {
    private static final Logger logger = LoggerFactory.getLogger(FilterView.class);

    private final TreeSurface source;
    private final TreeSurface target;
    private final String rootLabel;
    private final String noMatchesLabel;
    private final boolean leavesOnly;
    private final Map<NodeId, NodeId> originals = new HashMap<>();
    private NodeId syntheticRootId;
    private int matchCount;

    public FilterView(TreeSurface source, TreeSurface target,
                      String rootLabel, String noMatchesLabel, boolean leavesOnly) {
        if (source == target) {
            throw new IllegalArgumentException("Filter view needs its own surface");
        }
        this.source = source;
        this.target = target;
        this.rootLabel = rootLabel;
        this.noMatchesLabel = noMatchesLabel;
        this.leavesOnly = leavesOnly;
    }

    public NodeId rebuild(NodeId rootId, Predicate<String> predicate) {
        target.clear();
        originals.clear();
        matchCount = 0;
        syntheticRootId = target.insert(rootLabel, null);

        Predicate<String> test = predicate == null ? label -> false : predicate;
        TreeWalker.walk(source, rootId, false, id -> {
            if (leavesOnly && !TreeWalker.isLeaf(source, id)) {
                return;
            }
            String label = source.getLabel(id).orElse(null);
            if (label != null && test.test(label)) {
                NodeId filteredId = target.insert(label, syntheticRootId);
                originals.put(filteredId, id);
                matchCount++;
            }
        });

        if (matchCount == 0) {
            target.insert(noMatchesLabel, syntheticRootId);
        }
        logger.debug("Filter view rebuilt with {} entries", matchCount);
        return syntheticRootId;
    }

    public NodeId rebuild(NodeId rootId, SearchQuery query) {
        return rebuild(rootId, query == null ? null : query.toPredicate());
    }

    /**
     * Source node a filtered entry was copied from; empty for the synthetic
     * root, the sentinel leaf and ids from an earlier rebuild.
     */
    public Optional<NodeId> originalOf(NodeId filteredId) {
        return Optional.ofNullable(originals.get(filteredId));
    }

    public Optional<NodeId> getSyntheticRootId() {
        return Optional.ofNullable(syntheticRootId);
    }

    public int getMatchCount() {
        return matchCount;
    }

    public TreeSurface getTarget() {
        return target;
    }
}
