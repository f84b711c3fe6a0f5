package im.arun.treebinder.search;

import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.model.SearchMatch;
import im.arun.treebinder.surface.TreeSurface;
import im.arun.treebinder.util.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Depth-first label search below a root node.
 * <p>
 * Results are in pre-order (a node before its children, children left to
 * right); {@link ResultNavigator} relies on that order. The root passed in is
 * the search scope and is not itself tested.
 */
public class SearchEngine {
    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    private final TreeSurface surface;

    public SearchEngine(TreeSurface surface) {
        this.surface = surface;
    }

    public List<NodeId> find(NodeId rootId, Predicate<String> predicate) {
        return findMatches(rootId, predicate).stream()
            .map(SearchMatch::getNodeId)
            .collect(Collectors.toList());
    }

    public List<NodeId> find(NodeId rootId, SearchQuery query) {
        if (query == null || query.isEmpty()) {
            return new ArrayList<>();
        }
        return find(rootId, query.toPredicate());
    }

    public List<SearchMatch> findMatches(NodeId rootId, Predicate<String> predicate) {
        List<SearchMatch> matches = new ArrayList<>();
        if (predicate == null) {
            return matches;
        }
        TreeWalker.walk(surface, rootId, false, id -> {
            String label = surface.getLabel(id).orElse(null);
            if (label != null && predicate.test(label)) {
                matches.add(new SearchMatch(id, label));
            }
        });
        logger.debug("Search below {} found {} matches", rootId, matches.size());
        return matches;
    }

    public List<SearchMatch> findMatches(NodeId rootId, SearchQuery query) {
        if (query == null || query.isEmpty()) {
            return new ArrayList<>();
        }
        return findMatches(rootId, query.toPredicate());
    }
}
