package im.arun.treebinder.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import im.arun.treebinder.Fixtures;
import im.arun.treebinder.binder.TreeBinder;
import im.arun.treebinder.config.BinderConfig;
import im.arun.treebinder.model.MarkStyle;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.surface.InMemoryTreeSurface;
import im.arun.treebinder.util.TreeWalker;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HighlightStateTest {

    private InMemoryTreeSurface surface;
    private NodeId rootId;
    private HighlightState highlight;

    @BeforeEach
    void setUp() {
        surface = new InMemoryTreeSurface();
        rootId = new TreeBinder(surface, new BinderConfig()).bind(Fixtures.folders());
        highlight = new HighlightState(surface);
    }

    private long markedCount() {
        return TreeWalker.subtree(surface, rootId).stream().filter(highlight::isMarked).count();
    }

    @Test
    void marksOnlyGivenNodes() {
        List<NodeId> matches = new SearchEngine(surface).find(rootId, SearchQuery.contains("File3"));

        assertEquals(10, highlight.mark(matches));
        assertEquals(10, markedCount());
    }

    @Test
    void clearAllIsIdempotent() {
        highlight.mark(new SearchEngine(surface).find(rootId, SearchQuery.contains("File")));
        highlight.clearAll(rootId);
        assertEquals(0, markedCount());

        highlight.clearAll(rootId);
        assertEquals(0, markedCount());
    }

    @Test
    void clearAllRemovesMarksItDidNotPlace() {
        NodeId stray = TreeWalker.descendants(surface, rootId).get(5);
        surface.mark(stray, MarkStyle.HIGHLIGHT);
        surface.mark(rootId, MarkStyle.HIGHLIGHT);

        highlight.clearAll(rootId);

        assertFalse(highlight.isMarked(stray));
        assertFalse(highlight.isMarked(rootId));
    }

    @Test
    void markingTwiceIsHarmless() {
        List<NodeId> matches = new SearchEngine(surface).find(rootId, SearchQuery.contains("File8"));
        highlight.mark(matches);
        highlight.mark(matches);

        assertEquals(10, markedCount());
        assertTrue(highlight.isMarked(matches.get(0)));
    }

    @Test
    void leavesOtherStylesAlone() {
        NodeId node = TreeWalker.descendants(surface, rootId).get(0);
        surface.select(node);

        highlight.clearAll(rootId);

        assertTrue(surface.isMarked(node, MarkStyle.SELECTED));
    }

    @Test
    void staleIdsAreSkipped() {
        NodeId ghost = new NodeId(surface.sessionId(), 10_000);
        assertEquals(0, highlight.mark(List.of(ghost)));
    }
}
