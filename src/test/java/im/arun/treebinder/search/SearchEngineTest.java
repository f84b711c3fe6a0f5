package im.arun.treebinder.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import im.arun.treebinder.Fixtures;
import im.arun.treebinder.binder.TreeBinder;
import im.arun.treebinder.config.BinderConfig;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.model.SearchMatch;
import im.arun.treebinder.model.SourcePath;
import im.arun.treebinder.surface.InMemoryTreeSurface;
import im.arun.treebinder.util.TreeWalker;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SearchEngineTest {

    private InMemoryTreeSurface surface;
    private TreeBinder binder;
    private SearchEngine engine;

    @BeforeEach
    void setUp() {
        surface = new InMemoryTreeSurface();
        binder = new TreeBinder(surface, new BinderConfig());
        engine = new SearchEngine(surface);
    }

    @Test
    void findsLeafInNestedRecord() {
        NodeId rootId = binder.bind(Fixtures.simpleRecord());

        List<SearchMatch> matches = engine.findMatches(rootId, SearchQuery.contains("c"));

        assertEquals(1, matches.size());
        assertEquals("c: 2", matches.get(0).getLabel());
        assertEquals(binder.getIndex().idOf(SourcePath.of("b", "c")).orElseThrow(), matches.get(0).getNodeId());
    }

    @Test
    void resultsFollowFolderThenFileOrder() {
        NodeId rootId = binder.bind(Fixtures.folders());

        List<NodeId> ids = engine.find(rootId, SearchQuery.contains("File3"));

        assertEquals(10, ids.size());
        for (int i = 0; i < ids.size(); i++) {
            SourcePath path = binder.getIndex().pathOf(ids.get(i)).orElseThrow();
            assertEquals(SourcePath.of("Folder" + (i + 1), "File3.txt"), path);
        }
    }

    @Test
    void returnsExactlyTheMatchingNodes() {
        NodeId rootId = binder.bind(Fixtures.folders());
        Predicate<String> predicate = label -> label.contains("5");

        List<NodeId> found = engine.find(rootId, predicate);

        List<NodeId> expected = new ArrayList<>();
        for (NodeId id : TreeWalker.descendants(surface, rootId)) {
            if (predicate.test(surface.getLabel(id).orElseThrow())) {
                expected.add(id);
            }
        }
        assertEquals(expected, found);
        assertTrue(found.stream().allMatch(id -> predicate.test(surface.getLabel(id).orElseThrow())));
    }

    @Test
    void parentComesBeforeItsChildren() {
        NodeId rootId = binder.bind(Fixtures.simpleRecord());

        List<String> labels = engine.findMatches(rootId, label -> true).stream()
            .map(SearchMatch::getLabel)
            .collect(Collectors.toList());

        assertEquals(List.of("a: 1", "b", "c: 2"), labels);
    }

    @Test
    void emptyQueriesFindNothing() {
        NodeId rootId = binder.bind(Fixtures.folders());

        assertTrue(engine.find(rootId, label -> false).isEmpty());
        assertTrue(engine.find(rootId, SearchQuery.contains("")).isEmpty());
        assertTrue(engine.find(rootId, (SearchQuery) null).isEmpty());
        assertTrue(engine.find(rootId, (Predicate<String>) null).isEmpty());
    }

    @Test
    void searchScopeCanBeASubtree() {
        NodeId rootId = binder.bind(Fixtures.folders());
        NodeId folder2 = binder.getIndex().idOf(SourcePath.of("Folder2")).orElseThrow();

        assertEquals(8, engine.find(folder2, SearchQuery.contains("File")).size());
        assertEquals(80, engine.find(rootId, SearchQuery.contains("File")).size());
    }

    @Test
    void staleRootFindsNothing() {
        NodeId oldRoot = binder.bind(Fixtures.folders());
        binder.rebind();

        assertTrue(engine.find(oldRoot, SearchQuery.contains("File")).isEmpty());
    }
}
