package im.arun.treebinder.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import im.arun.treebinder.Fixtures;
import im.arun.treebinder.config.BinderConfig;
import im.arun.treebinder.model.DataNode;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.model.RecordNode;
import im.arun.treebinder.model.SearchMatch;
import im.arun.treebinder.model.SourcePath;
import im.arun.treebinder.model.TreeOutline;
import im.arun.treebinder.search.MatchMode;
import im.arun.treebinder.search.SearchQuery;
import im.arun.treebinder.util.TreeWalker;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TreeSessionTest {

    @Test
    void searchHighlightsAndNavigates() {
        TreeSession session = new TreeSession(new BinderConfig());
        session.bind(Fixtures.folders());

        List<SearchMatch> matches = session.search("File3");

        assertEquals(10, matches.size());
        assertTrue(matches.stream().allMatch(m -> session.getHighlightState().isMarked(m.getNodeId())));
        assertEquals(matches.get(0).getNodeId(), session.getNavigator().current().orElseThrow());
        assertEquals(matches.get(1).getNodeId(), session.next().orElseThrow());
        assertEquals(matches.get(0).getNodeId(), session.previous().orElseThrow());
        assertEquals(matches.get(9).getNodeId(), session.previous().orElseThrow());
    }

    @Test
    void newSearchClearsOldHighlights() {
        TreeSession session = new TreeSession(new BinderConfig());
        session.bind(Fixtures.folders());
        List<SearchMatch> first = session.search("File3");

        session.search("File4");

        assertTrue(first.stream().noneMatch(m -> session.getHighlightState().isMarked(m.getNodeId())));
    }

    @Test
    void emptySearchLeavesNavigatorEmpty() {
        TreeSession session = new TreeSession(new BinderConfig());
        session.bind(Fixtures.folders());

        assertTrue(session.search("").isEmpty());
        assertTrue(session.next().isEmpty());
        assertEquals(0, session.getNavigator().position());
    }

    @Test
    void replaceAndRollbackThroughSession() {
        TreeSession session = new TreeSession(new BinderConfig());
        NodeId rootId = session.bind(Fixtures.folders());
        String before = session.getReportFormatter().outline(session.getSurface(), rootId);

        assertEquals(80, session.replaceAll("File", "Document"));
        assertTrue(session.rollback());
        assertFalse(session.rollback());

        assertEquals(before, session.getReportFormatter().outline(session.getSurface(), rootId));
        List<String> operations = session.getJournal().getEntries().stream()
            .map(e -> (String) e.get("operation"))
            .collect(Collectors.toList());
        assertEquals(List.of("bind", "replace", "rollback", "rollback"), operations);
        assertEquals(80, session.getJournal().getEntries().get(2).get("labels"));
    }

    @Test
    void missingQueryMatchesNothing() {
        TreeSession session = new TreeSession(new BinderConfig());
        session.bind(Fixtures.folders());
        session.search("File3");

        assertTrue(session.search((SearchQuery) null).isEmpty());
        assertTrue(session.getNavigator().isEmpty());

        NodeId synthetic = session.filter((SearchQuery) null);
        List<String> entries = TreeWalker.children(session.getFilterView().getTarget(), synthetic).stream()
            .map(id -> session.getFilterView().getTarget().getLabel(id).orElseThrow())
            .collect(Collectors.toList());
        assertEquals(List.of("(no matches)"), entries);
    }

    @Test
    void filterUsesSeparateSurface() {
        TreeSession session = new TreeSession(new BinderConfig());
        NodeId rootId = session.bind(Fixtures.folders());

        NodeId synthetic = session.filter("3");

        assertFalse(session.getSurface().contains(synthetic));
        assertEquals(10, TreeWalker.children(session.getFilterView().getTarget(), synthetic).size());
        assertEquals(91, TreeWalker.subtree(session.getSurface(), rootId).size());
    }

    @Test
    void rebindResetsNavigatorAndHistory() {
        TreeSession session = new TreeSession(new BinderConfig());
        session.bind(Fixtures.folders());
        session.search("File1");
        session.replaceAll("File", "Doc");

        session.bind(Fixtures.simpleRecord());

        assertTrue(session.getNavigator().isEmpty());
        assertFalse(session.rollback());
    }

    @Test
    void updateWritesBackIntoInput() {
        TreeSession session = new TreeSession(new BinderConfig());
        RecordNode data = Fixtures.simpleRecord();
        NodeId oldRoot = session.bind(data);

        NodeId a = session.update(SourcePath.of("a"), DataNode.scalar("changed")).orElseThrow();

        assertEquals("a: changed", session.labelOf(a).orElseThrow());
        assertEquals(SourcePath.of("a"), session.pathOf(a).orElseThrow());
        assertFalse(session.getSurface().contains(oldRoot));
        assertEquals(session.getRootId().orElseThrow(), session.idOf(SourcePath.root()).orElseThrow());
    }

    @Test
    void outlineCarriesPathsAndMarks() {
        TreeSession session = new TreeSession(new BinderConfig());
        session.bind(Fixtures.simpleRecord());
        session.search(new SearchQuery("c: 2", MatchMode.EXACT, true));

        TreeOutline outline = session.outline();

        assertEquals("root", outline.getLabel());
        assertEquals("$", outline.getPath());
        TreeOutline b = outline.getNodes().get(1);
        assertEquals("$.b", b.getPath());
        assertNull(b.getMarked());
        TreeOutline c = b.getNodes().get(0);
        assertEquals("c: 2", c.getLabel());
        assertTrue(c.getMarked());
        assertNull(c.getNodes());
    }

    @Test
    void operationsBeforeBindFail() {
        TreeSession session = new TreeSession(new BinderConfig());

        assertThrows(IllegalStateException.class, () -> session.search("x"));
        assertThrows(IllegalStateException.class, () -> session.replaceAll("x", "y"));
        assertFalse(session.rollback());
    }

    @Test
    void sessionsDoNotShareState() {
        TreeSession one = new TreeSession(new BinderConfig());
        TreeSession two = new TreeSession(new BinderConfig());
        one.bind(Fixtures.folders());
        two.bind(Fixtures.folders());

        one.replaceAll("File", "Doc");

        assertFalse(two.rollback());
        assertEquals(80, two.search("File").size());
    }
}
