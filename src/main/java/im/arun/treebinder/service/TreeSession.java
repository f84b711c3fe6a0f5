package im.arun.treebinder.service;

import im.arun.treebinder.binder.NodeIndex;
import im.arun.treebinder.binder.TreeBinder;
import im.arun.treebinder.classify.DataClassifier;
import im.arun.treebinder.classify.DefaultScalarFormatter;
import im.arun.treebinder.classify.ScalarFormatter;
import im.arun.treebinder.config.BinderConfig;
import im.arun.treebinder.model.BindStats;
import im.arun.treebinder.model.DataNode;
import im.arun.treebinder.model.LabelChange;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.model.SearchMatch;
import im.arun.treebinder.model.SourcePath;
import im.arun.treebinder.model.Transaction;
import im.arun.treebinder.model.TreeOutline;
import im.arun.treebinder.replace.ReplaceEngine;
import im.arun.treebinder.report.ReportFormatter;
import im.arun.treebinder.search.FilterView;
import im.arun.treebinder.search.HighlightState;
import im.arun.treebinder.search.ResultNavigator;
import im.arun.treebinder.search.SearchEngine;
import im.arun.treebinder.search.SearchQuery;
import im.arun.treebinder.surface.InMemoryTreeSurface;
import im.arun.treebinder.surface.TreeSurface;
import im.arun.treebinder.util.OperationJournal;
import im.arun.treebinder.util.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One binding session: a tree surface with its binder, search, highlight,
 * filter and replace components wired together.
 * <p>
 * Every component here is owned by this session; independent trees need
 * independent sessions. Not thread-safe: call from the thread that owns the
 * surface. Rebinding invalidates all ids, so it also resets the navigator and
 * the undo history.
 */
public class TreeSession {
    private static final Logger logger = LoggerFactory.getLogger(TreeSession.class);

    private final BinderConfig config;
    private final TreeSurface surface;
    private final TreeBinder binder;
    private final SearchEngine searchEngine;
    private final ResultNavigator navigator;
    private final HighlightState highlightState;
    private final FilterView filterView;
    private final ReplaceEngine replaceEngine;
    private final ReportFormatter reportFormatter;
    private final OperationJournal journal;

    private NodeId rootId;

    public TreeSession(BinderConfig config) {
        this(config, new InMemoryTreeSurface(), new InMemoryTreeSurface(), new DefaultScalarFormatter(), "session");
    }

    public TreeSession(BinderConfig config, TreeSurface surface, TreeSurface filterSurface,
                       ScalarFormatter formatter, String sessionName) {
        this.config = config;
        this.surface = surface;
        this.binder = new TreeBinder(surface, config, new DataClassifier(), formatter);
        this.searchEngine = new SearchEngine(surface);
        this.navigator = new ResultNavigator(surface, config.isSelectOnNavigate());
        this.highlightState = new HighlightState(surface);
        this.filterView = new FilterView(surface, filterSurface,
            config.getFilterRootLabel(), config.getNoMatchesLabel(), config.isFilterLeavesOnly());
        this.replaceEngine = new ReplaceEngine(surface, config.isReplaceCaseSensitive(), config.getMaxUndoHistory());
        this.reportFormatter = new ReportFormatter();
        this.journal = new OperationJournal(config.getJournalDir(), sessionName);
    }

    /**
     * Bind a new input value, discarding the previous tree.
     */
    public NodeId bind(Object data) {
        rootId = binder.bind(data);
        resetDerivedState();
        BindStats stats = binder.getStats();
        journal.record("bind", Map.of(
            "nodes", stats.getNodeCount(),
            "cyclic_references", stats.getCyclicReferences(),
            "format_failures", stats.getFormatFailures()
        ));
        return rootId;
    }

    /**
     * Write a new value into the bound {@link DataNode} input and rebind.
     */
    public Optional<NodeId> update(SourcePath path, DataNode value) {
        requireBound();
        Optional<NodeId> updated = binder.updateValue(path, value);
        if (updated.isPresent()) {
            binder.getRootId().ifPresent(id -> rootId = id);
            resetDerivedState();
            journal.record("update", Map.of("path", path.toString()));
        } else {
            journal.warn("update", "No value at " + path);
        }
        return updated;
    }

    public List<SearchMatch> search(String term) {
        return search(new SearchQuery(term, config.getMatchMode(), config.isSearchCaseSensitive()));
    }

    /**
     * Find, highlight and load the navigator with the matches of a query.
     * Highlights from any earlier search are cleared first.
     */
    public List<SearchMatch> search(SearchQuery query) {
        requireBound();
        query = orEmpty(query);
        List<SearchMatch> matches = searchEngine.findMatches(rootId, query);
        List<NodeId> ids = matches.stream().map(SearchMatch::getNodeId).collect(Collectors.toList());

        highlightState.clearAll(rootId);
        highlightState.mark(ids);
        navigator.setResults(ids);

        journal.record("search", Map.of(
            "term", String.valueOf(query.getTerm()),
            "mode", String.valueOf(query.getMode()),
            "matches", matches.size()
        ));
        logger.debug("Search '{}' matched {} nodes", query.getTerm(), matches.size());
        return matches;
    }

    public void clearHighlights() {
        requireBound();
        highlightState.clearAll(rootId);
    }

    public Optional<NodeId> next() {
        return navigator.next();
    }

    public Optional<NodeId> previous() {
        return navigator.previous();
    }

    public NodeId filter(String term) {
        return filter(new SearchQuery(term, config.getMatchMode(), config.isSearchCaseSensitive()));
    }

    public NodeId filter(SearchQuery query) {
        requireBound();
        query = orEmpty(query);
        NodeId syntheticRoot = filterView.rebuild(rootId, query);
        journal.record("filter", Map.of(
            "term", String.valueOf(query.getTerm()),
            "matches", filterView.getMatchCount()
        ));
        return syntheticRoot;
    }

    // A missing query matches nothing
    private SearchQuery orEmpty(SearchQuery query) {
        return query != null ? query : new SearchQuery("", config.getMatchMode(), config.isSearchCaseSensitive());
    }

    public List<LabelChange> preview(String find, String replaceWith) {
        requireBound();
        return replaceEngine.preview(rootId, find, replaceWith);
    }

    public int replaceAll(String find, String replaceWith) {
        requireBound();
        int count = replaceEngine.replaceAll(rootId, find, replaceWith);
        journal.record("replace", Map.of(
            "find", String.valueOf(find),
            "replace_with", String.valueOf(replaceWith),
            "count", count
        ));
        return count;
    }

    /**
     * @return false when there was nothing to undo
     */
    public boolean rollback() {
        int size = replaceEngine.peek().map(Transaction::size).orElse(0);
        boolean reverted = replaceEngine.rollback();
        journal.record("rollback", Map.of("reverted", reverted, "labels", size));
        return reverted;
    }

    public Optional<SourcePath> pathOf(NodeId id) {
        return binder.getIndex().pathOf(id);
    }

    public Optional<NodeId> idOf(SourcePath path) {
        return binder.getIndex().idOf(path);
    }

    public Optional<String> labelOf(NodeId id) {
        return surface.getLabel(id);
    }

    /**
     * Nested snapshot of the bound tree, with paths and highlight flags.
     */
    public TreeOutline outline() {
        requireBound();
        return outline(rootId);
    }

    private TreeOutline outline(NodeId id) {
        TreeOutline node = new TreeOutline();
        node.setLabel(surface.getLabel(id).orElse(""));
        node.setNodeId(id.toString());
        binder.getIndex().pathOf(id).ifPresent(path -> node.setPath(path.toString()));
        if (highlightState.isMarked(id)) {
            node.setMarked(true);
        }
        List<NodeId> children = TreeWalker.children(surface, id);
        if (!children.isEmpty()) {
            List<TreeOutline> nodes = new ArrayList<>(children.size());
            for (NodeId child : children) {
                nodes.add(outline(child));
            }
            node.setNodes(nodes);
        }
        return node;
    }

    private void resetDerivedState() {
        navigator.setResults(List.of());
        replaceEngine.clearHistory();
    }

    private void requireBound() {
        if (rootId == null) {
            throw new IllegalStateException("No data bound in this session");
        }
    }

    public Optional<NodeId> getRootId() {
        return Optional.ofNullable(rootId);
    }

    public BindStats getBindStats() {
        return binder.getStats();
    }

    public NodeIndex getIndex() {
        return binder.getIndex();
    }

    public TreeSurface getSurface() {
        return surface;
    }

    public ResultNavigator getNavigator() {
        return navigator;
    }

    public HighlightState getHighlightState() {
        return highlightState;
    }

    public FilterView getFilterView() {
        return filterView;
    }

    public ReplaceEngine getReplaceEngine() {
        return replaceEngine;
    }

    public ReportFormatter getReportFormatter() {
        return reportFormatter;
    }

    public OperationJournal getJournal() {
        return journal;
    }

    public BinderConfig getConfig() {
        return config;
    }
}
