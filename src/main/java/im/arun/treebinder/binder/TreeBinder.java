package im.arun.treebinder.binder;

import im.arun.treebinder.classify.DataClassifier;
import im.arun.treebinder.classify.DefaultScalarFormatter;
import im.arun.treebinder.classify.FormatException;
import im.arun.treebinder.classify.ScalarFormatter;
import im.arun.treebinder.config.BinderConfig;
import im.arun.treebinder.model.BindStats;
import im.arun.treebinder.model.DataKind;
import im.arun.treebinder.model.DataNode;
import im.arun.treebinder.model.ListNode;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.model.RecordNode;
import im.arun.treebinder.model.SourcePath;
import im.arun.treebinder.surface.TreeSurface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Projects nested input data onto a {@link TreeSurface} and records every
 * created node in its {@link NodeIndex}.
 * <p>
 * Binding is pre-order: record fields in insertion order, list elements in
 * index order. Scalars become {@code "key: value"} or {@code "[i]: value"}
 * leaves; lists and records become containers labelled with their key or
 * index. Each bind discards the previous tree and every id it issued.
 */
public class TreeBinder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBinder.class);

    private final TreeSurface surface;
    private final NodeIndex index;
    private final DataClassifier classifier;
    private final ScalarFormatter formatter;
    private final BinderConfig config;

    private Object boundRoot;
    private NodeId rootId;
    private String indexTemplate;
    private int nodeCount;
    private int cyclicReferences;
    private int formatFailures;

    public TreeBinder(TreeSurface surface, BinderConfig config) {
        this(surface, config, new DataClassifier(), new DefaultScalarFormatter());
    }

    public TreeBinder(TreeSurface surface, BinderConfig config,
                      DataClassifier classifier, ScalarFormatter formatter) {
        this.surface = surface;
        this.config = config;
        this.classifier = classifier;
        this.formatter = formatter;
        this.index = new NodeIndex(surface.sessionId());
    }

    /**
     * Bind a value, replacing whatever was bound before.
     *
     * @param root a {@link DataNode}, Jackson tree, map, list, array or scalar
     * @return id of the root node
     */
    public NodeId bind(Object root) {
        surface.clear();
        index.clear();
        nodeCount = 0;
        cyclicReferences = 0;
        formatFailures = 0;
        indexTemplate = validTemplate(config.getIndexTemplate());
        boundRoot = root;

        DataKind kind = classifier.classify(root);
        if (kind == DataKind.SCALAR) {
            rootId = create(formatScalar(root, SourcePath.root()), null, SourcePath.root());
        } else {
            rootId = create(config.getRootLabel(), null, SourcePath.root());
            Set<Object> ancestors = Collections.newSetFromMap(new IdentityHashMap<>());
            ancestors.add(root);
            bindChildren(root, kind, rootId, SourcePath.root(), ancestors);
        }

        logger.info("Bound {} value into {} nodes ({} cyclic, {} unrepresentable)",
            kind, nodeCount, cyclicReferences, formatFailures);
        return rootId;
    }

    /**
     * Bind the current root again, e.g. after the caller changed it in place.
     */
    public NodeId rebind() {
        if (rootId == null) {
            throw new IllegalStateException("Nothing has been bound yet");
        }
        return bind(boundRoot);
    }

    /**
     * Replace the value at {@code path} inside the bound {@link DataNode} tree
     * and rebind.
     *
     * @return id of the node now bound at {@code path}, empty when the path does
     *         not exist or the bound input is not a {@link DataNode} tree
     */
    public Optional<NodeId> updateValue(SourcePath path, DataNode value) {
        if (!(boundRoot instanceof DataNode)) {
            logger.warn("Write-back needs a DataNode input, bound value is {}",
                boundRoot == null ? "null" : boundRoot.getClass().getSimpleName());
            return Optional.empty();
        }
        if (path.isRoot()) {
            bind(value);
            return Optional.of(rootId);
        }

        Optional<DataNode> parent = path.parent().flatMap(p -> p.resolve((DataNode) boundRoot));
        Object segment = path.lastSegment();
        if (parent.isPresent() && parent.get() instanceof RecordNode && segment instanceof String) {
            ((RecordNode) parent.get()).put((String) segment, value);
        } else if (parent.isPresent() && parent.get() instanceof ListNode && segment instanceof Integer
                && (Integer) segment < ((ListNode) parent.get()).size()) {
            ((ListNode) parent.get()).set((Integer) segment, value);
        } else {
            logger.warn("No value at {}, nothing updated", path);
            return Optional.empty();
        }

        rebind();
        return index.idOf(path);
    }

    private void bindChildren(Object value, DataKind kind, NodeId parentId,
                              SourcePath path, Set<Object> ancestors) {
        if (kind == DataKind.RECORD) {
            for (Map.Entry<String, Object> field : classifier.fields(value).entrySet()) {
                bindEntry(field.getKey(), field.getValue(), parentId, path.child(field.getKey()), ancestors);
            }
        } else if (kind == DataKind.LIST) {
            List<Object> items = classifier.items(value);
            for (int i = 0; i < items.size(); i++) {
                bindEntry(indexLabel(i), items.get(i), parentId, path.child(i), ancestors);
            }
        }
    }

    private void bindEntry(String name, Object value, NodeId parentId,
                           SourcePath path, Set<Object> ancestors) {
        DataKind kind = classifier.classify(value);
        if (kind == DataKind.SCALAR) {
            create(name + ": " + formatScalar(value, path), parentId, path);
            return;
        }
        if (ancestors.contains(value)) {
            cyclicReferences++;
            logger.debug("Cyclic reference at {}, bound as leaf", path);
            create(name + ": " + config.getCyclicLabel(), parentId, path);
            return;
        }

        NodeId containerId = create(name, parentId, path);
        ancestors.add(value);
        bindChildren(value, kind, containerId, path, ancestors);
        ancestors.remove(value);
    }

    private NodeId create(String label, NodeId parentId, SourcePath path) {
        NodeId id = surface.insert(label, parentId);
        index.register(id, path);
        nodeCount++;
        return id;
    }

    private String formatScalar(Object value, SourcePath path) {
        try {
            return formatter.format(value);
        } catch (FormatException e) {
            formatFailures++;
            logger.warn("Cannot render value at {}: {}", path, e.getMessage());
            return config.getUnrepresentableLabel();
        }
    }

    private String indexLabel(int i) {
        return String.format(indexTemplate, i);
    }

    private String validTemplate(String template) {
        if (template == null) {
            return "[%d]";
        }
        try {
            String.format(template, 0);
            return template;
        } catch (IllegalFormatException e) {
            logger.warn("Invalid index template '{}', using [%d]", template);
            return "[%d]";
        }
    }

    public NodeIndex getIndex() {
        return index;
    }

    public TreeSurface getSurface() {
        return surface;
    }

    public Optional<NodeId> getRootId() {
        return Optional.ofNullable(rootId);
    }

    public Object getBoundRoot() {
        return boundRoot;
    }

    public BindStats getStats() {
        return new BindStats(nodeCount, cyclicReferences, formatFailures);
    }
}
