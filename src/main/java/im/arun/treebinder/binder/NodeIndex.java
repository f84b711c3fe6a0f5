package im.arun.treebinder.binder;

import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.model.SourcePath;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bidirectional table between node ids and the source paths they were bound from.
 * <p>
 * One index belongs to one binder and one surface session. Ids issued by another
 * session are a programmer error: they trip an assertion when assertions are
 * enabled and otherwise resolve to nothing.
 */
public class NodeIndex {

    private final long sessionId;
    private final Map<NodeId, SourcePath> pathsById = new HashMap<>();
    private final Map<SourcePath, NodeId> idsByPath = new HashMap<>();

    public NodeIndex(long sessionId) {
        this.sessionId = sessionId;
    }

    public void register(NodeId id, SourcePath path) {
        if (id == null || path == null) {
            throw new IllegalArgumentException("id and path are required");
        }
        if (!checkSession(id)) {
            throw new IllegalArgumentException("Node " + id + " was not issued by session " + sessionId);
        }
        SourcePath previous = pathsById.put(id, path);
        if (previous != null && !previous.equals(path)) {
            idsByPath.remove(previous);
        }
        idsByPath.put(path, id);
    }

    public Optional<SourcePath> pathOf(NodeId id) {
        if (id == null || !checkSession(id)) {
            return Optional.empty();
        }
        return Optional.ofNullable(pathsById.get(id));
    }

    public Optional<NodeId> idOf(SourcePath path) {
        if (path == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(idsByPath.get(path));
    }

    public boolean contains(NodeId id) {
        return pathOf(id).isPresent();
    }

    public void clear() {
        pathsById.clear();
        idsByPath.clear();
    }

    public int size() {
        return pathsById.size();
    }

    public long getSessionId() {
        return sessionId;
    }

    private boolean checkSession(NodeId id) {
        boolean sameSession = id.getSession() == sessionId;
        assert sameSession : "Node " + id + " belongs to another tree session (expected " + sessionId + ")";
        return sameSession;
    }
}
