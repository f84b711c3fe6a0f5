package im.arun.treebinder.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Location of a value inside the bound input: a sequence of record keys
 * (strings) and list indexes (integers). The empty path is the input root.
 */
public final class SourcePath {

    private static final SourcePath ROOT = new SourcePath(Collections.emptyList());

    private final List<Object> segments;

    private SourcePath(List<Object> segments) {
        this.segments = segments;
    }

    public static SourcePath root() {
        return ROOT;
    }

    /**
     * Build a path from keys and indexes, e.g. {@code SourcePath.of("items", 2)}.
     */
    public static SourcePath of(Object... segments) {
        SourcePath path = ROOT;
        for (Object segment : segments) {
            if (segment instanceof Integer) {
                path = path.child((Integer) segment);
            } else if (segment instanceof String) {
                path = path.child((String) segment);
            } else {
                throw new IllegalArgumentException("Path segments must be String or Integer: " + segment);
            }
        }
        return path;
    }

    public SourcePath child(String key) {
        return append(Objects.requireNonNull(key, "key"));
    }

    public SourcePath child(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative list index: " + index);
        }
        return append(index);
    }

    private SourcePath append(Object segment) {
        List<Object> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new SourcePath(Collections.unmodifiableList(next));
    }

    public List<Object> getSegments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    public Optional<SourcePath> parent() {
        if (isRoot()) {
            return Optional.empty();
        }
        return Optional.of(new SourcePath(Collections.unmodifiableList(
            new ArrayList<>(segments.subList(0, segments.size() - 1)))));
    }

    public Object lastSegment() {
        return isRoot() ? null : segments.get(segments.size() - 1);
    }

    /**
     * Walk this path through a {@link DataNode} tree.
     *
     * @return the node at this path, or empty when a segment does not exist
     */
    public Optional<DataNode> resolve(DataNode root) {
        DataNode current = root;
        for (Object segment : segments) {
            if (current instanceof RecordNode && segment instanceof String) {
                RecordNode record = (RecordNode) current;
                if (!record.containsKey((String) segment)) {
                    return Optional.empty();
                }
                current = record.get((String) segment);
            } else if (current instanceof ListNode && segment instanceof Integer) {
                ListNode list = (ListNode) current;
                int index = (Integer) segment;
                if (index >= list.size()) {
                    return Optional.empty();
                }
                current = list.get(index);
            } else {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourcePath)) {
            return false;
        }
        return segments.equals(((SourcePath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    /**
     * Renders as {@code $}, {@code $.b.c} or {@code $.items[2]}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("$");
        for (Object segment : segments) {
            if (segment instanceof Integer) {
                sb.append('[').append(segment).append(']');
            } else {
                sb.append('.').append(segment);
            }
        }
        return sb.toString();
    }
}
