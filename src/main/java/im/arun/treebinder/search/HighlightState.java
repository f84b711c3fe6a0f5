package im.arun.treebinder.search;

import im.arun.treebinder.model.MarkStyle;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.surface.TreeSurface;
import im.arun.treebinder.util.TreeWalker;

import java.util.Collection;

/**
 * Marks matched nodes on the surface.
 * {@link #clearAll} walks the whole tree rather than remembering what it marked,
 * so marks from an older result set cannot survive a new search.
 */
public class HighlightState {

    private final TreeSurface surface;
    private final MarkStyle style;

    public HighlightState(TreeSurface surface) {
        this(surface, MarkStyle.HIGHLIGHT);
    }

    public HighlightState(TreeSurface surface, MarkStyle style) {
        this.surface = surface;
        this.style = style;
    }

    /**
     * @return how many of the ids were live and got marked
     */
    public int mark(Collection<NodeId> ids) {
        int marked = 0;
        for (NodeId id : ids) {
            if (surface.contains(id)) {
                surface.mark(id, style);
                marked++;
            }
        }
        return marked;
    }

    public void clearAll(NodeId rootId) {
        TreeWalker.walk(surface, rootId, true, id -> surface.unmark(id, style));
    }

    public boolean isMarked(NodeId id) {
        return surface.isMarked(id, style);
    }

    public MarkStyle getStyle() {
        return style;
    }
}
