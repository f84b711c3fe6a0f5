package im.arun.treebinder.replace;

import im.arun.treebinder.model.LabelChange;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.model.Transaction;
import im.arun.treebinder.surface.TreeSurface;
import im.arun.treebinder.util.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substring replacement over node labels with an undo stack.
 * <p>
 * {@link #replaceAll} plans every change first, then applies them; the batch is
 * pushed as one {@link Transaction} only after all labels were written. If the
 * surface rejects a write, labels already written are put back before the
 * failure propagates, so callers never see a half-applied batch.
 */
public class ReplaceEngine {
    private static final Logger logger = LoggerFactory.getLogger(ReplaceEngine.class);

    private final TreeSurface surface;
    private final boolean caseSensitive;
    private final int maxHistory;
    private final Deque<Transaction> undoStack = new ArrayDeque<>();

    public ReplaceEngine(TreeSurface surface) {
        this(surface, true, 0);
    }

    /**
     * @param maxHistory transactions kept for rollback, 0 for no limit
     */
    public ReplaceEngine(TreeSurface surface, boolean caseSensitive, int maxHistory) {
        if (maxHistory < 0) {
            throw new IllegalArgumentException("maxHistory must be >= 0");
        }
        this.surface = surface;
        this.caseSensitive = caseSensitive;
        this.maxHistory = maxHistory;
    }

    /**
     * Changes {@link #replaceAll} would make, without touching the tree.
     */
    public List<LabelChange> preview(NodeId rootId, String find, String replaceWith) {
        List<LabelChange> changes = new ArrayList<>();
        if (find == null || find.isEmpty()) {
            return changes;
        }
        Pattern pattern = caseSensitive
            ? Pattern.compile(Pattern.quote(find))
            : Pattern.compile(Pattern.quote(find), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        String replacement = Matcher.quoteReplacement(replaceWith == null ? "" : replaceWith);
        TreeWalker.walk(surface, rootId, false, id -> {
            String label = surface.getLabel(id).orElse(null);
            if (label == null) {
                return;
            }
            Matcher matcher = pattern.matcher(label);
            if (matcher.find()) {
                changes.add(new LabelChange(id, label, matcher.replaceAll(replacement)));
            }
        });
        return changes;
    }

    /**
     * @return number of labels rewritten
     */
    public int replaceAll(NodeId rootId, String find, String replaceWith) {
        List<LabelChange> plan = preview(rootId, find, replaceWith);
        if (plan.isEmpty()) {
            logger.debug("No labels below {} contain '{}'", rootId, find);
            return 0;
        }

        Transaction transaction = new Transaction("replace '" + find + "' with '" + replaceWith + "'");
        try {
            for (LabelChange change : plan) {
                surface.setLabel(change.getNodeId(), change.getNewLabel());
                transaction.record(change);
            }
        } catch (RuntimeException e) {
            logger.error("Replace failed after {} of {} labels, reverting", transaction.size(), plan.size(), e);
            writeAll(reversed(transaction.getChanges()), true, e);
            throw new IllegalStateException("Replace of '" + find + "' failed and was reverted", e);
        }

        push(transaction);
        logger.info("Replaced '{}' with '{}' in {} labels", find, replaceWith, plan.size());
        return plan.size();
    }

    /**
     * Undo the most recent replace.
     * <p>
     * A transaction whose nodes are gone (the tree was rebound) is discarded. If
     * the surface rejects a write midway, the labels already restored are put
     * back to their replaced text and the transaction stays on the stack.
     *
     * @return false when there is nothing to undo or the undo could not be applied
     */
    public boolean rollback() {
        Transaction transaction = undoStack.peekFirst();
        if (transaction == null) {
            logger.debug("Rollback requested with empty undo stack");
            return false;
        }
        for (LabelChange change : transaction.getChanges()) {
            if (!surface.contains(change.getNodeId())) {
                undoStack.pollFirst();
                logger.warn("Discarded {}: node {} no longer exists", transaction, change.getNodeId());
                return false;
            }
        }

        List<LabelChange> order = reversed(transaction.getChanges());
        int restored = 0;
        try {
            for (LabelChange change : order) {
                surface.setLabel(change.getNodeId(), change.getOldLabel());
                restored++;
            }
        } catch (RuntimeException e) {
            logger.error("Rollback of {} failed after {} labels, re-applying", transaction, restored, e);
            writeAll(order.subList(0, restored), false, e);
            return false;
        }

        undoStack.pollFirst();
        logger.info("Rolled back {}", transaction);
        return true;
    }

    public Optional<Transaction> peek() {
        return Optional.ofNullable(undoStack.peekFirst());
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public int historySize() {
        return undoStack.size();
    }

    public void clearHistory() {
        undoStack.clear();
    }

    private void push(Transaction transaction) {
        undoStack.push(transaction);
        if (maxHistory > 0) {
            while (undoStack.size() > maxHistory) {
                Transaction dropped = undoStack.removeLast();
                logger.debug("Undo history full, discarded {}", dropped);
            }
        }
    }

    // Newest change first, so a node touched twice ends at its oldest label
    private static List<LabelChange> reversed(List<LabelChange> changes) {
        List<LabelChange> order = new ArrayList<>(changes);
        Collections.reverse(order);
        return order;
    }

    /**
     * Write every change's old or new label, attempting all of them even when
     * some fail; failures are attached to {@code failure} as suppressed.
     */
    private void writeAll(List<LabelChange> changes, boolean oldLabels, RuntimeException failure) {
        for (LabelChange change : changes) {
            try {
                surface.setLabel(change.getNodeId(), oldLabels ? change.getOldLabel() : change.getNewLabel());
            } catch (RuntimeException e) {
                logger.error("Could not restore label of {}", change.getNodeId(), e);
                failure.addSuppressed(e);
            }
        }
    }
}
