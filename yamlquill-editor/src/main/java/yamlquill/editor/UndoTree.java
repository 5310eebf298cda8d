package yamlquill.editor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Branching undo history kept as a flat arena of [UndoNode]s.
///
/// Index 0 is always the root, built from the snapshot given at construction.
/// [#addCheckpoint(EditorSnapshot)] adds a child of the current node and moves
/// there, so editing after an undo starts a new branch and keeps the old one.
/// [#redo()] follows the newest branch by creation order, not the one visited last.
///
/// When the arena grows past its limit the oldest leaf off the root-to-current
/// path is evicted, repeatedly. Once only that path is left, its oldest end goes:
/// the root is dropped and its single child becomes the new root, so the
/// earliest states can no longer be undone to.
///
/// Snapshots are copied in and out; callers never share trees with the history.
public final class UndoTree {

    private static final Logger LOG = Logger.getLogger(UndoTree.class.getName());

    public static final int DEFAULT_LIMIT = 50;

    private final List<UndoNode> nodes = new ArrayList<>();
    private final int limit;
    private int current;
    private long nextSeq;

    public UndoTree(EditorSnapshot initial) {
        this(initial, DEFAULT_LIMIT);
    }

    /// @param limit maximum number of checkpoints kept, root included; at least 1
    public UndoTree(EditorSnapshot initial, int limit) {
        Objects.requireNonNull(initial, "initial must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        this.limit = limit;
        reset(initial);
    }

    /// Records `snapshot` as a new child of the current checkpoint and makes it current.
    public void addCheckpoint(EditorSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        final long seq = nextSeq++;
        final int index = nodes.size();
        nodes.add(new UndoNode(snapshot.deepCopy(), current, seq));
        node(current).addChild(index);
        current = index;
        LOG.fine(() -> "Checkpoint seq=" + seq + " at index " + index);
        prune();
    }

    /// Moves to the parent checkpoint.
    /// @return the parent's snapshot, or empty at the root
    public Optional<EditorSnapshot> undo() {
        final var node = node(current);
        if (node.isRoot()) {
            return Optional.empty();
        }
        current = node.parent();
        LOG.fine(() -> "Undo to index " + current);
        return Optional.of(node(current).snapshot().deepCopy());
    }

    /// Moves to the most recently created child checkpoint.
    /// @return that child's snapshot, or empty at a leaf
    public Optional<EditorSnapshot> redo() {
        final var children = node(current).children();
        if (children.isEmpty()) {
            return Optional.empty();
        }
        int newest = children.get(0);
        for (final int child : children) {
            if (node(child).seq() > node(newest).seq()) {
                newest = child;
            }
        }
        current = newest;
        LOG.fine(() -> "Redo to index " + current);
        return Optional.of(node(current).snapshot().deepCopy());
    }

    public boolean canUndo() {
        return !node(current).isRoot();
    }

    public boolean canRedo() {
        return !node(current).children().isEmpty();
    }

    /// {@return a copy of the current checkpoint's snapshot}
    public EditorSnapshot currentSnapshot() {
        return node(current).snapshot().deepCopy();
    }

    /// Drops all history and starts again from `initial`.
    public void clear(EditorSnapshot initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        reset(initial);
    }

    public int current() {
        return current;
    }

    public int size() {
        return nodes.size();
    }

    public int limit() {
        return limit;
    }

    /// {@return the arena node at `index`}
    /// @throws IllegalStateException if `index` is not a valid arena index
    public UndoNode node(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IllegalStateException("Undo arena index " + index + " out of range [0, " + nodes.size() + ")");
        }
        return nodes.get(index);
    }

    private void reset(EditorSnapshot initial) {
        nodes.clear();
        nodes.add(new UndoNode(initial.deepCopy(), UndoNode.NO_PARENT, 0));
        current = 0;
        nextSeq = 1;
    }

    private void prune() {
        while (nodes.size() > limit) {
            final int victim = oldestEvictableLeaf();
            if (victim >= 0) {
                evict(victim);
            } else if (current != 0 && node(0).children().size() == 1) {
                dropRoot();
            } else {
                LOG.warning(() -> "Undo history over limit (" + nodes.size() + " > " + limit
                        + ") with nothing left to evict");
                return;
            }
        }
    }

    private int oldestEvictableLeaf() {
        final Set<Integer> protectedPath = new HashSet<>();
        for (int i = current; i != UndoNode.NO_PARENT; i = node(i).parent()) {
            protectedPath.add(i);
        }
        int victim = -1;
        for (int i = 0; i < nodes.size(); i++) {
            final var node = nodes.get(i);
            if (!node.children().isEmpty() || protectedPath.contains(i)) {
                continue;
            }
            if (victim < 0 || node.seq() < nodes.get(victim).seq()) {
                victim = i;
            }
        }
        return victim;
    }

    private void evict(int index) {
        final var victim = node(index);
        LOG.fine(() -> "Evicting undo checkpoint seq=" + victim.seq());
        node(victim.parent()).removeChild(index);
        nodes.remove(index);
        for (final var node : nodes) {
            node.shiftIndicesAbove(index);
        }
        if (current > index) {
            current--;
        }
    }

    /// Only called when the arena is a single chain from the root to current.
    /// Arena order follows creation order, so the root's child sits at index 1.
    private void dropRoot() {
        final int child = node(0).children().get(0);
        if (child != 1) {
            throw new IllegalStateException("Undo arena out of creation order: root child at " + child);
        }
        LOG.fine(() -> "Dropping oldest undo checkpoint seq=" + node(0).seq());
        nodes.remove(0);
        for (final var node : nodes) {
            node.shiftIndicesAbove(0);
        }
        node(0).detachFromParent();
        current--;
    }
}
