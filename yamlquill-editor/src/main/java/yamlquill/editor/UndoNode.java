package yamlquill.editor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// One checkpoint in an [UndoTree] arena. Links are arena indices; the root has parent -1.
public final class UndoNode {

    static final int NO_PARENT = -1;

    private final EditorSnapshot snapshot;
    private int parent;
    private final List<Integer> children = new ArrayList<>();
    private final Instant timestamp;
    private final long seq;

    UndoNode(EditorSnapshot snapshot, int parent, long seq) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot must not be null");
        this.parent = parent;
        this.seq = seq;
        this.timestamp = Instant.now();
    }

    EditorSnapshot snapshot() {
        return snapshot;
    }

    /// {@return the parent index, or -1 for the root}
    public int parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == NO_PARENT;
    }

    public List<Integer> children() {
        return Collections.unmodifiableList(children);
    }

    public Instant timestamp() {
        return timestamp;
    }

    /// {@return the creation number; never reused within one tree}
    public long seq() {
        return seq;
    }

    void addChild(int index) {
        children.add(index);
    }

    void removeChild(int index) {
        children.remove(Integer.valueOf(index));
    }

    void detachFromParent() {
        parent = NO_PARENT;
    }

    /// Re-points links after the arena slot `removed` was compacted away.
    void shiftIndicesAbove(int removed) {
        if (parent > removed) {
            parent--;
        }
        children.replaceAll(child -> child > removed ? child - 1 : child);
    }

    @Override
    public String toString() {
        return "UndoNode[seq=" + seq + ", parent=" + parent + ", children=" + children + "]";
    }
}
