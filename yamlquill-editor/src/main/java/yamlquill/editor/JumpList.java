package yamlquill.editor;

import yamlquill.document.NodePath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Cursor history for jumping back and forward.
///
/// Recording a jump while somewhere in the middle of the list discards the
/// forward part. Recording the position already current is ignored. Past the
/// size cap the oldest entry is dropped.
public final class JumpList {

    public static final int DEFAULT_MAX_SIZE = 100;

    private final List<NodePath> jumps = new ArrayList<>();
    private final int maxSize;
    private int position;

    public JumpList() {
        this(DEFAULT_MAX_SIZE);
    }

    public JumpList(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    public void record(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        if (position < jumps.size() && jumps.get(position).equals(path)) {
            return;
        }
        if (position < jumps.size()) {
            jumps.subList(position + 1, jumps.size()).clear();
        }
        jumps.add(path);
        if (jumps.size() > maxSize) {
            jumps.remove(0);
        }
        position = jumps.size() - 1;
    }

    /// {@return the previous position, or empty at the oldest}
    public Optional<NodePath> back() {
        if (position == 0 || jumps.isEmpty()) {
            return Optional.empty();
        }
        position--;
        return Optional.of(jumps.get(position));
    }

    /// {@return the next position, or empty at the newest}
    public Optional<NodePath> forward() {
        if (position + 1 >= jumps.size()) {
            return Optional.empty();
        }
        position++;
        return Optional.of(jumps.get(position));
    }

    public int size() {
        return jumps.size();
    }

    public boolean isEmpty() {
        return jumps.isEmpty();
    }

    public int position() {
        return position;
    }

    public void clear() {
        jumps.clear();
        position = 0;
    }
}
