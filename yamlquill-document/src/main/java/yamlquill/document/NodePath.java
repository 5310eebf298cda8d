package yamlquill.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Positional address of a node, from the root down.
///
/// Each index selects the nth member of an object, or the nth element of an
/// array or multi-document stream. The empty path is the root.
///
/// Paths are positional: inserting or deleting an earlier sibling moves the
/// node to a different path.
public record NodePath(List<Integer> indices) {

    private static final NodePath ROOT = new NodePath(List.of());

    public NodePath {
        Objects.requireNonNull(indices, "indices must not be null");
        for (final var index : indices) {
            Objects.requireNonNull(index, "index must not be null");
            if (index < 0) {
                throw new IllegalArgumentException("path index must be non-negative: " + indices);
            }
        }
        indices = List.copyOf(indices);
    }

    /// {@return the empty path addressing the root}
    public static NodePath root() {
        return ROOT;
    }

    public static NodePath of(int... indices) {
        final var list = new ArrayList<Integer>(indices.length);
        for (final int index : indices) {
            list.add(index);
        }
        return new NodePath(list);
    }

    public int length() {
        return indices.size();
    }

    public boolean isRoot() {
        return indices.isEmpty();
    }

    public int get(int depth) {
        return indices.get(depth);
    }

    /// {@return the path of the containing node}
    /// @throws IllegalStateException for the root path
    public NodePath parent() {
        if (isRoot()) {
            throw new IllegalStateException("root path has no parent");
        }
        return new NodePath(indices.subList(0, indices.size() - 1));
    }

    /// {@return the index within the parent}
    /// @throws IllegalStateException for the root path
    public int lastIndex() {
        if (isRoot()) {
            throw new IllegalStateException("root path has no last index");
        }
        return indices.get(indices.size() - 1);
    }

    public NodePath child(int index) {
        final var list = new ArrayList<Integer>(indices.size() + 1);
        list.addAll(indices);
        list.add(index);
        return new NodePath(list);
    }

    /// {@return a copy of this path with the index at `depth` replaced}
    public NodePath withIndex(int depth, int index) {
        final var list = new ArrayList<>(indices);
        list.set(depth, index);
        return new NodePath(list);
    }

    /// {@return true if `other` equals this path or lies underneath it}
    public boolean isPrefixOf(NodePath other) {
        Objects.requireNonNull(other, "other must not be null");
        return other.indices.size() >= indices.size()
                && other.indices.subList(0, indices.size()).equals(indices);
    }

    @Override
    public String toString() {
        return indices.toString();
    }
}
