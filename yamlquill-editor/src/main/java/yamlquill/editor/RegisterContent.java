package yamlquill.editor;

import yamlquill.document.DocNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Captured nodes plus, position for position, the member key each one had.
/// A null key means the node came from an array or was the root.
///
/// Nodes are deep copied on the way in, so editing the tree afterwards never
/// changes what a register holds.
public record RegisterContent(List<DocNode> nodes, List<String> keys) {

    private static final RegisterContent EMPTY = new RegisterContent(List.of(), List.of());

    public RegisterContent {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(keys, "keys must not be null");
        if (nodes.size() != keys.size()) {
            throw new IllegalArgumentException(
                    "nodes and keys must have the same length: " + nodes.size() + " != " + keys.size());
        }
        final var copies = new ArrayList<DocNode>(nodes.size());
        for (final var node : nodes) {
            copies.add(Objects.requireNonNull(node, "nodes must not contain null").deepCopy());
        }
        nodes = Collections.unmodifiableList(copies);
        keys = Collections.unmodifiableList(new ArrayList<>(keys));
    }

    public static RegisterContent empty() {
        return EMPTY;
    }

    /// {@return content holding a single node}
    /// @param key the member key, or null
    public static RegisterContent of(DocNode node, String key) {
        final var keys = new ArrayList<String>(1);
        keys.add(key);
        return new RegisterContent(List.of(node), keys);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    /// {@return this content followed by `other`}
    public RegisterContent append(RegisterContent other) {
        Objects.requireNonNull(other, "other must not be null");
        final var allNodes = new ArrayList<DocNode>(nodes);
        allNodes.addAll(other.nodes);
        final var allKeys = new ArrayList<String>(keys);
        allKeys.addAll(other.keys);
        return new RegisterContent(allNodes, allKeys);
    }
}
