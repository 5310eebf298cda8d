package yamlquill.document;

import yamlquill.document.DocValue.Member;
import yamlquill.document.DocValue.ObjectValue;
import yamlquill.document.DocValue.Sequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// A document: a root [DocNode] plus, for parsed documents, the source text it
/// came from.
///
/// Nodes are addressed by [NodePath]. At each step an object index selects the
/// nth member and an array or multi-document index selects the nth element; a
/// scalar or an out-of-range index ends the walk with nothing.
///
/// Edits validate everything before touching the tree, so a failed
/// [EditResult] means nothing changed, modified flags included.
public final class DocTree {

    private static final Logger LOG = Logger.getLogger(DocTree.class.getName());

    private DocNode root;
    private final String originalSource;
    private final DocumentFormat sourceFormat;

    /// Creates a tree built in code: no source, so nothing can be copied verbatim on save.
    public DocTree(DocNode root) {
        this(root, null, null);
    }

    /// Creates a tree with the text it was parsed from.
    /// @param originalSource the full source text, or null
    /// @param sourceFormat the dialect of `originalSource`, or null when there is no source
    public DocTree(DocNode root, String originalSource, DocumentFormat sourceFormat) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.originalSource = originalSource;
        this.sourceFormat = sourceFormat;
    }

    public DocNode root() {
        return root;
    }

    /// {@return the root for mutation; marks it modified}
    public DocNode rootMut() {
        root.markModified();
        return root;
    }

    public Optional<String> originalSource() {
        return Optional.ofNullable(originalSource);
    }

    public Optional<DocumentFormat> sourceFormat() {
        return Optional.ofNullable(sourceFormat);
    }

    /// Looks up the node at `path` without side effects.
    public Optional<DocNode> getNode(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        var current = root;
        for (final int index : path.indices()) {
            final var next = child(current, index);
            if (next == null) {
                return Optional.empty();
            }
            current = next;
        }
        return Optional.of(current);
    }

    /// Looks up the node at `path` for mutation.
    ///
    /// Every node on the way, root and target included, is marked modified
    /// whether or not the caller then changes anything. Nothing is marked when
    /// the path does not resolve.
    public Optional<DocNode> getNodeMut(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        final var chain = resolveChain(path);
        if (chain == null) {
            return Optional.empty();
        }
        chain.forEach(DocNode::markModified);
        return Optional.of(chain.get(chain.size() - 1));
    }

    /// Removes the node at `path`; later siblings move up by one.
    public EditResult deleteNode(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isRoot()) {
            return EditResult.failure(new EditError.CannotDeleteRoot());
        }
        final var parentPath = path.parent();
        final int index = path.lastIndex();
        final var parent = getNode(parentPath);
        if (parent.isEmpty()) {
            return EditResult.failure(new EditError.ParentNotFound(parentPath));
        }

        final var value = parent.get().value();
        if (value instanceof ObjectValue obj) {
            if (index >= obj.size()) {
                return EditResult.failure(new EditError.IndexOutOfBounds(index, obj.size(), obj.typeName()));
            }
            getNodeMut(parentPath);
            obj.remove(index);
        } else if (value instanceof Sequence seq) {
            if (index >= seq.size()) {
                return EditResult.failure(new EditError.IndexOutOfBounds(index, seq.size(), seq.typeName()));
            }
            getNodeMut(parentPath);
            seq.remove(index);
        } else {
            return EditResult.failure(new EditError.NotAContainer(value.typeName()));
        }

        LOG.fine(() -> "Deleted node at " + path);
        return EditResult.success();
    }

    /// Inserts `key: node` into an object.
    ///
    /// The last path element is the insertion index inside the object found
    /// at the rest of the path; inserting at the current size appends. The
    /// empty path inserts at position 0 of the root.
    public EditResult insertNodeInObject(NodePath path, String key, DocNode node) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(node, "node must not be null");
        final var targetPath = path.isRoot() ? path : path.parent();
        final int index = path.isRoot() ? 0 : path.lastIndex();

        final var target = getNode(targetPath);
        if (target.isEmpty()) {
            return EditResult.failure(new EditError.ParentNotFound(targetPath));
        }
        if (!(target.get().value() instanceof ObjectValue obj)) {
            return EditResult.failure(new EditError.NotAnObject(target.get().value().typeName()));
        }
        if (index > obj.size()) {
            return EditResult.failure(new EditError.IndexOutOfBounds(index, obj.size(), obj.typeName()));
        }
        if (obj.containsKey(key)) {
            return EditResult.failure(new EditError.DuplicateKey(key));
        }

        getNodeMut(targetPath);
        obj.insert(index, new Member(key, node));
        LOG.fine(() -> "Inserted member '" + key + "' at " + path);
        return EditResult.success();
    }

    /// Inserts `node` into an array or multi-document stream, addressed the
    /// same way as [#insertNodeInObject(NodePath, String, DocNode)].
    public EditResult insertNodeInArray(NodePath path, DocNode node) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(node, "node must not be null");
        final var targetPath = path.isRoot() ? path : path.parent();
        final int index = path.isRoot() ? 0 : path.lastIndex();

        final var target = getNode(targetPath);
        if (target.isEmpty()) {
            return EditResult.failure(new EditError.ParentNotFound(targetPath));
        }
        if (!(target.get().value() instanceof Sequence seq)) {
            return EditResult.failure(new EditError.NotAnArray(target.get().value().typeName()));
        }
        if (index > seq.size()) {
            return EditResult.failure(new EditError.IndexOutOfBounds(index, seq.size(), seq.typeName()));
        }

        getNodeMut(targetPath);
        seq.insert(index, node);
        LOG.fine(() -> "Inserted element at " + path);
        return EditResult.success();
    }

    /// Puts `node` in place of the node at `path`, keeping the member key when
    /// the parent is an object. The empty path replaces the root.
    public EditResult replaceNode(NodePath path, DocNode node) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(node, "node must not be null");
        if (path.isRoot()) {
            root = node;
            LOG.fine("Replaced root node");
            return EditResult.success();
        }
        final var parentPath = path.parent();
        final int index = path.lastIndex();
        final var parent = getNode(parentPath);
        if (parent.isEmpty()) {
            return EditResult.failure(new EditError.ParentNotFound(parentPath));
        }

        final var value = parent.get().value();
        if (value instanceof ObjectValue obj) {
            if (index >= obj.size()) {
                return EditResult.failure(new EditError.IndexOutOfBounds(index, obj.size(), obj.typeName()));
            }
            getNodeMut(parentPath);
            obj.set(index, new Member(obj.member(index).key(), node));
        } else if (value instanceof Sequence seq) {
            if (index >= seq.size()) {
                return EditResult.failure(new EditError.IndexOutOfBounds(index, seq.size(), seq.typeName()));
            }
            getNodeMut(parentPath);
            seq.set(index, node);
        } else {
            return EditResult.failure(new EditError.NotAContainer(value.typeName()));
        }
        LOG.fine(() -> "Replaced node at " + path);
        return EditResult.success();
    }

    /// Renames the object member at `path`, keeping its position and node.
    public EditResult renameKey(NodePath path, String newKey) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(newKey, "newKey must not be null");
        if (path.isRoot()) {
            return EditResult.failure(new EditError.NotAnObject("root"));
        }
        final var parentPath = path.parent();
        final int index = path.lastIndex();
        final var parent = getNode(parentPath);
        if (parent.isEmpty()) {
            return EditResult.failure(new EditError.ParentNotFound(parentPath));
        }
        if (!(parent.get().value() instanceof ObjectValue obj)) {
            return EditResult.failure(new EditError.NotAnObject(parent.get().value().typeName()));
        }
        if (index >= obj.size()) {
            return EditResult.failure(new EditError.IndexOutOfBounds(index, obj.size(), obj.typeName()));
        }
        final int existing = obj.indexOf(newKey);
        if (existing >= 0 && existing != index) {
            return EditResult.failure(new EditError.DuplicateKey(newKey));
        }

        getNodeMut(parentPath);
        obj.set(index, new Member(newKey, obj.member(index).node()));
        LOG.fine(() -> "Renamed key at " + path + " to '" + newKey + "'");
        return EditResult.success();
    }

    /// {@return the member key of the node at `path` when its parent is an object}
    public Optional<String> keyAt(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isRoot()) {
            return Optional.empty();
        }
        return getNode(path.parent())
                .map(DocNode::value)
                .filter(ObjectValue.class::isInstance)
                .map(ObjectValue.class::cast)
                .filter(obj -> path.lastIndex() < obj.size())
                .map(obj -> obj.member(path.lastIndex()).key());
    }

    /// {@return an independent copy sharing only the immutable source text}
    public DocTree deepCopy() {
        return new DocTree(root.deepCopy(), originalSource, sourceFormat);
    }

    private List<DocNode> resolveChain(NodePath path) {
        final var chain = new ArrayList<DocNode>(path.length() + 1);
        var current = root;
        chain.add(current);
        for (final int index : path.indices()) {
            current = child(current, index);
            if (current == null) {
                return null;
            }
            chain.add(current);
        }
        return chain;
    }

    private static DocNode child(DocNode node, int index) {
        final var value = node.value();
        if (value instanceof ObjectValue obj) {
            return index < obj.size() ? obj.member(index).node() : null;
        }
        if (value instanceof Sequence seq) {
            return index < seq.size() ? seq.element(index) : null;
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocTree other)) return false;
        return root.equals(other.root)
                && Objects.equals(originalSource, other.originalSource)
                && sourceFormat == other.sourceFormat;
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, originalSource, sourceFormat);
    }

    @Override
    public String toString() {
        return "DocTree[root=" + root + ", hasSource=" + (originalSource != null) + "]";
    }
}
