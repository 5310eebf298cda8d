package yamlquill.editor;

import yamlquill.document.DocTree;
import yamlquill.document.NodePath;

import java.util.Objects;

/// A document and cursor, as captured by an undo checkpoint.
public record EditorSnapshot(DocTree tree, NodePath cursor) {

    public EditorSnapshot {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(cursor, "cursor must not be null");
    }

    /// {@return a snapshot whose tree shares no nodes with this one}
    public EditorSnapshot deepCopy() {
        return new EditorSnapshot(tree.deepCopy(), cursor);
    }
}
