package yamlquill.document;

import java.util.Objects;

/// Bookkeeping carried by every [DocNode] next to its value.
///
/// - `span`: location in the original source, null for nodes that never had one
/// - `modified`: once true, the node is re-serialized instead of copied from source
/// - `anchor`: anchor name this node defines (`&name`), or null
/// - `aliasTarget`: anchor name this node refers to (`*name`), or null
public final class NodeMetadata {

    private TextSpan span;
    private boolean modified;
    private String anchor;
    private String aliasTarget;

    NodeMetadata(TextSpan span, boolean modified) {
        this.span = span;
        this.modified = modified;
    }

    public TextSpan span() {
        return span;
    }

    public boolean modified() {
        return modified;
    }

    public String anchor() {
        return anchor;
    }

    public String aliasTarget() {
        return aliasTarget;
    }

    void markModified() {
        modified = true;
    }

    void setSpan(TextSpan span) {
        this.span = span;
    }

    void setAnchor(String anchor) {
        this.anchor = anchor;
    }

    void setAliasTarget(String aliasTarget) {
        this.aliasTarget = aliasTarget;
    }

    NodeMetadata copy() {
        final var copy = new NodeMetadata(span, modified);
        copy.anchor = anchor;
        copy.aliasTarget = aliasTarget;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeMetadata other)) return false;
        return modified == other.modified
                && Objects.equals(span, other.span)
                && Objects.equals(anchor, other.anchor)
                && Objects.equals(aliasTarget, other.aliasTarget);
    }

    @Override
    public int hashCode() {
        return Objects.hash(span, modified, anchor, aliasTarget);
    }

    @Override
    public String toString() {
        return "NodeMetadata[span=" + span + ", modified=" + modified
                + ", anchor=" + anchor + ", aliasTarget=" + aliasTarget + "]";
    }
}
