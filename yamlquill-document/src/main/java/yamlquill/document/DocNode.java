package yamlquill.document;

import yamlquill.document.DocValue.AliasValue;
import yamlquill.document.DocValue.ArrayValue;
import yamlquill.document.DocValue.BooleanValue;
import yamlquill.document.DocValue.CommentValue;
import yamlquill.document.DocValue.FloatNumber;
import yamlquill.document.DocValue.IntegerNumber;
import yamlquill.document.DocValue.Member;
import yamlquill.document.DocValue.NullValue;
import yamlquill.document.DocValue.ObjectValue;
import yamlquill.document.DocValue.StringValue;

import java.util.Arrays;
import java.util.Objects;

/// A [DocValue] plus its [NodeMetadata].
///
/// A node built in code is always `modified` with no span. Any mutable access,
/// through [#valueMut()] or [#setValue(DocValue)], sets `modified` and it is
/// never cleared again; the serializer then re-renders the node instead of
/// copying its source text.
public final class DocNode {

    private DocValue value;
    private final NodeMetadata metadata;

    private DocNode(DocValue value, NodeMetadata metadata) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.metadata = metadata;
    }

    /// Creates a new node: modified, no span.
    public static DocNode of(DocValue value) {
        return new DocNode(value, new NodeMetadata(null, true));
    }

    /// Creates a node as a parser would: unmodified, located at `span`.
    public static DocNode parsed(DocValue value, TextSpan span) {
        Objects.requireNonNull(span, "span must not be null");
        return new DocNode(value, new NodeMetadata(span, false));
    }

    public static DocNode string(String text) {
        return of(StringValue.plain(text));
    }

    public static DocNode integer(long value) {
        return of(IntegerNumber.of(value));
    }

    public static DocNode decimal(double value) {
        return of(FloatNumber.of(value));
    }

    public static DocNode bool(boolean value) {
        return of(BooleanValue.of(value));
    }

    public static DocNode nullNode() {
        return of(NullValue.INSTANCE);
    }

    public static DocNode alias(String anchorName) {
        final var node = of(new AliasValue(anchorName));
        node.metadata.setAliasTarget(anchorName);
        return node;
    }

    public static DocNode comment(String content, CommentPosition position) {
        return of(new CommentValue(content, position));
    }

    public static DocNode object(Member... members) {
        return of(new ObjectValue(Arrays.asList(members)));
    }

    public static DocNode array(DocNode... elements) {
        return of(new ArrayValue(Arrays.asList(elements)));
    }

    /// {@return the value, read-only access; does not touch the modified flag}
    public DocValue value() {
        return value;
    }

    /// {@return the value for in-place mutation; marks this node modified}
    public DocValue valueMut() {
        metadata.markModified();
        return value;
    }

    /// Replaces the value and marks this node modified. The alias target
    /// follows the new value: an [AliasValue] names it, anything else clears it.
    public void setValue(DocValue value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        metadata.setAliasTarget(value instanceof AliasValue alias ? alias.name() : null);
        metadata.markModified();
    }

    public NodeMetadata metadata() {
        return metadata;
    }

    public boolean isModified() {
        return metadata.modified();
    }

    public TextSpan span() {
        return metadata.span();
    }

    public String anchor() {
        return metadata.anchor();
    }

    /// Sets or clears (with null) the anchor name defined by this node.
    public void setAnchor(String anchor) {
        metadata.setAnchor(anchor);
    }

    public String aliasTarget() {
        return metadata.aliasTarget();
    }

    /// Sets or clears (with null) the anchor this node refers to.
    public void setAliasTarget(String aliasTarget) {
        metadata.setAliasTarget(aliasTarget);
    }

    void markModified() {
        metadata.markModified();
    }

    public boolean isContainer() {
        return value.isContainer();
    }

    public boolean isComment() {
        return value instanceof CommentValue;
    }

    public boolean isScalar() {
        return !value.isContainer();
    }

    /// {@return a detached copy of this subtree, metadata included}
    public DocNode deepCopy() {
        return new DocNode(value.deepCopy(), metadata.copy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocNode other)) return false;
        return value.equals(other.value) && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, metadata);
    }

    @Override
    public String toString() {
        return "DocNode[" + value + (metadata.modified() ? ", modified" : "") + "]";
    }
}
