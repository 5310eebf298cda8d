package yamlquill.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// The value held by a [DocNode].
///
/// Containers ([ObjectValue], [ArrayValue], [MultiDocValue]) own their child
/// nodes and are mutated in place through [DocTree]. Scalars are immutable
/// records; changing a scalar means replacing the node's value.
///
/// Variants:
/// - [ObjectValue]: ordered members with unique keys, addressed by position
/// - [ArrayValue]: ordered elements
/// - [StringValue]: text plus a [StringStyle]
/// - [IntegerNumber] / [FloatNumber]: kept apart so `42` and `42.0` stay distinct
/// - [BooleanValue], [NullValue]
/// - [AliasValue]: `*name` reference to an anchor, resolved through [AnchorRegistry]
/// - [CommentValue]: comment text with its [CommentPosition]
/// - [MultiDocValue]: stream of independent top-level documents
public sealed interface DocValue permits
        DocValue.ObjectValue,
        DocValue.Sequence,
        DocValue.StringValue,
        DocValue.NumberValue,
        DocValue.BooleanValue,
        DocValue.NullValue,
        DocValue.AliasValue,
        DocValue.CommentValue {

    /// {@return an independent copy; container children are deep copied with their metadata}
    DocValue deepCopy();

    /// {@return short lower-case type name for messages}
    String typeName();

    default boolean isContainer() {
        return this instanceof ObjectValue || this instanceof Sequence;
    }

    /// One key/node pair of an [ObjectValue].
    record Member(String key, DocNode node) {
        public Member {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(node, "node must not be null");
        }

        public static Member of(String key, DocNode node) {
            return new Member(key, node);
        }

        Member deepCopy() {
            return new Member(key, node.deepCopy());
        }
    }

    /// Ordered key/value members. Positional access is O(1); lookup by key is a
    /// linear scan because order, not hashing, is what the document means.
    final class ObjectValue implements DocValue {

        private final ArrayList<Member> members;

        public ObjectValue(List<Member> members) {
            Objects.requireNonNull(members, "members must not be null");
            final var seen = new HashSet<String>();
            for (final var member : members) {
                Objects.requireNonNull(member, "member must not be null");
                if (!seen.add(member.key())) {
                    throw new IllegalArgumentException("duplicate key: " + member.key());
                }
            }
            this.members = new ArrayList<>(members);
        }

        public static ObjectValue empty() {
            return new ObjectValue(List.of());
        }

        public List<Member> members() {
            return Collections.unmodifiableList(members);
        }

        public int size() {
            return members.size();
        }

        public boolean isEmpty() {
            return members.isEmpty();
        }

        public Member member(int index) {
            return members.get(index);
        }

        /// {@return position of `key`, or -1 if absent}
        public int indexOf(String key) {
            for (int i = 0; i < members.size(); i++) {
                if (members.get(i).key().equals(key)) {
                    return i;
                }
            }
            return -1;
        }

        public Optional<DocNode> get(String key) {
            final int index = indexOf(key);
            return index < 0 ? Optional.empty() : Optional.of(members.get(index).node());
        }

        public boolean containsKey(String key) {
            return indexOf(key) >= 0;
        }

        void insert(int index, Member member) {
            members.add(index, member);
        }

        Member remove(int index) {
            return members.remove(index);
        }

        void set(int index, Member member) {
            members.set(index, member);
        }

        @Override
        public ObjectValue deepCopy() {
            final var copy = new ArrayList<Member>(members.size());
            for (final var member : members) {
                copy.add(member.deepCopy());
            }
            return new ObjectValue(copy);
        }

        @Override
        public String typeName() {
            return "object";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ObjectValue other && members.equals(other.members);
        }

        @Override
        public int hashCode() {
            return members.hashCode();
        }

        @Override
        public String toString() {
            return "ObjectValue" + members;
        }
    }

    /// Positionally indexed node lists: arrays and multi-document streams.
    abstract sealed class Sequence implements DocValue permits ArrayValue, MultiDocValue {

        private final ArrayList<DocNode> elements;

        Sequence(List<DocNode> elements) {
            Objects.requireNonNull(elements, "elements must not be null");
            elements.forEach(e -> Objects.requireNonNull(e, "element must not be null"));
            this.elements = new ArrayList<>(elements);
        }

        /// {@return a read-only view of the elements}
        public List<DocNode> elements() {
            return Collections.unmodifiableList(elements);
        }

        public int size() {
            return elements.size();
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        public DocNode element(int index) {
            return elements.get(index);
        }

        void insert(int index, DocNode node) {
            elements.add(index, Objects.requireNonNull(node, "node must not be null"));
        }

        DocNode remove(int index) {
            return elements.remove(index);
        }

        void set(int index, DocNode node) {
            elements.set(index, Objects.requireNonNull(node, "node must not be null"));
        }

        List<DocNode> copyElements() {
            return elements.stream().map(DocNode::deepCopy).toList();
        }

        @Override
        public boolean equals(Object o) {
            return o != null && o.getClass() == getClass() && elements.equals(((Sequence) o).elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + elements;
        }
    }

    final class ArrayValue extends Sequence {

        public ArrayValue(List<DocNode> elements) {
            super(elements);
        }

        public static ArrayValue empty() {
            return new ArrayValue(List.of());
        }

        @Override
        public ArrayValue deepCopy() {
            return new ArrayValue(copyElements());
        }

        @Override
        public String typeName() {
            return "array";
        }
    }

    /// A stream of top-level documents (YAML `---` separated, or JSON Lines).
    final class MultiDocValue extends Sequence {

        public MultiDocValue(List<DocNode> documents) {
            super(documents);
        }

        @Override
        public MultiDocValue deepCopy() {
            return new MultiDocValue(copyElements());
        }

        @Override
        public String typeName() {
            return "multi-document";
        }
    }

    /// String scalar. Equality looks at the text only.
    record StringValue(String text, StringStyle style) implements DocValue {
        public StringValue {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(style, "style must not be null");
        }

        public static StringValue plain(String text) {
            return new StringValue(text, StringStyle.PLAIN);
        }

        @Override
        public StringValue deepCopy() {
            return this;
        }

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StringValue other && text.equals(other.text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }
    }

    /// Numeric scalar. The source lexeme, when known, is what gets written back.
    sealed interface NumberValue extends DocValue permits IntegerNumber, FloatNumber {

        /// {@return the text written for this number}
        String toText();

        double doubleValue();

        @Override
        default NumberValue deepCopy() {
            return this;
        }

        @Override
        default String typeName() {
            return "number";
        }
    }

    /// Whole number; `lexeme` may be null for values built in code.
    record IntegerNumber(long value, String lexeme) implements NumberValue {

        public static IntegerNumber of(long value) {
            return new IntegerNumber(value, null);
        }

        @Override
        public String toText() {
            return lexeme != null ? lexeme : Long.toString(value);
        }

        @Override
        public double doubleValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntegerNumber other && value == other.value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }
    }

    /// Floating-point number; always written with a fraction or exponent.
    record FloatNumber(double value, String lexeme) implements NumberValue {

        public FloatNumber {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("number must be finite: " + value);
            }
        }

        public static FloatNumber of(double value) {
            return new FloatNumber(value, null);
        }

        @Override
        public String toText() {
            return lexeme != null ? lexeme : Double.toString(value);
        }

        @Override
        public double doubleValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FloatNumber other && Double.compare(value, other.value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }
    }

    record BooleanValue(boolean value) implements DocValue {

        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);

        public static BooleanValue of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public BooleanValue deepCopy() {
            return this;
        }

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    record NullValue() implements DocValue {

        public static final NullValue INSTANCE = new NullValue();

        @Override
        public NullValue deepCopy() {
            return this;
        }

        @Override
        public String typeName() {
            return "null";
        }
    }

    /// Leaf reference to the anchor called `name`. The tree never shares
    /// subtrees; aliases are looked up on demand.
    record AliasValue(String name) implements DocValue {
        public AliasValue {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public AliasValue deepCopy() {
            return this;
        }

        @Override
        public String typeName() {
            return "alias";
        }
    }

    record CommentValue(String content, CommentPosition position) implements DocValue {
        public CommentValue {
            Objects.requireNonNull(content, "content must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public CommentValue deepCopy() {
            return this;
        }

        @Override
        public String typeName() {
            return "comment";
        }
    }
}
