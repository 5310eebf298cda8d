package yamlquill.document;

import yamlquill.document.DocValue.AliasValue;
import yamlquill.document.DocValue.BooleanValue;
import yamlquill.document.DocValue.CommentValue;
import yamlquill.document.DocValue.Member;
import yamlquill.document.DocValue.MultiDocValue;
import yamlquill.document.DocValue.NullValue;
import yamlquill.document.DocValue.NumberValue;
import yamlquill.document.DocValue.ObjectValue;
import yamlquill.document.DocValue.Sequence;
import yamlquill.document.DocValue.StringValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Turns a [DocTree] back into JSON or YAML text.
///
/// With [FormatConfig#preserveFormatting()] on and a tree parsed from the same
/// dialect, every unmodified node that has a span is written as the exact
/// source text it was read from; an unmodified root reproduces the whole
/// source. Everything else is rendered canonically: `indentSize` spaces per
/// level, and containers holding only scalars go on one line when that line
/// fits in `compactWidth`.
///
/// JSON output drops comments and anchors and writes aliases as the string
/// `"*name"`. A multi-document root becomes JSON Lines in JSON and
/// `---`-separated documents in YAML.
public final class DocumentSerializer {

    private static final Logger LOG = Logger.getLogger(DocumentSerializer.class.getName());

    private static final Set<String> YAML_RESERVED = Set.of(
            "true", "false", "null", "~", "yes", "no", "on", "off", "y", "n");
    private static final String YAML_INDICATORS = "-?:,[]{}#&*!|>'\"%@`";

    private final FormatConfig config;
    private final DocumentFormat format;
    private final String source;

    private DocumentSerializer(FormatConfig config, DocumentFormat format, String source) {
        this.config = config;
        this.format = format;
        this.source = source;
    }

    /// Serializes `tree` in `format`.
    public static String serialize(DocTree tree, DocumentFormat format, FormatConfig config) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(config, "config must not be null");

        final var original = tree.originalSource().orElse(null);
        final var preservable = config.preserveFormatting()
                && original != null
                && tree.sourceFormat().orElse(null) == format;
        final var root = tree.root();
        if (preservable && !root.isModified()) {
            LOG.fine("Root unmodified, writing original source verbatim");
            return original;
        }

        final var serializer = new DocumentSerializer(config, format, preservable ? original : null);
        var out = root.value() instanceof MultiDocValue docs
                ? serializer.documents(docs)
                : serializer.topLevel(root);
        if (original != null && original.endsWith("\n") && !out.endsWith("\n")) {
            out = out + "\n";
        }
        LOG.fine(() -> "Serialized " + format + " document of " + root.value().typeName());
        return out;
    }

    /// Renders a detached node canonically, with no source to copy from.
    public static String render(DocNode node, DocumentFormat format, FormatConfig config) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return new DocumentSerializer(config, format, null).topLevel(node);
    }

    /// Renders a node as single-line JSON with no spaces, as used for JSON Lines.
    public static String toCompactJson(DocNode node) {
        Objects.requireNonNull(node, "node must not be null");
        final var value = node.value();
        if (value instanceof ObjectValue obj) {
            final var parts = new ArrayList<String>();
            for (final var member : obj.members()) {
                if (!member.node().isComment()) {
                    parts.add(quote(member.key()) + ":" + toCompactJson(member.node()));
                }
            }
            return "{" + String.join(",", parts) + "}";
        }
        if (value instanceof Sequence seq) {
            final var parts = new ArrayList<String>();
            for (final var element : seq.elements()) {
                if (!element.isComment()) {
                    parts.add(toCompactJson(element));
                }
            }
            return "[" + String.join(",", parts) + "]";
        }
        return jsonScalar(value);
    }

    private String topLevel(DocNode node) {
        if (format == DocumentFormat.JSON) {
            return json(node, 0);
        }
        final var anchor = node.anchor() != null ? "&" + node.anchor() : null;
        final var body = yaml(node, 0);
        if (body.startsWith("\n")) {
            return (anchor != null ? anchor : "") + body.substring(anchor != null ? 0 : 1) + "\n";
        }
        return (anchor != null ? anchor + " " : "") + body + "\n";
    }

    private String documents(MultiDocValue docs) {
        final var sb = new StringBuilder();
        for (int i = 0; i < docs.size(); i++) {
            final var doc = docs.element(i);
            if (format == DocumentFormat.JSON) {
                final var preserved = preserved(doc);
                sb.append(preserved != null && !preserved.contains("\n") ? preserved : toCompactJson(doc));
                sb.append('\n');
            } else {
                if (i > 0) {
                    sb.append("---\n");
                }
                sb.append(topLevel(doc));
            }
        }
        return sb.toString();
    }

    /// {@return the original text of an unmodified spanned node, or null}
    private String preserved(DocNode node) {
        if (source == null || node.isModified() || node.span() == null || !node.span().fitsWithin(source)) {
            return null;
        }
        return node.span().slice(source);
    }

    // JSON

    private String json(DocNode node, int depth) {
        final var preserved = preserved(node);
        if (preserved != null) {
            return preserved;
        }
        final var value = node.value();
        if (value instanceof ObjectValue obj) {
            final var members = visibleMembers(obj);
            if (members.isEmpty()) {
                return "{}";
            }
            if (members.stream().allMatch(m -> m.node().isScalar())) {
                final var parts = members.stream()
                        .map(m -> quote(m.key()) + ": " + jsonScalar(m.node().value()))
                        .toList();
                final var compact = "{" + String.join(", ", parts) + "}";
                if (compact.length() <= config.compactWidth()) {
                    return compact;
                }
            }
            final var indent = pad(depth);
            final var nextIndent = pad(depth + 1);
            final var sb = new StringBuilder("{\n");
            for (int i = 0; i < members.size(); i++) {
                final var member = members.get(i);
                sb.append(nextIndent).append(quote(member.key())).append(": ").append(json(member.node(), depth + 1));
                if (i < members.size() - 1) {
                    sb.append(',');
                }
                sb.append('\n');
            }
            return sb.append(indent).append('}').toString();
        }
        if (value instanceof Sequence seq) {
            final var elements = visibleElements(seq);
            if (elements.isEmpty()) {
                return "[]";
            }
            if (elements.stream().allMatch(DocNode::isScalar)) {
                final var parts = elements.stream().map(e -> jsonScalar(e.value())).toList();
                final var compact = "[" + String.join(", ", parts) + "]";
                if (compact.length() <= config.compactWidth()) {
                    return compact;
                }
            }
            final var indent = pad(depth);
            final var nextIndent = pad(depth + 1);
            final var sb = new StringBuilder("[\n");
            for (int i = 0; i < elements.size(); i++) {
                sb.append(nextIndent).append(json(elements.get(i), depth + 1));
                if (i < elements.size() - 1) {
                    sb.append(',');
                }
                sb.append('\n');
            }
            return sb.append(indent).append(']').toString();
        }
        return jsonScalar(value);
    }

    private static String jsonScalar(DocValue value) {
        if (value instanceof StringValue s) {
            return quote(s.text());
        }
        if (value instanceof NumberValue n) {
            return n.toText();
        }
        if (value instanceof BooleanValue b) {
            return Boolean.toString(b.value());
        }
        if (value instanceof AliasValue alias) {
            return quote("*" + alias.name());
        }
        if (value instanceof NullValue || value instanceof CommentValue) {
            return "null";
        }
        throw new IllegalArgumentException("not a scalar: " + value.typeName());
    }

    private static List<Member> visibleMembers(ObjectValue obj) {
        return obj.members().stream().filter(m -> !m.node().isComment()).toList();
    }

    private static List<DocNode> visibleElements(Sequence seq) {
        return seq.elements().stream().filter(e -> !e.isComment()).toList();
    }

    // YAML

    /// Renders `node` as the value part of a YAML entry whose children sit at
    /// `indent`. Block collections come back starting with a newline; anything
    /// else fits after `key: ` or `- `.
    private String yaml(DocNode node, int indent) {
        final var preserved = preserved(node);
        if (preserved != null && !preserved.contains("\n")) {
            return preserved;
        }
        final var value = node.value();
        if (value instanceof ObjectValue obj) {
            return yamlObject(obj, indent);
        }
        if (value instanceof Sequence seq) {
            return yamlSequence(seq, indent);
        }
        if (value instanceof StringValue s) {
            return yamlString(s, indent);
        }
        if (value instanceof AliasValue alias) {
            return "*" + alias.name();
        }
        if (value instanceof CommentValue comment) {
            return "# " + comment.content();
        }
        if (value instanceof NullValue) {
            return "null";
        }
        return jsonScalar(value);
    }

    private String yamlObject(ObjectValue obj, int indent) {
        final var visible = visibleMembers(obj);
        if (visible.isEmpty() && obj.isEmpty()) {
            return "{}";
        }
        if (!visible.isEmpty() && visible.size() == obj.size() && visible.stream().allMatch(m -> flowable(m.node()))) {
            final var parts = visible.stream()
                    .map(m -> yamlKey(m.key()) + ": " + anchorPrefix(m.node()) + flowScalar(m.node().value()))
                    .toList();
            final var flow = "{" + String.join(", ", parts) + "}";
            if (flow.length() <= config.compactWidth()) {
                return flow;
            }
        }
        final var lines = new ArrayList<String>();
        final var pad = " ".repeat(indent);
        for (final var member : obj.members()) {
            final var child = member.node();
            if (child.value() instanceof CommentValue comment) {
                addComment(lines, pad, comment);
                continue;
            }
            final var rendered = yaml(child, indent + config.indentSize());
            final var key = pad + yamlKey(member.key()) + ":";
            if (rendered.startsWith("\n")) {
                lines.add(key + (child.anchor() != null ? " &" + child.anchor() : "") + rendered);
            } else {
                lines.add(key + " " + anchorPrefix(child) + rendered);
            }
        }
        return "\n" + String.join("\n", lines);
    }

    private String yamlSequence(Sequence seq, int indent) {
        final var visible = visibleElements(seq);
        if (visible.isEmpty() && seq.isEmpty()) {
            return "[]";
        }
        if (!visible.isEmpty() && visible.size() == seq.size() && visible.stream().allMatch(DocumentSerializer::flowable)) {
            final var parts = visible.stream().map(e -> anchorPrefix(e) + flowScalar(e.value())).toList();
            final var flow = "[" + String.join(", ", parts) + "]";
            if (flow.length() <= config.compactWidth()) {
                return flow;
            }
        }
        final var lines = new ArrayList<String>();
        final var pad = " ".repeat(indent);
        final int step = config.indentSize();
        for (final var element : seq.elements()) {
            if (element.value() instanceof CommentValue comment) {
                addComment(lines, pad, comment);
                continue;
            }
            final var rendered = yaml(element, indent + step);
            if (!rendered.startsWith("\n")) {
                lines.add(pad + "- " + anchorPrefix(element) + rendered);
            } else if (element.anchor() != null || step < 2) {
                lines.add(pad + "-" + (element.anchor() != null ? " &" + element.anchor() : "") + rendered);
            } else {
                // first nested line moves up beside the dash
                final var nested = rendered.substring(1);
                lines.add(pad + "-" + " ".repeat(step - 1) + nested.substring(indent + step));
            }
        }
        return "\n" + String.join("\n", lines);
    }

    private String yamlString(StringValue s, int indent) {
        final var text = s.text();
        final var pad = " ".repeat(indent);
        if (s.style() == StringStyle.LITERAL && blockSafe(text)) {
            final var body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
            final var sb = new StringBuilder(text.endsWith("\n") ? "|" : "|-");
            for (final var line : body.split("\n", -1)) {
                sb.append('\n').append(line.isEmpty() ? "" : pad + line);
            }
            return sb.toString();
        }
        if (s.style() == StringStyle.FOLDED && blockSafe(text) && !text.contains("\n\n")) {
            final var body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
            final var sb = new StringBuilder(text.endsWith("\n") ? ">" : ">-");
            final var lines = body.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    sb.append('\n');
                }
                sb.append('\n').append(pad).append(lines[i]);
            }
            return sb.toString();
        }
        return flowScalar(s);
    }

    /// Block-styled strings keep their style, so they never go into flow collections.
    private static boolean flowable(DocNode node) {
        return node.isScalar()
                && !(node.value() instanceof StringValue s && s.style() != StringStyle.PLAIN);
    }

    private static boolean blockSafe(String text) {
        if (text.isEmpty() || text.startsWith(" ") || text.endsWith("\n\n")) {
            return false;
        }
        for (final var line : text.split("\n", -1)) {
            if (line.startsWith(" ") || line.endsWith(" ")) {
                return false;
            }
        }
        return text.chars().noneMatch(c -> c != '\n' && (c < 0x20 || c == 0x7f));
    }

    private static String flowScalar(DocValue value) {
        if (value instanceof StringValue s) {
            return needsQuotes(s.text()) ? quote(s.text()) : s.text();
        }
        if (value instanceof AliasValue alias) {
            return "*" + alias.name();
        }
        return jsonScalar(value);
    }

    private static String yamlKey(String key) {
        return needsQuotes(key) ? quote(key) : key;
    }

    private static String anchorPrefix(DocNode node) {
        return node.anchor() != null ? "&" + node.anchor() + " " : "";
    }

    private static void addComment(List<String> lines, String pad, CommentValue comment) {
        if (comment.position() == CommentPosition.LINE && !lines.isEmpty()) {
            final int last = lines.size() - 1;
            lines.set(last, lines.get(last) + "  # " + comment.content());
        } else {
            lines.add(pad + "# " + comment.content());
        }
    }

    /// Plain YAML scalars are only written when they cannot be misread as
    /// another type or as syntax.
    static boolean needsQuotes(String s) {
        if (s.isEmpty() || YAML_RESERVED.contains(s.toLowerCase(Locale.ROOT))) {
            return true;
        }
        final char first = s.charAt(0);
        if (YAML_INDICATORS.indexOf(first) >= 0 || Character.isWhitespace(first)
                || Character.isWhitespace(s.charAt(s.length() - 1))) {
            return true;
        }
        final char lead = (first == '+' && s.length() > 1) ? s.charAt(1) : first;
        if (Character.isDigit(lead) || lead == '.') {
            return true;
        }
        if (s.contains(": ") || s.contains(" #") || s.endsWith(":")) {
            return true;
        }
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c < 0x20 || c == 0x7f || ",[]{}".indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    static String quote(String s) {
        final var sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private String pad(int depth) {
        return " ".repeat(config.indentSize() * depth);
    }
}
