package yamlquill.document;

import org.yaml.snakeyaml.DumperOptions.ScalarStyle;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.comments.CommentType;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.events.AliasEvent;
import org.yaml.snakeyaml.events.CommentEvent;
import org.yaml.snakeyaml.events.DocumentEndEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.NodeEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.events.StreamStartEvent;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.parser.Parser;
import org.yaml.snakeyaml.parser.ParserImpl;
import org.yaml.snakeyaml.reader.StreamReader;
import org.yaml.snakeyaml.resolver.Resolver;
import yamlquill.document.DocValue.AliasValue;
import yamlquill.document.DocValue.ArrayValue;
import yamlquill.document.DocValue.BooleanValue;
import yamlquill.document.DocValue.CommentValue;
import yamlquill.document.DocValue.FloatNumber;
import yamlquill.document.DocValue.IntegerNumber;
import yamlquill.document.DocValue.Member;
import yamlquill.document.DocValue.MultiDocValue;
import yamlquill.document.DocValue.NullValue;
import yamlquill.document.DocValue.ObjectValue;
import yamlquill.document.DocValue.Sequence;
import yamlquill.document.DocValue.StringValue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Builds a [DocTree] from YAML text, walking SnakeYAML's event stream.
///
/// Events rather than composed nodes, because composing resolves aliases
/// into shared objects and loses where each occurrence sits. Each node gets
/// the span of its value text (anchor and tag excluded). Comments become
/// [CommentValue] entries of the enclosing collection, under `__comment_N`
/// keys in mappings. More than one document gives a [MultiDocValue] root.
final class YamlDocumentReader {

    private static final Logger LOG = Logger.getLogger(YamlDocumentReader.class.getName());

    static final String COMMENT_KEY_PREFIX = "__comment_";

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on");
    private static final Pattern JSON_NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");

    private final String text;
    private final List<Event> events;
    private final int[] charOffsets;
    private final Resolver resolver = new Resolver();
    private final Set<String> anchorsDefined = new HashSet<>();
    private int pos;

    private YamlDocumentReader(String text, List<Event> events) {
        this.text = text;
        this.events = events;
        this.charOffsets = codePointOffsets(text);
    }

    static DocTree read(String text) {
        final var reader = new YamlDocumentReader(text, scan(text));
        return reader.stream();
    }

    private static List<Event> scan(String text) {
        final var options = new LoaderOptions();
        options.setProcessComments(true);
        final Parser parser = new ParserImpl(new StreamReader(text), options);
        final var events = new ArrayList<Event>();
        try {
            Event event;
            do {
                event = parser.getEvent();
                events.add(event);
            } while (!(event instanceof StreamEndEvent));
        } catch (MarkedYAMLException e) {
            final var mark = e.getProblemMark() != null ? e.getProblemMark() : e.getContextMark();
            final var problem = e.getProblem() != null ? e.getProblem() : e.getContext();
            if (mark == null) {
                throw new DocumentParseException(problem, 1, 1, 0);
            }
            LOG.fine(() -> "YAML syntax error: " + problem + " at " + mark.getLine() + ":" + mark.getColumn());
            throw new DocumentParseException(problem, mark.getLine() + 1, mark.getColumn() + 1,
                    Math.min(mark.getIndex(), text.length()));
        } catch (YAMLException e) {
            throw new DocumentParseException(e.getMessage(), 1, 1, 0);
        }
        LOG.finer(() -> "Scanned " + events.size() + " YAML events");
        return events;
    }

    private DocTree stream() {
        expect(StreamStartEvent.class, "stream start");
        final var documents = new ArrayList<DocNode>();
        final var pending = new ArrayList<DocNode>();
        while (true) {
            pending.addAll(comments());
            if (peek() instanceof StreamEndEvent) {
                break;
            }
            expect(DocumentStartEvent.class, "document start");
            anchorsDefined.clear();
            pending.addAll(comments());
            final var root = node();
            final var trailing = comments();
            expect(DocumentEndEvent.class, "document end");
            attach(root, pending, true);
            pending.clear();
            attach(root, trailing, false);
            documents.add(root);
        }
        if (!pending.isEmpty() && !documents.isEmpty()) {
            attach(documents.get(documents.size() - 1), pending, false);
        }

        final DocNode root;
        if (documents.isEmpty()) {
            root = DocNode.parsed(NullValue.INSTANCE, new TextSpan(0, 0));
        } else if (documents.size() == 1) {
            root = documents.get(0);
        } else {
            root = DocNode.parsed(new MultiDocValue(documents), new TextSpan(0, text.length()));
        }
        LOG.fine(() -> "Parsed YAML stream of " + documents.size() + " document(s)");
        return new DocTree(root, text, DocumentFormat.YAML);
    }

    private DocNode node() {
        return node(List.of());
    }

    /// Reads one value. `leading` comments go to the front of a collection
    /// value, or are dropped for a scalar.
    private DocNode node(List<DocNode> leading) {
        final var event = next();
        if (event instanceof ScalarEvent scalar) {
            final var node = DocNode.parsed(scalarValue(scalar), valueSpan(scalar, scalar.getEndMark()));
            return define(node, scalar);
        }
        if (event instanceof AliasEvent alias) {
            final var name = alias.getAnchor();
            if (!anchorsDefined.contains(name)) {
                throw error("Undefined alias '*" + name + "'", alias);
            }
            final var node = DocNode.parsed(new AliasValue(name), span(alias.getStartMark(), alias.getEndMark()));
            node.setAliasTarget(name);
            return node;
        }
        final DocNode collection;
        if (event instanceof MappingStartEvent mapping) {
            collection = mapping(mapping);
        } else if (event instanceof SequenceStartEvent sequence) {
            collection = sequence(sequence);
        } else {
            throw error("Expected a value", event);
        }
        attach(collection, leading, true);
        return collection;
    }

    private DocNode mapping(MappingStartEvent start) {
        if (start.getAnchor() != null) {
            anchorsDefined.add(start.getAnchor());
        }
        final var keys = new ArrayList<String>();
        final var nodes = new ArrayList<DocNode>();
        final var realKeys = new HashSet<String>();
        Event end;
        while (true) {
            for (final var comment : comments()) {
                keys.add(null);
                nodes.add(comment);
            }
            end = next();
            if (end instanceof MappingEndEvent) {
                break;
            }
            if (!(end instanceof ScalarEvent keyEvent)) {
                throw error("Only scalar keys are supported", end);
            }
            final var key = keyEvent.getValue();
            if (!realKeys.add(key)) {
                throw error("Duplicate key '" + key + "'", keyEvent);
            }
            // comments between a key and its value: a trailing one stays above
            // the entry, full-line ones open a collection value
            final var inside = new ArrayList<DocNode>();
            for (final var comment : comments()) {
                if (comment.value() instanceof CommentValue value && value.position() == CommentPosition.LINE) {
                    keys.add(null);
                    nodes.add(DocNode.parsed(new CommentValue(value.content(), CommentPosition.ABOVE), comment.span()));
                } else {
                    inside.add(comment);
                }
            }
            final var collectionNext = peek() instanceof MappingStartEvent || peek() instanceof SequenceStartEvent;
            if (!collectionNext) {
                for (final var comment : inside) {
                    keys.add(null);
                    nodes.add(comment);
                }
            }
            keys.add(key);
            nodes.add(node(collectionNext ? inside : List.of()));
        }

        final var members = new ArrayList<Member>(nodes.size());
        int counter = 0;
        for (int i = 0; i < nodes.size(); i++) {
            var key = keys.get(i);
            if (key == null) {
                do {
                    key = COMMENT_KEY_PREFIX + counter++;
                } while (realKeys.contains(key));
            }
            members.add(Member.of(key, nodes.get(i)));
        }
        LOG.finer(() -> "Parsed mapping with " + members.size() + " entries");
        return define(DocNode.parsed(new ObjectValue(members), valueSpan(start, end.getEndMark())), start);
    }

    private DocNode sequence(SequenceStartEvent start) {
        if (start.getAnchor() != null) {
            anchorsDefined.add(start.getAnchor());
        }
        final var elements = new ArrayList<DocNode>();
        Event end;
        while (true) {
            elements.addAll(comments());
            if (peek() instanceof SequenceEndEvent) {
                end = next();
                break;
            }
            elements.add(node());
        }
        LOG.finer(() -> "Parsed sequence with " + elements.size() + " entries");
        return define(DocNode.parsed(new ArrayValue(elements), valueSpan(start, end.getEndMark())), start);
    }

    private DocNode define(DocNode node, NodeEvent event) {
        final var anchor = event.getAnchor();
        if (anchor != null) {
            node.setAnchor(anchor);
            anchorsDefined.add(anchor);
        }
        return node;
    }

    /// Drains consecutive comment events. A run of full-line comments with a
    /// blank line on both sides is standalone; one that closes its collection
    /// sits below; otherwise above.
    private List<DocNode> comments() {
        final var run = new ArrayList<CommentEvent>();
        while (peek() instanceof CommentEvent comment) {
            run.add(comment);
            pos++;
        }
        if (run.isEmpty()) {
            return List.of();
        }
        final var closing = peek() instanceof MappingEndEvent
                || peek() instanceof SequenceEndEvent
                || peek() instanceof DocumentEndEvent
                || peek() instanceof StreamEndEvent;

        final var out = new ArrayList<DocNode>();
        int i = 0;
        while (i < run.size()) {
            final var event = run.get(i);
            if (event.getCommentType() == CommentType.BLANK_LINE) {
                i++;
                continue;
            }
            if (event.getCommentType() == CommentType.IN_LINE) {
                out.add(comment(event, CommentPosition.LINE));
                i++;
                continue;
            }
            int groupEnd = i;
            while (groupEnd < run.size() && run.get(groupEnd).getCommentType() == CommentType.BLOCK) {
                groupEnd++;
            }
            final var blankBefore = i > 0 && run.get(i - 1).getCommentType() == CommentType.BLANK_LINE;
            final var blankAfter = groupEnd < run.size() && run.get(groupEnd).getCommentType() == CommentType.BLANK_LINE;
            final CommentPosition position;
            if (blankBefore && blankAfter) {
                position = CommentPosition.STANDALONE;
            } else if (closing && groupEnd == run.size()) {
                position = CommentPosition.BELOW;
            } else {
                position = CommentPosition.ABOVE;
            }
            for (int g = i; g < groupEnd; g++) {
                out.add(comment(run.get(g), position));
            }
            i = groupEnd;
        }
        return out;
    }

    private DocNode comment(CommentEvent event, CommentPosition position) {
        final var content = event.getValue().strip();
        return DocNode.parsed(new CommentValue(content, position), span(event.getStartMark(), event.getEndMark()));
    }

    /// Comments outside the root collection go to its front or back; a scalar
    /// root has nowhere to keep them.
    private static void attach(DocNode root, List<DocNode> comments, boolean front) {
        if (comments.isEmpty()) {
            return;
        }
        final var value = root.value();
        if (value instanceof ObjectValue object) {
            int index = front ? 0 : object.size();
            for (final var comment : comments) {
                object.insert(index++, Member.of(freeCommentKey(object), comment));
            }
        } else if (value instanceof Sequence sequence) {
            int index = front ? 0 : sequence.size();
            for (final var comment : comments) {
                sequence.insert(index++, comment);
            }
        } else {
            LOG.fine(() -> "Dropping " + comments.size() + " comment(s) around a scalar document");
        }
    }

    private static String freeCommentKey(ObjectValue object) {
        int counter = 0;
        while (object.containsKey(COMMENT_KEY_PREFIX + counter)) {
            counter++;
        }
        return COMMENT_KEY_PREFIX + counter;
    }

    // Scalars

    private DocValue scalarValue(ScalarEvent event) {
        final var value = event.getValue();
        if (event.getScalarStyle() == ScalarStyle.LITERAL) {
            return new StringValue(value, StringStyle.LITERAL);
        }
        if (event.getScalarStyle() == ScalarStyle.FOLDED) {
            return new StringValue(value, StringStyle.FOLDED);
        }
        final Tag tag;
        if (event.getTag() == null) {
            tag = event.isPlain() ? resolver.resolve(NodeId.scalar, value, true) : Tag.STR;
        } else if ("!".equals(event.getTag())) {
            tag = Tag.STR;
        } else {
            tag = new Tag(event.getTag());
        }

        if (Tag.NULL.equals(tag)) {
            return NullValue.INSTANCE;
        }
        if (Tag.BOOL.equals(tag)) {
            return BooleanValue.of(TRUE_WORDS.contains(value.toLowerCase(Locale.ROOT)));
        }
        if (Tag.INT.equals(tag)) {
            return integer(value);
        }
        if (Tag.FLOAT.equals(tag)) {
            return decimal(value);
        }
        return StringValue.plain(value);
    }

    /// Decimal, `0x`, `0o`, `0b` and leading-zero octal forms, with `_` separators.
    private static DocValue integer(String value) {
        var digits = value.replace("_", "");
        boolean negative = false;
        if (digits.startsWith("-") || digits.startsWith("+")) {
            negative = digits.charAt(0) == '-';
            digits = digits.substring(1);
        }
        int radix = 10;
        if (digits.startsWith("0x")) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.startsWith("0o")) {
            radix = 8;
            digits = digits.substring(2);
        } else if (digits.startsWith("0b")) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.startsWith("0")) {
            radix = 8;
            digits = digits.substring(1);
        }
        final var lexeme = JSON_NUMBER.matcher(value).matches() ? value : null;
        try {
            final long parsed = Long.parseLong((negative ? "-" : "") + digits, radix);
            return new IntegerNumber(parsed, lexeme);
        } catch (NumberFormatException e) {
            if (radix == 10 && lexeme != null) {
                LOG.finer(() -> "Integer " + value + " exceeds long range, keeping as float");
                return new FloatNumber(Double.parseDouble(lexeme), lexeme);
            }
            LOG.finer(() -> "Keeping integer-like scalar " + value + " as a string");
            return StringValue.plain(value);
        }
    }

    /// Infinities and NaN cannot be represented as numbers here, so they stay strings.
    private static DocValue decimal(String value) {
        try {
            final double parsed = Double.parseDouble(value.replace("_", ""));
            if (Double.isFinite(parsed)) {
                return new FloatNumber(parsed, JSON_NUMBER.matcher(value).matches() ? value : null);
            }
        } catch (NumberFormatException e) {
            LOG.finer(() -> "Float-like scalar " + value + " is not a Java double");
        }
        return StringValue.plain(value);
    }

    // Positions

    private TextSpan span(Mark start, Mark end) {
        final int from = offset(start);
        return new TextSpan(from, Math.max(from, offset(end)));
    }

    /// The span of a node's value, skipping a leading `&anchor` or `!tag`.
    private TextSpan valueSpan(NodeEvent event, Mark end) {
        int from = offset(event.getStartMark());
        final var tagged = event instanceof ScalarEvent scalar ? scalar.getTag() != null
                : event instanceof MappingStartEvent mapping ? mapping.getTag() != null
                : event instanceof SequenceStartEvent sequence && sequence.getTag() != null;
        if (event.getAnchor() != null || tagged) {
            while (from < text.length() && (text.charAt(from) == '&' || text.charAt(from) == '!')) {
                while (from < text.length() && !Character.isWhitespace(text.charAt(from))) {
                    from++;
                }
                while (from < text.length() && (text.charAt(from) == ' ' || text.charAt(from) == '\t')) {
                    from++;
                }
            }
        }
        final int to = offset(end);
        return new TextSpan(Math.min(from, to), to);
    }

    private int offset(Mark mark) {
        final int index = mark.getIndex();
        if (charOffsets == null) {
            return Math.min(index, text.length());
        }
        return index < charOffsets.length ? charOffsets[index] : text.length();
    }

    /// SnakeYAML counts code points; spans count chars. Null when they agree.
    private static int[] codePointOffsets(String text) {
        final int count = text.codePointCount(0, text.length());
        if (count == text.length()) {
            return null;
        }
        final var offsets = new int[count + 1];
        int charIndex = 0;
        for (int i = 0; i < count; i++) {
            offsets[i] = charIndex;
            charIndex += Character.charCount(text.codePointAt(charIndex));
        }
        offsets[count] = text.length();
        return offsets;
    }

    // Event cursor

    private Event peek() {
        return events.get(Math.min(pos, events.size() - 1));
    }

    private Event next() {
        final var event = peek();
        pos++;
        return event;
    }

    private void expect(Class<? extends Event> type, String what) {
        final var event = next();
        if (!type.isInstance(event)) {
            throw error("Expected " + what, event);
        }
    }

    private DocumentParseException error(String message, Event event) {
        final var mark = event.getStartMark();
        if (mark == null) {
            return new DocumentParseException(message, 1, 1, 0);
        }
        LOG.fine(() -> "YAML structure error: " + message + " at " + mark.getLine() + ":" + mark.getColumn());
        return new DocumentParseException(message, mark.getLine() + 1, mark.getColumn() + 1, offset(mark));
    }
}
