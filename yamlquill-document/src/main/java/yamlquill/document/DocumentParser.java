package yamlquill.document;

import yamlquill.document.DocValue.ArrayValue;
import yamlquill.document.DocValue.BooleanValue;
import yamlquill.document.DocValue.FloatNumber;
import yamlquill.document.DocValue.IntegerNumber;
import yamlquill.document.DocValue.Member;
import yamlquill.document.DocValue.MultiDocValue;
import yamlquill.document.DocValue.NullValue;
import yamlquill.document.DocValue.ObjectValue;
import yamlquill.document.DocValue.StringValue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Objects;
import java.util.logging.Logger;

/// Recursive descent JSON parser that records where every node came from.
/// YAML goes through [#parseYaml(String)], which hands off to SnakeYAML.
///
/// Every node gets a [TextSpan] into the source and starts unmodified, so an
/// untouched tree serializes back to exactly the text it was read from.
/// Numbers keep their lexeme and stay integers unless written with a fraction
/// or exponent (or too large for a `long`).
public final class DocumentParser {

    private static final Logger LOG = Logger.getLogger(DocumentParser.class.getName());

    private final String text;
    private final int limit;
    private int pos;

    private DocumentParser(String text, int start, int limit) {
        this.text = text;
        this.pos = start;
        this.limit = limit;
    }

    /// Parses a single JSON document.
    /// @throws DocumentParseException if the text is not one well-formed JSON value
    public static DocTree parseJson(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Parsing JSON document of " + text.length() + " chars");
        final var parser = new DocumentParser(text, 0, text.length());
        parser.skipWhitespace();
        final var root = parser.parseValue();
        parser.skipWhitespace();
        if (parser.pos < parser.limit) {
            throw parser.error("Unexpected trailing content");
        }
        return new DocTree(root, text, DocumentFormat.JSON);
    }

    /// Parses JSON Lines: one document per non-blank line, collected under a
    /// multi-document root. Spans stay relative to the whole text.
    /// @throws DocumentParseException naming the line of the first malformed document
    public static DocTree parseJsonLines(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final var documents = new ArrayList<DocNode>();
        int lineStart = 0;
        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            final var parser = new DocumentParser(text, lineStart, lineEnd);
            parser.skipWhitespace();
            if (parser.pos < lineEnd) {
                final var document = parser.parseValue();
                parser.skipWhitespace();
                if (parser.pos < lineEnd) {
                    throw parser.error("Unexpected trailing content");
                }
                documents.add(document);
            }
            lineStart = lineEnd + 1;
        }
        LOG.fine(() -> "Parsed " + documents.size() + " JSON Lines documents");
        final var root = DocNode.parsed(new MultiDocValue(documents), new TextSpan(0, text.length()));
        return new DocTree(root, text, DocumentFormat.JSON);
    }

    /// Parses a YAML stream: anchors, aliases, comments, block scalar styles
    /// and `---` separated documents are kept. Several documents give a
    /// multi-document root.
    /// @throws DocumentParseException if the text is not well-formed YAML or
    ///         uses an alias before its anchor, a duplicate key or a non-scalar key
    public static DocTree parseYaml(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Parsing YAML stream of " + text.length() + " chars");
        return YamlDocumentReader.read(text);
    }

    private DocNode parseValue() {
        if (pos >= limit) {
            throw error("Unexpected end of input, expected a value");
        }
        final char c = text.charAt(pos);
        return switch (c) {
            case '{' -> parseObject();
            case '[' -> parseArray();
            case '"' -> {
                final int start = pos;
                final var s = parseString();
                yield DocNode.parsed(StringValue.plain(s), new TextSpan(start, pos));
            }
            case 't' -> parseLiteral("true", BooleanValue.TRUE);
            case 'f' -> parseLiteral("false", BooleanValue.FALSE);
            case 'n' -> parseLiteral("null", NullValue.INSTANCE);
            default -> {
                if (c == '-' || (c >= '0' && c <= '9')) {
                    yield parseNumber();
                }
                throw error("Unexpected character '" + c + "'");
            }
        };
    }

    private DocNode parseObject() {
        final int start = pos;
        pos++; // skip {
        final var members = new ArrayList<Member>();
        final var keys = new HashSet<String>();
        skipWhitespace();
        if (peek() == '}') {
            pos++;
            return DocNode.parsed(new ObjectValue(members), new TextSpan(start, pos));
        }
        while (true) {
            skipWhitespace();
            if (peek() != '"') {
                throw error("Expected string key");
            }
            final int keyPos = pos;
            final var key = parseString();
            if (!keys.add(key)) {
                pos = keyPos;
                throw error("Duplicate key '" + key + "'");
            }
            skipWhitespace();
            expect(':');
            skipWhitespace();
            members.add(new Member(key, parseValue()));
            skipWhitespace();
            final char c = peek();
            if (c == ',') {
                pos++;
            } else if (c == '}') {
                pos++;
                break;
            } else {
                throw error("Expected ',' or '}'");
            }
        }
        LOG.finer(() -> "Parsed object with " + members.size() + " members");
        return DocNode.parsed(new ObjectValue(members), new TextSpan(start, pos));
    }

    private DocNode parseArray() {
        final int start = pos;
        pos++; // skip [
        final var elements = new ArrayList<DocNode>();
        skipWhitespace();
        if (peek() == ']') {
            pos++;
            return DocNode.parsed(new ArrayValue(elements), new TextSpan(start, pos));
        }
        while (true) {
            skipWhitespace();
            elements.add(parseValue());
            skipWhitespace();
            final char c = peek();
            if (c == ',') {
                pos++;
            } else if (c == ']') {
                pos++;
                break;
            } else {
                throw error("Expected ',' or ']'");
            }
        }
        LOG.finer(() -> "Parsed array with " + elements.size() + " elements");
        return DocNode.parsed(new ArrayValue(elements), new TextSpan(start, pos));
    }

    private String parseString() {
        pos++; // skip opening quote
        final var sb = new StringBuilder();
        while (pos < limit) {
            final char c = text.charAt(pos);
            if (c == '"') {
                pos++;
                return sb.toString();
            }
            if (c < 0x20) {
                throw error("Unescaped control character in string");
            }
            if (c == '\\') {
                pos++;
                if (pos >= limit) {
                    break;
                }
                final char escaped = text.charAt(pos);
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case '/' -> sb.append('/');
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (pos + 4 >= limit) {
                            throw error("Truncated unicode escape");
                        }
                        final var hex = text.substring(pos + 1, pos + 5);
                        if (!hex.chars().allMatch(DocumentParser::isHexDigit)) {
                            throw error("Invalid unicode escape '\\u" + hex + "'");
                        }
                        sb.append((char) Integer.parseInt(hex, 16));
                        pos += 4;
                    }
                    default -> throw error("Invalid escape '\\" + escaped + "'");
                }
                pos++;
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw error("Unterminated string");
    }

    private DocNode parseNumber() {
        final int start = pos;
        if (peek() == '-') {
            pos++;
        }
        if (peek() == '0') {
            pos++;
        } else if (isDigit(peek())) {
            skipDigits();
        } else {
            throw error("Expected digit");
        }
        boolean integral = true;
        if (peek() == '.') {
            integral = false;
            pos++;
            if (!isDigit(peek())) {
                throw error("Expected digit after decimal point");
            }
            skipDigits();
        }
        if (peek() == 'e' || peek() == 'E') {
            integral = false;
            pos++;
            if (peek() == '+' || peek() == '-') {
                pos++;
            }
            if (!isDigit(peek())) {
                throw error("Expected digit in exponent");
            }
            skipDigits();
        }

        final var lexeme = text.substring(start, pos);
        final var span = new TextSpan(start, pos);
        if (integral) {
            try {
                return DocNode.parsed(new IntegerNumber(Long.parseLong(lexeme), lexeme), span);
            } catch (NumberFormatException e) {
                LOG.finer(() -> "Integer " + lexeme + " exceeds long range, keeping as float");
            }
        }
        final double value = Double.parseDouble(lexeme);
        if (!Double.isFinite(value)) {
            pos = start;
            throw error("Number out of range");
        }
        return DocNode.parsed(new FloatNumber(value, lexeme), span);
    }

    private DocNode parseLiteral(String literal, DocValue value) {
        if (!text.startsWith(literal, pos) || pos + literal.length() > limit) {
            throw error("Expected '" + literal + "'");
        }
        final int start = pos;
        pos += literal.length();
        return DocNode.parsed(value, new TextSpan(start, pos));
    }

    private void skipDigits() {
        while (isDigit(peek())) {
            pos++;
        }
    }

    private static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char peek() {
        return pos < limit ? text.charAt(pos) : '\0';
    }

    private void expect(char c) {
        if (peek() != c) {
            throw error("Expected '" + c + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (pos < limit) {
            final char c = text.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                break;
            }
            pos++;
        }
    }

    private DocumentParseException error(String message) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < pos && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        final int column = pos - lineStart + 1;
        final int errorLine = line;
        LOG.fine(() -> "Parse error: " + message + " at line " + errorLine + ", column " + column);
        return new DocumentParseException(message, line, column, pos);
    }
}
