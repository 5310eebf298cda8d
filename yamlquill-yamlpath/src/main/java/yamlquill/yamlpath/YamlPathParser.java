package yamlquill.yamlpath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Parser for YAMLPath expressions into AST.
/// Whitespace between tokens is ignored.
///
/// Supported syntax:
/// - `$` : root (required first character)
/// - `.name` or `['name']` : child property
/// - `['a','b']` : several properties, in order
/// - `[n]` : array index, negative from the end
/// - `[start:end]` : slice, either bound optional
/// - `.*` or `[*]` : wildcard
/// - `..name`, `..*`, `..[...]` : recursive descent
final class YamlPathParser {

    private static final Logger LOG = Logger.getLogger(YamlPathParser.class.getName());

    private final String path;
    private int pos;

    private YamlPathParser(String path) {
        this.path = path;
        this.pos = 0;
    }

    /// Parses a YAMLPath expression into an AST.
    /// @param path the query string
    /// @return the parsed AST, whose first segment is always [YamlPathAst.Root]
    /// @throws NullPointerException if path is null
    /// @throws YamlPathParseException if the path is invalid
    static YamlPathAst.Query parse(String path) {
        Objects.requireNonNull(path, "path must not be null");
        LOG.fine(() -> "Parsing YAMLPath: " + path);
        return new YamlPathParser(path).parseQuery();
    }

    private YamlPathAst.Query parseQuery() {
        skipWhitespace();
        if (pos >= path.length() || path.charAt(pos) != '$') {
            throw error(new YamlPathError.InvalidSyntax("YAMLPath must start with '$'"));
        }
        pos++;

        final var segments = new ArrayList<YamlPathAst.Segment>();
        segments.add(new YamlPathAst.Root());

        while (true) {
            skipWhitespace();
            if (pos >= path.length()) {
                break;
            }
            final char c = path.charAt(pos);
            if (c == '.') {
                segments.add(parseDotSegment());
            } else if (c == '[') {
                segments.add(parseBracketSegment());
            } else {
                throw unexpected(c, "'.' or '['");
            }
        }

        final var query = new YamlPathAst.Query(segments);
        LOG.finer(() -> "Parsed " + segments.size() + " segments from " + path);
        return query;
    }

    private YamlPathAst.Segment parseDotSegment() {
        pos++; // skip '.'
        if (pos < path.length() && path.charAt(pos) == '.') {
            pos++;
            return parseRecursiveDescent();
        }
        skipWhitespace();
        if (pos < path.length() && path.charAt(pos) == '*') {
            pos++;
            return new YamlPathAst.Wildcard();
        }
        return new YamlPathAst.Child(parseIdentifier("property name"));
    }

    private YamlPathAst.Segment parseRecursiveDescent() {
        skipWhitespace();
        if (pos >= path.length()) {
            throw error(new YamlPathError.UnexpectedEnd("property name, '*' or '['"));
        }
        final char c = path.charAt(pos);
        if (c == '[') {
            // bracket is left for the next segment
            return new YamlPathAst.RecursiveDescent(null);
        }
        if (c == '*') {
            pos++;
            return new YamlPathAst.RecursiveDescent(null);
        }
        return new YamlPathAst.RecursiveDescent(parseIdentifier("property name, '*' or '['"));
    }

    private YamlPathAst.Segment parseBracketSegment() {
        pos++; // skip '['
        skipWhitespace();
        if (pos >= path.length()) {
            throw error(new YamlPathError.UnexpectedEnd("bracket expression"));
        }

        final char c = path.charAt(pos);
        if (c == '*') {
            pos++;
            expect(']');
            return new YamlPathAst.Wildcard();
        }
        if (c == '\'' || c == '"') {
            return parseQuotedNames();
        }
        if (c == ':') {
            return parseSliceFrom(null);
        }
        if (c == '-' || Character.isDigit(c)) {
            final int first = parseInteger();
            skipWhitespace();
            if (pos < path.length() && path.charAt(pos) == ':') {
                return parseSliceFrom(first);
            }
            expect(']');
            return new YamlPathAst.Index(first);
        }
        if (c == ']') {
            throw error(new YamlPathError.InvalidSyntax("Empty brackets"));
        }
        throw unexpected(c, "'*', quoted name, index or slice");
    }

    private YamlPathAst.Segment parseQuotedNames() {
        final var names = new ArrayList<String>();
        names.add(parseQuotedString());
        while (true) {
            skipWhitespace();
            if (pos < path.length() && path.charAt(pos) == ',') {
                pos++;
                skipWhitespace();
                if (pos >= path.length()) {
                    throw error(new YamlPathError.UnexpectedEnd("quoted name"));
                }
                final char next = path.charAt(pos);
                if (next != '\'' && next != '"') {
                    throw unexpected(next, "quoted name");
                }
                names.add(parseQuotedString());
            } else {
                break;
            }
        }
        expect(']');
        if (names.size() == 1) {
            return new YamlPathAst.Child(names.get(0));
        }
        return new YamlPathAst.MultiProperty(List.copyOf(names));
    }

    /// `pos` is at the ':' of a slice; `start` was already read, or is null.
    private YamlPathAst.Segment parseSliceFrom(Integer start) {
        pos++; // skip ':'
        skipWhitespace();
        Integer end = null;
        if (pos < path.length() && path.charAt(pos) != ']') {
            end = parseInteger();
        }
        expect(']');

        if (start != null && end != null && start >= 0 && end >= 0 && start > end) {
            throw error(new YamlPathError.InvalidSyntax("Invalid slice: start (" + start + ") > end (" + end + ")"));
        }
        return new YamlPathAst.Slice(start, end);
    }

    private int parseInteger() {
        final int start = pos;
        if (pos < path.length() && path.charAt(pos) == '-') {
            pos++;
        }
        final int digitsStart = pos;
        while (pos < path.length() && Character.isDigit(path.charAt(pos))) {
            pos++;
        }
        if (pos == digitsStart) {
            if (pos >= path.length()) {
                throw error(new YamlPathError.UnexpectedEnd("number"));
            }
            throw unexpected(path.charAt(pos), "number");
        }
        final var text = path.substring(start, pos);
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw errorAt(new YamlPathError.InvalidSyntax("Invalid number: " + text), start);
        }
    }

    private String parseQuotedString() {
        final char quote = path.charAt(pos);
        pos++; // skip opening quote

        final var sb = new StringBuilder();
        while (pos < path.length()) {
            final char c = path.charAt(pos);
            if (c == quote) {
                pos++;
                return sb.toString();
            }
            if (c == '\\') {
                pos++;
                if (pos >= path.length()) {
                    throw error(new YamlPathError.UnexpectedEnd("escape character"));
                }
                final char escaped = path.charAt(pos);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\' -> sb.append('\\');
                    case '\'' -> sb.append('\'');
                    case '"' -> sb.append('"');
                    default -> throw error(new YamlPathError.InvalidSyntax("Invalid escape sequence '\\" + escaped + "'"));
                }
                pos++;
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw error(new YamlPathError.UnexpectedEnd("closing quote " + quote));
    }

    private String parseIdentifier(String expected) {
        skipWhitespace();
        final int start = pos;
        while (pos < path.length() && isIdentifierChar(path.charAt(pos))) {
            pos++;
        }
        if (pos == start) {
            if (pos >= path.length()) {
                throw error(new YamlPathError.UnexpectedEnd(expected));
            }
            throw unexpected(path.charAt(pos), expected);
        }
        return path.substring(start, pos);
    }

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private void expect(char c) {
        skipWhitespace();
        if (pos >= path.length()) {
            throw error(new YamlPathError.UnexpectedEnd("'" + c + "'"));
        }
        final char found = path.charAt(pos);
        if (found != c) {
            throw unexpected(found, "'" + c + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (pos < path.length() && Character.isWhitespace(path.charAt(pos))) {
            pos++;
        }
    }

    private YamlPathParseException unexpected(char found, String expected) {
        return error(new YamlPathError.UnexpectedToken(pos, String.valueOf(found), expected));
    }

    private YamlPathParseException error(YamlPathError error) {
        return errorAt(error, pos);
    }

    private YamlPathParseException errorAt(YamlPathError error, int position) {
        return new YamlPathParseException(error, path, position);
    }
}
