package yamlquill.yamlpath;

import yamlquill.document.DocNode;
import yamlquill.document.DocTree;
import yamlquill.document.NodePath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// YAMLPath queries over a [DocTree].
///
/// Usage examples:
/// ```java
/// // Compile once, run against many trees
/// YamlPath path = YamlPath.parse("$.store.book[*].price");
/// List<NodePath> prices = path.find(tree);
///
/// // One-off from user input; a bad query is reported, not thrown
/// QueryResult result = YamlPath.find(input, tree);
/// ```
public final class YamlPath {

    private static final Logger LOG = Logger.getLogger(YamlPath.class.getName());

    private final YamlPathAst.Query ast;

    private YamlPath(YamlPathAst.Query ast) {
        this.ast = ast;
    }

    /// Parses a YAMLPath expression for reuse.
    /// @param path the YAMLPath expression
    /// @return a compiled YamlPath
    /// @throws NullPointerException if path is null
    /// @throws YamlPathParseException if the path is invalid
    public static YamlPath parse(String path) {
        Objects.requireNonNull(path, "path must not be null");
        LOG.fine(() -> "Parsing path: " + path);
        return new YamlPath(YamlPathParser.parse(path));
    }

    /// Paths of every node the query selects, in match order. May be empty.
    /// @throws NullPointerException if tree is null
    public List<NodePath> find(DocTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        LOG.fine(() -> "Querying document with path: " + this);
        return YamlPathEvaluator.evaluate(ast, tree);
    }

    /// The selected nodes themselves, in match order.
    public List<DocNode> select(DocTree tree) {
        final var paths = find(tree);
        final var nodes = new ArrayList<DocNode>(paths.size());
        for (final var path : paths) {
            tree.getNode(path).ifPresent(nodes::add);
        }
        return nodes;
    }

    /// Parses and runs `query` in one step. Syntax errors come back as a failed [QueryResult].
    /// @throws NullPointerException if query or tree is null
    public static QueryResult find(String query, DocTree tree) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        final YamlPath path;
        try {
            path = parse(query);
        } catch (YamlPathParseException e) {
            LOG.fine(() -> "Rejected query: " + e.getMessage());
            return QueryResult.failure(e.error());
        }
        return QueryResult.success(path.find(tree));
    }

    List<YamlPathAst.Segment> segments() {
        return ast.segments();
    }

    /// Reconstructs the YAMLPath expression from the AST.
    @Override
    public String toString() {
        return reconstruct(ast);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof YamlPath other && ast.equals(other.ast);
    }

    @Override
    public int hashCode() {
        return ast.hashCode();
    }

    private static String reconstruct(YamlPathAst.Query query) {
        final var sb = new StringBuilder("$");
        final var segments = query.segments();
        // leading Root is the '$' above
        for (int i = 1; i < segments.size(); i++) {
            appendSegment(sb, segments.get(i));
        }
        return sb.toString();
    }

    private static void appendSegment(StringBuilder sb, YamlPathAst.Segment segment) {
        if (segment instanceof YamlPathAst.Child child) {
            if (isSimpleIdentifier(child.name())) {
                sb.append(".").append(child.name());
            } else {
                sb.append("['").append(escape(child.name())).append("']");
            }
        } else if (segment instanceof YamlPathAst.Index index) {
            sb.append("[").append(index.index()).append("]");
        } else if (segment instanceof YamlPathAst.Slice slice) {
            sb.append("[");
            if (slice.start() != null) sb.append(slice.start());
            sb.append(":");
            if (slice.end() != null) sb.append(slice.end());
            sb.append("]");
        } else if (segment instanceof YamlPathAst.Wildcard) {
            sb.append(".*");
        } else if (segment instanceof YamlPathAst.RecursiveDescent descent) {
            sb.append("..").append(descent.name() == null ? "*" : descent.name());
        } else if (segment instanceof YamlPathAst.MultiProperty multi) {
            sb.append("[");
            for (int i = 0; i < multi.names().size(); i++) {
                if (i > 0) sb.append(",");
                sb.append("'").append(escape(multi.names().get(i))).append("'");
            }
            sb.append("]");
        }
        // Root and Current print nothing after the leading '$'
    }

    private static boolean isSimpleIdentifier(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!YamlPathParser.isIdentifierChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String escape(String s) {
        final var sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
