package yamlquill.yamlpath;

import java.util.List;
import java.util.Objects;

/// AST for YAMLPath queries.
///
/// A query is an ordered list of segments, always starting with [Root]:
/// - Root: `$`, the document root
/// - Current: `@`, reserved; evaluation keeps the candidates unchanged
/// - Child: `.name` or `['name']`
/// - Index: `[n]`, negative counts from the end
/// - Wildcard: `.*` or `[*]`
/// - RecursiveDescent: `..name` for members called `name` at any depth, `..*` or `..[` for every descendant
/// - Slice: `[start:end]`, either bound optional
/// - MultiProperty: `['a','b']`
sealed interface YamlPathAst {

    record Query(List<Segment> segments) implements YamlPathAst {
        public Query {
            Objects.requireNonNull(segments, "segments must not be null");
            segments = List.copyOf(segments);
        }
    }

    sealed interface Segment permits
            Root,
            Current,
            Child,
            Index,
            Wildcard,
            RecursiveDescent,
            Slice,
            MultiProperty {}

    record Root() implements Segment {}

    record Current() implements Segment {}

    record Child(String name) implements Segment {
        public Child {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record Index(int index) implements Segment {}

    record Wildcard() implements Segment {}

    /// `name` is null when every descendant matches.
    record RecursiveDescent(String name) implements Segment {}

    /// Null bounds mean "from the start" and "to the end".
    record Slice(Integer start, Integer end) implements Segment {}

    record MultiProperty(List<String> names) implements Segment {
        public MultiProperty {
            Objects.requireNonNull(names, "names must not be null");
            if (names.isEmpty()) {
                throw new IllegalArgumentException("MultiProperty must name at least one property");
            }
            names = List.copyOf(names);
        }
    }
}
