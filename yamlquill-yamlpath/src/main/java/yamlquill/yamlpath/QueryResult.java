package yamlquill.yamlpath;

import yamlquill.document.NodePath;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Outcome of running a query string: either the matching paths, or the reason the query was rejected.
/// A rejected query always has no matches.
public record QueryResult(List<NodePath> matches, YamlPathError error) {

    public QueryResult {
        Objects.requireNonNull(matches, "matches must not be null");
        matches = List.copyOf(matches);
        if (error != null && !matches.isEmpty()) {
            throw new IllegalArgumentException("A failed query cannot carry matches");
        }
    }

    public static QueryResult success(List<NodePath> matches) {
        return new QueryResult(matches, null);
    }

    public static QueryResult failure(YamlPathError error) {
        Objects.requireNonNull(error, "error must not be null");
        return new QueryResult(List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<YamlPathError> errorIfAny() {
        return Optional.ofNullable(error);
    }
}
