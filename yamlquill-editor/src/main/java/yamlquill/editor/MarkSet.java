package yamlquill.editor;

import yamlquill.document.NodePath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/// Local marks `a`-`z`, each remembering a cursor path for the session.
public final class MarkSet {

    /// A set mark.
    public record Mark(char name, NodePath path) {}

    private final TreeMap<Character, NodePath> marks = new TreeMap<>();

    public void set(char name, NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        marks.put(checkName(name), path);
    }

    public Optional<NodePath> get(char name) {
        return Optional.ofNullable(marks.get(checkName(name)));
    }

    public void clear() {
        marks.clear();
    }

    /// {@return every set mark, ordered by name}
    public List<Mark> list() {
        final var out = new ArrayList<Mark>(marks.size());
        marks.forEach((name, path) -> out.add(new Mark(name, path)));
        return out;
    }

    private static char checkName(char name) {
        if (name < 'a' || name > 'z') {
            throw new IllegalArgumentException("Mark name must be a-z: '" + name + "'");
        }
        return name;
    }
}
