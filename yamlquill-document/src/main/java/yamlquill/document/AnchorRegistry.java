package yamlquill.document;

import yamlquill.document.DocValue.AliasValue;
import yamlquill.document.DocValue.ObjectValue;
import yamlquill.document.DocValue.Sequence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/// Tracks where anchors are defined and which alias nodes point at them.
///
/// The tree never shares subtrees: an alias is a leaf naming its anchor, and
/// this registry answers "where is that anchor" and "who refers to it". Paths
/// are positional, so the editing layer reports structural edits through
/// [#nodeInserted(NodePath)] and [#nodeDeleted(NodePath)] to keep them valid.
public final class AnchorRegistry {

    private static final Logger LOG = Logger.getLogger(AnchorRegistry.class.getName());

    private final Map<String, NodePath> anchors = new LinkedHashMap<>();
    private final Map<String, Set<NodePath>> aliasesByAnchor = new HashMap<>();
    private final Map<NodePath, String> aliasTargets = new HashMap<>();

    /// Records that the node at `path` defines anchor `name`. Re-registering a
    /// name moves it.
    public void registerAnchor(String name, NodePath path) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(path, "path must not be null");
        anchors.put(name, path);
        LOG.finer(() -> "Anchor &" + name + " at " + path);
    }

    /// Records that the alias node at `aliasPath` refers to `name`. A path
    /// registered again is moved to the new name.
    public void registerAlias(NodePath aliasPath, String name) {
        Objects.requireNonNull(aliasPath, "aliasPath must not be null");
        Objects.requireNonNull(name, "name must not be null");
        final var previous = aliasTargets.put(aliasPath, name);
        if (previous != null && !previous.equals(name)) {
            detachAlias(previous, aliasPath);
        }
        aliasesByAnchor.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(aliasPath);
        LOG.finer(() -> "Alias *" + name + " at " + aliasPath);
    }

    public Optional<NodePath> getAnchorPath(String name) {
        return Optional.ofNullable(anchors.get(name));
    }

    /// {@return the alias paths referring to `name`; empty when there are none}
    public Set<NodePath> getAliasesFor(String name) {
        final var set = aliasesByAnchor.get(name);
        return set == null ? Set.of() : Collections.unmodifiableSet(set);
    }

    /// {@return true when no alias refers to `name`}
    public boolean canDeleteAnchor(String name) {
        return getAliasesFor(name).isEmpty();
    }

    /// Forgets whatever is registered at exactly `path`: an anchor defined
    /// there loses its entry and its alias associations; an alias there is
    /// detached from its anchor.
    public void removeNode(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        final var anchorNames = anchors.entrySet().stream()
                .filter(e -> e.getValue().equals(path))
                .map(Map.Entry::getKey)
                .toList();
        for (final var name : anchorNames) {
            anchors.remove(name);
            final var dangling = aliasesByAnchor.remove(name);
            if (dangling != null) {
                dangling.forEach(aliasTargets::remove);
            }
            LOG.fine(() -> "Removed anchor &" + name);
        }
        final var target = aliasTargets.remove(path);
        if (target != null) {
            detachAlias(target, path);
            LOG.fine(() -> "Removed alias *" + target + " at " + path);
        }
    }

    /// Updates registered paths after a node was inserted at `path`: later
    /// siblings, and everything beneath them, move one position on. The root
    /// path means position 0 of the root, as in [DocTree].
    public void nodeInserted(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        final var at = path.isRoot() ? NodePath.of(0) : path;
        final int depth = at.length() - 1;
        final var parent = at.parent();
        remap(p -> p.length() > depth && parent.isPrefixOf(p) && p.get(depth) >= at.lastIndex()
                ? p.withIndex(depth, p.get(depth) + 1)
                : p);
    }

    /// Updates registered paths after the node at `path` was deleted. Entries
    /// at or under it are removed as by [#removeNode(NodePath)]; later
    /// siblings move one position back.
    public void nodeDeleted(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isRoot()) {
            clear();
            return;
        }
        final var doomed = new LinkedHashSet<NodePath>();
        anchors.values().stream().filter(path::isPrefixOf).forEach(doomed::add);
        aliasTargets.keySet().stream().filter(path::isPrefixOf).forEach(doomed::add);
        doomed.forEach(this::removeNode);

        final int depth = path.length() - 1;
        final var parent = path.parent();
        remap(p -> p.length() > depth && parent.isPrefixOf(p) && p.get(depth) > path.lastIndex()
                ? p.withIndex(depth, p.get(depth) - 1)
                : p);
    }

    /// Registers anchors and aliases found in `node`, which now sits at `path`.
    /// Used after pasting or replacing a subtree.
    public void registerSubtree(NodePath path, DocNode node) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(node, "node must not be null");
        scan(node, path);
    }

    /// {@return anchors defined at or under `path` that are still referenced by an alias outside it}
    /// Deleting `path` would leave those aliases dangling.
    public Set<String> anchorsReferencedFromOutside(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        final var blocking = new LinkedHashSet<String>();
        anchors.forEach((name, anchorPath) -> {
            if (path.isPrefixOf(anchorPath)
                    && getAliasesFor(name).stream().anyMatch(alias -> !path.isPrefixOf(alias))) {
                blocking.add(name);
            }
        });
        return blocking;
    }

    /// Looks up the node an alias named `name` stands for.
    public Optional<DocNode> resolve(String name, DocTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        return getAnchorPath(name).flatMap(tree::getNode);
    }

    /// Discards everything and re-registers anchors and aliases found in
    /// `tree`, in document order.
    public void rebuild(DocTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        clear();
        scan(tree.root(), NodePath.root());
        LOG.fine(() -> "Rebuilt registry: " + anchors.size() + " anchors, " + aliasTargets.size() + " aliases");
    }

    public void clear() {
        anchors.clear();
        aliasesByAnchor.clear();
        aliasTargets.clear();
    }

    /// {@return anchor names in registration order}
    public Set<String> anchorNames() {
        return Collections.unmodifiableSet(anchors.keySet());
    }

    private void scan(DocNode node, NodePath path) {
        if (node.anchor() != null) {
            registerAnchor(node.anchor(), path);
        }
        if (node.value() instanceof AliasValue alias) {
            registerAlias(path, alias.name());
        } else if (node.aliasTarget() != null) {
            registerAlias(path, node.aliasTarget());
        }
        final var value = node.value();
        if (value instanceof ObjectValue obj) {
            for (int i = 0; i < obj.size(); i++) {
                scan(obj.member(i).node(), path.child(i));
            }
        } else if (value instanceof Sequence seq) {
            for (int i = 0; i < seq.size(); i++) {
                scan(seq.element(i), path.child(i));
            }
        }
    }

    private void detachAlias(String name, NodePath aliasPath) {
        final var set = aliasesByAnchor.get(name);
        if (set != null) {
            set.remove(aliasPath);
            if (set.isEmpty()) {
                aliasesByAnchor.remove(name);
            }
        }
    }

    private void remap(UnaryOperator<NodePath> shift) {
        anchors.replaceAll((name, p) -> shift.apply(p));

        final var oldTargets = new ArrayList<>(aliasTargets.entrySet());
        aliasTargets.clear();
        aliasesByAnchor.clear();
        for (final var entry : oldTargets) {
            final var moved = shift.apply(entry.getKey());
            aliasTargets.put(moved, entry.getValue());
            aliasesByAnchor.computeIfAbsent(entry.getValue(), k -> new LinkedHashSet<>()).add(moved);
        }
    }

    @Override
    public String toString() {
        final List<String> parts = new ArrayList<>();
        anchors.forEach((name, p) -> parts.add("&" + name + "@" + p + " <- " + getAliasesFor(name)));
        return "AnchorRegistry" + parts;
    }
}
