package yamlquill.editor;

import yamlquill.document.AnchorRegistry;
import yamlquill.document.DocNode;
import yamlquill.document.DocTree;
import yamlquill.document.DocValue;
import yamlquill.document.DocValue.AliasValue;
import yamlquill.document.DocValue.ObjectValue;
import yamlquill.document.DocValue.Sequence;
import yamlquill.document.DocumentFiles;
import yamlquill.document.EditError;
import yamlquill.document.EditResult;
import yamlquill.document.FormatConfig;
import yamlquill.document.NodePath;
import yamlquill.yamlpath.QueryResult;
import yamlquill.yamlpath.YamlPath;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// One open document and everything an editor keeps alongside it: the cursor,
/// undo history, registers, anchors, marks, jump list, mode and search results.
///
/// Operations that can fail for ordinary reasons (deleting the root, pasting
/// an empty register, a bad query) return `false` or a failed result, leave
/// the document untouched and put a status message in [#message()]. Every
/// successful edit records an undo checkpoint and keeps anchor paths in step.
///
/// Not thread-safe; a session belongs to the thread driving the editor.
public final class EditSession {

    private static final Logger LOG = Logger.getLogger(EditSession.class.getName());

    private static final String PASTED_KEY = "pasted";

    private DocTree tree;
    private NodePath cursor;
    private final UndoTree history;
    private final RegisterSet registers = new RegisterSet();
    private final AnchorRegistry anchors = new AnchorRegistry();
    private final MarkSet marks = new MarkSet();
    private final JumpList jumps = new JumpList();
    private final ModeMachine modes = new ModeMachine();
    private List<NodePath> searchResults = List.of();
    private int searchIndex;
    private String message;
    private boolean dirty;

    public EditSession(DocTree tree) {
        this(tree, UndoTree.DEFAULT_LIMIT);
    }

    public EditSession(DocTree tree, int undoLimit) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.cursor = initialCursor(tree);
        this.history = new UndoTree(new EditorSnapshot(tree, cursor), undoLimit);
        anchors.rebuild(tree);
    }

    /// Replaces the document and forgets everything tied to the old one.
    public void load(DocTree newTree) {
        tree = Objects.requireNonNull(newTree, "newTree must not be null");
        cursor = initialCursor(tree);
        history.clear(new EditorSnapshot(tree, cursor));
        registers.clear();
        marks.clear();
        jumps.clear();
        modes.reset();
        anchors.rebuild(tree);
        searchResults = List.of();
        searchIndex = 0;
        message = null;
        dirty = false;
        LOG.fine("Loaded new document into session");
    }

    /// Writes the document to `path` and clears the dirty flag.
    public void save(Path path, FormatConfig config) throws IOException {
        DocumentFiles.save(path, tree, config);
        dirty = false;
        message = "Saved " + path.getFileName();
    }

    // ========== Accessors ==========

    public DocTree tree() {
        return tree;
    }

    public NodePath cursor() {
        return cursor;
    }

    public RegisterSet registers() {
        return registers;
    }

    public AnchorRegistry anchors() {
        return anchors;
    }

    public UndoTree history() {
        return history;
    }

    public MarkSet marks() {
        return marks;
    }

    public EditorMode mode() {
        return modes.mode();
    }

    /// Feeds a mode event to the session's mode machine.
    public EditorMode fire(ModeEvent event) {
        return modes.fire(event);
    }

    public boolean isDirty() {
        return dirty;
    }

    /// {@return the latest status message, if any}
    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    public void clearMessage() {
        message = null;
    }

    // ========== Cursor, marks and jumps ==========

    /// Moves the cursor without touching the jump list.
    /// @return false, with the cursor unchanged, when nothing is at `path`
    public boolean moveCursor(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        if (tree.getNode(path).isEmpty()) {
            return false;
        }
        cursor = path;
        return true;
    }

    /// Moves the cursor and remembers both ends in the jump list.
    public boolean jumpTo(NodePath path) {
        Objects.requireNonNull(path, "path must not be null");
        if (tree.getNode(path).isEmpty()) {
            return false;
        }
        jumps.record(cursor);
        cursor = path;
        jumps.record(path);
        return true;
    }

    public boolean jumpBack() {
        return jumps.back().map(this::moveCursor).orElse(false);
    }

    public boolean jumpForward() {
        return jumps.forward().map(this::moveCursor).orElse(false);
    }

    public void setMark(char name) {
        marks.set(name, cursor);
        message = "Mark '" + name + "' set";
    }

    public boolean jumpToMark(char name) {
        final var target = marks.get(name);
        if (target.isEmpty()) {
            message = "Mark '" + name + "' not set";
            return false;
        }
        if (!jumpTo(target.get())) {
            message = "Mark '" + name + "' no longer points at a node";
            return false;
        }
        return true;
    }

    // ========== Delete, yank, paste ==========

    /// Deletes the node under the cursor into the unnamed register.
    public boolean deleteAtCursor() {
        return deleteAtCursor(RegisterSet.UNNAMED, false);
    }

    /// Deletes the node under the cursor.
    ///
    /// The node goes into `register` (replacing or, with `append`, extending
    /// it) and always into the delete history. The cursor stays at the same
    /// position, or the last remaining sibling, or the parent when none remain.
    /// Refused when an anchor inside the node is still used by an alias elsewhere.
    public boolean deleteAtCursor(char register, boolean append) {
        checkWritable(register);
        final var path = cursor;
        final var node = tree.getNode(path);
        if (node.isEmpty()) {
            return fail("No node at cursor");
        }
        if (!path.isRoot()) {
            final var blocking = anchors.anchorsReferencedFromOutside(path);
            if (!blocking.isEmpty()) {
                final var anchor = blocking.iterator().next();
                final int outside = (int) anchors.getAliasesFor(anchor).stream()
                        .filter(alias -> !path.isPrefixOf(alias))
                        .count();
                return fail(new EditError.AnchorInUse(anchor, outside));
            }
        }

        final var content = RegisterContent.of(node.get(), tree.keyAt(path).orElse(null));
        final var result = tree.deleteNode(path);
        if (result.isFailure()) {
            return fail(result.error());
        }

        store(content, register, append);
        registers.pushDeleteHistory(content);
        anchors.nodeDeleted(path);
        cursor = cursorAfterDelete(path);
        checkpoint("delete " + path);
        return true;
    }

    /// Yanks `count` nodes, starting at the cursor, into the unnamed register.
    public boolean yankAtCursor(int count) {
        return yankAtCursor(count, RegisterSet.UNNAMED, false);
    }

    /// Copies the node under the cursor and up to `count - 1` following
    /// siblings into `register` and register `0`. The cursor does not move.
    public boolean yankAtCursor(int count, char register, boolean append) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1: " + count);
        }
        checkWritable(register);
        final var nodes = new ArrayList<DocNode>();
        final var keys = new ArrayList<String>();
        var path = cursor;
        for (int i = 0; i < count; i++) {
            final var node = tree.getNode(path);
            if (node.isEmpty()) {
                break;
            }
            nodes.add(node.get());
            keys.add(tree.keyAt(path).orElse(null));
            if (path.isRoot()) {
                break;
            }
            path = path.withIndex(path.length() - 1, path.lastIndex() + 1);
        }
        if (nodes.isEmpty()) {
            return fail("Nothing to yank");
        }

        final var content = new RegisterContent(nodes, keys);
        store(content, register, append);
        registers.updateYankRegister(content);
        message = content.size() + " node(s) yanked";
        LOG.fine(() -> "Yanked " + content.size() + " node(s) at " + cursor);
        return true;
    }

    public boolean pasteAfterCursor() {
        return paste(RegisterSet.UNNAMED, true);
    }

    public boolean pasteAfterCursor(char register) {
        return paste(register, true);
    }

    public boolean pasteBeforeCursor(char register) {
        return paste(register, false);
    }

    /// Inserts a register's nodes next to the cursor, as siblings. At the
    /// root they go to the front of the root container. Object members keep
    /// their captured key, or `pasted` when they had none; a clashing key gets
    /// a numeric suffix, and so does a pasted anchor whose name is taken.
    /// The cursor ends on the last pasted node.
    private boolean paste(char register, boolean after) {
        final var content = registers.get(register).orElse(RegisterContent.empty());
        if (content.isEmpty()) {
            return fail(register == RegisterSet.UNNAMED
                    ? "Nothing to paste"
                    : "Nothing in register '" + register + "'");
        }

        final NodePath containerPath;
        final int start;
        if (cursor.isRoot()) {
            containerPath = NodePath.root();
            start = 0;
        } else {
            containerPath = cursor.parent();
            start = cursor.lastIndex() + (after ? 1 : 0);
        }
        final var container = tree.getNode(containerPath).map(DocNode::value).orElse(null);
        if (container == null) {
            return fail(new EditError.ParentNotFound(containerPath));
        }
        if (!(container instanceof ObjectValue) && !(container instanceof Sequence)) {
            return fail(new EditError.NotAContainer(container.typeName()));
        }

        final var before = tree.deepCopy();
        NodePath last = cursor;
        for (int i = 0; i < content.size(); i++) {
            final var node = content.nodes().get(i).deepCopy();
            renameClashingAnchors(node, new HashMap<>());
            final var path = containerPath.child(start + i);
            final EditResult result;
            if (container instanceof ObjectValue object) {
                result = tree.insertNodeInObject(path, uniqueKey(object, content.keys().get(i)), node);
            } else {
                result = tree.insertNodeInArray(path, node);
            }
            if (result.isFailure()) {
                tree = before;
                anchors.rebuild(tree);
                return fail(result.error());
            }
            anchors.nodeInserted(path);
            anchors.registerSubtree(path, node);
            last = path;
        }

        cursor = last;
        checkpoint("paste " + content.size() + " node(s) at " + containerPath);
        return true;
    }

    // ========== In-place edits ==========

    /// Replaces the value under the cursor, keeping the node's anchor and key.
    public boolean replaceValueAtCursor(DocValue value) {
        Objects.requireNonNull(value, "value must not be null");
        final var path = cursor;
        for (final var anchor : anchors.anchorsReferencedFromOutside(path)) {
            final var anchorPath = anchors.getAnchorPath(anchor).orElse(path);
            if (!anchorPath.equals(path)) {
                return fail(new EditError.AnchorInUse(anchor, anchors.getAliasesFor(anchor).size()));
            }
        }
        final var node = tree.getNodeMut(path);
        if (node.isEmpty()) {
            return fail("No node at cursor");
        }
        node.get().setValue(value);
        anchors.rebuild(tree);
        checkpoint("replace value at " + path);
        return true;
    }

    public boolean renameKeyAtCursor(String newKey) {
        final var result = tree.renameKey(cursor, newKey);
        if (result.isFailure()) {
            return fail(result.error());
        }
        checkpoint("rename key at " + cursor);
        return true;
    }

    // ========== Undo ==========

    /// Restores the previous checkpoint's document and cursor.
    /// @return false at the oldest checkpoint
    public boolean undo() {
        return history.undo().map(this::restore).orElseGet(() -> fail("Already at oldest change"));
    }

    /// Restores the newest checkpoint branching from the current one.
    /// @return false when there is nothing to redo
    public boolean redo() {
        return history.redo().map(this::restore).orElseGet(() -> fail("Already at newest change"));
    }

    private boolean restore(EditorSnapshot snapshot) {
        tree = snapshot.tree();
        cursor = snapshot.cursor();
        anchors.rebuild(tree);
        searchResults = List.of();
        searchIndex = 0;
        dirty = true;
        return true;
    }

    // ========== Search ==========

    /// Runs a YAMLPath query and moves the cursor to the first match.
    ///
    /// A syntax error clears the results, leaves the cursor where it was and
    /// reports the error as the status message.
    public QueryResult search(String query) {
        Objects.requireNonNull(query, "query must not be null");
        final var result = YamlPath.find(query, tree);
        searchResults = result.matches();
        searchIndex = 0;
        if (!result.isSuccess()) {
            message = "Invalid YAMLPath: " + result.error().message();
            return result;
        }
        if (searchResults.isEmpty()) {
            message = "No matches for " + query;
        } else {
            jumpTo(searchResults.get(0));
            message = "Found " + searchResults.size() + " matches for " + query;
        }
        return result;
    }

    public List<NodePath> searchResults() {
        return searchResults;
    }

    /// {@return the 1-based position among the search results, if there are any}
    public Optional<Integer> searchPosition() {
        return searchResults.isEmpty() ? Optional.empty() : Optional.of(searchIndex + 1);
    }

    /// Moves to the next match, wrapping to the first.
    public boolean nextSearchResult() {
        if (searchResults.isEmpty()) {
            return false;
        }
        searchIndex = (searchIndex + 1) % searchResults.size();
        return moveCursor(searchResults.get(searchIndex));
    }

    /// Moves to the previous match, wrapping to the last.
    public boolean previousSearchResult() {
        if (searchResults.isEmpty()) {
            return false;
        }
        searchIndex = (searchIndex + searchResults.size() - 1) % searchResults.size();
        return moveCursor(searchResults.get(searchIndex));
    }

    // ========== Helpers ==========

    private void checkpoint(String what) {
        history.addCheckpoint(new EditorSnapshot(tree, cursor));
        dirty = true;
        message = null;
        LOG.fine(() -> "Checkpoint after " + what);
    }

    private void store(RegisterContent content, char register, boolean append) {
        if (register == RegisterSet.UNNAMED) {
            registers.setUnnamed(content);
        } else if (append) {
            registers.appendNamed(register, content);
        } else {
            registers.setNamed(register, content);
        }
    }

    private static void checkWritable(char register) {
        final char lower = Character.toLowerCase(register);
        if (register != RegisterSet.UNNAMED && (lower < 'a' || lower > 'z')) {
            throw new IllegalArgumentException("Register '" + register + "' cannot be written to");
        }
    }

    private boolean fail(EditError error) {
        return fail(error.message());
    }

    private boolean fail(String text) {
        message = text;
        LOG.fine(() -> "Edit refused: " + text);
        return false;
    }

    private NodePath cursorAfterDelete(NodePath deleted) {
        final var parent = deleted.parent();
        final int remaining = childCount(parent);
        if (remaining == 0) {
            return parent;
        }
        return parent.child(Math.min(deleted.lastIndex(), remaining - 1));
    }

    private int childCount(NodePath path) {
        final var value = tree.getNode(path).map(DocNode::value).orElse(null);
        if (value instanceof ObjectValue object) {
            return object.size();
        }
        if (value instanceof Sequence sequence) {
            return sequence.size();
        }
        return 0;
    }

    private static NodePath initialCursor(DocTree tree) {
        final var first = NodePath.of(0);
        return tree.getNode(first).isPresent() ? first : NodePath.root();
    }

    /// Gives each anchor in a pasted subtree that already exists in the
    /// document a fresh name (`b` becomes `b2`, `b3`, ...), and points the
    /// subtree's own later aliases at the new name.
    private void renameClashingAnchors(DocNode node, Map<String, String> renamed) {
        final var anchor = node.anchor();
        if (anchor != null && anchors.getAnchorPath(anchor).isPresent()) {
            var candidate = anchor;
            int counter = 2;
            while (anchors.getAnchorPath(candidate).isPresent() || renamed.containsValue(candidate)) {
                candidate = anchor + counter++;
            }
            final var fresh = candidate;
            renamed.put(anchor, fresh);
            node.setAnchor(fresh);
            LOG.fine(() -> "Pasted anchor &" + anchor + " renamed to &" + fresh);
        }
        final var value = node.value();
        if (value instanceof AliasValue alias && renamed.containsKey(alias.name())) {
            node.setValue(new AliasValue(renamed.get(alias.name())));
        } else if (value instanceof ObjectValue object) {
            for (final var member : object.members()) {
                renameClashingAnchors(member.node(), renamed);
            }
        } else if (value instanceof Sequence sequence) {
            for (final var element : sequence.elements()) {
                renameClashingAnchors(element, renamed);
            }
        }
    }

    private static String uniqueKey(ObjectValue object, String key) {
        final var base = key == null ? PASTED_KEY : key;
        var candidate = base;
        int counter = 2;
        while (object.containsKey(candidate)) {
            candidate = base + counter++;
        }
        return candidate;
    }
}
