package yamlquill.editor;

import org.junit.jupiter.api.Test;
import yamlquill.document.DocNode;
import yamlquill.document.DocTree;
import yamlquill.document.DocValue.StringValue;
import yamlquill.document.NodePath;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UndoTreeTest extends EditorLoggingConfig {

    private static final Logger LOG = Logger.getLogger(UndoTreeTest.class.getName());

    private static EditorSnapshot snapshot(String label) {
        return new EditorSnapshot(new DocTree(DocNode.string(label)), NodePath.root());
    }

    private static String label(EditorSnapshot snapshot) {
        return ((StringValue) snapshot.tree().root().value()).text();
    }

    @Test
    void testFreshTreeHasOnlyRoot() {
        LOG.info(() -> "TEST: testFreshTreeHasOnlyRoot");
        final var history = new UndoTree(snapshot("R"), 50);
        assertThat(history.current()).isZero();
        assertThat(history.size()).isEqualTo(1);
        assertThat(history.limit()).isEqualTo(50);
        assertThat(history.node(0).seq()).isZero();
        assertThat(history.node(0).isRoot()).isTrue();
        assertThat(history.canUndo()).isFalse();
        assertThat(history.canRedo()).isFalse();
    }

    @Test
    void testCheckpointLinksParentAndChild() {
        LOG.info(() -> "TEST: testCheckpointLinksParentAndChild");
        final var history = new UndoTree(snapshot("R"));
        history.addCheckpoint(snapshot("A"));

        assertThat(history.current()).isEqualTo(1);
        assertThat(history.node(1).parent()).isZero();
        assertThat(history.node(1).seq()).isEqualTo(1);
        assertThat(history.node(0).children()).containsExactly(1);
    }

    @Test
    void testUndoAndRedoAreNoOpsAtTheEnds() {
        LOG.info(() -> "TEST: testUndoAndRedoAreNoOpsAtTheEnds");
        final var history = new UndoTree(snapshot("R"));
        assertThat(history.undo()).isEmpty();
        assertThat(history.redo()).isEmpty();
        assertThat(history.current()).isZero();
    }

    @Test
    void testRedoFollowsNewestBranch() {
        LOG.info(() -> "TEST: testRedoFollowsNewestBranch - R -> A, undo, R -> B");
        final var history = new UndoTree(snapshot("R"));
        history.addCheckpoint(snapshot("A"));
        assertThat(history.undo().map(UndoTreeTest::label)).contains("R");
        history.addCheckpoint(snapshot("B"));

        assertThat(history.undo().map(UndoTreeTest::label)).contains("R");
        assertThat(history.redo().map(UndoTreeTest::label)).contains("B");
        assertThat(history.node(0).children()).hasSize(2);
    }

    @Test
    void testRedoPrefersNewestEvenAfterVisitingOlderBranch() {
        LOG.info(() -> "TEST: testRedoPrefersNewestEvenAfterVisitingOlderBranch");
        final var history = new UndoTree(snapshot("R"));
        history.addCheckpoint(snapshot("A"));
        history.undo();
        history.addCheckpoint(snapshot("B"));
        history.undo();
        history.redo();
        history.undo();

        assertThat(history.redo().map(UndoTreeTest::label)).contains("B");
    }

    @Test
    void testSnapshotsAreCopiedInAndOut() {
        LOG.info(() -> "TEST: testSnapshotsAreCopiedInAndOut");
        final var live = snapshot("R");
        final var history = new UndoTree(live);
        live.tree().root().setValue(StringValue.plain("changed"));
        history.addCheckpoint(snapshot("A"));

        final var restored = history.undo().orElseThrow();
        assertThat(label(restored)).isEqualTo("R");
        restored.tree().root().setValue(StringValue.plain("mutated"));
        assertThat(label(history.currentSnapshot())).isEqualTo("R");
    }

    @Test
    void testPruningEvictsOldestLeafOffCurrentPath() {
        LOG.info(() -> "TEST: testPruningEvictsOldestLeafOffCurrentPath");
        final var history = new UndoTree(snapshot("R"), 3);
        history.addCheckpoint(snapshot("A"));
        history.undo();
        history.addCheckpoint(snapshot("B"));
        history.addCheckpoint(snapshot("C"));

        assertThat(history.size()).isEqualTo(3);
        assertThat(label(history.currentSnapshot())).isEqualTo("C");
        assertThat(history.undo().map(UndoTreeTest::label)).contains("B");
        assertThat(history.undo().map(UndoTreeTest::label)).contains("R");
        assertThat(history.node(0).children()).hasSize(1);
    }

    @Test
    void testPruningALinearHistoryDropsOldestStates() {
        LOG.info(() -> "TEST: testPruningALinearHistoryDropsOldestStates");
        final var history = new UndoTree(snapshot("R"), 3);
        for (final var label : new String[]{"A", "B", "C", "D"}) {
            history.addCheckpoint(snapshot(label));
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.node(0).isRoot()).isTrue();
        assertThat(history.node(0).seq()).isEqualTo(2);
        assertThat(history.undo().map(UndoTreeTest::label)).contains("C");
        assertThat(history.undo().map(UndoTreeTest::label)).contains("B");
        assertThat(history.undo()).isEmpty();
    }

    @Test
    void testSequenceNumbersAreNeverReused() {
        LOG.info(() -> "TEST: testSequenceNumbersAreNeverReused");
        final var history = new UndoTree(snapshot("R"), 2);
        history.addCheckpoint(snapshot("A"));
        history.undo();
        history.addCheckpoint(snapshot("B"));
        assertThat(history.node(history.current()).seq()).isEqualTo(2);
    }

    @Test
    void testInvalidArenaIndexIsAnInternalError() {
        LOG.info(() -> "TEST: testInvalidArenaIndexIsAnInternalError");
        final var history = new UndoTree(snapshot("R"));
        assertThatThrownBy(() -> history.node(1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> history.node(-1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testClearStartsOver() {
        LOG.info(() -> "TEST: testClearStartsOver");
        final var history = new UndoTree(snapshot("R"));
        history.addCheckpoint(snapshot("A"));
        history.clear(snapshot("N"));
        assertThat(history.size()).isEqualTo(1);
        assertThat(label(history.currentSnapshot())).isEqualTo("N");
        history.addCheckpoint(snapshot("X"));
        assertThat(history.node(1).seq()).isEqualTo(1);
    }
}
