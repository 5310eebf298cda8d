package yamlquill.editor;

import org.junit.jupiter.api.Test;
import yamlquill.document.NodePath;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Marks and the jump list.
class NavigationTest extends EditorLoggingConfig {

    private static final Logger LOG = Logger.getLogger(NavigationTest.class.getName());

    @Test
    void testMarksAreListedByName() {
        LOG.info(() -> "TEST: testMarksAreListedByName");
        final var marks = new MarkSet();
        marks.set('q', NodePath.of(2));
        marks.set('b', NodePath.of(0, 1));
        marks.set('q', NodePath.of(3));

        assertThat(marks.get('q')).contains(NodePath.of(3));
        assertThat(marks.get('z')).isEmpty();
        assertThat(marks.list()).containsExactly(
                new MarkSet.Mark('b', NodePath.of(0, 1)),
                new MarkSet.Mark('q', NodePath.of(3)));

        marks.clear();
        assertThat(marks.list()).isEmpty();
        assertThatThrownBy(() -> marks.set('A', NodePath.root())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testJumpBackAndForward() {
        LOG.info(() -> "TEST: testJumpBackAndForward");
        final var jumps = new JumpList();
        jumps.record(NodePath.of(0));
        jumps.record(NodePath.of(1));
        jumps.record(NodePath.of(2));

        assertThat(jumps.back()).contains(NodePath.of(1));
        assertThat(jumps.back()).contains(NodePath.of(0));
        assertThat(jumps.back()).isEmpty();
        assertThat(jumps.forward()).contains(NodePath.of(1));
        assertThat(jumps.forward()).contains(NodePath.of(2));
        assertThat(jumps.forward()).isEmpty();
    }

    @Test
    void testRecordingMidListTruncatesForwardHistory() {
        LOG.info(() -> "TEST: testRecordingMidListTruncatesForwardHistory");
        final var jumps = new JumpList();
        jumps.record(NodePath.of(0));
        jumps.record(NodePath.of(1));
        jumps.record(NodePath.of(2));
        jumps.back();
        jumps.back();

        jumps.record(NodePath.of(5));

        assertThat(jumps.size()).isEqualTo(2);
        assertThat(jumps.forward()).isEmpty();
        assertThat(jumps.back()).contains(NodePath.of(0));
    }

    @Test
    void testDuplicateOfCurrentIsIgnored() {
        LOG.info(() -> "TEST: testDuplicateOfCurrentIsIgnored");
        final var jumps = new JumpList();
        jumps.record(NodePath.of(4));
        jumps.record(NodePath.of(4));
        assertThat(jumps.size()).isEqualTo(1);
    }

    @Test
    void testOldestJumpDroppedAtCapacity() {
        LOG.info(() -> "TEST: testOldestJumpDroppedAtCapacity");
        final var jumps = new JumpList(3);
        for (int i = 0; i < 5; i++) {
            jumps.record(NodePath.of(i));
        }
        assertThat(jumps.size()).isEqualTo(3);
        assertThat(jumps.position()).isEqualTo(2);
        assertThat(jumps.back()).contains(NodePath.of(3));
        assertThat(jumps.back()).contains(NodePath.of(2));
        assertThat(jumps.back()).isEmpty();
    }
}
