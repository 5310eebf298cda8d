package yamlquill.editor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import yamlquill.document.DocNode;
import yamlquill.document.DocValue.IntegerNumber;
import yamlquill.document.DocValue.StringValue;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegisterSetTest extends EditorLoggingConfig {

    private static final Logger LOG = Logger.getLogger(RegisterSetTest.class.getName());

    private static RegisterContent content(long value) {
        return RegisterContent.of(DocNode.integer(value), null);
    }

    private static long single(RegisterContent content) {
        assertThat(content.size()).isEqualTo(1);
        return ((IntegerNumber) content.nodes().get(0).value()).value();
    }

    @Test
    void testFreshSetIsEmpty() {
        LOG.info(() -> "TEST: testFreshSetIsEmpty");
        final var registers = new RegisterSet();
        assertThat(registers.getUnnamed().isEmpty()).isTrue();
        assertThat(registers.getNamed('a')).isEmpty();
        for (int i = 0; i < 10; i++) {
            assertThat(registers.getNumbered(i).isEmpty()).isTrue();
        }
    }

    @Test
    void testNamedRegistersIgnoreCase() {
        LOG.info(() -> "TEST: testNamedRegistersIgnoreCase");
        final var registers = new RegisterSet();
        registers.setNamed('A', content(1));
        assertThat(registers.getNamed('a').map(RegisterSetTest::single)).contains(1L);
        assertThat(registers.get('A').map(RegisterSetTest::single)).contains(1L);
    }

    @Test
    void testGetRoutesByCharacter() {
        LOG.info(() -> "TEST: testGetRoutesByCharacter");
        final var registers = new RegisterSet();
        registers.setNamed('a', content(1));
        registers.setNumbered(5, content(2));
        registers.setUnnamed(content(3));

        assertThat(registers.get('a').map(RegisterSetTest::single)).contains(1L);
        assertThat(registers.get('5').map(RegisterSetTest::single)).contains(2L);
        assertThat(registers.get('"').map(RegisterSetTest::single)).contains(3L);
        assertThat(registers.get('z')).isEmpty();
    }

    @Test
    void testAppendConcatenatesNodesAndKeys() {
        LOG.info(() -> "TEST: testAppendConcatenatesNodesAndKeys");
        final var registers = new RegisterSet();
        registers.appendNamed('b', RegisterContent.of(DocNode.integer(1), "one"));
        registers.appendNamed('B', RegisterContent.of(DocNode.integer(2), null));

        final var held = registers.getNamed('b').orElseThrow();
        assertThat(held.size()).isEqualTo(2);
        assertThat(held.keys()).containsExactly("one", null);
    }

    @Test
    void testDeleteHistoryShiftsNewestIntoSlotOne() {
        LOG.info(() -> "TEST: testDeleteHistoryShiftsNewestIntoSlotOne");
        final var registers = new RegisterSet();
        registers.pushDeleteHistory(content(1));
        registers.pushDeleteHistory(content(2));
        registers.pushDeleteHistory(content(3));

        assertThat(single(registers.getNumbered(1))).isEqualTo(3);
        assertThat(single(registers.getNumbered(2))).isEqualTo(2);
        assertThat(single(registers.getNumbered(3))).isEqualTo(1);
        assertThat(registers.getNumbered(0).isEmpty()).isTrue();
    }

    @Test
    void testDeleteHistoryDropsSlotNine() {
        LOG.info(() -> "TEST: testDeleteHistoryDropsSlotNine");
        final var registers = new RegisterSet();
        for (long i = 1; i <= 10; i++) {
            registers.pushDeleteHistory(content(i));
        }
        assertThat(single(registers.getNumbered(1))).isEqualTo(10);
        assertThat(single(registers.getNumbered(9))).isEqualTo(2);
    }

    @Test
    void testYankRegisterIsSeparateFromDeletes() {
        LOG.info(() -> "TEST: testYankRegisterIsSeparateFromDeletes");
        final var registers = new RegisterSet();
        registers.updateYankRegister(content(7));
        registers.pushDeleteHistory(content(8));
        assertThat(single(registers.getNumbered(0))).isEqualTo(7);
        assertThat(single(registers.getNumbered(1))).isEqualTo(8);
    }

    @Test
    void testContentIsIsolatedFromLaterEdits() {
        LOG.info(() -> "TEST: testContentIsIsolatedFromLaterEdits");
        final var node = DocNode.string("before");
        final var content = RegisterContent.of(node, "k");
        node.setValue(StringValue.plain("after"));
        assertThat(content.nodes().get(0).value()).isEqualTo(StringValue.plain("before"));
    }

    @Test
    void testContentRejectsMismatchedKeys() {
        LOG.info(() -> "TEST: testContentRejectsMismatchedKeys");
        assertThatThrownBy(() -> new RegisterContent(List.of(DocNode.nullNode()), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        final var keys = Arrays.asList((String) null);
        assertThat(new RegisterContent(List.of(DocNode.nullNode()), keys).keys()).containsExactly((String) null);
    }

    @Test
    void testClearEmptiesEverything() {
        LOG.info(() -> "TEST: testClearEmptiesEverything");
        final var registers = new RegisterSet();
        registers.setUnnamed(content(1));
        registers.setNamed('q', content(2));
        registers.pushDeleteHistory(content(3));
        registers.clear();
        assertThat(registers.getUnnamed().isEmpty()).isTrue();
        assertThat(registers.getNamed('q')).isEmpty();
        assertThat(registers.getNumbered(1).isEmpty()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(chars = {'1', '!', ' ', '"'})
    void testNamedAccessRejectsNonLetters(char register) {
        LOG.info(() -> "TEST: testNamedAccessRejectsNonLetters - " + register);
        final var registers = new RegisterSet();
        assertThatThrownBy(() -> registers.setNamed(register, content(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNumberedIndexOutOfRange() {
        LOG.info(() -> "TEST: testNumberedIndexOutOfRange");
        final var registers = new RegisterSet();
        assertThatThrownBy(() -> registers.getNumbered(10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registers.setNumbered(-1, content(1))).isInstanceOf(IllegalArgumentException.class);
    }
}
