package yamlquill.yamlpath;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import yamlquill.document.DocNode;
import yamlquill.document.DocTree;
import yamlquill.document.NodePath;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Index and slice laws over arrays of random length.
class YamlPathPropertyTest extends YamlPathLoggingConfig {

    private static final Logger LOG = Logger.getLogger(YamlPathPropertyTest.class.getName());

    private static DocTree arrayOf(int size) {
        final var elements = new DocNode[size];
        for (int i = 0; i < size; i++) {
            elements[i] = DocNode.integer(i);
        }
        return new DocTree(DocNode.array(elements));
    }

    @Property(tries = 100)
    void negativeIndexMirrorsPositiveIndex(@ForAll @IntRange(min = 1, max = 20) int size,
                                           @ForAll @IntRange(min = 1, max = 20) int fromEnd) {
        Assume.that(fromEnd <= size);
        LOG.finer(() -> "negativeIndexMirrorsPositiveIndex size=" + size + " fromEnd=" + fromEnd);
        final var tree = arrayOf(size);
        assertThat(YamlPath.parse("$[-" + fromEnd + "]").find(tree))
                .isEqualTo(YamlPath.parse("$[" + (size - fromEnd) + "]").find(tree));
    }

    @Property(tries = 200)
    void sliceStaysInBoundsAndInOrder(@ForAll @IntRange(max = 15) int size,
                                      @ForAll @IntRange(min = -20, max = 20) int start,
                                      @ForAll @IntRange(min = -20, max = 20) int end) {
        Assume.that(start < 0 || end < 0 || start <= end);
        final var matches = YamlPath.parse("$[" + start + ":" + end + "]").find(arrayOf(size));

        int previous = -1;
        for (final NodePath match : matches) {
            assertThat(match.length()).isEqualTo(1);
            assertThat(match.lastIndex()).isBetween(0, size - 1).isGreaterThan(previous);
            previous = match.lastIndex();
        }
    }

    @Property(tries = 50)
    void wildcardListsEveryElement(@ForAll @IntRange(max = 30) int size) {
        final var matches = YamlPath.parse("$[*]").find(arrayOf(size));
        assertThat(matches).hasSize(size);
        for (int i = 0; i < size; i++) {
            assertThat(matches.get(i)).isEqualTo(NodePath.of(i));
        }
    }
}
