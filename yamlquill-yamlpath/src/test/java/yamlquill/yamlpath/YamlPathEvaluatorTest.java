package yamlquill.yamlpath;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import yamlquill.document.DocNode;
import yamlquill.document.DocTree;
import yamlquill.document.DocValue.Member;
import yamlquill.document.DocValue.StringValue;
import yamlquill.document.DocumentParser;
import yamlquill.document.NodePath;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Queries run against a parsed store document.
class YamlPathEvaluatorTest extends YamlPathLoggingConfig {

    private static final Logger LOG = Logger.getLogger(YamlPathEvaluatorTest.class.getName());

    private static final String STORE_JSON = """
        {
          "store": {
            "book": [
              {"category": "reference", "author": "Nigel Rees", "title": "Sayings of the Century", "price": 8.95},
              {"category": "fiction", "author": "Evelyn Waugh", "title": "Sword of Honour", "price": 12.99},
              {"category": "fiction", "author": "Herman Melville", "title": "Moby Dick", "isbn": "0-553-21311-3", "price": 8.99},
              {"category": "fiction", "author": "J. R. R. Tolkien", "title": "The Lord of the Rings", "isbn": "0-395-19395-8", "price": 22.99}
            ],
            "bicycle": {"color": "red", "price": 19.95}
          }
        }
        """;

    private static DocTree store;

    @BeforeAll
    static void parseStore() {
        store = DocumentParser.parseJson(STORE_JSON);
        LOG.info(() -> "Parsed store document for evaluator tests");
    }

    private static DocTree items(int count) {
        final var elements = new DocNode[count];
        for (int i = 0; i < count; i++) {
            elements[i] = DocNode.integer(i * 10L);
        }
        return new DocTree(DocNode.object(Member.of("items", DocNode.array(elements))));
    }

    @Test
    void testRootOnly() {
        LOG.info(() -> "TEST: testRootOnly - $ selects the root path");
        assertThat(YamlPath.parse("$").find(store)).containsExactly(NodePath.root());
    }

    @Test
    void testChildChain() {
        LOG.info(() -> "TEST: testChildChain - $.store.bicycle.color");
        assertThat(YamlPath.parse("$.store.bicycle.color").find(store)).containsExactly(NodePath.of(0, 1, 0));
    }

    @Test
    void testMissingChildMatchesNothing() {
        LOG.info(() -> "TEST: testMissingChildMatchesNothing");
        assertThat(YamlPath.parse("$.store.car").find(store)).isEmpty();
        assertThat(YamlPath.parse("$.store.book.author").find(store)).isEmpty();
        assertThat(YamlPath.parse("$.store[0]").find(store)).isEmpty();
    }

    @Test
    void testSliceSelectsHalfOpenRange() {
        LOG.info(() -> "TEST: testSliceSelectsHalfOpenRange - $.items[0:3]");
        assertThat(YamlPath.parse("$.items[0:3]").find(items(5)))
                .containsExactly(NodePath.of(0, 0), NodePath.of(0, 1), NodePath.of(0, 2));
    }

    @Test
    void testSliceBoundsAreClamped() {
        LOG.info(() -> "TEST: testSliceBoundsAreClamped");
        final var tree = items(5);
        assertThat(YamlPath.parse("$.items[3:100]").find(tree)).containsExactly(NodePath.of(0, 3), NodePath.of(0, 4));
        assertThat(YamlPath.parse("$.items[-2:]").find(tree)).containsExactly(NodePath.of(0, 3), NodePath.of(0, 4));
        assertThat(YamlPath.parse("$.items[:-4]").find(tree)).containsExactly(NodePath.of(0, 0));
        assertThat(YamlPath.parse("$.items[-100:1]").find(tree)).containsExactly(NodePath.of(0, 0));
        assertThat(YamlPath.parse("$.items[4:-3]").find(tree)).isEmpty();
        assertThat(YamlPath.parse("$.items[2:2]").find(tree)).isEmpty();
    }

    @Test
    void testNegativeIndexCountsFromEnd() {
        LOG.info(() -> "TEST: testNegativeIndexCountsFromEnd - $.items[-1]");
        final var tree = items(5);
        assertThat(YamlPath.parse("$.items[-1]").find(tree)).containsExactly(NodePath.of(0, 4));
        assertThat(YamlPath.parse("$.items[-6]").find(tree)).isEmpty();
        assertThat(YamlPath.parse("$.items[5]").find(tree)).isEmpty();
    }

    @Test
    void testWildcardOverArrayAndObject() {
        LOG.info(() -> "TEST: testWildcardOverArrayAndObject");
        assertThat(YamlPath.parse("$.store.book[*].author").find(store)).containsExactly(
                NodePath.of(0, 0, 0, 1), NodePath.of(0, 0, 1, 1), NodePath.of(0, 0, 2, 1), NodePath.of(0, 0, 3, 1));
        assertThat(YamlPath.parse("$.store.*").find(store)).containsExactly(NodePath.of(0, 0), NodePath.of(0, 1));
        assertThat(YamlPath.parse("$.store.bicycle.color.*").find(store)).isEmpty();
    }

    @Test
    void testRecursiveDescentIsPreOrder() {
        LOG.info(() -> "TEST: testRecursiveDescentIsPreOrder - $..price");
        final var tree = DocumentParser.parseJson("{\"a\": {\"price\": 1, \"b\": {\"price\": 2}}, \"price\": 3}");
        assertThat(YamlPath.parse("$..price").find(tree))
                .containsExactly(NodePath.of(0, 0), NodePath.of(0, 1, 0), NodePath.of(1));
    }

    @Test
    void testRecursiveDescentThroughArrays() {
        LOG.info(() -> "TEST: testRecursiveDescentThroughArrays - $..price on store");
        assertThat(YamlPath.parse("$..price").find(store)).containsExactly(
                NodePath.of(0, 0, 0, 3),
                NodePath.of(0, 0, 1, 3),
                NodePath.of(0, 0, 2, 4),
                NodePath.of(0, 0, 3, 4),
                NodePath.of(0, 1, 1));
        assertThat(YamlPath.parse("$..isbn").find(store)).hasSize(2);
    }

    @Test
    void testRecursiveWildcardVisitsEveryDescendant() {
        LOG.info(() -> "TEST: testRecursiveWildcardVisitsEveryDescendant");
        final var tree = DocumentParser.parseJson("{\"a\": [1, {\"b\": 2}]}");
        assertThat(YamlPath.parse("$..*").find(tree)).containsExactly(
                NodePath.of(0), NodePath.of(0, 0), NodePath.of(0, 1), NodePath.of(0, 1, 0));
    }

    @Test
    void testRecursiveBracketAppliesToEveryDescendant() {
        LOG.info(() -> "TEST: testRecursiveBracketAppliesToEveryDescendant - $..[0]");
        final var tree = DocumentParser.parseJson("{\"a\": [[1, 2], [3]]}");
        assertThat(YamlPath.parse("$..[0]").find(tree)).containsExactly(
                NodePath.of(0, 0), NodePath.of(0, 0, 0), NodePath.of(0, 1, 0));
    }

    @Test
    void testMultiPropertyKeepsRequestedOrder() {
        LOG.info(() -> "TEST: testMultiPropertyKeepsRequestedOrder");
        assertThat(YamlPath.parse("$.store.book[0]['title','author','missing']").find(store))
                .containsExactly(NodePath.of(0, 0, 0, 2), NodePath.of(0, 0, 0, 1));
    }

    @Test
    void testSelectReturnsNodes() {
        LOG.info(() -> "TEST: testSelectReturnsNodes");
        final var nodes = YamlPath.parse("$.store.bicycle.color").select(store);
        assertThat(nodes).extracting(DocNode::value).containsExactly(StringValue.plain("red"));
    }

    @Test
    void testQueriesReachIntoJsonLinesDocuments() {
        LOG.info(() -> "TEST: testQueriesReachIntoJsonLinesDocuments");
        final var tree = DocumentParser.parseJsonLines("{\"id\": 1}\n{\"id\": 2}\n");
        assertThat(YamlPath.parse("$[1].id").find(tree)).containsExactly(NodePath.of(1, 0));
        assertThat(YamlPath.parse("$[*].id").find(tree)).containsExactly(NodePath.of(0, 0), NodePath.of(1, 0));
    }

    @Test
    void testOneShotFindSucceeds() {
        LOG.info(() -> "TEST: testOneShotFindSucceeds");
        final var result = YamlPath.find("$.items[-1]", items(3));
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.matches()).containsExactly(NodePath.of(0, 2));
    }
}
