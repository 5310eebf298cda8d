package yamlquill.document;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import yamlquill.document.DocValue.Member;
import yamlquill.document.DocValue.MultiDocValue;
import yamlquill.document.DocValue.StringValue;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/// Format preservation and canonical JSON/YAML rendering.
class DocumentSerializerTest extends DocumentLoggingConfig {

    private static final Logger LOG = Logger.getLogger(DocumentSerializerTest.class.getName());

    private static final FormatConfig DEFAULTS = FormatConfig.defaults();

    private static String json(DocTree tree) {
        return DocumentSerializer.serialize(tree, DocumentFormat.JSON, DEFAULTS);
    }

    private static String yaml(DocNode root) {
        return DocumentSerializer.serialize(new DocTree(root), DocumentFormat.YAML, DEFAULTS);
    }

    // ========== Preservation ==========

    @ParameterizedTest
    @ValueSource(strings = {
            "{\n    \"name\": \"Alice\",\n    \"tags\": [1,2]\n}\n",
            "  [ 1 ,2.50,  \"x\" ]  ",
            "{\"a\":{\"b\":[true,false,null]},\"c\":1e10}",
            "\"just a string\"\n"
    })
    void testUnmodifiedTreeRoundTripsExactly(String source) {
        LOG.info(() -> "TEST: testUnmodifiedTreeRoundTripsExactly");
        assertThat(json(DocumentParser.parseJson(source))).isEqualTo(source);
    }

    @Test
    void testEditedNodeIsReRenderedAndSiblingsKeepSourceText() {
        LOG.info(() -> "TEST: testEditedNodeIsReRenderedAndSiblingsKeepSourceText");
        final var tree = DocumentParser.parseJson("{\n    \"name\": \"Alice\",\n    \"tags\": [1,2]\n}\n");
        tree.getNodeMut(NodePath.of(0)).orElseThrow().setValue(StringValue.plain("Bob"));

        assertThat(json(tree)).isEqualTo("{\n  \"name\": \"Bob\",\n  \"tags\": [1,2]\n}\n");
    }

    @Test
    void testPreserveFormattingDisabledRendersEverything() {
        LOG.info(() -> "TEST: testPreserveFormattingDisabledRendersEverything");
        final var tree = DocumentParser.parseJson("{\n    \"name\": \"Alice\",\n    \"tags\": [1,2]\n}\n");
        final var out = DocumentSerializer.serialize(tree, DocumentFormat.JSON, DEFAULTS.withPreserveFormatting(false));
        assertThat(out).isEqualTo("{\n  \"name\": \"Alice\",\n  \"tags\": [1, 2]\n}\n");
    }

    @Test
    void testJsonSourceIsNotCopiedIntoYaml() {
        LOG.info(() -> "TEST: testJsonSourceIsNotCopiedIntoYaml");
        final var tree = DocumentParser.parseJson("{\"name\":\"Alice\",\"tags\":[1,2]}");
        assertThat(DocumentSerializer.serialize(tree, DocumentFormat.YAML, DEFAULTS))
                .isEqualTo("name: Alice\ntags: [1, 2]\n");
    }

    // ========== Canonical JSON ==========

    @Test
    void testCompactObjectOfScalars() {
        LOG.info(() -> "TEST: testCompactObjectOfScalars");
        final var root = DocNode.object(
                Member.of("a", DocNode.integer(1)),
                Member.of("b", DocNode.string("test")),
                Member.of("c", DocNode.bool(false)));
        assertThat(json(new DocTree(root))).isEqualTo("{\"a\": 1, \"b\": \"test\", \"c\": false}");
    }

    @Test
    void testNestedContainerGoesMultiline() {
        LOG.info(() -> "TEST: testNestedContainerGoesMultiline");
        final var root = DocNode.object(Member.of("user", DocNode.object(Member.of("age", DocNode.integer(30)))));
        assertThat(json(new DocTree(root))).isEqualTo("{\n  \"user\": {\"age\": 30}\n}");
    }

    @Test
    void testLongArrayExceedsCompactWidth() {
        LOG.info(() -> "TEST: testLongArrayExceedsCompactWidth");
        final var elements = IntStream.range(0, 30).mapToObj(DocNode::integer).toArray(DocNode[]::new);
        final var out = json(new DocTree(DocNode.array(elements)));
        assertThat(out).startsWith("[\n  0,\n  1,");
        assertThat(out).endsWith("  29\n]");
    }

    @Test
    void testIndentSizeIsHonoured() {
        LOG.info(() -> "TEST: testIndentSizeIsHonoured");
        final var root = DocNode.object(Member.of("list", DocNode.array(DocNode.array())));
        final var out = DocumentSerializer.serialize(new DocTree(root), DocumentFormat.JSON, DEFAULTS.withIndentSize(4));
        assertThat(out).isEqualTo("{\n    \"list\": [\n        []\n    ]\n}");
    }

    @Test
    void testNumbersKeepTheirKind() {
        LOG.info(() -> "TEST: testNumbersKeepTheirKind");
        final var root = DocNode.array(DocNode.integer(42), DocNode.decimal(42.0));
        assertThat(json(new DocTree(root))).isEqualTo("[42, 42.0]");
    }

    @Test
    void testJsonEscapesAliasesAndDropsComments() {
        LOG.info(() -> "TEST: testJsonEscapesAliasesAndDropsComments");
        final var base = DocNode.object(Member.of("x", DocNode.integer(1)));
        base.setAnchor("b");
        final var root = DocNode.object(
                Member.of("__comment_0", DocNode.comment("heading", CommentPosition.ABOVE)),
                Member.of("base", base),
                Member.of("ref", DocNode.alias("b")),
                Member.of("text", DocNode.string("say \"hi\"\n")));
        assertThat(json(new DocTree(root))).isEqualTo(
                "{\n  \"base\": {\"x\": 1},\n  \"ref\": \"*b\",\n  \"text\": \"say \\\"hi\\\"\\n\"\n}");
    }

    @Test
    void testEmptyContainers() {
        LOG.info(() -> "TEST: testEmptyContainers");
        assertThat(json(new DocTree(DocNode.object()))).isEqualTo("{}");
        assertThat(json(new DocTree(DocNode.array()))).isEqualTo("[]");
        assertThat(yaml(DocNode.object())).isEqualTo("{}\n");
    }

    // ========== JSON Lines ==========

    @Test
    void testJsonLinesKeepsUntouchedLines() {
        LOG.info(() -> "TEST: testJsonLinesKeepsUntouchedLines");
        final var source = "{\"a\":1}\n{\"b\": 2}\n";
        final var tree = DocumentParser.parseJsonLines(source);
        assertThat(json(tree)).isEqualTo(source);

        tree.getNodeMut(NodePath.of(0, 0)).orElseThrow().setValue(DocValue.IntegerNumber.of(5));
        assertThat(json(tree)).isEqualTo("{\"a\":5}\n{\"b\": 2}\n");
    }

    @Test
    void testBuiltMultiDocumentAsJsonLines() {
        LOG.info(() -> "TEST: testBuiltMultiDocumentAsJsonLines");
        final var root = DocNode.of(new MultiDocValue(List.of(
                DocNode.object(Member.of("id", DocNode.integer(1)), Member.of("tags", DocNode.array(DocNode.string("a")))),
                DocNode.array())));
        assertThat(json(new DocTree(root))).isEqualTo("{\"id\":1,\"tags\":[\"a\"]}\n[]\n");
    }

    // ========== YAML ==========

    @Test
    void testYamlBlockMappingWithFlowSequence() {
        LOG.info(() -> "TEST: testYamlBlockMappingWithFlowSequence");
        final var root = DocNode.object(
                Member.of("name", DocNode.string("Alice")),
                Member.of("age", DocNode.integer(30)),
                Member.of("tags", DocNode.array(DocNode.string("a"), DocNode.string("b"))));
        assertThat(yaml(root)).isEqualTo("name: Alice\nage: 30\ntags: [a, b]\n");
    }

    @Test
    void testYamlBlockSequencesWhenFlowIsDisabled() {
        LOG.info(() -> "TEST: testYamlBlockSequencesWhenFlowIsDisabled");
        final var config = DEFAULTS.withCompactWidth(0);
        final var mapping = DocNode.object(
                Member.of("name", DocNode.string("Alice")),
                Member.of("tags", DocNode.array(DocNode.string("a"), DocNode.string("b"))));
        assertThat(DocumentSerializer.render(mapping, DocumentFormat.YAML, config))
                .isEqualTo("name: Alice\ntags:\n  - a\n  - b\n");

        final var list = DocNode.array(DocNode.object(Member.of("a", DocNode.integer(1)), Member.of("b", DocNode.integer(2))));
        assertThat(DocumentSerializer.render(list, DocumentFormat.YAML, config)).isEqualTo("- a: 1\n  b: 2\n");
    }

    @Test
    void testYamlAnchorsAndAliases() {
        LOG.info(() -> "TEST: testYamlAnchorsAndAliases");
        final var base = DocNode.object(Member.of("x", DocNode.integer(1)));
        base.setAnchor("b");
        final var root = DocNode.object(Member.of("base", base), Member.of("ref", DocNode.alias("b")));
        assertThat(yaml(root)).isEqualTo("base: &b {x: 1}\nref: *b\n");
    }

    @Test
    void testYamlComments() {
        LOG.info(() -> "TEST: testYamlComments");
        final var root = DocNode.object(
                Member.of("__comment_0", DocNode.comment("heading", CommentPosition.ABOVE)),
                Member.of("name", DocNode.string("Alice")),
                Member.of("__comment_1", DocNode.comment("inline", CommentPosition.LINE)));
        assertThat(yaml(root)).isEqualTo("# heading\nname: Alice  # inline\n");
    }

    @Test
    void testYamlBlockScalars() {
        LOG.info(() -> "TEST: testYamlBlockScalars");
        final var literal = DocNode.object(Member.of("script",
                DocNode.of(new StringValue("echo hi\necho bye\n", StringStyle.LITERAL))));
        assertThat(yaml(literal)).isEqualTo("script: |\n  echo hi\n  echo bye\n");

        final var folded = DocNode.object(Member.of("note",
                DocNode.of(new StringValue("first\nsecond", StringStyle.FOLDED))));
        assertThat(yaml(folded)).isEqualTo("note: >-\n  first\n\n  second\n");
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "No", "123", "1.5", "", "a: b", "- item", "x #y", " lead", "[x]", "~", "multi\nline"})
    void testYamlQuotesAmbiguousStrings(String text) {
        LOG.info(() -> "TEST: testYamlQuotesAmbiguousStrings - " + text);
        assertThat(yaml(DocNode.string(text))).startsWith("\"");
    }

    @ParameterizedTest
    @ValueSource(strings = {"hello", "hello world", "snake_case", "path/to/file", "e-mail"})
    void testYamlLeavesPlainStringsAlone(String text) {
        LOG.info(() -> "TEST: testYamlLeavesPlainStringsAlone - " + text);
        assertThat(yaml(DocNode.string(text))).isEqualTo(text + "\n");
    }

    @Test
    void testYamlMultiDocument() {
        LOG.info(() -> "TEST: testYamlMultiDocument");
        final var root = DocNode.of(new MultiDocValue(List.of(
                DocNode.object(Member.of("a", DocNode.integer(1))),
                DocNode.object(Member.of("b", DocNode.integer(2))))));
        assertThat(yaml(root)).isEqualTo("{a: 1}\n---\n{b: 2}\n");
    }
}
