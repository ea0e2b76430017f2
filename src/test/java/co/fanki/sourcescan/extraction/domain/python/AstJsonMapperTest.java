package co.fanki.sourcescan.extraction.domain.python;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AstJsonMapper}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AstJsonMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void whenMapping_givenCallTree_shouldRebuildNodes() throws Exception {
        final SyntaxTree tree = map("storage.upload(b, retries=3)\n", """
                {"tree": {"_type": "Module", "fields": {"body": [
                  {"_type": "Expr", "lineno": 1, "col_offset": 0, "fields": {
                    "value": {"_type": "Call", "lineno": 1, "col_offset": 0,
                      "fields": {
                        "func": {"_type": "Attribute", "lineno": 1,
                          "col_offset": 0, "payload": "upload", "fields": {
                            "value": {"_type": "Name", "lineno": 1,
                              "col_offset": 0, "payload": "storage",
                              "fields": {}}}},
                        "args": [{"_type": "Name", "lineno": 1,
                          "col_offset": 15, "payload": "b", "fields": {}}],
                        "keywords": [{"_type": "keyword", "lineno": 1,
                          "col_offset": 18, "payload": "retries", "fields": {
                            "value": {"_type": "Constant", "lineno": 1,
                              "col_offset": 26,
                              "payload": {"kind": "integer", "value": "3"},
                              "fields": {}}}}]}}}}]}}}
                """);

        final SyntaxNode call = tree.root().children(Fields.BODY).get(0)
                .requireChild(Fields.VALUE);
        assertEquals(NodeKind.CALL, call.kind());
        assertEquals("upload", call.requireChild(Fields.FUNC).payload());

        final SyntaxNode keyword = call.children(Fields.KEYWORDS).get(0);
        assertEquals(NodeKind.KEYWORD, keyword.kind());
        assertEquals(18, keyword.column());
        assertEquals(BigInteger.valueOf(3), keyword.requireChild(Fields.VALUE)
                .payload(LiteralValue.class).value());
    }

    @Test
    void whenMapping_givenImportPayloads_shouldBuildAliases()
            throws Exception {
        final SyntaxTree tree = map("from . import a as b\n", """
                {"tree": {"_type": "Module", "fields": {"body": [
                  {"_type": "ImportFrom", "lineno": 1, "col_offset": 0,
                    "fields": {"names": [{"_type": "alias", "lineno": 1,
                      "col_offset": 14,
                      "payload": {"name": "a", "asname": "b"},
                      "fields": {}}]}}]}}}
                """);

        final SyntaxNode statement = tree.root().children(Fields.BODY).get(0);
        assertNull(statement.payload());
        assertEquals(new ImportAlias("a", "b"), statement
                .children(Fields.NAMES).get(0).payload(ImportAlias.class));
    }

    @Test
    void whenMapping_givenPatternPayloads_shouldTypeThem() throws Exception {
        final SyntaxTree tree = map("match p:\n    case C(k=None):\n"
                + "        pass\n", """
                {"tree": {"_type": "Module", "fields": {"body": [
                  {"_type": "Match", "lineno": 1, "col_offset": 0, "fields": {
                    "subject": {"_type": "Name", "lineno": 1,
                      "col_offset": 6, "payload": "p", "fields": {}},
                    "cases": [{"_type": "match_case", "fields": {
                      "pattern": {"_type": "MatchClass", "lineno": 2,
                        "col_offset": 9, "payload": ["k"], "fields": {
                          "cls": {"_type": "Name", "lineno": 2,
                            "col_offset": 9, "payload": "C", "fields": {}},
                          "patterns": [],
                          "kwd_patterns": [{"_type": "MatchSingleton",
                            "lineno": 2, "col_offset": 13,
                            "payload": {"kind": "none"}, "fields": {}}]}},
                      "guard": null,
                      "body": [{"_type": "Pass", "lineno": 3,
                        "col_offset": 8, "fields": {}}]}}]}}]}}}
                """);

        final SyntaxNode match = tree.root().children(Fields.BODY).get(0);
        assertEquals(NodeKind.MATCH, match.kind());
        final SyntaxNode matchCase = match.children(Fields.CASES).get(0);
        assertEquals(NodeKind.MATCH_CASE, matchCase.kind());
        assertNull(matchCase.child(Fields.GUARD));

        final SyntaxNode pattern = matchCase.requireChild(Fields.PATTERN);
        assertEquals(NodeKind.MATCH_CLASS, pattern.kind());
        assertEquals(List.of("k"), pattern.payload());
        assertEquals(LiteralValue.none(), pattern
                .children(Fields.KWD_PATTERNS).get(0)
                .payload(LiteralValue.class));
    }

    @Test
    void whenMapping_givenDictWithUnpacking_shouldKeepNullKey()
            throws Exception {
        final SyntaxTree tree = map("x = {**a, 'k': 1.5}\n", """
                {"tree": {"_type": "Module", "fields": {"body": [
                  {"_type": "Expr", "lineno": 1, "col_offset": 0, "fields": {
                    "value": {"_type": "Dict", "lineno": 1, "col_offset": 4,
                      "fields": {
                        "keys": [null, {"_type": "Constant", "lineno": 1,
                          "col_offset": 10,
                          "payload": {"kind": "string", "value": "k"},
                          "fields": {}}],
                        "values": [
                          {"_type": "Name", "lineno": 1, "col_offset": 7,
                            "payload": "a", "fields": {}},
                          {"_type": "Constant", "lineno": 1,
                            "col_offset": 15,
                            "payload": {"kind": "float", "value": "1.5"},
                            "fields": {}}]}}}}]}}}
                """);

        final SyntaxNode dict = tree.root().children(Fields.BODY).get(0)
                .requireChild(Fields.VALUE);
        final List<SyntaxNode> keys = dict.children(Fields.KEYS);
        assertNull(keys.get(0));
        assertEquals(new BigDecimal("1.5"), dict.children(Fields.VALUES)
                .get(1).payload(LiteralValue.class).value());
        assertEquals(6, tree.enumerate().size());
    }

    @Test
    void whenMapping_givenSyntaxError_shouldThrowWithLocation()
            throws Exception {
        final String source = "upload(bucket='b'\nprint(1)\n";

        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class, () -> map(source, """
                        {"error": {"msg": "'(' was never closed",
                          "lineno": 1, "offset": 7,
                          "text": "upload(bucket='b'"}}
                        """));

        assertEquals("'(' was never closed", e.getMessage());
        assertEquals(1, e.getLine());
        assertEquals(7, e.getOffset());
        assertEquals("upload(bucket='b'", e.getText());
    }

    @Test
    void whenMapping_givenSyntaxErrorWithoutText_shouldUseSourceLine() {
        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class, () -> map("a = 1\nb = \n", """
                        {"error": {"msg": "invalid syntax", "lineno": 2,
                          "offset": 5, "text": null}}
                        """));

        assertEquals("b = ", e.getText());
    }

    @Test
    void whenMapping_givenInterpreterFailure_shouldThrowFrontEndException() {
        final FrontEndException e = assertThrows(FrontEndException.class,
                () -> map("x\n", """
                        {"failure": {"type": "MemoryError",
                          "message": "out of memory"}}
                        """));

        assertTrue(e.getMessage().contains("MemoryError"));
    }

    @Test
    void whenMapping_givenNonModuleRoot_shouldThrowFrontEndException() {
        assertThrows(FrontEndException.class, () -> map("x\n", """
                {"tree": {"_type": "Expr", "lineno": 1, "col_offset": 0,
                  "fields": {}}}
                """));
    }

    @Test
    void whenMapping_givenEmptyDocument_shouldThrowFrontEndException() {
        assertThrows(FrontEndException.class, () -> map("x\n", "{}"));
    }

    @Test
    void whenMapping_givenUnknownConstantKind_shouldThrowFrontEndException() {
        assertThrows(FrontEndException.class, () -> map("x\n", """
                {"tree": {"_type": "Module", "fields": {"body": [
                  {"_type": "Expr", "lineno": 1, "col_offset": 0, "fields": {
                    "value": {"_type": "Constant", "lineno": 1,
                      "col_offset": 0, "payload": {"kind": "frozenset"},
                      "fields": {}}}}]}}}
                """));
    }

    private SyntaxTree map(final String source, final String json)
            throws Exception {
        final JsonNode document = objectMapper.readTree(json);
        return new AstJsonMapper(SourceLines.of(source)).toTree(document);
    }
}
