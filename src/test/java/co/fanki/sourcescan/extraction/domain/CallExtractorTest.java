package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.Fixtures;
import co.fanki.sourcescan.extraction.domain.python.Fields;
import co.fanki.sourcescan.extraction.domain.python.NativePythonFrontEnd;
import co.fanki.sourcescan.extraction.domain.python.NodeKind;
import co.fanki.sourcescan.extraction.domain.python.SourceLines;
import co.fanki.sourcescan.extraction.domain.python.SyntaxNode;
import co.fanki.sourcescan.extraction.domain.python.SyntaxTree;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CallExtractor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CallExtractorTest {

    private final CallExtractor extractor = new CallExtractor(
            new ValueNormalizer());

    private final NativePythonFrontEnd frontEnd = new NativePythonFrontEnd();

    @Test
    void whenExtracting_givenKeywordCall_shouldSplitArguments() {
        final CallRecord call = single(
                "upload(bucket='my-bucket', source='/tmp/f', destination=d)\n");

        assertEquals("upload", call.function());
        assertNull(call.module());
        assertEquals(1, call.line());
        assertEquals(0, call.column());
        assertTrue(call.positional().isEmpty());
        assertEquals(List.of("bucket", "source", "destination"),
                List.copyOf(call.keywords().keySet()));
        assertEquals(TypedValue.ofString("my-bucket"),
                call.keywords().get("bucket"));
        assertEquals(TypedValue.variable("d"),
                call.keywords().get("destination"));
        assertEquals(call.keywords(), call.arguments());
    }

    @Test
    void whenExtracting_givenPositionalAndKeywords_shouldCombineInOrder() {
        final CallRecord call = single("f(1, x, k='v')\n");

        final Map<String, TypedValue> expected = new LinkedHashMap<>();
        expected.put("arg_0", TypedValue.ofNumber(BigInteger.ONE));
        expected.put("arg_1", TypedValue.variable("x"));
        expected.put("k", TypedValue.ofString("v"));

        assertEquals(expected, call.arguments());
        assertEquals(List.copyOf(expected.keySet()),
                List.copyOf(call.arguments().keySet()));
        assertEquals(List.of(TypedValue.ofNumber(BigInteger.ONE),
                TypedValue.variable("x")), call.positional());
    }

    @Test
    void whenExtracting_givenDottedCallee_shouldResolveModule() {
        final CallRecord call = single("os.path.join(a, 'b')\n");

        assertEquals("join", call.function());
        assertEquals("os.path", call.module());
    }

    @Test
    void whenExtracting_givenCalleeNotRootedInName_shouldHaveNoModule() {
        final List<CallRecord> calls = extract("x().f()\nitems[0].g()\n");

        final CallRecord chained = calls.stream()
                .filter(c -> "f".equals(c.function())).findFirst()
                .orElseThrow();
        assertNull(chained.module());

        final CallRecord subscripted = calls.stream()
                .filter(c -> "g".equals(c.function())).findFirst()
                .orElseThrow();
        assertNull(subscripted.module());
    }

    @Test
    void whenExtracting_givenCalleeWithoutName_shouldLeaveFunctionNull() {
        final List<CallRecord> calls = extract("handlers[0](event)\n");

        assertEquals(1, calls.size());
        assertNull(calls.get(0).function());
        assertNull(calls.get(0).module());
        assertEquals(List.of(TypedValue.variable("event")),
                calls.get(0).positional());
    }

    @Test
    void whenExtracting_givenKeywordUnpacking_shouldNumberTheEntries() {
        final CallRecord call = single("f(a=1, **opts, **{'b': 2})\n");

        assertEquals(List.of("a", "**0", "**1"),
                List.copyOf(call.keywords().keySet()));
        assertEquals(TypedValue.variable("opts"), call.keywords().get("**0"));
        assertEquals(ValueKind.DICT, call.keywords().get("**1").kind());
    }

    @Test
    void whenExtracting_givenStarredPositional_shouldBeUnknown() {
        final CallRecord call = single("f(*rest)\n");

        assertEquals(List.of(TypedValue.unknown()), call.positional());
    }

    @Test
    void whenExtracting_givenKeywordNamedLikePositional_shouldLetKeywordWin() {
        final CallRecord call = single("f(1, arg_0=2)\n");

        assertEquals(TypedValue.ofNumber(BigInteger.ONE),
                call.positional().get(0));
        assertEquals(TypedValue.ofNumber(BigInteger.TWO),
                call.keywords().get("arg_0"));
        assertEquals(1, call.arguments().size());
        assertEquals(TypedValue.ofNumber(BigInteger.TWO),
                call.arguments().get("arg_0"));
    }

    @Test
    void whenExtracting_givenMultiLineCall_shouldEchoItsFirstLineStripped() {
        final CallRecord call = single(
                "    \n"
                + "result = upload(\n"
                + "    bucket='b',\n"
                + ")\n");

        assertEquals(2, call.line());
        assertEquals(9, call.column());
        assertEquals("result = upload(", call.sourceLine());
    }

    @Test
    void whenExtracting_givenLineOutsideTheText_shouldLeaveSourceLineNull() {
        final SyntaxTree tree = frontEnd.parse("f(1)\n");

        final List<CallRecord> calls = extractor.extract(tree,
                SourceLines.of(""));

        assertNull(calls.get(0).sourceLine());
    }

    @Test
    void whenExtracting_givenNestedCalls_shouldEmitOuterFirst() {
        final List<CallRecord> calls = extract(
                "print(len(files), str(total))\n");

        assertEquals(List.of("print", "len", "str"), functions(calls));
        assertEquals(List.of(TypedValue.unknown(), TypedValue.unknown()),
                calls.get(0).positional());
    }

    @Test
    void whenExtracting_givenDataPipeline_shouldFollowDocumentOrder() {
        final List<CallRecord> calls = extract(
                Fixtures.read("data_pipeline.py"));

        assertEquals(List.of("list_objects", "replace", "process_data_files",
                "download", "process_file", "upload", "basename", "basename"),
                functions(calls));

        final CallRecord listing = calls.get(0);
        assertEquals(11, listing.line());
        assertEquals(18, listing.column());
        assertEquals(TypedValue.ofString("data-lake"),
                listing.keywords().get("bucket"));
        assertEquals(TypedValue.ofString("raw/2024/"),
                listing.keywords().get("prefix"));
        assertEquals("input_files = list_objects(", listing.sourceLine());

        final CallRecord replace = calls.get(1);
        assertEquals("filepath", replace.module());
        assertEquals(List.of(TypedValue.ofString(".csv"),
                TypedValue.ofString("_processed.csv")), replace.positional());

        final CallRecord download = calls.get(3);
        assertEquals(19, download.line());
        assertEquals(8, download.column());
        assertEquals(TypedValue.unknown(), download.keywords().get("source"));
        assertEquals(TypedValue.variable("local_path"),
                download.keywords().get("destination"));

        final CallRecord basename = calls.get(7);
        assertEquals("os.path", basename.module());
        assertEquals(32, basename.line());
        assertEquals(42, basename.column());
        assertEquals(List.of(TypedValue.variable("processed_path")),
                basename.positional());
    }

    @Test
    void whenExtracting_givenMultipleOperations_shouldListEveryCall() {
        final List<CallRecord> calls = extract(
                Fixtures.read("multiple_operations.py"));

        assertEquals(List.of("upload", "list_objects", "print", "download",
                "delete", "manage_backups", "len"), functions(calls));
        assertEquals(List.of("bucket", "path"),
                List.copyOf(calls.get(4).keywords().keySet()));
        assertEquals(TypedValue.variable("files"),
                calls.get(6).positional().get(0));
    }

    @Test
    void whenExtracting_givenMatchStatement_shouldFindCallsInEveryPart() {
        final List<CallRecord> calls = extract("match load(path):\n"
                + "    case {'kind': 'csv'} if valid(path):\n"
                + "        upload(bucket='b')\n"
                + "    case _:\n"
                + "        skip()\n");

        assertEquals(List.of("load", "valid", "upload", "skip"),
                functions(calls));
        assertEquals(TypedValue.ofString("b"),
                calls.get(2).keywords().get("bucket"));
        assertEquals(3, calls.get(2).line());
        assertEquals(8, calls.get(2).column());
    }

    @Test
    void whenExtracting_givenCallNodeWithoutCallee_shouldThrowIllegalState() {
        final SyntaxNode broken = SyntaxNode.builder(NodeKind.CALL, 1, 0)
                .build();
        final SyntaxNode module = SyntaxNode.builder(NodeKind.MODULE, 0, 0)
                .children(Fields.BODY, List.of(
                        SyntaxNode.builder(NodeKind.EXPR, 1, 0)
                                .child(Fields.VALUE, broken)
                                .build()))
                .build();

        assertThrows(IllegalStateException.class, () -> extractor.extract(
                new SyntaxTree(module), SourceLines.of("f()\n")));
    }

    private CallRecord single(final String source) {
        final List<CallRecord> calls = extract(source);
        assertEquals(1, calls.size());
        return calls.get(0);
    }

    private List<CallRecord> extract(final String source) {
        return extractor.extract(frontEnd.parse(source),
                SourceLines.of(source));
    }

    private static List<String> functions(final List<CallRecord> calls) {
        return calls.stream().map(CallRecord::function).toList();
    }
}
