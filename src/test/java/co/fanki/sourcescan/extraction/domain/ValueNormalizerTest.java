package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.extraction.domain.python.Fields;
import co.fanki.sourcescan.extraction.domain.python.NativePythonFrontEnd;
import co.fanki.sourcescan.extraction.domain.python.SyntaxNode;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Unit tests for {@link ValueNormalizer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ValueNormalizerTest {

    private final ValueNormalizer normalizer = new ValueNormalizer();

    private final NativePythonFrontEnd frontEnd = new NativePythonFrontEnd();

    @Test
    void whenNormalizing_givenNull_shouldBeUnknown() {
        assertSame(TypedValue.unknown(), normalizer.normalize(null));
    }

    @Test
    void whenNormalizing_givenNone_shouldBeNone() {
        final TypedValue value = normalize("None");

        assertEquals(ValueKind.NONE, value.kind());
        assertNull(value.value());
    }

    @Test
    void whenNormalizing_givenBooleans_shouldBeBoolNotNumber() {
        assertEquals(TypedValue.ofBool(true), normalize("True"));
        assertEquals(TypedValue.ofBool(false), normalize("False"));
    }

    @Test
    void whenNormalizing_givenStrings_shouldDecodeAndConcatenate() {
        assertEquals(TypedValue.ofString("raw/2024/"), normalize("'raw/2024/'"));
        assertEquals(TypedValue.ofString("a\tb"), normalize("\"a\\tb\""));
        assertEquals(TypedValue.ofString("backups/data.csv"),
                normalize("'backups/' \"data.csv\""));
        assertEquals(TypedValue.ofString(""), normalize("''"));
    }

    @Test
    void whenNormalizing_givenIntegers_shouldKeepExactValue() {
        assertEquals(TypedValue.ofNumber(BigInteger.valueOf(42)),
                normalize("42"));
        assertEquals(TypedValue.ofNumber(
                new BigInteger("123456789012345678901234567890")),
                normalize("123_456_789_012_345_678_901_234_567_890"));
        assertEquals(TypedValue.ofNumber(BigInteger.valueOf(8)),
                normalize("0o10"));
    }

    @Test
    void whenNormalizing_givenFloats_shouldKeepWrittenDigits() {
        assertEquals(TypedValue.ofNumber(new BigDecimal("0.1")),
                normalize("0.1"));
        assertEquals(TypedValue.ofNumber(new BigDecimal("1.5e3")),
                normalize("1.5e3"));
    }

    @Test
    void whenNormalizing_givenSignedNumbers_shouldFoldTheSign() {
        assertEquals(TypedValue.ofNumber(BigInteger.valueOf(-5)),
                normalize("-5"));
        assertEquals(TypedValue.ofNumber(new BigDecimal("2.5")),
                normalize("+2.5"));
        assertEquals(TypedValue.ofNumber(new BigDecimal("-0.25")),
                normalize("-0.25"));
    }

    @Test
    void whenNormalizing_givenSignAppliedToNonLiteral_shouldBeUnknown() {
        assertSame(TypedValue.unknown(), normalize("-x"));
        assertSame(TypedValue.unknown(), normalize("~5"));
        assertSame(TypedValue.unknown(), normalize("--5"));
        assertSame(TypedValue.unknown(), normalize("-'a'"));
    }

    @Test
    void whenNormalizing_givenIdentifier_shouldBeVariable() {
        assertEquals(TypedValue.variable("local_path"),
                normalize("local_path"));
    }

    @Test
    void whenNormalizing_givenNestedList_shouldNormalizeEachElement() {
        final TypedValue value = normalize("[1, 'a', [None, x], f()]");

        assertEquals(TypedValue.ofList(List.of(
                TypedValue.ofNumber(BigInteger.ONE),
                TypedValue.ofString("a"),
                TypedValue.ofList(List.of(TypedValue.none(),
                        TypedValue.variable("x"))),
                TypedValue.unknown())), value);
    }

    @Test
    void whenNormalizing_givenDict_shouldRenderKeysAsText() {
        final TypedValue value = normalize(
                "{'region': 'us', 1: True, 2.50: None, None: 0, flag: x,"
                + " False: 'off'}");

        assertEquals(ValueKind.DICT, value.kind());
        @SuppressWarnings("unchecked")
        final Map<String, TypedValue> entries =
                (Map<String, TypedValue>) value.value();
        assertEquals(List.of("region", "1", "2.50", "null", "flag", "false"),
                List.copyOf(entries.keySet()));
        assertEquals(TypedValue.ofString("us"), entries.get("region"));
        assertEquals(TypedValue.variable("x"), entries.get("flag"));
    }

    @Test
    void whenNormalizing_givenRepeatedDictKey_shouldKeepLastValue() {
        final TypedValue value = normalize("{'a': 1, 'b': 2, 'a': 3}");

        @SuppressWarnings("unchecked")
        final Map<String, TypedValue> entries =
                (Map<String, TypedValue>) value.value();
        assertEquals(List.of("a", "b"), List.copyOf(entries.keySet()));
        assertEquals(TypedValue.ofNumber(BigInteger.valueOf(3)),
                entries.get("a"));
    }

    @Test
    void whenNormalizing_givenEqualNumericKeys_shouldMergeUnderFirstSpelling() {
        final TypedValue value = normalize(
                "{1: 'int', 'k': 0, True: 'bool', 1.0: 'float', 0.0: 'z',"
                + " False: 'f'}");

        @SuppressWarnings("unchecked")
        final Map<String, TypedValue> entries =
                (Map<String, TypedValue>) value.value();
        assertEquals(List.of("1", "k", "0.0"),
                List.copyOf(entries.keySet()));
        assertEquals(TypedValue.ofString("float"), entries.get("1"));
        assertEquals(TypedValue.ofString("f"), entries.get("0.0"));

        assertEquals(TypedValue.ofDict(Map.of("1",
                TypedValue.ofNumber(BigInteger.valueOf(3)))),
                normalize("{1: 2, True: 3}"));
        assertEquals(TypedValue.ofDict(Map.of("10", TypedValue.none())),
                normalize("{10: 1, 10.0: None}"));
    }

    @Test
    void whenNormalizing_givenDictWithNonScalarKey_shouldBeUnknown() {
        assertSame(TypedValue.unknown(), normalize("{(1, 2): 'pair'}"));
        assertSame(TypedValue.unknown(), normalize("{**base, 'k': 1}"));
        assertSame(TypedValue.unknown(), normalize("{f(): 1}"));
    }

    @Test
    void whenNormalizing_givenEmptyDict_shouldBeEmptyDict() {
        assertEquals(TypedValue.ofDict(Map.of()), normalize("{}"));
    }

    @Test
    void whenNormalizing_givenUnsupportedShapes_shouldBeUnknown() {
        for (final String expression : List.of("(1, 2)", "{1, 2}",
                "f'{x}'", "b'raw'", "3j", "...", "a.b", "a[0]",
                "lambda: 1", "x if y else z", "a + b", "[i for i in y]",
                "not x")) {
            assertSame(TypedValue.unknown(), normalize(expression),
                    expression);
        }
    }

    private TypedValue normalize(final String expression) {
        final SyntaxNode value = frontEnd.parse("value = " + expression + "\n")
                .root().children(Fields.BODY).get(0)
                .requireChild(Fields.VALUE);
        return normalizer.normalize(value);
    }
}
