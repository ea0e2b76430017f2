package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.extraction.domain.python.Fields;
import co.fanki.sourcescan.extraction.domain.python.LiteralValue;
import co.fanki.sourcescan.extraction.domain.python.NodeKind;
import co.fanki.sourcescan.extraction.domain.python.SyntaxNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts expression nodes into {@link TypedValue}s.
 *
 * <p>The conversion is total: every node, including null, yields a value,
 * and shapes without a representation become {@link ValueKind#UNKNOWN}.
 * Recognized shapes:</p>
 * <ul>
 *   <li>None, bool, string and number constants. Booleans are always
 *       {@code bool}, never {@code number}.</li>
 *   <li>A unary {@code -} or {@code +} applied directly to a number
 *       constant, folded into a signed number.</li>
 *   <li>Bare identifiers, as {@code variable}.</li>
 *   <li>List displays, element by element.</li>
 *   <li>Dict displays whose keys are all scalar. Keys are rendered as
 *       strings; when a key repeats, the last value wins under the first
 *       spelling of the key. Numbers and booleans compare by value, so
 *       {@code 1}, {@code 1.0} and {@code True} are one key. A dict with
 *       a non-scalar key or a {@code **} entry is {@code unknown}.</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ValueNormalizer {

    /**
     * Normalizes an expression node.
     *
     * @param node the node, may be null
     * @return the typed value, never null
     */
    public TypedValue normalize(final SyntaxNode node) {
        if (node == null) {
            return TypedValue.unknown();
        }
        return switch (node.kind()) {
            case CONSTANT -> constant(node.payload(LiteralValue.class));
            case UNARY_OP -> signedNumber(node);
            case NAME -> TypedValue.variable(node.payload(String.class));
            case LIST -> list(node);
            case DICT -> dict(node);
            case MODULE, FUNCTION_DEF, ASYNC_FUNCTION_DEF, CLASS_DEF, RETURN,
                    DELETE, ASSIGN, AUG_ASSIGN, ANN_ASSIGN, FOR, ASYNC_FOR,
                    WHILE, IF, WITH, ASYNC_WITH, MATCH, RAISE, TRY, TRY_STAR,
                    ASSERT, IMPORT, IMPORT_FROM, GLOBAL, NONLOCAL, EXPR, PASS,
                    BREAK, CONTINUE -> TypedValue.unknown();
            case BOOL_OP, NAMED_EXPR, BIN_OP, LAMBDA, IF_EXP, SET, LIST_COMP,
                    SET_COMP, DICT_COMP, GENERATOR_EXP, AWAIT, YIELD,
                    YIELD_FROM, COMPARE, CALL, FORMATTED_VALUE, JOINED_STR,
                    ATTRIBUTE, SUBSCRIPT, STARRED, TUPLE, SLICE ->
                    TypedValue.unknown();
            case COMPREHENSION, EXCEPT_HANDLER, ARGUMENTS, ARG, KEYWORD, ALIAS,
                    WITH_ITEM, OTHER -> TypedValue.unknown();
            case MATCH_CASE, MATCH_VALUE, MATCH_SINGLETON, MATCH_SEQUENCE,
                    MATCH_MAPPING, MATCH_CLASS, MATCH_STAR, MATCH_AS,
                    MATCH_OR -> TypedValue.unknown();
        };
    }

    private static TypedValue constant(final LiteralValue literal) {
        if (literal == null) {
            return TypedValue.unknown();
        }
        return switch (literal.kind()) {
            case NONE -> TypedValue.none();
            case BOOLEAN -> TypedValue.ofBool((Boolean) literal.value());
            case STRING -> TypedValue.ofString((String) literal.value());
            case INTEGER -> TypedValue.ofNumber((BigInteger) literal.value());
            case FLOAT -> TypedValue.ofNumber((BigDecimal) literal.value());
            case BYTES, IMAGINARY, ELLIPSIS -> TypedValue.unknown();
        };
    }

    private static TypedValue signedNumber(final SyntaxNode node) {
        final Object operator = node.payload();
        final SyntaxNode operand = node.child(Fields.OPERAND);
        if (operand == null || !operand.is(NodeKind.CONSTANT)
                || !("-".equals(operator) || "+".equals(operator))) {
            return TypedValue.unknown();
        }

        final boolean negate = "-".equals(operator);
        final Object value = operand.payload(LiteralValue.class).value();
        if (value instanceof BigInteger integer) {
            return TypedValue.ofNumber(negate ? integer.negate() : integer);
        }
        if (value instanceof BigDecimal decimal) {
            return TypedValue.ofNumber(negate ? decimal.negate() : decimal);
        }
        return TypedValue.unknown();
    }

    private TypedValue list(final SyntaxNode node) {
        final List<TypedValue> elements = new ArrayList<>();
        for (final SyntaxNode element : node.children(Fields.ELTS)) {
            elements.add(normalize(element));
        }
        return TypedValue.ofList(elements);
    }

    private TypedValue dict(final SyntaxNode node) {
        final List<SyntaxNode> keys = node.children(Fields.KEYS);
        final List<SyntaxNode> values = node.children(Fields.VALUES);

        final Map<String, TypedValue> entries = new LinkedHashMap<>();
        final Map<Object, String> renderedKeys = new HashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            final TypedValue key = normalize(keys.get(i));
            final String text = keyText(key);
            if (text == null) {
                return TypedValue.unknown();
            }
            // A repeated key keeps its first spelling and position.
            final String rendered = renderedKeys.computeIfAbsent(
                    keyIdentity(key, text), identity -> text);
            entries.put(rendered, normalize(i < values.size()
                    ? values.get(i) : null));
        }
        return TypedValue.ofDict(entries);
    }

    /**
     * Returns the value Python hashes a key by: numbers and booleans by
     * numeric value, everything else by its rendered text.
     */
    private static Object keyIdentity(final TypedValue key,
            final String text) {
        final BigDecimal number;
        if (key.kind() == ValueKind.BOOL) {
            number = Boolean.TRUE.equals(key.value())
                    ? BigDecimal.ONE : BigDecimal.ZERO;
        } else if (key.value() instanceof BigInteger integer) {
            number = new BigDecimal(integer);
        } else if (key.value() instanceof BigDecimal decimal) {
            number = decimal;
        } else {
            return text;
        }
        return number.signum() == 0 ? BigDecimal.ZERO
                : number.stripTrailingZeros();
    }

    /**
     * Renders a normalized key as a map key.
     *
     * @return the key text, or null if the key is not a scalar
     */
    private static String keyText(final TypedValue key) {
        return switch (key.kind()) {
            case STRING, VARIABLE -> (String) key.value();
            case NUMBER -> key.value() instanceof BigDecimal decimal
                    ? decimal.toPlainString() : key.value().toString();
            case BOOL -> key.value().toString();
            case NONE -> "null";
            case LIST, DICT, UNKNOWN -> null;
        };
    }
}
