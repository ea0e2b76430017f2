package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.Preconditions;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Payload of a {@link NodeKind#CONSTANT} node.
 *
 * <p>The value type depends on the kind: {@link Boolean} for booleans,
 * {@link String} for strings and bytes (bytes keep their source text),
 * {@link BigInteger} for integers, {@link BigDecimal} for floats, the
 * literal text for imaginary numbers, and null for None and Ellipsis.</p>
 *
 * @param kind the literal kind
 * @param value the decoded value
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LiteralValue(LiteralKind kind, Object value) {

    /** The shapes a Python constant can take. */
    public enum LiteralKind {
        NONE, BOOLEAN, STRING, BYTES, INTEGER, FLOAT, IMAGINARY, ELLIPSIS
    }

    /**
     * Creates a new literal value.
     *
     * @param kind the literal kind, never null
     * @param value the decoded value
     */
    public LiteralValue {
        Preconditions.requireNonNull(kind, "Literal kind is required");
    }

    /** @return the None literal */
    public static LiteralValue none() {
        return new LiteralValue(LiteralKind.NONE, null);
    }

    /** @return the Ellipsis literal */
    public static LiteralValue ellipsis() {
        return new LiteralValue(LiteralKind.ELLIPSIS, null);
    }

    /**
     * @param value the boolean
     * @return a boolean literal
     */
    public static LiteralValue ofBoolean(final boolean value) {
        return new LiteralValue(LiteralKind.BOOLEAN, value);
    }

    /**
     * @param value the decoded string
     * @return a string literal
     */
    public static LiteralValue ofString(final String value) {
        return new LiteralValue(LiteralKind.STRING, value);
    }

    /**
     * @param text the bytes literal body as written
     * @return a bytes literal
     */
    public static LiteralValue ofBytes(final String text) {
        return new LiteralValue(LiteralKind.BYTES, text);
    }

    /**
     * Builds a numeric literal from its source text.
     *
     * @param text the literal as written, e.g. {@code 0x_FF} or {@code 1.5e3}
     * @return an integer, float or imaginary literal
     */
    public static LiteralValue ofNumber(final String text) {
        return NumberLiterals.parse(text);
    }
}
