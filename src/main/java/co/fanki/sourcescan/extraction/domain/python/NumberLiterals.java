package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.extraction.domain.python.LiteralValue.LiteralKind;
import co.fanki.sourcescan.shared.Preconditions;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Converts Python numeric literal text into exact Java numbers.
 *
 * <p>Values are built from the literal text instead of going through
 * {@code double}, so {@code 12345678901234567890} and {@code 0.1} keep
 * every digit they were written with.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class NumberLiterals {

    private NumberLiterals() {
        // Utility class, not instantiable
    }

    /**
     * Parses a numeric literal.
     *
     * @param text the literal as written in the source
     * @return the literal value
     * @throws NumberFormatException if the text is not a numeric literal
     */
    static LiteralValue parse(final String text) {
        Preconditions.requireNonNull(text, "Number text is required");

        final String digits = text.replace("_", "");
        final String lower = digits.toLowerCase(Locale.ROOT);

        if (lower.endsWith("j")) {
            return new LiteralValue(LiteralKind.IMAGINARY, text);
        }
        if (lower.startsWith("0x")) {
            return new LiteralValue(LiteralKind.INTEGER,
                    new BigInteger(digits.substring(2), 16));
        }
        if (lower.startsWith("0o")) {
            return new LiteralValue(LiteralKind.INTEGER,
                    new BigInteger(digits.substring(2), 8));
        }
        if (lower.startsWith("0b")) {
            return new LiteralValue(LiteralKind.INTEGER,
                    new BigInteger(digits.substring(2), 2));
        }
        if (lower.indexOf('.') >= 0 || lower.indexOf('e') >= 0) {
            return new LiteralValue(LiteralKind.FLOAT, new BigDecimal(digits));
        }
        return new LiteralValue(LiteralKind.INTEGER, new BigInteger(digits));
    }
}
