package co.fanki.sourcescan.extraction.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The shape of a {@link TypedValue}.
 *
 * <p>Each kind fixes the Java type of the payload: {@code NONE} and
 * {@code UNKNOWN} carry null, {@code BOOL} a {@link Boolean},
 * {@code STRING} and {@code VARIABLE} a {@link String}, {@code NUMBER} a
 * {@link java.math.BigInteger} or {@link java.math.BigDecimal},
 * {@code LIST} a list of typed values and {@code DICT} an ordered map of
 * string keys to typed values.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ValueKind {

    NONE("none"),
    BOOL("bool"),
    STRING("string"),
    NUMBER("number"),
    VARIABLE("variable"),
    LIST("list"),
    DICT("dict"),
    UNKNOWN("unknown");

    private final String wireName;

    ValueKind(final String theWireName) {
        this.wireName = theWireName;
    }

    /** @return the name written to JSON, e.g. "bool" */
    @JsonValue
    public String wireName() {
        return wireName;
    }
}
