package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.shared.Preconditions;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A normalized argument value: a {@link ValueKind} tag and its payload.
 *
 * <p>Use the factory methods; they guarantee the payload type matches the
 * kind. The payload is always serialized, including a null one.</p>
 *
 * @param kind the value kind
 * @param value the payload, typed as {@link ValueKind} describes
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TypedValue(
        ValueKind kind,
        @JsonInclude(JsonInclude.Include.ALWAYS) Object value
) {

    private static final TypedValue NONE = new TypedValue(ValueKind.NONE, null);
    private static final TypedValue UNKNOWN =
            new TypedValue(ValueKind.UNKNOWN, null);

    /**
     * Creates a new typed value.
     *
     * @param kind the value kind, never null
     * @param value the payload
     */
    public TypedValue {
        Preconditions.requireNonNull(kind, "Value kind is required");
    }

    /** @return the typed value of a None literal */
    public static TypedValue none() {
        return NONE;
    }

    /** @return the typed value of anything that cannot be represented */
    public static TypedValue unknown() {
        return UNKNOWN;
    }

    /**
     * @param value the boolean
     * @return a bool value
     */
    public static TypedValue ofBool(final boolean value) {
        return new TypedValue(ValueKind.BOOL, value);
    }

    /**
     * @param value the decoded string, never null
     * @return a string value
     */
    public static TypedValue ofString(final String value) {
        Preconditions.requireNonNull(value, "String value is required");
        return new TypedValue(ValueKind.STRING, value);
    }

    /**
     * @param value an integer value, never null
     * @return a number value
     */
    public static TypedValue ofNumber(final BigInteger value) {
        Preconditions.requireNonNull(value, "Number value is required");
        return new TypedValue(ValueKind.NUMBER, value);
    }

    /**
     * @param value a decimal value, never null
     * @return a number value
     */
    public static TypedValue ofNumber(final BigDecimal value) {
        Preconditions.requireNonNull(value, "Number value is required");
        return new TypedValue(ValueKind.NUMBER, value);
    }

    /**
     * @param name the identifier, never blank
     * @return a variable reference
     */
    public static TypedValue variable(final String name) {
        Preconditions.requireNonBlank(name, "Variable name is required");
        return new TypedValue(ValueKind.VARIABLE, name);
    }

    /**
     * @param elements the normalized elements in source order
     * @return a list value
     */
    public static TypedValue ofList(final List<TypedValue> elements) {
        Preconditions.requireNonNull(elements, "List elements are required");
        return new TypedValue(ValueKind.LIST, List.copyOf(elements));
    }

    /**
     * @param entries the normalized entries in insertion order
     * @return a dict value
     */
    public static TypedValue ofDict(final Map<String, TypedValue> entries) {
        Preconditions.requireNonNull(entries, "Dict entries are required");
        return new TypedValue(ValueKind.DICT,
                Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    /**
     * Tells whether this value is of the given kind.
     *
     * @param expected the kind
     * @return true if it matches
     */
    public boolean is(final ValueKind expected) {
        return kind == expected;
    }
}
