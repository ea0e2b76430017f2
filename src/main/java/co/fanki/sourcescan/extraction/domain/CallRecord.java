package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.shared.Preconditions;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One call expression found in a document.
 *
 * <p>{@code positional} and {@code keywords} hold the arguments as written.
 * {@code arguments} is the combined view: positional values under
 * {@code arg_0}, {@code arg_1}, ... followed by the keywords.</p>
 *
 * @param line the 1-based line of the call
 * @param column the 0-based column where the callee expression starts
 * @param function the called name, null for callees without one
 * @param module the dotted qualifier of an attribute callee rooted in a
 *        plain identifier, otherwise null
 * @param arguments the combined argument view
 * @param positional the positional arguments in order
 * @param keywords the keyword arguments in order; {@code **} unpackings
 *        appear as {@code **0}, {@code **1}, ...
 * @param sourceLine the trimmed text of the call's line, null if the line
 *        is out of range
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"line", "column", "function", "module", "arguments",
        "positional", "keywords", "sourceLine"})
public record CallRecord(
        int line,
        int column,
        String function,
        String module,
        Map<String, TypedValue> arguments,
        List<TypedValue> positional,
        Map<String, TypedValue> keywords,
        String sourceLine
) {

    /**
     * Creates a new call record.
     *
     * @param line the line, positive
     * @param column the column, not negative
     * @param function the function name, may be null
     * @param module the module, may be null
     * @param arguments the combined arguments, never null
     * @param positional the positional arguments, never null
     * @param keywords the keyword arguments, never null
     * @param sourceLine the source line, may be null
     */
    public CallRecord {
        Preconditions.requirePositive(line, "Line must be positive");
        Preconditions.requireNonNegative(column, "Column must not be negative");
        Preconditions.requireNonNull(arguments, "Arguments are required");
        Preconditions.requireNonNull(positional, "Positional are required");
        Preconditions.requireNonNull(keywords, "Keywords are required");
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        positional = List.copyOf(positional);
        keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }
}
