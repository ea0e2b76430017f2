package co.fanki.sourcescan.extraction.application;

import co.fanki.sourcescan.extraction.domain.CallRecord;
import co.fanki.sourcescan.extraction.domain.ExtractionResult;
import co.fanki.sourcescan.extraction.domain.ExtractionResult.ExtractionFault;
import co.fanki.sourcescan.extraction.domain.ExtractionResult.Success;
import co.fanki.sourcescan.extraction.domain.ExtractionResult.SyntaxFault;
import co.fanki.sourcescan.extraction.domain.ImportRecord;
import co.fanki.sourcescan.shared.Preconditions;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * JSON document describing one extraction.
 *
 * <p>A success carries {@code language}, {@code imports}, {@code calls} and
 * {@code sourceCode}; a failure carries only {@code error}. Fields that do
 * not apply are left out of the JSON, not written as null.</p>
 *
 * @param language the grammar identifier, success only
 * @param imports the import records, success only
 * @param calls the call records, success only
 * @param sourceCode the original text, success only
 * @param success whether the extraction succeeded
 * @param error the failure description, failure only
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"language", "imports", "calls", "sourceCode", "success",
        "error"})
public record ExtractionEnvelope(
        String language,
        List<ImportRecord> imports,
        List<CallRecord> calls,
        String sourceCode,
        boolean success,
        ErrorInfo error
) {

    /** The error type reported for syntax faults. */
    public static final String SYNTAX_FAULT = "SyntaxFault";

    /**
     * Renders an extraction result.
     *
     * @param result the result, never null
     * @return the envelope
     */
    public static ExtractionEnvelope of(final ExtractionResult result) {
        Preconditions.requireNonNull(result, "Extraction result is required");

        if (result instanceof Success s) {
            return new ExtractionEnvelope(s.language(), s.imports(), s.calls(),
                    s.sourceCode(), true, null);
        }
        if (result instanceof SyntaxFault f) {
            return failure(new ErrorInfo(SYNTAX_FAULT, f.message(), f.line(),
                    f.offset(), f.text()));
        }
        if (result instanceof ExtractionFault f) {
            return failure(new ErrorInfo(f.kind(), f.message(), null, null,
                    null));
        }
        throw new IllegalArgumentException("Unsupported result type "
                + result.getClass().getName());
    }

    private static ExtractionEnvelope failure(final ErrorInfo error) {
        return new ExtractionEnvelope(null, null, null, null, false, error);
    }

    /**
     * Failure description.
     *
     * @param type {@value #SYNTAX_FAULT} or the fault kind
     * @param message the description
     * @param line the 1-based line, syntax faults only
     * @param offset the 1-based column, syntax faults only
     * @param text the offending line, syntax faults only
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorInfo(
            String type,
            String message,
            Integer line,
            Integer offset,
            String text
    ) {}
}
