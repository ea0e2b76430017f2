package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.shared.Preconditions;

import java.util.List;

/**
 * Outcome of extracting one document: exactly one of {@link Success},
 * {@link SyntaxFault} or {@link ExtractionFault}.
 *
 * <p>Callers branch with {@code instanceof} patterns; only a success carries
 * imports, calls and the source text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ExtractionResult {

    /** @return true only for {@link Success} */
    boolean success();

    /**
     * The document parsed and both extractors ran.
     *
     * @param language the grammar identifier, always "python"
     * @param imports the import records in document order
     * @param calls the call records in document order
     * @param sourceCode the unmodified input text
     */
    record Success(
            String language,
            List<ImportRecord> imports,
            List<CallRecord> calls,
            String sourceCode
    ) implements ExtractionResult {

        /**
         * Creates a new success.
         *
         * @param language the language, never blank
         * @param imports the imports, never null
         * @param calls the calls, never null
         * @param sourceCode the source text, never null
         */
        public Success {
            Preconditions.requireNonBlank(language, "Language is required");
            Preconditions.requireNonNull(imports, "Imports are required");
            Preconditions.requireNonNull(calls, "Calls are required");
            Preconditions.requireNonNull(sourceCode, "Source code is required");
            imports = List.copyOf(imports);
            calls = List.copyOf(calls);
        }

        @Override
        public boolean success() {
            return true;
        }
    }

    /**
     * The front-end rejected the document.
     *
     * @param message the syntax error description
     * @param line the 1-based line of the first unparsable construct
     * @param offset the 1-based column within that line
     * @param text the offending line, may be null
     */
    record SyntaxFault(
            String message,
            int line,
            int offset,
            String text
    ) implements ExtractionResult {

        @Override
        public boolean success() {
            return false;
        }
    }

    /**
     * Something other than the document's syntax failed: reading the
     * source, running the front-end or walking the tree.
     *
     * @param kind the failure kind, e.g. {@code IllegalStateException}
     *        or {@code AcquisitionFault}
     * @param message the failure description, never null
     */
    record ExtractionFault(
            String kind,
            String message
    ) implements ExtractionResult {

        /**
         * Creates a new extraction fault.
         *
         * @param kind the kind, never blank
         * @param message the message; null becomes empty
         */
        public ExtractionFault {
            Preconditions.requireNonBlank(kind, "Fault kind is required");
            message = message == null ? "" : message;
        }

        @Override
        public boolean success() {
            return false;
        }
    }
}
