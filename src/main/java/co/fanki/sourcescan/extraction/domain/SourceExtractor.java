package co.fanki.sourcescan.extraction.domain;

import co.fanki.sourcescan.extraction.domain.ExtractionResult.ExtractionFault;
import co.fanki.sourcescan.extraction.domain.ExtractionResult.Success;
import co.fanki.sourcescan.extraction.domain.ExtractionResult.SyntaxFault;
import co.fanki.sourcescan.extraction.domain.python.PythonFrontEnd;
import co.fanki.sourcescan.extraction.domain.python.PythonSyntaxException;
import co.fanki.sourcescan.extraction.domain.python.SourceLines;
import co.fanki.sourcescan.extraction.domain.python.SyntaxTree;
import co.fanki.sourcescan.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Turns one Python document into an {@link ExtractionResult}.
 *
 * <p>Parses the text with the configured {@link PythonFrontEnd}, then runs
 * the {@link ImportExtractor} and the {@link CallExtractor} over the tree.
 * Every failure is reported in the result; nothing is thrown past this
 * class except argument errors:</p>
 * <ul>
 *   <li>a {@link PythonSyntaxException} becomes a {@link SyntaxFault};</li>
 *   <li>any other runtime exception becomes an {@link ExtractionFault}
 *       named after the exception class;</li>
 *   <li>a failing {@link SourceSupplier} becomes an {@link ExtractionFault}
 *       of kind {@value #ACQUISITION_FAULT}.</li>
 * </ul>
 *
 * <p>Holds no per-document state; one instance serves concurrent
 * callers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceExtractor.class);

    /** The grammar identifier reported in every success. */
    public static final String LANGUAGE = "python";

    /** Fault kind used when the source text cannot be obtained. */
    public static final String ACQUISITION_FAULT = "AcquisitionFault";

    private final PythonFrontEnd frontEnd;
    private final ImportExtractor importExtractor;
    private final CallExtractor callExtractor;

    /**
     * Creates an extractor with the default extractors.
     *
     * @param theFrontEnd the front-end, never null
     */
    public SourceExtractor(final PythonFrontEnd theFrontEnd) {
        this(theFrontEnd, new ImportExtractor(),
                new CallExtractor(new ValueNormalizer()));
    }

    /**
     * Creates a new extractor.
     *
     * @param theFrontEnd the front-end, never null
     * @param theImportExtractor the import extractor, never null
     * @param theCallExtractor the call extractor, never null
     */
    public SourceExtractor(final PythonFrontEnd theFrontEnd,
            final ImportExtractor theImportExtractor,
            final CallExtractor theCallExtractor) {
        this.frontEnd = Preconditions.requireNonNull(theFrontEnd,
                "Front-end is required");
        this.importExtractor = Preconditions.requireNonNull(
                theImportExtractor, "Import extractor is required");
        this.callExtractor = Preconditions.requireNonNull(theCallExtractor,
                "Call extractor is required");
    }

    /**
     * Extracts imports and calls from a document.
     *
     * @param source the complete document text, never null
     * @return the result, never null
     */
    public ExtractionResult extract(final String source) {
        Preconditions.requireNonNull(source, "Source text is required");

        try {
            final SyntaxTree tree = frontEnd.parse(source);
            return new Success(LANGUAGE,
                    importExtractor.extract(tree),
                    callExtractor.extract(tree, SourceLines.of(source)),
                    source);

        } catch (final PythonSyntaxException e) {
            LOG.debug("Syntax error at {}:{}: {}", e.getLine(),
                    e.getOffset(), e.getMessage());
            return new SyntaxFault(e.getMessage(), e.getLine(),
                    e.getOffset(), e.getText());

        } catch (final RuntimeException e) {
            LOG.warn("Extraction failed with {}: {}",
                    e.getClass().getSimpleName(), e.getMessage(), e);
            return new ExtractionFault(e.getClass().getSimpleName(),
                    e.getMessage());
        }
    }

    /**
     * Reads a document and extracts imports and calls from it.
     *
     * @param supplier the document source, never null
     * @return the result, never null
     */
    public ExtractionResult extract(final SourceSupplier supplier) {
        Preconditions.requireNonNull(supplier, "Source supplier is required");

        final String source;
        try {
            source = supplier.get();
        } catch (final IOException | RuntimeException e) {
            LOG.warn("Could not read source: {}", e.getMessage());
            return new ExtractionFault(ACQUISITION_FAULT, e.getMessage());
        }

        if (source == null) {
            return new ExtractionFault(ACQUISITION_FAULT,
                    "Source supplier returned no text");
        }
        return extract(source);
    }
}
