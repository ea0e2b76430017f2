package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.DomainException;

/**
 * Reports that a front-end could not produce a tree for reasons other than
 * the document's syntax: the interpreter is missing, timed out, or wrote
 * output that cannot be read.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FrontEndException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new front-end exception.
     *
     * @param message the error message
     */
    public FrontEndException(final String message) {
        super(message, "FRONT_END_FAILURE");
    }

    /**
     * Creates a new front-end exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public FrontEndException(final String message, final Throwable cause) {
        super(message, "FRONT_END_FAILURE", cause);
    }
}
