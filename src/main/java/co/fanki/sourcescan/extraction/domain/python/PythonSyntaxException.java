package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.DomainException;

/**
 * Reports that a document does not conform to the Python grammar.
 *
 * <p>Carries the location of the first construct the front-end could not
 * parse, in the same terms CPython uses for {@code SyntaxError}: a 1-based
 * line, a 1-based offset within that line and the text of the line.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonSyntaxException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int offset;
    private final String text;

    /**
     * Creates a new syntax exception.
     *
     * @param message the description, e.g. "invalid syntax"
     * @param theLine the 1-based line of the offending construct
     * @param theOffset the 1-based column of the offending construct
     * @param theText the text of the offending line, may be null
     */
    public PythonSyntaxException(final String message, final int theLine,
            final int theOffset, final String theText) {
        super(message, "SYNTAX_FAULT");
        this.line = theLine;
        this.offset = theOffset;
        this.text = theText;
    }

    /** @return the 1-based line */
    public int getLine() {
        return line;
    }

    /** @return the 1-based offset within the line */
    public int getOffset() {
        return offset;
    }

    /** @return the offending line text, may be null */
    public String getText() {
        return text;
    }
}
