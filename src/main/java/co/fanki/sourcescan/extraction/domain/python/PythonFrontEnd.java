package co.fanki.sourcescan.extraction.domain.python;

/**
 * Turns Python source text into a {@link SyntaxTree}.
 *
 * <p>Implementations own nothing between calls; the same instance may be
 * used from several threads at once.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface PythonFrontEnd {

    /**
     * Returns a short name for logs and configuration, e.g. "native".
     *
     * @return the front-end name
     */
    String name();

    /**
     * Parses a complete document.
     *
     * @param source the full source text, never null
     * @return the parsed tree
     * @throws PythonSyntaxException if the text is not valid Python
     * @throws FrontEndException if the front-end itself fails
     */
    SyntaxTree parse(String source);
}
