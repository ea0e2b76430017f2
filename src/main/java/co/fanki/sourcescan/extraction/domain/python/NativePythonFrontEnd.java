package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.Preconditions;

/**
 * In-process {@link PythonFrontEnd} backed by {@link PythonTokenizer} and
 * {@link PythonParser}.
 *
 * <p>Needs no interpreter. Accepts the Python 3.11 grammar, {@code match}
 * statements included. The 3.12 {@code type} alias statement is reported
 * as a syntax error.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NativePythonFrontEnd implements PythonFrontEnd {

    /** The configuration name of this front-end. */
    public static final String NAME = "native";

    /** {@inheritDoc} */
    @Override
    public String name() {
        return NAME;
    }

    /** {@inheritDoc} */
    @Override
    public SyntaxTree parse(final String source) {
        Preconditions.requireNonNull(source, "Source text is required");

        final SourceLines lines = SourceLines.of(source);
        try {
            return new PythonParser(new PythonTokenizer(source, lines), lines)
                    .parseModule();
        } catch (final StackOverflowError e) {
            throw new FrontEndException(
                    "Source is nested too deeply to parse", e);
        }
    }
}
