package co.fanki.sourcescan.extraction.domain.python;

/**
 * A lexical token of Python source.
 *
 * @param type the token type
 * @param text the token text as written; empty for layout tokens
 * @param line the 1-based start line
 * @param column the 0-based start column
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
record Token(Type type, String text, int line, int column) {

    /** Token types produced by {@link PythonTokenizer}. */
    enum Type {
        NAME, NUMBER, STRING, OP, NEWLINE, INDENT, DEDENT, ENDMARKER
    }

    /**
     * @param op the operator or delimiter text
     * @return true if this token is that operator
     */
    boolean isOp(final String op) {
        return type == Type.OP && text.equals(op);
    }

    /**
     * @param keyword the keyword or soft keyword
     * @return true if this token is a name spelled as the keyword
     */
    boolean isKeyword(final String keyword) {
        return type == Type.NAME && text.equals(keyword);
    }

    /**
     * @param expected the token type
     * @return true if this token has the type
     */
    boolean is(final Type expected) {
        return type == expected;
    }
}
