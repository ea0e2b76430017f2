package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.extraction.domain.python.Token.Type;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Set;

/**
 * On-demand tokenizer for Python 3 source.
 *
 * <p>Produces NAME, NUMBER, STRING and OP tokens plus the layout tokens
 * NEWLINE, INDENT and DEDENT that the grammar needs. Tokens are produced
 * one at a time so a parse error early in a document is reported before a
 * lexical error further down, as CPython does.</p>
 *
 * <p>Inside brackets newlines and indentation are ignored. A tokenizer
 * built for an f-string replacement field behaves as if it were always
 * inside brackets.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class PythonTokenizer {

    private static final int TAB_SIZE = 8;

    private static final String[] OPERATORS = {
        "**=", "//=", ">>=", "<<=", "...",
        "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
        "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "br", "rb", "f", "fr", "rf");

    /** CPython's limits on bracket nesting and indentation depth. */
    private static final int MAX_BRACKET_DEPTH = 200;
    private static final int MAX_INDENT_DEPTH = 100;

    private final String source;
    private final SourceLines lines;
    private final boolean embedded;
    private final int lineBase;
    private final int columnBase;

    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Token> brackets = new ArrayDeque<>();
    private final Deque<Token> pending = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean atLineStart;
    private boolean lineHasContent;
    private int commentColumn = -1;
    private boolean finished;

    /**
     * Creates a tokenizer over a whole document.
     *
     * @param theSource the document text
     * @param theLines the line index of the document
     */
    PythonTokenizer(final String theSource, final SourceLines theLines) {
        this(theSource, theLines, false, 1, 0);
    }

    /**
     * Creates a tokenizer over a fragment embedded in a document.
     *
     * @param theSource the fragment text
     * @param theLines the line index of the enclosing document
     * @param isEmbedded true to ignore layout as if inside brackets
     * @param theLineBase the document line the fragment starts on
     * @param theColumnBase the document column the fragment starts at
     */
    PythonTokenizer(final String theSource, final SourceLines theLines,
            final boolean isEmbedded, final int theLineBase,
            final int theColumnBase) {
        this.source = theSource;
        this.lines = theLines;
        this.embedded = isEmbedded;
        this.lineBase = theLineBase;
        this.columnBase = theColumnBase;
        this.atLineStart = !isEmbedded;
        this.indents.push(0);
    }

    /**
     * Returns the next token; after the ENDMARKER it keeps returning it.
     *
     * @return the next token
     * @throws PythonSyntaxException on a lexical error
     */
    Token next() {
        while (pending.isEmpty()) {
            if (finished) {
                return token(Type.ENDMARKER, "", line, pos - lineStart);
            }
            scan();
        }
        return pending.poll();
    }

    private void scan() {
        if (atLineStart) {
            if (!brackets.isEmpty() || embedded) {
                atLineStart = false;
            } else if (!readIndentation()) {
                return;
            }
        }

        skipBlanks();

        if (pos >= source.length()) {
            endOfInput();
            return;
        }

        final char c = source.charAt(pos);

        if (c == '#') {
            commentColumn = pos - lineStart;
            while (pos < source.length() && !isNewline(source.charAt(pos))) {
                pos++;
            }
            return;
        }

        if (c == '\\') {
            scanContinuation();
            return;
        }

        if (isNewline(c)) {
            final int column = newlineColumn();
            final int newlineLine = line;
            consumeNewline();
            if (brackets.isEmpty() && !embedded && lineHasContent) {
                emit(Type.NEWLINE, "", newlineLine, column);
                lineHasContent = false;
            }
            atLineStart = true;
            return;
        }

        final int cp = source.codePointAt(pos);
        if (cp == '_' || Character.isUnicodeIdentifierStart(cp)) {
            scanNameOrString();
            return;
        }

        if (isDigit(c) || (c == '.' && pos + 1 < source.length()
                && isDigit(source.charAt(pos + 1)))) {
            scanNumber();
            return;
        }

        if (c == '\'' || c == '"') {
            scanString(pos, line, pos - lineStart);
            return;
        }

        scanOperator(cp);
    }

    /**
     * Measures the indentation of a new logical line and queues INDENT or
     * DEDENT tokens.
     *
     * @return false if the line was blank and has been skipped
     */
    private boolean readIndentation() {
        int column = 0;
        while (pos < source.length()) {
            final char c = source.charAt(pos);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column = (column / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                column = 0;
            } else {
                break;
            }
            pos++;
        }

        if (pos >= source.length()) {
            atLineStart = false;
            return true;
        }

        final char c = source.charAt(pos);
        if (c == '#' || isNewline(c)) {
            while (pos < source.length() && !isNewline(source.charAt(pos))) {
                pos++;
            }
            if (pos < source.length()) {
                consumeNewline();
            }
            return false;
        }
        if (c == '\\' && pos + 1 < source.length()
                && isNewline(source.charAt(pos + 1))) {
            // A continuation on an otherwise empty line joins the next one.
            pos++;
            consumeNewline();
            return false;
        }

        atLineStart = false;

        final int current = indents.peek();
        if (column > current) {
            if (indents.size() > MAX_INDENT_DEPTH) {
                throw error("too many levels of indentation", line, column);
            }
            indents.push(column);
            emit(Type.INDENT, "", line, 0);
        } else if (column < current) {
            while (column < indents.peek()) {
                indents.pop();
                emit(Type.DEDENT, "", line, column);
            }
            if (column != indents.peek()) {
                throw error("unindent does not match any outer indentation"
                        + " level", line, column);
            }
        }
        return true;
    }

    private void skipBlanks() {
        while (pos < source.length()) {
            final char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else {
                return;
            }
        }
    }

    /**
     * Returns where the NEWLINE token of the current line starts: at a
     * trailing comment if there is one, at the line break otherwise.
     */
    private int newlineColumn() {
        final int column = commentColumn >= 0 ? commentColumn
                : pos - lineStart;
        commentColumn = -1;
        return column;
    }

    private void endOfInput() {
        if (!brackets.isEmpty()) {
            final Token open = brackets.peek();
            throw errorAt("'" + open.text() + "' was never closed", open);
        }
        if (!embedded) {
            if (lineHasContent) {
                emit(Type.NEWLINE, "", line, newlineColumn());
                lineHasContent = false;
            }
            while (indents.peek() > 0) {
                indents.pop();
                emit(Type.DEDENT, "", line, 0);
            }
        }
        emit(Type.ENDMARKER, "", line, pos - lineStart);
        finished = true;
    }

    private void scanContinuation() {
        final int column = pos - lineStart;
        pos++;
        if (pos >= source.length()) {
            throw error("unexpected EOF while parsing", line, column);
        }
        if (!isNewline(source.charAt(pos))) {
            throw error("unexpected character after line continuation"
                    + " character", line, column);
        }
        consumeNewline();
    }

    private void scanNameOrString() {
        final int start = pos;
        final int startLine = line;
        final int startColumn = pos - lineStart;

        while (pos < source.length()) {
            final int cp = source.codePointAt(pos);
            if (cp == '_' || Character.isUnicodeIdentifierPart(cp)) {
                pos += Character.charCount(cp);
            } else {
                break;
            }
        }

        final String name = source.substring(start, pos);
        if (pos < source.length()
                && (source.charAt(pos) == '\'' || source.charAt(pos) == '"')
                && STRING_PREFIXES.contains(name.toLowerCase(Locale.ROOT))) {
            scanString(start, startLine, startColumn);
            return;
        }
        emit(Type.NAME, name, startLine, startColumn);
    }

    private void scanString(final int start, final int startLine,
            final int startColumn) {
        final char quote = source.charAt(pos);
        final boolean triple = pos + 2 < source.length()
                && source.charAt(pos + 1) == quote
                && source.charAt(pos + 2) == quote;
        pos += triple ? 3 : 1;

        while (true) {
            if (pos >= source.length()) {
                throw unterminated(triple, startLine, startColumn);
            }
            final char c = source.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < source.length()) {
                    if (isNewline(source.charAt(pos))) {
                        consumeNewline();
                    } else {
                        pos++;
                    }
                }
                continue;
            }
            if (isNewline(c)) {
                if (!triple) {
                    throw unterminated(false, startLine, startColumn);
                }
                consumeNewline();
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (pos + 2 < source.length()
                        && source.charAt(pos + 1) == quote
                        && source.charAt(pos + 2) == quote) {
                    pos += 3;
                    break;
                }
            }
            pos++;
        }

        emit(Type.STRING, source.substring(start, pos), startLine,
                startColumn);
    }

    private PythonSyntaxException unterminated(final boolean triple,
            final int startLine, final int startColumn) {
        final String kind = triple
                ? "unterminated triple-quoted string literal"
                : "unterminated string literal";
        return error(kind + " (detected at line " + (line + lineBase - 1)
                + ")", startLine, startColumn);
    }

    private void scanNumber() {
        final int start = pos;
        final int startColumn = pos - lineStart;
        final char first = source.charAt(pos);
        final boolean radixLiteral = first == '0' && pos + 1 < source.length()
                && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0;

        if (radixLiteral) {
            final char radix = Character.toLowerCase(source.charAt(pos + 1));
            pos += 2;
            final int digitsStart = pos;
            while (pos < source.length()
                    && (source.charAt(pos) == '_'
                    || isRadixDigit(source.charAt(pos), radix))) {
                pos++;
            }
            if (pos == digitsStart) {
                throw error("invalid " + radixName(radix) + " literal",
                        line, startColumn);
            }
        } else {
            readDigits();
            if (pos < source.length() && source.charAt(pos) == '.') {
                pos++;
                readDigits();
            }
            if (pos < source.length()
                    && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                final int mark = pos;
                pos++;
                if (pos < source.length()
                        && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < source.length() && isDigit(source.charAt(pos))) {
                    readDigits();
                } else {
                    pos = mark;
                }
            }
            if (pos < source.length()
                    && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
                pos++;
            }
        }

        final String text = source.substring(start, pos);
        if (text.endsWith("_") || text.contains("__")
                || text.contains("_.") || text.contains("._")) {
            throw error("invalid decimal literal", line, startColumn);
        }
        if (!radixLiteral && hasLeadingZeros(text)) {
            throw error("leading zeros in decimal integer literals are not"
                    + " permitted; use an 0o prefix for octal integers",
                    line, startColumn);
        }
        emit(Type.NUMBER, text, line, startColumn);
    }

    private void readDigits() {
        while (pos < source.length()) {
            final char c = source.charAt(pos);
            final boolean separator = c == '_' && pos + 1 < source.length()
                    && isDigit(source.charAt(pos + 1));
            if (!isDigit(c) && !separator) {
                return;
            }
            pos++;
        }
    }

    private static boolean hasLeadingZeros(final String text) {
        if (text.length() < 2 || text.charAt(0) != '0') {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '.' || c == 'e' || c == 'E' || c == 'j' || c == 'J') {
                return false;
            }
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c != '0' && c != '_') {
                return true;
            }
        }
        return false;
    }

    private void scanOperator(final int cp) {
        final int column = pos - lineStart;

        for (final String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                final Token token = token(Type.OP, op, line, column);
                trackBracket(token);
                pending.add(token);
                lineHasContent = true;
                return;
            }
        }

        if (cp < 128) {
            throw error("invalid syntax", line, column);
        }
        throw error(String.format("invalid character '%s' (U+%04X)",
                new String(Character.toChars(cp)), cp), line, column);
    }

    private void trackBracket(final Token token) {
        final String text = token.text();
        if ("([{".contains(text)) {
            if (brackets.size() >= MAX_BRACKET_DEPTH) {
                throw errorAt("too many nested parentheses", token);
            }
            brackets.push(token);
            return;
        }
        if (!")]}".contains(text)) {
            return;
        }
        if (brackets.isEmpty()) {
            throw errorAt("unmatched '" + text + "'", token);
        }
        final Token open = brackets.pop();
        if (!matches(open.text(), text)) {
            String message = "closing parenthesis '" + text
                    + "' does not match opening parenthesis '"
                    + open.text() + "'";
            if (open.line() != token.line()) {
                message += " on line " + open.line();
            }
            throw errorAt(message, token);
        }
    }

    private static boolean matches(final String open, final String close) {
        return ("(".equals(open) && ")".equals(close))
                || ("[".equals(open) && "]".equals(close))
                || ("{".equals(open) && "}".equals(close));
    }

    private void consumeNewline() {
        if (source.charAt(pos) == '\r' && pos + 1 < source.length()
                && source.charAt(pos + 1) == '\n') {
            pos++;
        }
        pos++;
        line++;
        lineStart = pos;
    }

    private void emit(final Type type, final String text, final int tokenLine,
            final int column) {
        pending.add(token(type, text, tokenLine, column));
        if (type != Type.NEWLINE && type != Type.INDENT
                && type != Type.DEDENT && type != Type.ENDMARKER) {
            lineHasContent = true;
        }
    }

    /** Builds a token translating fragment positions to document ones. */
    private Token token(final Type type, final String text,
            final int tokenLine, final int column) {
        return new Token(type, text, tokenLine + lineBase - 1,
                column + (tokenLine == 1 ? columnBase : 0));
    }

    private PythonSyntaxException error(final String message,
            final int fragmentLine, final int fragmentColumn) {
        final int documentLine = fragmentLine + lineBase - 1;
        final int documentColumn = fragmentColumn
                + (fragmentLine == 1 ? columnBase : 0);
        return new PythonSyntaxException(message, documentLine,
                documentColumn + 1, lines.line(documentLine));
    }

    /** Reports an error at a token, whose position is already absolute. */
    private PythonSyntaxException errorAt(final String message,
            final Token token) {
        return new PythonSyntaxException(message, token.line(),
                token.column() + 1, lines.line(token.line()));
    }

    private static boolean isNewline(final char c) {
        return c == '\n' || c == '\r';
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isRadixDigit(final char c, final char radix) {
        return switch (radix) {
            case 'x' -> Character.digit(c, 16) >= 0 && c < 128;
            case 'o' -> c >= '0' && c <= '7';
            default -> c == '0' || c == '1';
        };
    }

    private static String radixName(final char radix) {
        return switch (radix) {
            case 'x' -> "hexadecimal";
            case 'o' -> "octal";
            default -> "binary";
        };
    }
}
