package co.fanki.sourcescan.extraction.domain.python;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes Python string literal tokens.
 *
 * <p>Plain strings have their escape sequences resolved, bytes literals
 * keep their body as written, and f-strings are split into literal
 * segments and replacement fields whose expression text is parsed later
 * by {@link PythonParser}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class StringLiterals {

    private StringLiterals() {
        // Utility class, not instantiable
    }

    /**
     * A decoded string token.
     *
     * @param bytes true for a bytes literal
     * @param formatted true for an f-string
     * @param value the decoded text; the raw body for bytes, null for
     *        f-strings
     * @param segments the f-string segments, empty for other literals
     */
    record Literal(boolean bytes, boolean formatted, String value,
            List<Segment> segments) {
    }

    /**
     * One piece of an f-string: either literal text or a field.
     *
     * @param text the literal text, null for a field
     * @param field the replacement field, null for literal text
     */
    record Segment(String text, Field field) {
    }

    /**
     * A replacement field of an f-string.
     *
     * @param expression the expression source text
     * @param line the document line the expression starts on
     * @param column the document column the expression starts at
     * @param conversion the conversion character, or -1
     * @param formatSpec the format spec segments, null if there is none
     */
    record Field(String expression, int line, int column, int conversion,
            List<Segment> formatSpec) {
    }

    /**
     * Decodes a STRING token.
     *
     * @param token the token
     * @param lines the document line index, for error reporting
     * @return the decoded literal
     * @throws PythonSyntaxException if the literal is malformed
     */
    static Literal read(final Token token, final SourceLines lines) {
        final String text = token.text();

        int prefixLength = 0;
        while (text.charAt(prefixLength) != '\''
                && text.charAt(prefixLength) != '"') {
            prefixLength++;
        }
        final String prefix = text.substring(0, prefixLength)
                .toLowerCase(Locale.ROOT);
        final boolean raw = prefix.indexOf('r') >= 0;
        final boolean bytes = prefix.indexOf('b') >= 0;
        final boolean formatted = prefix.indexOf('f') >= 0;

        final char quote = text.charAt(prefixLength);
        final boolean triple = text.length() >= prefixLength + 6
                && text.charAt(prefixLength + 1) == quote
                && text.charAt(prefixLength + 2) == quote;
        final int quoteLength = triple ? 3 : 1;
        final String body = text.substring(prefixLength + quoteLength,
                text.length() - quoteLength);

        if (bytes) {
            for (int i = 0; i < body.length(); i++) {
                if (body.charAt(i) > 127) {
                    throw error("bytes can only contain ASCII literal"
                            + " characters", token, lines);
                }
            }
            return new Literal(true, false, body, List.of());
        }

        if (formatted) {
            final BodyScanner scanner = new BodyScanner(body, raw, token,
                    lines, prefixLength + quoteLength);
            final List<Segment> segments = scanner.scanSegments(false);
            return new Literal(false, true, null, segments);
        }

        final String value = raw ? body : decode(body, token, lines);
        return new Literal(false, false, value, List.of());
    }

    /**
     * Resolves the escape sequences of a non-raw string body.
     */
    static String decode(final String body, final Token token,
            final SourceLines lines) {
        if (body.indexOf('\\') < 0) {
            return body;
        }

        final StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            final char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }

            final char next = body.charAt(i + 1);
            switch (next) {
                case '\n' -> i += 2;
                case '\r' -> i += (i + 2 < body.length()
                        && body.charAt(i + 2) == '\n') ? 3 : 2;
                case '\\' -> { out.append('\\'); i += 2; }
                case '\'' -> { out.append('\''); i += 2; }
                case '"' -> { out.append('"'); i += 2; }
                case 'a' -> { out.append('\u0007'); i += 2; }
                case 'b' -> { out.append('\b'); i += 2; }
                case 'f' -> { out.append('\f'); i += 2; }
                case 'n' -> { out.append('\n'); i += 2; }
                case 'r' -> { out.append('\r'); i += 2; }
                case 't' -> { out.append('\t'); i += 2; }
                case 'v' -> { out.append('\u000B'); i += 2; }
                case 'x' -> i = appendHex(body, i, 2, out, token, lines);
                case 'u' -> i = appendHex(body, i, 4, out, token, lines);
                case 'U' -> i = appendHex(body, i, 8, out, token, lines);
                case 'N' -> i = appendNamed(body, i, out, token, lines);
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i + 1;
                        while (end < body.length() && end < i + 4
                                && body.charAt(end) >= '0'
                                && body.charAt(end) <= '7') {
                            end++;
                        }
                        out.appendCodePoint(
                                Integer.parseInt(body.substring(i + 1, end), 8));
                        i = end;
                    } else {
                        out.append('\\').append(next);
                        i += 2;
                    }
                }
            }
        }
        return out.toString();
    }

    private static int appendHex(final String body, final int start,
            final int digits, final StringBuilder out, final Token token,
            final SourceLines lines) {
        final int end = start + 2 + digits;
        if (end > body.length()) {
            throw truncated(body.charAt(start + 1), digits, token, lines);
        }
        final String hex = body.substring(start + 2, end);
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw truncated(body.charAt(start + 1), digits, token, lines);
            }
        }
        final int codePoint = Integer.parseUnsignedInt(hex, 16);
        if (codePoint < 0 || codePoint > Character.MAX_CODE_POINT) {
            throw error("(unicode error) 'unicodeescape' codec can't decode"
                    + " bytes: illegal Unicode character", token, lines);
        }
        out.appendCodePoint(codePoint);
        return end;
    }

    private static int appendNamed(final String body, final int start,
            final StringBuilder out, final Token token,
            final SourceLines lines) {
        final int close = body.indexOf('}', start);
        if (start + 2 >= body.length() || body.charAt(start + 2) != '{'
                || close < 0) {
            throw error("(unicode error) 'unicodeescape' codec can't decode"
                    + " bytes: malformed \\N character escape", token, lines);
        }
        final String name = body.substring(start + 3, close);
        try {
            out.appendCodePoint(Character.codePointOf(name));
        } catch (final IllegalArgumentException e) {
            throw error("(unicode error) 'unicodeescape' codec can't decode"
                    + " bytes: unknown Unicode character name", token, lines);
        }
        return close + 1;
    }

    private static PythonSyntaxException truncated(final char escape,
            final int digits, final Token token, final SourceLines lines) {
        final StringBuilder placeholder = new StringBuilder();
        for (int i = 0; i < digits; i++) {
            placeholder.append('X');
        }
        return error("(unicode error) 'unicodeescape' codec can't decode"
                + " bytes: truncated \\" + escape + placeholder + " escape",
                token, lines);
    }

    private static PythonSyntaxException error(final String message,
            final Token token, final SourceLines lines) {
        return new PythonSyntaxException(message, token.line(),
                token.column() + 1, lines.line(token.line()));
    }

    /**
     * Walks an f-string body splitting literal text from fields.
     */
    private static final class BodyScanner {

        private final String body;
        private final boolean raw;
        private final Token token;
        private final SourceLines lines;
        private final int bodyColumn;
        private int pos;

        BodyScanner(final String theBody, final boolean isRaw,
                final Token theToken, final SourceLines theLines,
                final int bodyOffset) {
            this.body = theBody;
            this.raw = isRaw;
            this.token = theToken;
            this.lines = theLines;
            this.bodyColumn = theToken.column() + bodyOffset;
        }

        /**
         * Scans segments until the end of the body, or until an unmatched
         * closing brace when scanning a format spec.
         */
        List<Segment> scanSegments(final boolean inFormatSpec) {
            final List<Segment> segments = new ArrayList<>();
            final StringBuilder literal = new StringBuilder();

            while (pos < body.length()) {
                final char c = body.charAt(pos);

                if (c == '{') {
                    if (!inFormatSpec && pos + 1 < body.length()
                            && body.charAt(pos + 1) == '{') {
                        literal.append('{');
                        pos += 2;
                        continue;
                    }
                    flush(literal, segments);
                    pos++;
                    scanField(segments);
                    continue;
                }

                if (c == '}') {
                    if (inFormatSpec) {
                        break;
                    }
                    if (pos + 1 < body.length() && body.charAt(pos + 1) == '}') {
                        literal.append('}');
                        pos += 2;
                        continue;
                    }
                    throw error("f-string: single '}' is not allowed",
                            token, lines);
                }

                if (c == '\\' && !raw && pos + 1 < body.length()) {
                    literal.append(c).append(body.charAt(pos + 1));
                    if (body.charAt(pos + 1) == 'N' && pos + 2 < body.length()
                            && body.charAt(pos + 2) == '{') {
                        final int close = body.indexOf('}', pos);
                        if (close > 0) {
                            literal.append(body, pos + 2, close + 1);
                            pos = close + 1;
                            continue;
                        }
                    }
                    pos += 2;
                    continue;
                }

                literal.append(c);
                pos++;
            }

            flush(literal, segments);
            return segments;
        }

        private void flush(final StringBuilder literal,
                final List<Segment> segments) {
            if (literal.length() == 0) {
                return;
            }
            final String text = raw ? literal.toString()
                    : decode(literal.toString(), token, lines);
            segments.add(new Segment(text, null));
            literal.setLength(0);
        }

        private void scanField(final List<Segment> segments) {
            final int start = pos;
            int depth = 0;
            int expressionEnd = -1;
            String debugText = null;

            while (pos < body.length()) {
                final char c = body.charAt(pos);
                if (c == '\'' || c == '"') {
                    skipQuoted(c);
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                    depth--;
                } else if (depth == 0) {
                    if (c == '}' || c == ':') {
                        break;
                    }
                    if (c == '!' && (pos + 1 >= body.length()
                            || body.charAt(pos + 1) != '=')) {
                        break;
                    }
                    if (c == '=' && debugText == null && isDebugMarker()) {
                        expressionEnd = pos;
                        pos++;
                        skipWhitespace();
                        debugText = body.substring(start, pos);
                        break;
                    }
                }
                pos++;
            }

            if (pos >= body.length()) {
                throw error("f-string: expecting '}'", token, lines);
            }

            if (expressionEnd < 0) {
                expressionEnd = pos;
            }
            final String expression = body.substring(start, expressionEnd);
            if (expression.isBlank()) {
                throw error("f-string: empty expression not allowed",
                        token, lines);
            }

            int conversion = -1;
            if (body.charAt(pos) == '!') {
                if (pos + 1 >= body.length()
                        || "sra".indexOf(body.charAt(pos + 1)) < 0) {
                    throw error("f-string: invalid conversion character:"
                            + " expected 's', 'r', or 'a'", token, lines);
                }
                conversion = body.charAt(pos + 1);
                pos += 2;
            }

            List<Segment> formatSpec = null;
            if (pos < body.length() && body.charAt(pos) == ':') {
                pos++;
                formatSpec = scanSegments(true);
            }

            if (pos >= body.length() || body.charAt(pos) != '}') {
                throw error("f-string: expecting '}'", token, lines);
            }
            pos++;

            if (debugText != null) {
                segments.add(new Segment(debugText, null));
                if (conversion < 0 && formatSpec == null) {
                    conversion = 'r';
                }
            }

            final int[] position = positionOf(start);
            segments.add(new Segment(null, new Field(expression,
                    position[0], position[1], conversion, formatSpec)));
        }

        /** An '=' ends a self-documenting expression unless it is part of an operator. */
        private boolean isDebugMarker() {
            final char previous = pos > 0 ? body.charAt(pos - 1) : ' ';
            final char following = pos + 1 < body.length()
                    ? body.charAt(pos + 1) : ' ';
            if ("=!<>".indexOf(previous) >= 0 || following == '=') {
                return false;
            }
            int i = pos + 1;
            while (i < body.length() && Character.isWhitespace(body.charAt(i))) {
                i++;
            }
            return i < body.length() && "}!:".indexOf(body.charAt(i)) >= 0;
        }

        private void skipWhitespace() {
            while (pos < body.length()
                    && Character.isWhitespace(body.charAt(pos))) {
                pos++;
            }
        }

        private void skipQuoted(final char quote) {
            final boolean triple = pos + 2 < body.length()
                    && body.charAt(pos + 1) == quote
                    && body.charAt(pos + 2) == quote;
            pos += triple ? 3 : 1;
            while (pos < body.length()) {
                if (body.charAt(pos) == quote) {
                    if (!triple) {
                        pos++;
                        return;
                    }
                    if (pos + 2 < body.length()
                            && body.charAt(pos + 1) == quote
                            && body.charAt(pos + 2) == quote) {
                        pos += 3;
                        return;
                    }
                }
                pos++;
            }
        }

        /** Maps a body index to a document line and column. */
        private int[] positionOf(final int index) {
            int line = token.line();
            int column = bodyColumn;
            for (int i = 0; i < index; i++) {
                final char c = body.charAt(i);
                if (c == '\n' || (c == '\r' && (i + 1 >= body.length()
                        || body.charAt(i + 1) != '\n'))) {
                    line++;
                    column = 0;
                } else if (c != '\r') {
                    column++;
                }
            }
            return new int[] {line, column};
        }
    }
}
