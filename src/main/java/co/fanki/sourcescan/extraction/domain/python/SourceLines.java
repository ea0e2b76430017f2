package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line index over a source text.
 *
 * <p>Lines are split on {@code \r\n}, {@code \r} and {@code \n}, the same
 * terminators the Python tokenizer recognizes, so line numbers reported by
 * any front-end land on the same text. Returned lines never include their
 * terminator.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceLines {

    private final List<String> lines;

    private SourceLines(final List<String> theLines) {
        this.lines = Collections.unmodifiableList(theLines);
    }

    /**
     * Indexes the lines of a source text.
     *
     * @param source the source text, never null
     * @return the line index
     */
    public static SourceLines of(final String source) {
        Preconditions.requireNonNull(source, "Source text is required");

        final List<String> result = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < source.length()) {
            final char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                result.add(source.substring(start, i));
                if (c == '\r' && i + 1 < source.length()
                        && source.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
            i++;
        }
        result.add(source.substring(start));
        return new SourceLines(result);
    }

    /**
     * Returns a line by its 1-based number.
     *
     * @param number the line number
     * @return the line text, or null if the number is out of range
     */
    public String line(final int number) {
        if (number < 1 || number > lines.size()) {
            return null;
        }
        return lines.get(number - 1);
    }

    /** @return how many lines the text has; an empty text has one */
    public int count() {
        return lines.size();
    }
}
