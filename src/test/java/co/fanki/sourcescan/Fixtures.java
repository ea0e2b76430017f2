package co.fanki.sourcescan;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the Python programs under {@code src/test/resources/fixtures}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * Reads a fixture as UTF-8 text.
     *
     * @param name the file name, e.g. "simple_upload.py"
     * @return the file content
     */
    public static String read(final String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream(
                "/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
