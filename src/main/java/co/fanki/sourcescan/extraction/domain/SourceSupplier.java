package co.fanki.sourcescan.extraction.domain;

import java.io.IOException;

/**
 * Produces the text of a document, e.g. by reading a file or a stream.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface SourceSupplier {

    /**
     * Reads the whole document.
     *
     * @return the document text
     * @throws IOException if the text cannot be read
     */
    String get() throws IOException;
}
