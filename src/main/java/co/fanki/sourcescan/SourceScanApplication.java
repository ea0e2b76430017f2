package co.fanki.sourcescan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Source Scan Application.
 *
 * <p>Main entry point of the Python source scanner, which extracts import
 * declarations and call expressions from Python programs, with literal
 * arguments normalized into typed values. It serves the extraction over
 * REST, as an MCP stdio tool, or as a one-shot command line run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class SourceScanApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(SourceScanApplication.class, args);
    }

}
