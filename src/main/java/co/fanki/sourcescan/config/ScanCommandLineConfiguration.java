package co.fanki.sourcescan.config;

import co.fanki.sourcescan.extraction.application.ExtractionEnvelope;
import co.fanki.sourcescan.extraction.application.ExtractionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * One-shot command line mode.
 *
 * <p>When {@code sourcescan.cli.enabled} is {@code true}, the application
 * extracts the file named by the first non-option argument, or standard
 * input when there is none, prints the indented envelope to standard output
 * and returns. Run it with the {@code cli} profile, which turns the web
 * server and the banner off.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "sourcescan.cli.enabled", havingValue = "true")
public class ScanCommandLineConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            ScanCommandLineConfiguration.class);

    /**
     * Creates the runner that performs the scan.
     *
     * @param extractionService the extraction service
     * @return the command line runner
     */
    @Bean
    CommandLineRunner scanCommandLineRunner(
            final ExtractionService extractionService) {
        return args -> scan(extractionService, args, System.in, System.out);
    }

    /**
     * Scans the file named in the arguments, or the input stream.
     *
     * @param extractionService the extraction service
     * @param args the command line arguments
     * @param in the stream read when no file is named
     * @param out the stream the envelope is printed to
     */
    static void scan(final ExtractionService extractionService,
            final String[] args, final InputStream in, final PrintStream out) {

        final String file = firstOperand(args);

        final ExtractionEnvelope envelope;
        if (file == null) {
            LOG.info("Reading Python source from standard input");
            envelope = extractionService.extractStream(in);
        } else {
            envelope = extractionService.extractFile(Path.of(file));
        }

        out.println(extractionService.toJson(envelope));
        out.flush();
    }

    private static String firstOperand(final String[] args) {
        for (final String arg : args) {
            if (!arg.startsWith("--")) {
                return arg;
            }
        }
        return null;
    }
}
