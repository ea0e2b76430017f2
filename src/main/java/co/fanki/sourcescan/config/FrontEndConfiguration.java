package co.fanki.sourcescan.config;

import co.fanki.sourcescan.extraction.domain.SourceExtractor;
import co.fanki.sourcescan.extraction.domain.python.NativePythonFrontEnd;
import co.fanki.sourcescan.extraction.domain.python.ProcessPythonFrontEnd;
import co.fanki.sourcescan.extraction.domain.python.PythonFrontEnd;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the Python front-end and wires the extractor around it.
 *
 * <p>{@code sourcescan.frontend} picks the implementation: {@code native}
 * (default) parses in the JVM, {@code process} runs the interpreter named
 * by {@code sourcescan.python.executable}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class FrontEndConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            FrontEndConfiguration.class);

    /**
     * Creates the configured front-end.
     *
     * @param frontEnd the front-end name
     * @param executable the interpreter command for the process front-end
     * @param timeoutSeconds the per-document timeout of the process
     *        front-end
     * @param objectMapper the mapper the process front-end reads JSON with
     * @return the front-end
     */
    @Bean
    PythonFrontEnd pythonFrontEnd(
            @Value("${sourcescan.frontend:native}") final String frontEnd,
            @Value("${sourcescan.python.executable:python3}")
            final String executable,
            @Value("${sourcescan.python.timeout-seconds:30}")
            final int timeoutSeconds,
            final ObjectMapper objectMapper) {

        final PythonFrontEnd result = switch (frontEnd.trim()) {
            case NativePythonFrontEnd.NAME -> new NativePythonFrontEnd();
            case ProcessPythonFrontEnd.NAME -> new ProcessPythonFrontEnd(
                    executable, timeoutSeconds, objectMapper);
            default -> throw new IllegalStateException("Unknown front-end '"
                    + frontEnd + "', expected '" + NativePythonFrontEnd.NAME
                    + "' or '" + ProcessPythonFrontEnd.NAME + "'");
        };

        LOG.info("Using the {} Python front-end", result.name());
        return result;
    }

    /**
     * Creates the source extractor.
     *
     * @param frontEnd the front-end
     * @return the extractor
     */
    @Bean
    SourceExtractor sourceExtractor(final PythonFrontEnd frontEnd) {
        return new SourceExtractor(frontEnd);
    }
}
