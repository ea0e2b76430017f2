package co.fanki.sourcescan.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Source Scan service.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Source Scan API")
                        .description("""
                                Source Scan - extracts import declarations and call expressions
                                from Python source, with literal arguments normalized into typed values.

                                ## Features
                                - **Single document**: `POST /api/extractions` with the source as text/plain
                                - **Batch**: `POST /api/extractions/batch` with a JSON array of sources

                                ## Envelope
                                Every request answers with an envelope. On success it carries
                                `language`, `imports`, `calls` and `sourceCode`; on failure only
                                `error`, whose `type` is `SyntaxFault` or the failure kind.

                                ## MCP Tools
                                - `extract_python_source` - Extract imports and calls from a source text
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
