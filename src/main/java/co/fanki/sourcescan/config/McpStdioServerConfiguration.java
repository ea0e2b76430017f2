package co.fanki.sourcescan.config;

import co.fanki.sourcescan.extraction.application.ExtractionEnvelope;
import co.fanki.sourcescan.extraction.application.ExtractionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Configures the MCP stdio server transport.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * this configuration starts an MCP server that communicates via
 * stdin/stdout using the JSON-RPC protocol. Run it with the {@code mcp}
 * profile, which also turns the web server off.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    /** Name of the extraction tool. */
    static final String EXTRACT_TOOL = "extract_python_source";

    private static final String EXTRACT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "source": {
                  "type": "string",
                  "description": "The complete Python source text"
                }
              },
              "required": ["source"]
            }
            """;

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server.
     *
     * @param transportProvider the stdio transport provider
     * @param extractionService the service that runs extractions
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final ExtractionService extractionService) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("source-scan", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(extractTool(extractionService));

        LOG.info("MCP stdio server initialized with 1 tool");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    private McpServerFeatures.SyncToolSpecification extractTool(
            final ExtractionService extractionService) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool(EXTRACT_TOOL,
                        "Extract the imports and calls of a Python program."
                                + " Returns a JSON envelope: on success the"
                                + " import records, the call records with"
                                + " their callee, module and typed"
                                + " arguments, and the source; on a syntax"
                                + " error its message, line and offset.",
                        EXTRACT_SCHEMA),
                (exchange, arguments) -> {
                    final Object source = arguments.get("source");
                    if (!(source instanceof String text)) {
                        return errorResult(new IllegalArgumentException(
                                "Argument 'source' must be a string"));
                    }

                    try {
                        final ExtractionEnvelope envelope =
                                extractionService.extract(text);
                        return new CallToolResult(List.of(
                                new McpSchema.TextContent(
                                        extractionService.toJson(envelope))),
                                false);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
