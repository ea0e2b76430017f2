package co.fanki.sourcescan.extraction.application;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for Python source extraction.
 *
 * <p>Failure envelopes are regular responses: a document with a syntax
 * error still answers 200 with {@code success=false}. Only malformed
 * requests answer 400.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/extractions")
@Tag(name = "Extraction", description = "Extract imports and calls from Python source")
public class ExtractionController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExtractionController.class);

    private final ExtractionService extractionService;

    /**
     * Creates a new ExtractionController.
     *
     * @param theExtractionService the extraction service
     */
    public ExtractionController(final ExtractionService theExtractionService) {
        this.extractionService = theExtractionService;
    }

    /**
     * Extracts imports and calls from one Python document.
     *
     * @param source the document text; an empty body is an empty module
     * @return the envelope
     */
    @Operation(
            summary = "Extract one document",
            description = "Parses the Python source sent as the request body and returns "
                    + "its imports and calls, or the syntax error that stopped parsing."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Extraction envelope",
                    content = @Content(schema = @Schema(
                            implementation = ExtractionEnvelope.class)))
    })
    @PostMapping(consumes = MediaType.TEXT_PLAIN_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExtractionEnvelope> extract(
            @RequestBody(required = false) final String source) {

        final String text = source == null ? "" : source;
        LOG.info("Received extraction request for {} chars", text.length());

        return ResponseEntity.ok(extractionService.extract(text));
    }

    /**
     * Extracts imports and calls from several Python documents.
     *
     * @param sources the document texts
     * @return one envelope per document, in request order
     */
    @Operation(
            summary = "Extract a batch of documents",
            description = "Takes a JSON array of Python sources and returns one envelope "
                    + "per source, in the same order."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Extraction envelopes",
                    content = @Content(array = @ArraySchema(schema = @Schema(
                            implementation = ExtractionEnvelope.class)))),
            @ApiResponse(responseCode = "400", description = "Missing or null sources")
    })
    @PostMapping(value = "/batch",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ExtractionEnvelope>> extractBatch(
            @RequestBody final List<String> sources) {

        LOG.info("Received batch extraction request for {} documents",
                sources.size());

        try {
            return ResponseEntity.ok(extractionService.extractAll(sources));
        } catch (final IllegalArgumentException e) {
            LOG.warn("Rejected batch extraction request: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }
}
