package co.fanki.sourcescan.extraction.application;

import co.fanki.sourcescan.extraction.domain.ExtractionResult;
import co.fanki.sourcescan.extraction.domain.ExtractionResult.ExtractionFault;
import co.fanki.sourcescan.extraction.domain.SourceExtractor;
import co.fanki.sourcescan.shared.Preconditions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Application service for Python source extraction.
 *
 * <p>Wraps {@link SourceExtractor} with logging, source acquisition from
 * files and streams, concurrent processing of several documents and JSON
 * rendering of the resulting envelopes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ExtractionService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExtractionService.class);

    private final SourceExtractor extractor;
    private final ObjectMapper objectMapper;
    private final int parallelism;

    /**
     * Creates a new ExtractionService.
     *
     * @param theExtractor the extractor
     * @param theObjectMapper the mapper used to render envelopes
     * @param theParallelism how many documents a batch processes at once
     */
    public ExtractionService(
            final SourceExtractor theExtractor,
            final ObjectMapper theObjectMapper,
            @Value("${sourcescan.batch.parallelism:4}")
            final int theParallelism) {
        this.extractor = Preconditions.requireNonNull(theExtractor,
                "Source extractor is required");
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
        this.parallelism = Preconditions.requirePositive(theParallelism,
                "Batch parallelism must be positive");
    }

    /**
     * Extracts imports and calls from a document.
     *
     * @param source the complete document text, never null
     * @return the envelope
     */
    public ExtractionEnvelope extract(final String source) {
        Preconditions.requireNonNull(source, "Source text is required");

        return timed(() -> extractor.extract(source));
    }

    /**
     * Reads a UTF-8 file and extracts imports and calls from it.
     *
     * <p>A file that cannot be read yields a failure envelope of type
     * {@value SourceExtractor#ACQUISITION_FAULT}.</p>
     *
     * @param file the file, never null
     * @return the envelope
     */
    public ExtractionEnvelope extractFile(final Path file) {
        Preconditions.requireNonNull(file, "File is required");

        LOG.info("Extracting from file {}", file);
        return timed(() -> extractor.extract(
                () -> Files.readString(file, StandardCharsets.UTF_8)));
    }

    /**
     * Reads a UTF-8 stream to its end and extracts imports and calls.
     *
     * @param in the stream, never null; it is not closed
     * @return the envelope
     */
    public ExtractionEnvelope extractStream(final InputStream in) {
        Preconditions.requireNonNull(in, "Input stream is required");

        return timed(() -> extractor.extract(
                () -> new String(in.readAllBytes(), StandardCharsets.UTF_8)));
    }

    /**
     * Extracts several independent documents concurrently.
     *
     * @param sources the document texts, none of them null
     * @return one envelope per document, in input order
     */
    public List<ExtractionEnvelope> extractAll(final List<String> sources) {
        Preconditions.requireNonNull(sources, "Sources are required");
        for (final String source : sources) {
            Preconditions.requireNonNull(source, "Source text is required");
        }

        if (sources.isEmpty()) {
            return List.of();
        }

        LOG.info("Extracting batch of {} documents", sources.size());

        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(parallelism, sources.size()));
        try {
            final List<Future<ExtractionEnvelope>> futures = new ArrayList<>(
                    sources.size());
            for (final String source : sources) {
                futures.add(executor.submit(() -> extract(source)));
            }

            final List<ExtractionEnvelope> results = new ArrayList<>(
                    sources.size());
            for (final Future<ExtractionEnvelope> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Renders an envelope as indented JSON.
     *
     * @param envelope the envelope, never null
     * @return the JSON document
     */
    public String toJson(final ExtractionEnvelope envelope) {
        Preconditions.requireNonNull(envelope, "Envelope is required");
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(envelope);
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException("Cannot render envelope", e);
        }
    }

    private ExtractionEnvelope await(final Future<ExtractionEnvelope> future) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExtractionEnvelope.of(new ExtractionFault(
                    e.getClass().getSimpleName(), "Batch interrupted"));
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Unexpected error in batch extraction: {}",
                    cause.getMessage());
            return ExtractionEnvelope.of(new ExtractionFault(
                    cause.getClass().getSimpleName(), cause.getMessage()));
        }
    }

    private static ExtractionEnvelope timed(
            final Supplier<ExtractionResult> extraction) {
        final long start = System.currentTimeMillis();
        final ExtractionEnvelope envelope = ExtractionEnvelope.of(
                extraction.get());
        final long elapsed = System.currentTimeMillis() - start;

        if (envelope.success()) {
            LOG.info("Extracted {} imports and {} calls from {} chars in {} ms",
                    envelope.imports().size(), envelope.calls().size(),
                    envelope.sourceCode().length(), elapsed);
        } else {
            LOG.info("Extraction failed with {} in {} ms: {}",
                    envelope.error().type(), elapsed,
                    envelope.error().message());
        }
        return envelope;
    }
}
