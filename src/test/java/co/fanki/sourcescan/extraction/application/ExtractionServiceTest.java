package co.fanki.sourcescan.extraction.application;

import co.fanki.sourcescan.Fixtures;
import co.fanki.sourcescan.extraction.domain.SourceExtractor;
import co.fanki.sourcescan.extraction.domain.python.NativePythonFrontEnd;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ExtractionService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExtractionServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ExtractionService service = new ExtractionService(
            new SourceExtractor(new NativePythonFrontEnd()), objectMapper, 3);

    @TempDir
    Path tempDir;

    @Test
    void whenExtracting_givenValidSource_shouldReturnSuccessEnvelope() {
        final ExtractionEnvelope envelope = service.extract(
                "import os\nos.remove(path)\n");

        assertTrue(envelope.success());
        assertEquals(1, envelope.imports().size());
        assertEquals("remove", envelope.calls().get(0).function());
        assertEquals("os", envelope.calls().get(0).module());
    }

    @Test
    void whenExtracting_givenInvalidSource_shouldReturnFailureEnvelope() {
        final ExtractionEnvelope envelope = service.extract("def f(:\n");

        assertFalse(envelope.success());
        assertEquals(ExtractionEnvelope.SYNTAX_FAULT, envelope.error().type());
        assertEquals(1, envelope.error().line());
    }

    @Test
    void whenExtractingFile_givenUtf8File_shouldReadIt() throws Exception {
        final Path file = tempDir.resolve("upload.py");
        Files.writeString(file, "upload(name='señal')\n",
                StandardCharsets.UTF_8);

        final ExtractionEnvelope envelope = service.extractFile(file);

        assertTrue(envelope.success());
        assertEquals("señal", envelope.calls().get(0).keywords().get("name")
                .value());
    }

    @Test
    void whenExtractingFile_givenMissingFile_shouldReturnAcquisitionFault() {
        final ExtractionEnvelope envelope = service.extractFile(
                tempDir.resolve("missing.py"));

        assertFalse(envelope.success());
        assertEquals(SourceExtractor.ACQUISITION_FAULT,
                envelope.error().type());
    }

    @Test
    void whenExtractingStream_givenUtf8Bytes_shouldReadToTheEnd() {
        final ExtractionEnvelope envelope = service.extractStream(
                new ByteArrayInputStream("a = 1\nprint(a)\n"
                        .getBytes(StandardCharsets.UTF_8)));

        assertTrue(envelope.success());
        assertEquals("a = 1\nprint(a)\n", envelope.sourceCode());
    }

    @Test
    void whenExtractingAll_givenMixedDocuments_shouldKeepInputOrder() {
        final List<String> sources = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            sources.add(i % 5 == 0 ? "broken(\n" : "call_" + i + "()\n");
        }

        final List<ExtractionEnvelope> envelopes = service.extractAll(sources);

        assertEquals(20, envelopes.size());
        for (int i = 0; i < 20; i++) {
            final ExtractionEnvelope envelope = envelopes.get(i);
            if (i % 5 == 0) {
                assertFalse(envelope.success());
            } else {
                assertEquals("call_" + i,
                        envelope.calls().get(0).function());
            }
        }
    }

    @Test
    void whenExtractingAll_givenEmptyBatch_shouldReturnEmptyList() {
        assertTrue(service.extractAll(List.of()).isEmpty());
    }

    @Test
    void whenExtractingAll_givenNullDocument_shouldThrowIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> service.extractAll(Arrays.asList("x\n", null)));
    }

    @Test
    void whenExtractingAll_givenSameFixtureTwice_shouldReturnEqualEnvelopes() {
        final String source = Fixtures.read("multiple_operations.py");

        final List<ExtractionEnvelope> envelopes = service.extractAll(
                List.of(source, source));

        assertEquals(envelopes.get(0), envelopes.get(1));
    }

    @Test
    void whenRenderingJson_givenEnvelope_shouldProduceIndentedDocument()
            throws Exception {
        final String json = service.toJson(service.extract("f(1)\n"));

        assertTrue(json.contains("\n"));
        final JsonNode node = objectMapper.readTree(json);
        assertEquals("f", node.path("calls").get(0).path("function").asText());
        assertEquals(1, node.path("calls").get(0).path("arguments")
                .path("arg_0").path("value").asInt());
    }

    @Test
    void whenCreating_givenNonPositiveParallelism_shouldThrowIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExtractionService(new SourceExtractor(
                        new NativePythonFrontEnd()), objectMapper, 0));
    }
}
