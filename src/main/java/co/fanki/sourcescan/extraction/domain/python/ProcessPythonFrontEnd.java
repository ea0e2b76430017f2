package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.shared.Preconditions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * {@link PythonFrontEnd} that delegates parsing to a CPython interpreter.
 *
 * <h3>Protocol</h3>
 * <p>The source is written to a temporary file, the bundled
 * {@code python/ast_dump.py} script is run with {@code python -c} against
 * it, and the script writes the tree as JSON into a second temporary
 * file, which {@link AstJsonMapper} converts. Both files are removed
 * afterwards.</p>
 *
 * <p>The tree matches the one the interpreter itself builds, so the
 * accepted grammar is whatever that interpreter version accepts.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ProcessPythonFrontEnd implements PythonFrontEnd {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProcessPythonFrontEnd.class);

    /** The configuration name of this front-end. */
    public static final String NAME = "process";

    private static final String DUMPER_RESOURCE = "/python/ast_dump.py";

    private final String executable;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper;
    private final String dumperScript;

    /**
     * Creates a new process front-end.
     *
     * @param theExecutable the interpreter command, e.g. {@code python3}
     * @param theTimeoutSeconds how long a single parse may run
     * @param theObjectMapper the mapper used to read the dumper output
     */
    public ProcessPythonFrontEnd(final String theExecutable,
            final int theTimeoutSeconds, final ObjectMapper theObjectMapper) {
        this.executable = Preconditions.requireNonBlank(theExecutable,
                "Python executable is required");
        this.timeoutSeconds = Preconditions.requirePositive(theTimeoutSeconds,
                "Python timeout must be positive");
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "Object mapper is required");
        this.dumperScript = loadDumperScript();
    }

    /** {@inheritDoc} */
    @Override
    public String name() {
        return NAME;
    }

    /** {@inheritDoc} */
    @Override
    public SyntaxTree parse(final String source) {
        Preconditions.requireNonNull(source, "Source text is required");

        Path input = null;
        Path output = null;
        Path errors = null;
        try {
            input = Files.createTempFile("sourcescan-input-", ".py");
            output = Files.createTempFile("sourcescan-ast-", ".json");
            errors = Files.createTempFile("sourcescan-stderr-", ".txt");
            Files.writeString(input, source, StandardCharsets.UTF_8);

            runDumper(input, output, errors);

            if (Files.size(output) == 0) {
                throw new FrontEndException("Python front-end produced no"
                        + " output");
            }
            final JsonNode document = objectMapper.readTree(output.toFile());
            return new AstJsonMapper(SourceLines.of(source)).toTree(document);

        } catch (final IOException e) {
            throw new FrontEndException("Python front-end failed: "
                    + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FrontEndException("Python front-end interrupted", e);
        } finally {
            delete(input);
            delete(output);
            delete(errors);
        }
    }

    private void runDumper(final Path input, final Path output,
            final Path errors) throws IOException, InterruptedException {

        final ProcessBuilder pb = new ProcessBuilder(
                executable, "-c", dumperScript,
                input.toAbsolutePath().toString(),
                output.toAbsolutePath().toString());
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(errors.toFile());
        pb.environment().put("PYTHONIOENCODING", "utf-8");

        LOG.debug("Running {} on {}", executable, input);

        final Process process = pb.start();
        final boolean finished;
        try {
            finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        if (!finished) {
            process.destroyForcibly();
            throw new FrontEndException("Python front-end timed out after "
                    + timeoutSeconds + " seconds");
        }

        if (process.exitValue() != 0) {
            final String stderr = Files.readString(errors,
                    StandardCharsets.UTF_8).trim();
            LOG.warn("Python front-end exited with code {}: {}",
                    process.exitValue(), stderr);
            throw new FrontEndException("Python front-end exited with code "
                    + process.exitValue() + ": " + stderr);
        }
    }

    private static void delete(final Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (final IOException e) {
            LOG.warn("Could not delete temporary file {}: {}", file,
                    e.getMessage());
        }
    }

    private static String loadDumperScript() {
        try (InputStream in = ProcessPythonFrontEnd.class.getResourceAsStream(
                DUMPER_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource "
                        + DUMPER_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new IllegalStateException("Cannot read resource "
                    + DUMPER_RESOURCE, e);
        }
    }
}
