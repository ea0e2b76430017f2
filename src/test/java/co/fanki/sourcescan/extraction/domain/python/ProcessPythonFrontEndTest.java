package co.fanki.sourcescan.extraction.domain.python;

import co.fanki.sourcescan.Fixtures;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for {@link ProcessPythonFrontEnd}.
 *
 * <p>Needs a {@code python3} interpreter on the path; skipped otherwise.
 * The nodes extraction reads (calls, attributes, keywords and imports)
 * are compared against {@link NativePythonFrontEnd}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProcessPythonFrontEndTest {

    private static final Set<NodeKind> EXTRACTED = EnumSet.of(
            NodeKind.CALL, NodeKind.ATTRIBUTE, NodeKind.KEYWORD,
            NodeKind.IMPORT, NodeKind.IMPORT_FROM, NodeKind.ALIAS);

    private static final Set<NodeKind> PATTERN_KINDS = EnumSet.of(
            NodeKind.MATCH, NodeKind.MATCH_CASE, NodeKind.MATCH_VALUE,
            NodeKind.MATCH_SINGLETON, NodeKind.MATCH_SEQUENCE,
            NodeKind.MATCH_MAPPING, NodeKind.MATCH_CLASS, NodeKind.MATCH_STAR,
            NodeKind.MATCH_AS, NodeKind.MATCH_OR, NodeKind.CALL,
            NodeKind.ATTRIBUTE, NodeKind.NAME, NodeKind.CONSTANT,
            NodeKind.UNARY_OP, NodeKind.TUPLE);

    private static boolean pythonAvailable;

    private final ProcessPythonFrontEnd frontEnd = new ProcessPythonFrontEnd(
            "python3", 30, new ObjectMapper());

    private final NativePythonFrontEnd nativeFrontEnd =
            new NativePythonFrontEnd();

    @BeforeAll
    static void detectInterpreter() {
        try {
            final Process process = new ProcessBuilder("python3", "--version")
                    .redirectErrorStream(true)
                    .start();
            pythonAvailable = process.waitFor(10, TimeUnit.SECONDS)
                    && process.exitValue() == 0;
        } catch (final Exception e) {
            pythonAvailable = false;
        }
    }

    @Test
    void whenAskingName_shouldBeProcess() {
        assertEquals("process", frontEnd.name());
    }

    @Test
    void whenParsing_givenFixtures_shouldMatchNativeFrontEnd() {
        assumeTrue(pythonAvailable, "python3 is not installed");

        for (final String fixture : List.of("simple_upload.py",
                "multiple_operations.py", "data_pipeline.py",
                "constructs.py")) {
            final String source = Fixtures.read(fixture);

            assertEquals(describe(nativeFrontEnd.parse(source)),
                    describe(frontEnd.parse(source)), fixture);
        }
    }

    @Test
    void whenParsing_givenNonAsciiLine_shouldReportCharacterColumns() {
        assumeTrue(pythonAvailable, "python3 is not installed");

        final SyntaxTree tree = frontEnd.parse("s = 'ñandú'; f(s)\n");

        final SyntaxNode call = tree.root().children(Fields.BODY).get(1)
                .requireChild(Fields.VALUE);
        assertEquals(13, call.column());
    }

    @Test
    void whenParsing_givenUnclosedCall_shouldReportInterpreterError() {
        assumeTrue(pythonAvailable, "python3 is not installed");

        final PythonSyntaxException e = assertThrows(
                PythonSyntaxException.class,
                () -> frontEnd.parse("upload(bucket='b'\nprint(1)\n"));

        assertEquals("'(' was never closed", e.getMessage());
        assertEquals(1, e.getLine());
        assertEquals(7, e.getOffset());
        assertEquals("upload(bucket='b'", e.getText());
    }

    @Test
    void whenParsing_givenMatchStatement_shouldMatchNativeFrontEnd() {
        assumeTrue(pythonAvailable, "python3 is not installed");

        final String source = "match a, b:\n"
                + "    case (x as y) | [1, *_] if g(x):\n"
                + "        f(1)\n"
                + "    case {\"k\": -1, **rest}:\n"
                + "        pass\n"
                + "    case P.Q(1, z=2) | None:\n"
                + "        pass\n"
                + "    case [*items] | (True | 1 - 2j):\n"
                + "        upload(items)\n"
                + "    case _:\n"
                + "        h()\n";

        assertEquals(describe(nativeFrontEnd.parse(source), PATTERN_KINDS),
                describe(frontEnd.parse(source), PATTERN_KINDS));
    }

    @Test
    void whenParsing_givenSyntaxErrors_shouldReportSamePositionAsNative() {
        assumeTrue(pythonAvailable, "python3 is not installed");

        for (final String source : List.of(
                "a = 1\n    b = 2\n",
                "a = 1\n\tb = 2\n",
                "x = f\"{}\" + 1\n",
                "x = f\"{}\"  # c\n",
                "x = f\"{f\"{a}\"}\"\n",
                "x = (f\"{a\"\n  )\n",
                "x =  # c\n",
                "f(x for x in y, 1)\n",
                "f(1, x for x in y)\n",
                "f(**k, *y)\n",
                "f(a=1, b)\n",
                "f(a=1, b, c=2)\n",
                "f(**k, a, b=1)\n",
                "print \"hello\"\n",
                "f(print \"a\")\n",
                "def print \"a\"\n",
                "match x:\n  pass\n",
                "match x:\n  case 1+1:\n    pass\n",
                "match x:\n  case C(1, a=2, 3):\n    pass\n")) {
            final PythonSyntaxException expected = assertThrows(
                    PythonSyntaxException.class,
                    () -> frontEnd.parse(source), source);
            final PythonSyntaxException actual = assertThrows(
                    PythonSyntaxException.class,
                    () -> nativeFrontEnd.parse(source), source);

            assertEquals(expected.getMessage(), actual.getMessage(), source);
            assertEquals(expected.getLine(), actual.getLine(), source);
            assertEquals(expected.getOffset(), actual.getOffset(), source);
        }
    }

    @Test
    void whenInterrupted_givenRunningInterpreter_shouldKillTheChild(
            @TempDir final Path directory) throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")),
                "/bin/sh is not available");

        final Path sleeper = directory.resolve("slow-python");
        Files.writeString(sleeper, "#!/bin/sh\nexec sleep 30\n");
        assumeTrue(sleeper.toFile().setExecutable(true),
                "cannot mark script executable");

        final ProcessPythonFrontEnd slow = new ProcessPythonFrontEnd(
                sleeper.toString(), 60, new ObjectMapper());
        final Set<Long> before = childPids();
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        final Thread worker = new Thread(() -> {
            try {
                slow.parse("x = 1\n");
            } catch (final Throwable e) {
                failure.set(e);
            }
        });
        worker.start();

        final ProcessHandle child = awaitNewChild(before);
        worker.interrupt();
        worker.join(TimeUnit.SECONDS.toMillis(10));

        assertFalse(worker.isAlive());
        final FrontEndException e = assertInstanceOf(
                FrontEndException.class, failure.get());
        assertEquals("Python front-end interrupted", e.getMessage());
        child.onExit().get(10, TimeUnit.SECONDS);
        assertFalse(child.isAlive());
    }

    @Test
    void whenParsing_givenMissingInterpreter_shouldThrowFrontEndException() {
        final ProcessPythonFrontEnd missing = new ProcessPythonFrontEnd(
                "no-such-python-interpreter", 5, new ObjectMapper());

        assertThrows(FrontEndException.class, () -> missing.parse("x = 1\n"));
    }

    @Test
    void whenCreating_givenBlankExecutable_shouldThrowIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> new ProcessPythonFrontEnd(" ", 5, new ObjectMapper()));
    }

    private static Set<Long> childPids() {
        final Set<Long> pids = new HashSet<>();
        ProcessHandle.current().children()
                .forEach(child -> pids.add(child.pid()));
        return pids;
    }

    private static ProcessHandle awaitNewChild(final Set<Long> before)
            throws InterruptedException {
        final long deadline = System.nanoTime()
                + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            final Optional<ProcessHandle> child = ProcessHandle.current()
                    .children()
                    .filter(handle -> !before.contains(handle.pid()))
                    .findFirst();
            if (child.isPresent()) {
                return child.get();
            }
            Thread.sleep(20);
        }
        throw new AssertionError("interpreter process never started");
    }

    private static List<String> describe(final SyntaxTree tree) {
        return describe(tree, EXTRACTED);
    }

    private static List<String> describe(final SyntaxTree tree,
            final Set<NodeKind> kinds) {
        final List<String> result = new ArrayList<>();
        for (final SyntaxNode node : tree.enumerate()) {
            if (!kinds.contains(node.kind())) {
                continue;
            }
            result.add(node.kind() + "@" + node.line() + ":" + node.column()
                    + " " + node.payload());
        }
        return result;
    }
}
