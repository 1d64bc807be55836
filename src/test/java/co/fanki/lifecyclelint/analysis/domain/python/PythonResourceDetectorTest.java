package co.fanki.lifecyclelint.analysis.domain.python;

import co.fanki.lifecyclelint.analysis.domain.Finding;
import co.fanki.lifecyclelint.analysis.domain.ScanRequest;
import co.fanki.lifecyclelint.analysis.domain.SourceFile;
import co.fanki.lifecyclelint.analysis.domain.UnparsableSourceException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PythonResourceDetector} and
 * {@link ResourceLifecycleAnalyzer}, parsing with a real GraalPy engine.
 *
 * <p>The engine is expensive to start, so one instance is shared by all
 * the tests of this class.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PythonResourceDetectorTest {

    private static PythonAstEngine engine;

    @BeforeAll
    static void setUp() throws IOException {
        engine = new PythonAstEngine();
    }

    @AfterAll
    static void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    // -- Scoped acquisition --

    @Test
    void whenAnalyzing_givenWithStatement_shouldReportNothing() {
        final String source = """
                def read(p):
                    with open(p) as f:
                        return f.read()
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenWithStatementAndExplicitClose_shouldReportNothing() {
        final String source = """
                with open("data.txt") as f:
                    f.close()
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenResourceNestedInWithCall_shouldReportNothing() {
        final String source = """
                import contextlib
                with contextlib.closing(open("a.txt")) as f:
                    pass
                """;

        assertTrue(analyze(source).isEmpty());
    }

    // -- Unbound acquisitions --

    @Test
    void whenAnalyzing_givenBareOpen_shouldReportFileHandleAtCallLine() {
        final String source = """
                def touch(p):
                    open(p)
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        final Finding finding = findings.get(0);
        assertEquals("service.py", finding.path());
        assertEquals(2, finding.line());
        assertNull(finding.column());
        assertEquals("file_handle", finding.kind());
        assertEquals("File handle file_handle opened without context manager"
                + " or close()", finding.message());
    }

    // -- Same scope release --

    @Test
    void whenAnalyzing_givenOpenThenClose_shouldReportNothing() {
        final String source = """
                f = open("p")
                f.close()
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenOpenWithoutClose_shouldNameTheVariable() {
        final String source = """
                f = open("p")
                data = f.read()
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals(1, findings.get(0).line());
        assertEquals("File handle f opened without context manager or close()",
                findings.get(0).message());
    }

    @Test
    void whenAnalyzing_givenAttributeTarget_shouldTrackDottedName() {
        final String source = """
                class Reader:
                    def __init__(self, p):
                        self.fh = open(p)

                    def close(self):
                        self.fh.close()
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals("File handle self.fh opened without context manager"
                + " or close()", findings.get(0).message());
    }

    @Test
    void whenAnalyzing_givenSameNameReopened_shouldReleaseEarliestOnly() {
        final String source = """
                f = open("a")
                f = open("b")
                f.close()
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals(2, findings.get(0).line());
    }

    // -- Ownership transfer --

    @Test
    void whenAnalyzing_givenReturnedResource_shouldReportNothing() {
        final String source = """
                def make(p):
                    f = open(p)
                    return f
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenYieldedResources_shouldReportNothing() {
        final String source = """
                import socket

                def handles(p):
                    f = open(p)
                    yield f
                    s = socket.socket()
                    yield from [s]
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenClosureReturningOuterResource_shouldReportNothing() {
        final String source = """
                def outer(p):
                    f = open(p)
                    def inner():
                        return f
                    return inner
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenClosureClosingOuterResource_shouldStillReport() {
        final String source = """
                def outer(p):
                    f = open(p)
                    def inner():
                        f.close()
                    return inner
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals(2, findings.get(0).line());
    }

    // -- Alias resolution --

    @Test
    void whenAnalyzing_givenModuleAlias_shouldResolvePopen() {
        final String source = """
                import subprocess as sp
                proc = sp.Popen(["ls"])
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals("popen_handle", findings.get(0).kind());
        assertEquals("subprocess handle proc never waited/terminated",
                findings.get(0).message());
    }

    @Test
    void whenAnalyzing_givenFromImportAndWait_shouldReportNothing() {
        final String source = """
                from subprocess import Popen
                p = Popen(["ls"])
                p.wait()
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenPathBuilderChain_shouldResolvePathlibOpen() {
        final String source = """
                from pathlib import Path
                fh = Path("x.txt").open()
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals("file_handle", findings.get(0).kind());
    }

    @Test
    void whenAnalyzing_givenFunctionLocalImport_shouldResolveInThatScope() {
        final String source = """
                def spawn():
                    from subprocess import Popen as Spawn
                    child = Spawn(["ls"])
                    return 1

                def other():
                    child = Spawn(["ls"])
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals(3, findings.get(0).line());
    }

    @Test
    void whenAnalyzing_givenUnknownOpenMethod_shouldReportNothing() {
        final String source = """
                import os
                fd = os.open("x", os.O_RDONLY)
                """;

        assertTrue(analyze(source).isEmpty());
    }

    // -- Sockets --

    @Test
    void whenAnalyzing_givenSocketClosed_shouldReportNothing() {
        final String source = """
                import socket
                s = socket.socket()
                s.close()
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenSocketPairHalfClosed_shouldReportOtherHalf() {
        final String source = """
                import socket
                r, w = socket.socketpair()
                r.close()
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals("Socket w opened without close()",
                findings.get(0).message());
    }

    // -- asyncio --

    @Test
    void whenAnalyzing_givenTasksAwaitedGatheredAndLeaked_shouldReportLeak() {
        final String source = """
                import asyncio

                async def main():
                    t1 = asyncio.create_task(work())
                    t2 = asyncio.create_task(work())
                    t3 = asyncio.create_task(work())
                    t4 = asyncio.create_task(work())
                    await t1
                    await asyncio.gather(t2, return_exceptions=True)
                    await asyncio.wait([t4])
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals(6, findings.get(0).line());
        assertEquals("asyncio_task", findings.get(0).kind());
        assertEquals("asyncio task t3 neither awaited nor cancelled",
                findings.get(0).message());
    }

    @Test
    void whenAnalyzing_givenCancelledTask_shouldReportNothing() {
        final String source = """
                import asyncio

                async def main():
                    task = asyncio.create_task(work())
                    task.cancel()
                """;

        assertTrue(analyze(source).isEmpty());
    }

    // -- Reporting --

    @Test
    void whenAnalyzing_givenSeveralLeaksOnOneLine_shouldSortByKindThenName() {
        final String source = """
                import socket, subprocess
                b = socket.socket(); a = open("x"); p = subprocess.Popen([])
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(3, findings.size());
        assertEquals("file_handle", findings.get(0).kind());
        assertEquals("popen_handle", findings.get(1).kind());
        assertEquals("socket_handle", findings.get(2).kind());
    }

    @Test
    void whenAnalyzing_givenSameSourceTwice_shouldProduceSameFindings() {
        final String source = """
                import socket
                s = socket.create_connection(("h", 1))
                open("x")
                """;

        assertEquals(analyze(source), analyze(source));
    }

    @Test
    void whenParsing_givenSyntaxError_shouldThrowUnparsable() {
        assertThrows(UnparsableSourceException.class,
                () -> analyze("def broken(:\n    pass\n"));
    }

    // -- Detector --

    @Test
    void whenDetecting_givenTreeWithBrokenAndLargeFiles_shouldSkipThem(
            @TempDir final Path root) throws IOException {
        final Path pkg = Files.createDirectories(root.resolve("pkg"));
        Files.writeString(pkg.resolve("ok.py"), "open('x')\n");
        Files.writeString(pkg.resolve("broken.py"), "def broken(:\n");
        Files.writeString(pkg.resolve("big.py"),
                "open('y')\n" + "#".repeat(2048) + "\n");
        final Path venv = Files.createDirectories(root.resolve(".venv/lib"));
        Files.writeString(venv.resolve("dep.py"), "open('z')\n");

        final List<Finding> findings = new PythonResourceDetector(1024)
                .detect(ScanRequest.of(root));

        assertEquals(1, findings.size());
        assertEquals("pkg/ok.py", findings.get(0).path());
        assertEquals(1, findings.get(0).line());
    }

    private static List<Finding> analyze(final String source) {
        return PythonResourceDetector.analyze(engine,
                new SourceFile(Path.of("service.py"), "service.py", source));
    }

}
