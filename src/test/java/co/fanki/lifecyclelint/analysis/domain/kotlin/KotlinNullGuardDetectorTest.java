package co.fanki.lifecyclelint.analysis.domain.kotlin;

import co.fanki.lifecyclelint.analysis.domain.Finding;
import co.fanki.lifecyclelint.analysis.domain.ScanRequest;
import co.fanki.lifecyclelint.analysis.domain.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link KotlinNullGuardDetector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class KotlinNullGuardDetectorTest {

    private final KotlinNullGuardDetector detector =
            new KotlinNullGuardDetector();

    @Test
    void whenAnalyzing_givenNonExitingNullGuard_shouldReportForcedAccess() {
        final String source = """
                fun run(x: Service?) {
                    if (x == null) { doSomething() }
                    x!!.use()
                }
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        final Finding finding = findings.get(0);
        assertEquals(3, finding.line());
        assertEquals(5, finding.column());
        assertEquals("null_guard_force_unwrap", finding.kind());
        assertEquals("x!! after non-exiting null guard", finding.message());
    }

    @Test
    void whenAnalyzing_givenExitingNullGuard_shouldReportNothing() {
        final String source = """
                fun run(x: Service?) {
                    if (x == null) { return }
                    x!!.use()
                }
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenReassignmentAfterGuard_shouldReportNothing() {
        final String source = """
                fun run(input: Service?) {
                    var x = input
                    if (x == null) { log("missing") }
                    x = Service()
                    x!!.use()
                }
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenNestedCallInCondition_shouldUseWholeCondition() {
        final String source = """
                fun run(x: Service?) {
                    if (x == null && check(a(b))) { return }
                    x!!.use()
                }
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenAnalyzing_givenExitingPositiveGuard_shouldReport() {
        final String source = """
                fun run(x: Service?) {
                    if (x != null) { return }
                    x!!.use()
                }
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals("x!! used after '!= null' guard without exit",
                findings.get(0).message());
    }

    @Test
    void whenAnalyzing_givenSafeCallGuard_shouldReport() {
        final String source = """
                fun run(x: Service?) {
                    if (x?.ready == true) { start() }
                    x!!.use()
                }
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals("x!! used after ?. guard without exit",
                findings.get(0).message());
    }

    @Test
    void whenAnalyzing_givenSafeCastForcedLater_shouldReport() {
        final String source = """
                fun run(any: Any) {
                    val s = any as? String
                    println(s!!.length)
                }
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals("safe_cast_force_unwrap", findings.get(0).kind());
        assertEquals("s forced (!!) after as? smart cast",
                findings.get(0).message());
        assertEquals(3, findings.get(0).line());
    }

    @Test
    void whenAnalyzing_givenElvisForcedLater_shouldReport() {
        final String source = """
                fun run(map: Map<String, String?>) {
                    val v = map["k"] ?: map["fallback"]
                    println(v!!.length)
                }
                """;

        final List<Finding> findings = analyze(source);

        assertEquals(1, findings.size());
        assertEquals("elvis_force_unwrap", findings.get(0).kind());
        assertEquals("v assigned via Elvis operator but later forced with !!",
                findings.get(0).message());
    }

    @Test
    void whenAnalyzing_givenGuardInsideComment_shouldReportNothing() {
        final String source = """
                fun run(x: Service?) {
                    // if (x == null) { log() }
                    /* x!!.use() */
                    val msg = "if (x == null) { } x!!"
                }
                """;

        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void whenDetecting_givenProjectTree_shouldReportRelativePaths(
            @TempDir final Path root) throws IOException {
        final Path dir = Files.createDirectories(root.resolve("app/src"));
        Files.writeString(dir.resolve("Main.kt"), """
                fun run(x: Service?) {
                    if (x == null) { log() }
                    x!!.use()
                }
                """);
        final Path build = Files.createDirectories(root.resolve("build"));
        Files.writeString(build.resolve("Gen.kt"), """
                fun gen(x: Service?) {
                    if (x == null) { log() }
                    x!!.use()
                }
                """);

        final List<Finding> findings = detector.detect(ScanRequest.of(root));

        assertEquals(1, findings.size());
        assertEquals("app/src/Main.kt", findings.get(0).path());
    }

    @Test
    void whenDetecting_givenMissingTarget_shouldReturnNothing(
            @TempDir final Path root) {
        assertTrue(detector.detect(ScanRequest.of(root.resolve("missing")))
                .isEmpty());
    }

    private List<Finding> analyze(final String source) {
        return detector.analyze(new SourceFile(Path.of("Main.kt"), "Main.kt",
                source));
    }

}
