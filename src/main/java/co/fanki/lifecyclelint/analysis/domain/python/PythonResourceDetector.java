package co.fanki.lifecyclelint.analysis.domain.python;

import co.fanki.lifecyclelint.analysis.domain.Detector;
import co.fanki.lifecyclelint.analysis.domain.Finding;
import co.fanki.lifecyclelint.analysis.domain.ScanRequest;
import co.fanki.lifecyclelint.analysis.domain.SourceAnalyzer;
import co.fanki.lifecyclelint.analysis.domain.SourceFile;
import co.fanki.lifecyclelint.shared.Preconditions;

import java.util.List;
import java.util.Set;

/**
 * Finds Python files, sockets, subprocesses and asyncio tasks that are
 * acquired and never released.
 *
 * <p>Unlike the other detectors this one works on a real syntax tree,
 * obtained from {@link PythonAstEngine}. One engine is opened per run and
 * shared by all files. A file with a syntax error is skipped with a
 * warning.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonResourceDetector extends Detector {

    private final long maxFileSizeBytes;

    /**
     * Creates the detector.
     *
     * @param theMaxFileSizeBytes files larger than this are skipped
     */
    public PythonResourceDetector(final long theMaxFileSizeBytes) {
        Preconditions.require(theMaxFileSizeBytes > 0,
                "Max file size must be positive");
        this.maxFileSizeBytes = theMaxFileSizeBytes;
    }

    @Override
    public String name() {
        return "python-resources";
    }

    @Override
    public String language() {
        return "python";
    }

    @Override
    protected Set<String> extensions() {
        return Set.of(".py");
    }

    @Override
    protected Set<String> excludedDirectories() {
        return Set.of(".git", "__pycache__", ".mypy_cache", ".pytest_cache",
                ".ruff_cache", "node_modules", "dist", "build", ".venv",
                "venv", "env", "envs", "site-packages", "target");
    }

    @Override
    protected boolean warnOnUnreadableFiles() {
        return true;
    }

    @Override
    protected long maxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    @Override
    protected SourceAnalyzer openAnalyzer(final ScanRequest request) {
        final PythonAstEngine engine = PythonAstEngine.open();
        return new SourceAnalyzer() {

            @Override
            public List<Finding> analyze(final SourceFile file) {
                return PythonResourceDetector.analyze(engine, file);
            }

            @Override
            public void close() {
                engine.close();
            }
        };
    }

    /**
     * Analyzes one Python file with an already open engine.
     *
     * @param engine the parser engine
     * @param file the file
     * @return the findings sorted by line, kind and name
     */
    public static List<Finding> analyze(final PythonAstEngine engine,
            final SourceFile file) {
        Preconditions.requireNonNull(engine, "Engine is required");
        Preconditions.requireNonNull(file, "File is required");
        return ResourceLifecycleAnalyzer.analyze(file.displayPath(),
                engine.parse(file.text(), file.displayPath()));
    }

}
