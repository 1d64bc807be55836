package co.fanki.lifecyclelint.analysis.domain;

import java.util.List;

/**
 * Per-run analysis of individual files, opened by a {@link Detector}.
 *
 * <p>Text detectors return a stateless lambda. Front ends that hold an
 * expensive parser (the Python one) close it when the run ends.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface SourceAnalyzer extends AutoCloseable {

    /**
     * Analyzes one file.
     *
     * @param file the file to analyze
     * @return the findings for this file, in reporting order
     * @throws UnparsableSourceException if the file cannot be parsed
     */
    List<Finding> analyze(SourceFile file);

    /** Releases the resources held for the run. */
    @Override
    default void close() {
    }

}
