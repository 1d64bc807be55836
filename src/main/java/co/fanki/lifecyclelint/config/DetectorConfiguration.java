package co.fanki.lifecyclelint.config;

import co.fanki.lifecyclelint.analysis.application.DetectorRegistry;
import co.fanki.lifecyclelint.analysis.application.FindingReporter;
import co.fanki.lifecyclelint.analysis.application.LintCommand;
import co.fanki.lifecyclelint.analysis.domain.Detector;
import co.fanki.lifecyclelint.analysis.domain.java.JdbcHandleDetector;
import co.fanki.lifecyclelint.analysis.domain.kotlin.KotlinNullGuardDetector;
import co.fanki.lifecyclelint.analysis.domain.python.PythonResourceDetector;
import co.fanki.lifecyclelint.analysis.domain.rust.RustUnwrapGuardDetector;
import co.fanki.lifecyclelint.analysis.domain.swift.SwiftOptionalGuardDetector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Declares the detectors and the command that runs them.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class DetectorConfiguration {

    /**
     * Creates the Python resource lifecycle detector.
     *
     * @param maxFileSizeBytes Python files above this size are skipped
     * @return the detector
     */
    @Bean
    public Detector pythonResourceDetector(
            @Value("${lint.python.max-file-size-bytes:5242880}")
            final long maxFileSizeBytes) {
        return new PythonResourceDetector(maxFileSizeBytes);
    }

    /**
     * Creates the JDBC statement and result set detector.
     *
     * @return the detector
     */
    @Bean
    public Detector jdbcHandleDetector() {
        return new JdbcHandleDetector();
    }

    /**
     * Creates the Kotlin null guard detector.
     *
     * @return the detector
     */
    @Bean
    public Detector kotlinNullGuardDetector() {
        return new KotlinNullGuardDetector();
    }

    /**
     * Creates the Swift optional guard detector.
     *
     * @return the detector
     */
    @Bean
    public Detector swiftOptionalGuardDetector() {
        return new SwiftOptionalGuardDetector();
    }

    /**
     * Creates the Rust unwrap guard detector.
     *
     * @param objectMapper the mapper for structural-match feeds
     * @return the detector
     */
    @Bean
    public Detector rustUnwrapGuardDetector(final ObjectMapper objectMapper) {
        return new RustUnwrapGuardDetector(objectMapper);
    }

    /**
     * Indexes every detector bean by name.
     *
     * @param detectors all the detector beans
     * @return the registry
     */
    @Bean
    public DetectorRegistry detectorRegistry(final List<Detector> detectors) {
        return new DetectorRegistry(detectors);
    }

    /**
     * Creates the finding reporter.
     *
     * @return the reporter
     */
    @Bean
    public FindingReporter findingReporter() {
        return new FindingReporter();
    }

    /**
     * Creates the lint command.
     *
     * @param registry the detector registry
     * @param reporter the finding reporter
     * @return the command
     */
    @Bean
    public LintCommand lintCommand(final DetectorRegistry registry,
            final FindingReporter reporter) {
        return new LintCommand(registry, reporter);
    }

}
