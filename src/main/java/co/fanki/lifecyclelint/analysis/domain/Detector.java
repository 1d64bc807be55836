package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Abstract strategy for finding one family of defects in the source files
 * of one language.
 *
 * <p>Each language has its own file extensions, excluded directories and
 * analysis. Subclasses supply these; this class provides the template
 * method {@link #detect(ScanRequest)} that resolves the target, walks the
 * tree, reads each file and collects the findings.</p>
 *
 * <p>Failures are isolated per file: an unreadable file or a file the
 * front end cannot parse is skipped and the walk continues. Detectors keep
 * no state between runs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class Detector {

    private static final Logger LOG = LoggerFactory.getLogger(Detector.class);

    /**
     * Returns the name used to select this detector on the command line.
     *
     * @return the detector name (e.g. "python-resources")
     */
    public abstract String name();

    /**
     * Returns the language this detector analyzes.
     *
     * @return the language name (e.g. "python")
     */
    public abstract String language();

    /**
     * Returns the accepted file extensions.
     *
     * @return lower case extensions with leading dot
     */
    protected abstract Set<String> extensions();

    /**
     * Returns the directory names that are never entered.
     *
     * @return the excluded directory names
     */
    protected abstract Set<String> excludedDirectories();

    /**
     * Opens the per-file analysis for one run.
     *
     * @param request the scan request
     * @return the analyzer, closed when the run ends
     */
    protected abstract SourceAnalyzer openAnalyzer(ScanRequest request);

    /**
     * Whether unreadable files are reported on stderr. Silent by default.
     *
     * @return true to warn about unreadable files
     */
    protected boolean warnOnUnreadableFiles() {
        return false;
    }

    /**
     * Returns the size above which a file is skipped.
     *
     * @return the maximum file size in bytes
     */
    protected long maxFileSizeBytes() {
        return Long.MAX_VALUE;
    }

    /**
     * Whether this detector accepts a structural match feed.
     *
     * @return true if {@link ScanRequest#structuralFeed()} is honored
     */
    public boolean acceptsStructuralFeed() {
        return false;
    }

    /**
     * Analyzes a project directory or a single file.
     *
     * <p>A target that does not exist yields no findings.</p>
     *
     * @param request the scan request
     * @return the findings, grouped by file in path order
     */
    public List<Finding> detect(final ScanRequest request) {
        Preconditions.requireNonNull(request, "Scan request is required");

        final Path target = request.target().toAbsolutePath().normalize();
        if (!Files.exists(target)) {
            LOG.debug("Target {} does not exist, nothing to analyze", target);
            return List.of();
        }

        final Path projectRoot = projectRoot(target);
        final List<Path> files;
        try {
            files = new SourceFileWalker(extensions(), excludedDirectories())
                    .walk(target);
        } catch (final IOException e) {
            LOG.warn("Could not walk {}: {}", target, e.getMessage());
            return List.of();
        }

        LOG.info("[{}] discovered {} {} files under {}", name(),
                files.size(), language(), target);
        if (files.isEmpty()) {
            return List.of();
        }

        final List<Finding> findings = new ArrayList<>();
        try (SourceAnalyzer analyzer = openAnalyzer(request)) {
            for (final Path file : files) {
                final Optional<SourceFile> source = read(projectRoot, file);
                if (source.isEmpty()) {
                    continue;
                }
                try {
                    findings.addAll(analyzer.analyze(source.get()));
                } catch (final UnparsableSourceException e) {
                    LOG.warn("Syntax error in {}: {}", file, e.getMessage());
                }
            }
        }

        LOG.info("[{}] {} findings", name(), findings.size());
        return findings;
    }

    /**
     * Returns the directory that findings are reported relative to.
     *
     * @param target the normalized, existing scan target
     * @return the target itself for a directory, its parent for a file
     */
    protected static Path projectRoot(final Path target) {
        if (Files.isDirectory(target) || target.getParent() == null) {
            return target;
        }
        return target.getParent();
    }

    /**
     * Reads a file, skipping it when it is too large or unreadable.
     *
     * <p>Malformed UTF-8 sequences are replaced rather than rejected.</p>
     *
     * @param projectRoot the project root for display paths
     * @param file the file to read
     * @return the source file, or empty when skipped
     */
    protected Optional<SourceFile> read(final Path projectRoot,
            final Path file) {
        try {
            final long size = Files.size(file);
            if (size > maxFileSizeBytes()) {
                LOG.warn("Skipping large file: {} ({} bytes)", file, size);
                return Optional.empty();
            }
            final String text = new String(Files.readAllBytes(file),
                    StandardCharsets.UTF_8);
            return Optional.of(new SourceFile(file,
                    SourceFile.displayPath(projectRoot, file), text));
        } catch (final IOException e) {
            if (warnOnUnreadableFiles()) {
                LOG.warn("Could not read {}: {}", file, e.getMessage());
            } else {
                LOG.debug("Could not read {}: {}", file, e.getMessage());
            }
            return Optional.empty();
        }
    }

}
