package co.fanki.lifecyclelint.analysis.domain.rust;

import co.fanki.lifecyclelint.analysis.domain.Detector;
import co.fanki.lifecyclelint.analysis.domain.ExitClassifier;
import co.fanki.lifecyclelint.analysis.domain.Finding;
import co.fanki.lifecyclelint.analysis.domain.ScanRequest;
import co.fanki.lifecyclelint.analysis.domain.SourceAnalyzer;
import co.fanki.lifecyclelint.analysis.domain.SourceDialect;
import co.fanki.lifecyclelint.analysis.domain.SourceFile;
import co.fanki.lifecyclelint.analysis.domain.SourceLocator;
import co.fanki.lifecyclelint.analysis.domain.TextMasker;
import co.fanki.lifecyclelint.analysis.domain.Utf8Offsets;
import co.fanki.lifecyclelint.analysis.domain.guard.ForcedAccessRule;
import co.fanki.lifecyclelint.analysis.domain.guard.GuardShape;
import co.fanki.lifecyclelint.shared.Preconditions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Finds Rust {@code unwrap()}/{@code expect()} calls on a value that an
 * earlier {@code if let Some(..)}/{@code if let Ok(..)} only partially
 * handled.
 *
 * <p>When a structural-match feed is supplied, its precomputed guard
 * ranges are used instead of the regex scan. A feed that cannot be read,
 * holds no usable entry or yields no finding falls back to the regex scan
 * over the whole tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RustUnwrapGuardDetector extends Detector {

    private static final Logger LOG = LoggerFactory.getLogger(
            RustUnwrapGuardDetector.class);

    private static final String KIND = "guard_unwrap";

    private static final String MESSAGE = "%s unwrap/expect after partial guard";

    private static final GuardShape IF_LET = new GuardShape(
            Pattern.compile("\\bif\\s+let\\s+(?:Some|Ok)\\s*\\([^)]*\\)\\s*=\\s*"
                    + "([A-Za-z_][A-Za-z0-9_]*)\\s*(?=\\{)"),
            KIND, MESSAGE, true, false);

    private final ForcedAccessRule rule = new ForcedAccessRule(
            "%s\\s*\\.(?:unwrap|expect)\\s*\\(", ExitClassifier.RUST);

    private final StructuralMatchFeed feedReader;

    /**
     * Creates the detector.
     *
     * @param objectMapper the mapper used to read structural-match feeds
     */
    public RustUnwrapGuardDetector(final ObjectMapper objectMapper) {
        this.feedReader = new StructuralMatchFeed(objectMapper);
    }

    @Override
    public String name() {
        return "rust-narrowing";
    }

    @Override
    public String language() {
        return "rust";
    }

    @Override
    protected Set<String> extensions() {
        return Set.of(".rs");
    }

    @Override
    protected Set<String> excludedDirectories() {
        return Set.of("target", ".git", ".hg", ".svn", "node_modules");
    }

    @Override
    public boolean acceptsStructuralFeed() {
        return true;
    }

    @Override
    protected SourceAnalyzer openAnalyzer(final ScanRequest request) {
        return this::analyze;
    }

    @Override
    public List<Finding> detect(final ScanRequest request) {
        Preconditions.requireNonNull(request, "Scan request is required");

        if (request.hasStructuralFeed()) {
            final List<Finding> fromFeed = detectFromFeed(request);
            if (!fromFeed.isEmpty()) {
                return fromFeed;
            }
            LOG.debug("Structural feed {} produced no findings, scanning",
                    request.structuralFeed());
        }
        return super.detect(request);
    }

    /**
     * Analyzes one Rust file with the regex guard scan.
     *
     * @param file the file
     * @return the findings in source order
     */
    public List<Finding> analyze(final SourceFile file) {
        final String masked = TextMasker.mask(file.text(), SourceDialect.RUST);
        return rule.apply(file.displayPath(), masked,
                new SourceLocator(file.text()), IF_LET);
    }

    private List<Finding> detectFromFeed(final ScanRequest request) {
        final Path target = request.target().toAbsolutePath().normalize();
        if (!Files.exists(target)) {
            return List.of();
        }
        final Path projectRoot = projectRoot(target);

        final List<StructuralMatch> matches;
        try {
            matches = feedReader.read(request.structuralFeed());
        } catch (final IOException e) {
            LOG.debug("Could not read structural feed {}: {}",
                    request.structuralFeed(), e.getMessage());
            return List.of();
        }

        final Map<Path, List<StructuralMatch>> byFile = new TreeMap<>();
        for (final StructuralMatch match : matches) {
            final Optional<Path> file = resolve(match.file(), projectRoot);
            file.ifPresent(path -> byFile.computeIfAbsent(path,
                    key -> new ArrayList<>()).add(match));
        }

        final List<Finding> findings = new ArrayList<>();
        for (final Map.Entry<Path, List<StructuralMatch>> entry
                : byFile.entrySet()) {
            read(projectRoot, entry.getKey()).ifPresent(source ->
                    findings.addAll(analyzeMatches(source, entry.getValue())));
        }
        return findings;
    }

    private List<Finding> analyzeMatches(final SourceFile source,
            final List<StructuralMatch> matches) {

        final String text = source.text();
        final String masked = TextMasker.mask(text, SourceDialect.RUST);
        final SourceLocator locator = new SourceLocator(text);

        final List<Finding> findings = new ArrayList<>();
        for (final StructuralMatch match : matches) {
            final String name = match.guardedName().orElseThrow();
            final int start = Utf8Offsets.toCharIndex(text,
                    match.range().byteOffset().start());
            final int end = Utf8Offsets.toCharIndex(text,
                    match.range().byteOffset().end());
            if (end < start) {
                continue;
            }
            if (rule.exits(masked.substring(start, end))) {
                continue;
            }
            final OptionalInt access = rule.firstForcedAccess(masked, name,
                    end);
            if (access.isPresent()) {
                findings.add(Finding.at(source.displayPath(),
                        locator.locate(access.getAsInt()), KIND,
                        String.format(MESSAGE, name)));
            }
        }
        return findings;
    }

    private static Optional<Path> resolve(final String file,
            final Path projectRoot) {
        try {
            final Path path = Path.of(file).toAbsolutePath().normalize();
            if (!path.startsWith(projectRoot) || !Files.isRegularFile(path)) {
                return Optional.empty();
            }
            return Optional.of(path);
        } catch (final InvalidPathException e) {
            LOG.debug("Ignoring feed entry with invalid path {}", file);
            return Optional.empty();
        }
    }

}
