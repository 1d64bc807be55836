package co.fanki.lifecyclelint.analysis.application;

import co.fanki.lifecyclelint.analysis.domain.Detector;
import co.fanki.lifecyclelint.analysis.domain.Finding;
import co.fanki.lifecyclelint.analysis.domain.ScanRequest;
import co.fanki.lifecyclelint.shared.DomainException;
import co.fanki.lifecyclelint.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one detector from command line arguments.
 *
 * <p>Arguments are {@code <detector> <project_dir_or_file>}, optionally
 * followed by {@code --ast-json <feed>} for detectors that accept a
 * structural-match feed. Findings go to standard output; usage errors go
 * to standard error.</p>
 *
 * <p>Exit codes: 0 after a completed run (with or without findings), 2
 * for a usage error, 1 when the analysis could not run at all.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LintCommand {

    private static final Logger LOG = LoggerFactory.getLogger(
            LintCommand.class);

    /** Completed run. */
    public static final int EXIT_OK = 0;

    /** The analysis could not be carried out. */
    public static final int EXIT_FAILURE = 1;

    /** Bad command line. */
    public static final int EXIT_USAGE = 2;

    private static final String AST_JSON_FLAG = "--ast-json";

    private final DetectorRegistry registry;

    private final FindingReporter reporter;

    /**
     * Creates the command.
     *
     * @param theRegistry the available detectors
     * @param theReporter the finding reporter
     */
    public LintCommand(final DetectorRegistry theRegistry,
            final FindingReporter theReporter) {
        this.registry = Preconditions.requireNonNull(theRegistry,
                "Registry is required");
        this.reporter = Preconditions.requireNonNull(theReporter,
                "Reporter is required");
    }

    /**
     * Runs the command.
     *
     * @param args the command line arguments
     * @param out where findings are printed
     * @param err where usage errors are printed
     * @return the process exit code
     */
    public int run(final String[] args, final PrintStream out,
            final PrintStream err) {
        Preconditions.requireNonNull(args, "Arguments are required");

        final Detector detector;
        final ScanRequest request;
        try {
            detector = detector(args);
            request = request(detector, args);
        } catch (final UsageException e) {
            err.println("error: " + e.getMessage());
            err.println(usage());
            err.flush();
            return EXIT_USAGE;
        }

        try {
            final List<Finding> findings = detector.detect(request);
            reporter.print(findings, out);
            return EXIT_OK;
        } catch (final DomainException e) {
            LOG.error("[{}] analysis failed ({}): {}", detector.name(),
                    e.getErrorCode(), e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Returns the usage line.
     *
     * @return the usage text, listing the detector names
     */
    public String usage() {
        return "usage: lifecycle-lint <detector> <project_dir_or_file>"
                + " [" + AST_JSON_FLAG + " <path>]\n"
                + "detectors: " + String.join(", ", registry.names());
    }

    private Detector detector(final String[] args) {
        if (args.length < 2) {
            throw new UsageException("expected a detector and a path");
        }
        return registry.find(args[0]).orElseThrow(() ->
                new UsageException("unknown detector: " + args[0]));
    }

    private static ScanRequest request(final Detector detector,
            final String[] args) {
        final Path target = path(args[1]);
        if (args.length == 2) {
            return ScanRequest.of(target);
        }

        if (!AST_JSON_FLAG.equals(args[2])) {
            throw new UsageException("unexpected argument: " + args[2]);
        }
        if (!detector.acceptsStructuralFeed()) {
            throw new UsageException(detector.name() + " does not accept "
                    + AST_JSON_FLAG);
        }
        if (args.length < 4) {
            throw new UsageException(AST_JSON_FLAG + " requires a path");
        }
        if (args.length > 4) {
            throw new UsageException("unexpected argument: " + args[4]);
        }
        return new ScanRequest(target, path(args[3]));
    }

    private static Path path(final String value) {
        try {
            return Path.of(value);
        } catch (final InvalidPathException e) {
            throw new UsageException("invalid path: " + value);
        }
    }

}
