package co.fanki.lifecyclelint.analysis.domain.java;

import co.fanki.lifecyclelint.analysis.domain.Detector;
import co.fanki.lifecyclelint.analysis.domain.Finding;
import co.fanki.lifecyclelint.analysis.domain.ResourceKind;
import co.fanki.lifecyclelint.analysis.domain.ScanRequest;
import co.fanki.lifecyclelint.analysis.domain.SourceAnalyzer;
import co.fanki.lifecyclelint.analysis.domain.SourceDialect;
import co.fanki.lifecyclelint.analysis.domain.SourceFile;
import co.fanki.lifecyclelint.analysis.domain.SourceLocator;
import co.fanki.lifecyclelint.analysis.domain.TextMasker;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds JDBC statements and result sets that are neither declared in a
 * try-with-resources header nor closed.
 *
 * <p>Works on masked text, so declarations and {@code close()} calls that
 * only appear inside comments or string literals are ignored. There is no
 * scope model: any later {@code name.close(} in the file counts as a
 * release.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class JdbcHandleDetector extends Detector {

    private static final Pattern STATEMENT = Pattern.compile(
            "\\b(?:PreparedStatement|CallableStatement|Statement)\\s+"
                    + "([A-Za-z_][A-Za-z0-9_]*)\\s*=.*?;",
            Pattern.DOTALL);

    private static final Pattern RESULT_SET = Pattern.compile(
            "\\bResultSet\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=.*?;",
            Pattern.DOTALL);

    private static final Pattern TRY_HEADER = Pattern.compile(
            "\\btry\\s*\\(");

    @Override
    public String name() {
        return "java-resources";
    }

    @Override
    public String language() {
        return "java";
    }

    @Override
    protected Set<String> extensions() {
        return Set.of(".java");
    }

    @Override
    protected Set<String> excludedDirectories() {
        return Set.of(".git", "node_modules", "dist", "build", "bin", "out",
                ".venv", "vendor");
    }

    @Override
    protected boolean warnOnUnreadableFiles() {
        return true;
    }

    @Override
    protected SourceAnalyzer openAnalyzer(final ScanRequest request) {
        return this::analyze;
    }

    /**
     * Analyzes one Java file.
     *
     * @param file the file
     * @return statement findings first, then result set findings
     */
    public List<Finding> analyze(final SourceFile file) {
        if (file.text().isBlank()) {
            return List.of();
        }
        final String masked = TextMasker.mask(file.text(), SourceDialect.JAVA);
        final SourceLocator locator = new SourceLocator(file.text());

        final List<Finding> findings = new ArrayList<>();
        collect(file, masked, locator, STATEMENT,
                ResourceKind.STATEMENT_HANDLE, findings);
        collect(file, masked, locator, RESULT_SET,
                ResourceKind.RESULTSET_HANDLE, findings);
        return findings;
    }

    private static void collect(final SourceFile file, final String masked,
            final SourceLocator locator, final Pattern declaration,
            final ResourceKind kind, final List<Finding> findings) {

        final Matcher match = declaration.matcher(masked);
        while (match.find()) {
            final String name = match.group(1);
            if ("_".equals(name)
                    || insideTryWithResources(masked, match.start())
                    || closedAfter(masked, name, match.end())) {
                continue;
            }
            findings.add(Finding.atLine(file.displayPath(),
                    locator.line(match.start()), kind.tag(), null));
        }
    }

    /**
     * Checks whether the offset lies inside the still open parenthesis of
     * the nearest preceding {@code try (}.
     */
    static boolean insideTryWithResources(final String masked,
            final int offset) {
        final Matcher header = TRY_HEADER.matcher(masked);
        header.region(0, offset);
        int open = -1;
        while (header.find()) {
            open = header.end();
        }
        if (open < 0) {
            return false;
        }
        int depth = 1;
        for (int i = open; i < offset; i++) {
            final char ch = masked.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean closedAfter(final String masked, final String name,
            final int from) {
        final Matcher close = Pattern.compile("\\b" + Pattern.quote(name)
                + "\\.close\\s*\\(").matcher(masked);
        return close.find(from);
    }

}
