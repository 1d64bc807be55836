package co.fanki.lifecyclelint.analysis.domain.swift;

import co.fanki.lifecyclelint.analysis.domain.BlockExtractor;
import co.fanki.lifecyclelint.analysis.domain.Detector;
import co.fanki.lifecyclelint.analysis.domain.ExitClassifier;
import co.fanki.lifecyclelint.analysis.domain.Finding;
import co.fanki.lifecyclelint.analysis.domain.ScanRequest;
import co.fanki.lifecyclelint.analysis.domain.SourceAnalyzer;
import co.fanki.lifecyclelint.analysis.domain.SourceDialect;
import co.fanki.lifecyclelint.analysis.domain.SourceFile;
import co.fanki.lifecyclelint.analysis.domain.SourceLocator;
import co.fanki.lifecyclelint.analysis.domain.TextMasker;
import co.fanki.lifecyclelint.analysis.domain.guard.ForcedAccessRule;
import co.fanki.lifecyclelint.analysis.domain.guard.GuardShape;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds Swift {@code !} forced unwraps after an optional check that does
 * not leave the scope, and {@code guard let} statements whose else block
 * falls through.
 *
 * <p>A guard condition wrapped in parentheses is taken up to its balanced
 * closing parenthesis. A {@code guard let} binding list may span several
 * lines, up to the {@code else} that opens its block.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SwiftOptionalGuardDetector extends Detector {

    private static final String IDENTIFIER = "([A-Za-z_][A-Za-z0-9_]*)";

    private static final List<GuardShape> GUARDS = List.of(
            new GuardShape(
                    Pattern.compile("\\bif\\s*\\(?\\s*" + IDENTIFIER
                            + "\\s*==\\s*nil[^)\\{]*\\)?"),
                    "nil_guard_force_unwrap",
                    "%s! used after == nil guard without exit", true, true),
            new GuardShape(
                    Pattern.compile("\\bif\\s*\\(?\\s*" + IDENTIFIER
                            + "\\s*!=\\s*nil[^)\\{]*\\)?"),
                    "nil_guard_force_unwrap",
                    "%s! used after '!= nil' guard without exit",
                    false, true),
            new GuardShape(
                    Pattern.compile("\\bif\\s*\\(?\\s*" + IDENTIFIER
                            + "\\?\\.[^\\{\\n]*"),
                    "nil_guard_force_unwrap",
                    "%s! forced after ?. guard without exit", false, true));

    private static final Pattern GUARD_LET = Pattern.compile(
            "\\bguard\\s+(?:let|var)\\s+" + IDENTIFIER
                    + "(?:\\s*=\\s*[^{}]+?)?\\s+else\\s*(?=\\{)");

    private final ForcedAccessRule rule = new ForcedAccessRule(
            "%s\\s*!(?!=)", ExitClassifier.SWIFT);

    @Override
    public String name() {
        return "swift-narrowing";
    }

    @Override
    public String language() {
        return "swift";
    }

    @Override
    protected Set<String> extensions() {
        return Set.of(".swift");
    }

    @Override
    protected Set<String> excludedDirectories() {
        return Set.of(".git", ".hg", ".svn", "build", "DerivedData",
                ".swiftpm", ".idea", "node_modules");
    }

    @Override
    protected SourceAnalyzer openAnalyzer(final ScanRequest request) {
        return this::analyze;
    }

    /**
     * Analyzes one Swift file.
     *
     * @param file the file
     * @return the findings, guard shapes first, then guard-let else blocks
     */
    public List<Finding> analyze(final SourceFile file) {
        final String masked = TextMasker.mask(file.text(), SourceDialect.SWIFT);
        final SourceLocator locator = new SourceLocator(file.text());

        final List<Finding> findings = new ArrayList<>();
        for (final GuardShape guard : GUARDS) {
            findings.addAll(rule.apply(file.displayPath(), masked, locator,
                    guard));
        }

        final Matcher guardLet = GUARD_LET.matcher(masked);
        while (guardLet.find()) {
            final int open = guardLet.end();
            final BlockExtractor.Block elseBlock = BlockExtractor.extract(
                    masked, open);
            if (!rule.exits(elseBlock.text())) {
                findings.add(Finding.at(file.displayPath(),
                        locator.locate(open), "guard_else_without_exit",
                        "guard let '" + guardLet.group(1)
                                + "' else-block does not exit before continuing"));
            }
        }
        return findings;
    }

}
