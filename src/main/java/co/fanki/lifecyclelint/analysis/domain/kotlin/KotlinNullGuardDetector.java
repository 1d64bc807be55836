package co.fanki.lifecyclelint.analysis.domain.kotlin;

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
 * Finds Kotlin {@code !!} forced unwraps that follow a null check which
 * does not leave the scope.
 *
 * <p>Three guard shapes are recognized: {@code if (x == null)},
 * {@code if (x != null)} and {@code if (x?.…)}. Only the first one is made
 * safe by an exiting body. Two declaration rules complete the picture: a
 * value obtained through {@code as?} or through the Elvis operator and
 * later forced with {@code !!}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class KotlinNullGuardDetector extends Detector {

    private static final String IDENTIFIER = "([A-Za-z_][A-Za-z0-9_]*)";

    private static final List<GuardShape> GUARDS = List.of(
            new GuardShape(
                    Pattern.compile("\\bif\\s*\\(\\s*" + IDENTIFIER
                            + "\\s*(?:===|==)\\s*null\\b"),
                    "null_guard_force_unwrap",
                    "%s!! after non-exiting null guard", true, true),
            new GuardShape(
                    Pattern.compile("\\bif\\s*\\(\\s*" + IDENTIFIER
                            + "\\s*(?:!==|!=)\\s*null\\b"),
                    "null_guard_force_unwrap",
                    "%s!! used after '!= null' guard without exit",
                    false, true),
            new GuardShape(
                    Pattern.compile("\\bif\\s*\\(\\s*" + IDENTIFIER
                            + "\\s*\\?\\."),
                    "null_guard_force_unwrap",
                    "%s!! used after ?. guard without exit", false, true));

    private static final Pattern SAFE_CAST = Pattern.compile(
            "\\b(?:val|var)\\s+" + IDENTIFIER
                    + "\\s*=\\s*[^;\\n]+as\\?\\s+[A-Za-z0-9_.]+");

    private static final Pattern ELVIS = Pattern.compile(
            "\\b(?:val|var)\\s+" + IDENTIFIER + "\\s*=\\s*[^;\\n]+?\\?:");

    private final ForcedAccessRule rule = new ForcedAccessRule(
            "%s\\s*!!", ExitClassifier.KOTLIN);

    @Override
    public String name() {
        return "kotlin-narrowing";
    }

    @Override
    public String language() {
        return "kotlin";
    }

    @Override
    protected Set<String> extensions() {
        return Set.of(".kt", ".kts");
    }

    @Override
    protected Set<String> excludedDirectories() {
        return Set.of(".git", "build", "out", "dist", "target", ".gradle",
                ".idea", "node_modules");
    }

    @Override
    protected SourceAnalyzer openAnalyzer(final ScanRequest request) {
        return this::analyze;
    }

    /**
     * Analyzes one Kotlin file.
     *
     * @param file the file
     * @return the findings, guard shapes first, then the declaration rules
     */
    public List<Finding> analyze(final SourceFile file) {
        final String masked = TextMasker.mask(file.text(), SourceDialect.KOTLIN);
        final SourceLocator locator = new SourceLocator(file.text());

        final List<Finding> findings = new ArrayList<>();
        for (final GuardShape guard : GUARDS) {
            findings.addAll(rule.apply(file.displayPath(), masked, locator,
                    guard));
        }
        findings.addAll(forcedAfterDeclaration(file, masked, locator,
                SAFE_CAST, "safe_cast_force_unwrap",
                "%s forced (!!) after as? smart cast"));
        findings.addAll(forcedAfterDeclaration(file, masked, locator,
                ELVIS, "elvis_force_unwrap",
                "%s assigned via Elvis operator but later forced with !!"));
        return findings;
    }

    private List<Finding> forcedAfterDeclaration(final SourceFile file,
            final String masked, final SourceLocator locator,
            final Pattern declaration, final String kind,
            final String messageTemplate) {

        final List<Finding> findings = new ArrayList<>();
        final Matcher match = declaration.matcher(masked);
        while (match.find()) {
            final String name = match.group(1);
            final Matcher forced = rule.forcedAccess(name).matcher(masked);
            if (forced.find(match.end())) {
                findings.add(Finding.at(file.displayPath(),
                        locator.locate(forced.start()), kind,
                        String.format(messageTemplate, name)));
            }
        }
        return findings;
    }

}
