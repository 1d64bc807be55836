package co.fanki.lifecyclelint.analysis.domain.guard;

import co.fanki.lifecyclelint.analysis.domain.BlockExtractor;
import co.fanki.lifecyclelint.analysis.domain.ExitClassifier;
import co.fanki.lifecyclelint.analysis.domain.Finding;
import co.fanki.lifecyclelint.analysis.domain.SourceLocator;
import co.fanki.lifecyclelint.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reports a forced access (e.g. {@code x!!}) that follows a guard whose
 * body does not make the access safe.
 *
 * <p>For every match of a {@link GuardShape} the rule extracts the guard
 * body, consults the {@link ExitClassifier}, then scans forward from the
 * end of the body for the first forced access of the same identifier. A
 * reassignment of the identifier before that access means the access works
 * on new data and nothing is reported. At most one finding is produced
 * per guard match.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ForcedAccessRule {

    private final String forcedAccessTemplate;

    private final ExitClassifier exitClassifier;

    /**
     * Creates a rule.
     *
     * @param theForcedAccessTemplate the forced access regex, where
     *        {@code %s} stands for the quoted identifier; it is anchored at
     *        a word boundary by the rule
     * @param theExitClassifier the language's exit classifier
     */
    public ForcedAccessRule(final String theForcedAccessTemplate,
            final ExitClassifier theExitClassifier) {
        this.forcedAccessTemplate = Preconditions.requireNonBlank(
                theForcedAccessTemplate, "Forced access template is required");
        this.exitClassifier = Preconditions.requireNonNull(theExitClassifier,
                "Exit classifier is required");
    }

    /**
     * Applies the rule for one guard shape over a masked file.
     *
     * @param displayPath the path printed in findings
     * @param masked the masked file text
     * @param locator the locator of the file text
     * @param shape the guard shape to look for
     * @return the findings in source order
     */
    public List<Finding> apply(final String displayPath, final String masked,
            final SourceLocator locator, final GuardShape shape) {

        final List<Finding> findings = new ArrayList<>();
        final Matcher guard = shape.pattern().matcher(masked);

        while (guard.find()) {
            final String name = guard.group(1);
            final BlockExtractor.Block body = BlockExtractor.extract(masked,
                    shape.conditionEnd(masked, guard));

            if (shape.skipOnExit() && exitClassifier.exits(body.text())) {
                continue;
            }

            final OptionalInt access = firstForcedAccess(masked, name,
                    body.end());
            if (access.isPresent()) {
                findings.add(Finding.at(displayPath,
                        locator.locate(access.getAsInt()), shape.kind(),
                        shape.describe(name)));
            }
        }
        return findings;
    }

    /**
     * Checks whether a guard body exits.
     *
     * @param body the masked body text
     * @return true if the body contains an exit keyword
     */
    public boolean exits(final String body) {
        return exitClassifier.exits(body);
    }

    /**
     * Finds the first forced access of a name at or after an offset,
     * unless the name is reassigned before it.
     *
     * @param masked the masked text
     * @param name the identifier
     * @param from the offset to scan from
     * @return the offset of the forced access, or empty
     */
    public OptionalInt firstForcedAccess(final String masked,
            final String name, final int from) {

        final Matcher forced = forcedAccess(name).matcher(masked);
        if (!forced.find(from)) {
            return OptionalInt.empty();
        }

        final Matcher assignment = reassignment(name).matcher(masked);
        assignment.region(from, forced.start());
        if (assignment.find()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(forced.start());
    }

    /**
     * Returns the forced access pattern for an identifier.
     *
     * @param name the identifier
     * @return the compiled pattern
     */
    public Pattern forcedAccess(final String name) {
        return Pattern.compile("\\b" + String.format(forcedAccessTemplate,
                Pattern.quote(name)));
    }

    private static Pattern reassignment(final String name) {
        return Pattern.compile("\\b" + Pattern.quote(name) + "\\s*=(?!=)");
    }

}
