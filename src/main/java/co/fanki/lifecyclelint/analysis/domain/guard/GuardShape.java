package co.fanki.lifecyclelint.analysis.domain.guard;

import co.fanki.lifecyclelint.analysis.domain.BlockExtractor;
import co.fanki.lifecyclelint.shared.Preconditions;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One syntactic form of guard clause, such as {@code if (x == null)}.
 *
 * <p>The pattern's first group captures the guarded identifier. The guard
 * condition ends where the pattern match ends, unless the shape asks for
 * balanced parentheses and the keyword is directly followed by one, in
 * which case it ends at the parenthesis closing that one. Either way, the guard body starts right
 * after the condition.</p>
 *
 * <p>{@code skipOnExit} encodes polarity: a negative check
 * ({@code x == null}) whose body exits makes later forced access safe,
 * while a positive or optional-chaining check that exits leaves the wrong
 * branch, so the forced access is still reported.</p>
 *
 * @param pattern the guard pattern, group 1 is the guarded name
 * @param kind the kind tag of findings produced by this shape
 * @param messageTemplate the finding message, {@code %s} is the name
 * @param skipOnExit whether an exiting body makes the guard safe
 * @param balancedCondition whether the condition extends to the matching
 *        closing parenthesis
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GuardShape(
        Pattern pattern,
        String kind,
        String messageTemplate,
        boolean skipOnExit,
        boolean balancedCondition
) {

    private static final Pattern KEYWORD = Pattern.compile("\\w+\\s*");

    /** Validates the shape on construction. */
    public GuardShape {
        Preconditions.requireNonNull(pattern, "Guard pattern is required");
        Preconditions.requireNonBlank(kind, "Guard kind is required");
        Preconditions.requireNonBlank(messageTemplate,
                "Guard message is required");
    }

    /**
     * Returns the offset at which the guard condition of a match ends.
     *
     * @param text the masked text the match was found in
     * @param match the guard match
     * @return the offset just past the condition
     */
    public int conditionEnd(final String text, final Matcher match) {
        if (!balancedCondition) {
            return match.end();
        }
        final int open = text.indexOf('(', match.start());
        if (open < 0 || open >= match.end()
                || !KEYWORD.matcher(text.substring(match.start(), open))
                        .matches()) {
            return match.end();
        }
        final int close = BlockExtractor.closingParen(text, open);
        return close < 0 ? match.end() : close + 1;
    }

    /**
     * Builds the finding message for a guarded name.
     *
     * @param name the guarded identifier
     * @return the message
     */
    public String describe(final String name) {
        return String.format(messageTemplate, name);
    }

}
