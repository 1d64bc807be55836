package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.Preconditions;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether a guard body leaves the enclosing scope.
 *
 * <p>This is keyword presence, not reachability: a {@code return} nested in
 * an inner conditional still counts as an exit. The classifier expects
 * masked text, so keywords inside comments and strings are not seen.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExitClassifier {

    /** Kotlin escaping keywords. */
    public static final ExitClassifier KOTLIN = of(
            "return", "throw", "break", "continue");

    /** Swift escaping keywords and never-returning functions. */
    public static final ExitClassifier SWIFT = of(
            "return", "throw", "break", "continue",
            "fatalError", "preconditionFailure");

    /** Rust escaping keywords. */
    public static final ExitClassifier RUST = of(
            "return", "break", "continue");

    private final Pattern keywords;

    private ExitClassifier(final Pattern theKeywords) {
        this.keywords = theKeywords;
    }

    /**
     * Creates a classifier for the given keyword set.
     *
     * @param exitKeywords the keywords that leave a scope
     * @return the classifier
     */
    public static ExitClassifier of(final String... exitKeywords) {
        Preconditions.require(exitKeywords.length > 0,
                "At least one exit keyword is required");
        final String alternation = Arrays.stream(exitKeywords)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return new ExitClassifier(
                Pattern.compile("\\b(?:" + alternation + ")\\b"));
    }

    /**
     * Checks whether the block contains any exit keyword.
     *
     * @param block the masked block text
     * @return true if the block exits
     */
    public boolean exits(final String block) {
        return keywords.matcher(block).find();
    }

}
