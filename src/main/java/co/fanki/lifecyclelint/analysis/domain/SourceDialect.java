package co.fanki.lifecyclelint.analysis.domain;

/**
 * Lexical rules of the languages handled by the text based detectors.
 *
 * <p>Only the rules that decide where comments and literals start and end
 * are modeled; everything else is code as far as {@link TextMasker} is
 * concerned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum SourceDialect {

    /** Java: char literals, text blocks with escapes, flat comments. */
    JAVA(false, SingleQuote.LITERAL, true, true, false),

    /** Kotlin: nesting comments, raw triple-quoted strings. */
    KOTLIN(true, SingleQuote.LITERAL, true, false, false),

    /** Swift: nesting comments, no single-quoted literals. */
    SWIFT(true, SingleQuote.NONE, true, true, false),

    /** Rust: nesting comments, raw strings, char literals vs lifetimes. */
    RUST(true, SingleQuote.CHAR_OR_LIFETIME, false, false, true);

    /** How a single quote is interpreted. */
    public enum SingleQuote {

        /** Starts a quoted literal terminated by another single quote. */
        LITERAL,

        /** Starts a char literal only when one closes it, else a lifetime. */
        CHAR_OR_LIFETIME,

        /** Not a delimiter. */
        NONE
    }

    private final boolean nestedBlockComments;

    private final SingleQuote singleQuote;

    private final boolean tripleQuotedStrings;

    private final boolean tripleQuotedEscapes;

    private final boolean rawStrings;

    SourceDialect(final boolean theNestedBlockComments,
            final SingleQuote theSingleQuote,
            final boolean theTripleQuotedStrings,
            final boolean theTripleQuotedEscapes,
            final boolean theRawStrings) {
        this.nestedBlockComments = theNestedBlockComments;
        this.singleQuote = theSingleQuote;
        this.tripleQuotedStrings = theTripleQuotedStrings;
        this.tripleQuotedEscapes = theTripleQuotedEscapes;
        this.rawStrings = theRawStrings;
    }

    /** @return whether a block comment may contain another one */
    public boolean nestedBlockComments() {
        return nestedBlockComments;
    }

    /** @return the meaning of a single quote */
    public SingleQuote singleQuote() {
        return singleQuote;
    }

    /** @return whether three double quotes open a multi-line string */
    public boolean tripleQuotedStrings() {
        return tripleQuotedStrings;
    }

    /** @return whether a backslash escapes inside triple-quoted strings */
    public boolean tripleQuotedEscapes() {
        return tripleQuotedEscapes;
    }

    /** @return whether {@code r"..."} and {@code r#"..."#} are recognized */
    public boolean rawStrings() {
        return rawStrings;
    }

    /** @return whether a plain string literal may span lines */
    public boolean multiLineStrings() {
        return this == RUST;
    }

}
