package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.Preconditions;

/**
 * Blanks out comments and literal contents of a source text.
 *
 * <p>The masked text has the same length as the input and keeps every
 * newline in place, so any offset found by a regular expression on the
 * masked text maps to the same line and column of the original. Comment
 * characters and the characters inside string, char and text block
 * literals become spaces; the quote delimiters themselves are kept.</p>
 *
 * <pre>
 *   Statement s = c.createStatement(); // s.close() later
 *   String q = "s.close()";
 * </pre>
 * <p>masks to</p>
 * <pre>
 *   Statement s = c.createStatement();
 *   String q = "         ";
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TextMasker {

    private static final String TRIPLE_QUOTE = "\"\"\"";

    private TextMasker() {
    }

    /**
     * Masks the given source text.
     *
     * @param text the raw source text, never null
     * @param dialect the lexical rules to apply, never null
     * @return the masked text, with the same length as the input
     */
    public static String mask(final String text, final SourceDialect dialect) {
        Preconditions.requireNonNull(text, "Text is required");
        Preconditions.requireNonNull(dialect, "Dialect is required");

        final char[] out = text.toCharArray();
        final int n = text.length();
        int i = 0;

        while (i < n) {
            final char ch = text.charAt(i);

            if (text.startsWith("//", i)) {
                i = maskLineComment(text, out, i);
            } else if (text.startsWith("/*", i)) {
                i = maskBlockComment(text, out, i,
                        dialect.nestedBlockComments());
            } else if (dialect.tripleQuotedStrings()
                    && text.startsWith(TRIPLE_QUOTE, i)) {
                i = maskTripleQuoted(text, out, i + 3,
                        dialect.tripleQuotedEscapes());
            } else if (dialect.rawStrings() && rawStringHashes(text, i) >= 0) {
                i = maskRawString(text, out, i);
            } else if (ch == '"') {
                i = maskQuoted(text, out, i + 1, '"',
                        !dialect.multiLineStrings());
            } else if (ch == '\'') {
                i = maskSingleQuote(text, out, i, dialect.singleQuote());
            } else {
                i++;
            }
        }

        return new String(out);
    }

    private static int maskLineComment(final String text, final char[] out,
            final int start) {
        int j = start;
        while (j < text.length() && text.charAt(j) != '\n') {
            blank(out, j);
            j++;
        }
        return j;
    }

    private static int maskBlockComment(final String text, final char[] out,
            final int start, final boolean nested) {
        blank(out, start);
        blank(out, start + 1);
        int depth = 1;
        int j = start + 2;

        while (j < text.length() && depth > 0) {
            if (nested && text.startsWith("/*", j)) {
                blank(out, j);
                blank(out, j + 1);
                depth++;
                j += 2;
            } else if (text.startsWith("*/", j)) {
                blank(out, j);
                blank(out, j + 1);
                depth--;
                j += 2;
            } else {
                blank(out, j);
                j++;
            }
        }
        return j;
    }

    /**
     * Masks a quoted literal whose opening delimiter sits just before
     * {@code start}. Returns the offset following the closing delimiter.
     */
    private static int maskQuoted(final String text, final char[] out,
            final int start, final char quote, final boolean endsAtNewline) {
        int j = start;
        while (j < text.length()) {
            final char c = text.charAt(j);
            if (c == '\\') {
                blank(out, j);
                if (j + 1 < text.length()) {
                    blank(out, j + 1);
                }
                j += 2;
                continue;
            }
            if (c == quote) {
                return j + 1;
            }
            if (c == '\n' && endsAtNewline) {
                return j;
            }
            blank(out, j);
            j++;
        }
        return text.length();
    }

    private static int maskTripleQuoted(final String text, final char[] out,
            final int start, final boolean escapes) {
        int j = start;
        while (j < text.length()) {
            if (escapes && text.charAt(j) == '\\') {
                blank(out, j);
                if (j + 1 < text.length()) {
                    blank(out, j + 1);
                }
                j += 2;
                continue;
            }
            if (text.startsWith(TRIPLE_QUOTE, j)) {
                return j + 3;
            }
            blank(out, j);
            j++;
        }
        return text.length();
    }

    private static int maskSingleQuote(final String text, final char[] out,
            final int start, final SourceDialect.SingleQuote mode) {
        switch (mode) {
            case LITERAL:
                return maskQuoted(text, out, start + 1, '\'', true);
            case CHAR_OR_LIFETIME:
                return maskCharOrLifetime(text, out, start);
            default:
                return start + 1;
        }
    }

    /**
     * Rust: {@code 'x'} and {@code '\n'} are char literals, while
     * {@code 'a} in {@code &'a str} is a lifetime and stays code.
     */
    private static int maskCharOrLifetime(final String text, final char[] out,
            final int start) {
        final int n = text.length();
        if (start + 1 < n && text.charAt(start + 1) == '\\') {
            final int close = text.indexOf('\'', start + 2);
            final int newline = text.indexOf('\n', start + 2);
            if (close > 0 && (newline < 0 || close < newline)) {
                for (int j = start + 1; j < close; j++) {
                    blank(out, j);
                }
                return close + 1;
            }
            return start + 1;
        }
        if (start + 2 < n && text.charAt(start + 2) == '\''
                && text.charAt(start + 1) != '\n') {
            blank(out, start + 1);
            return start + 3;
        }
        return start + 1;
    }

    /**
     * Returns the number of hashes of a raw string starting at the given
     * offset ({@code r"}, {@code r#"}, {@code br##"} ...), or -1 when no raw
     * string starts there.
     */
    private static int rawStringHashes(final String text, final int start) {
        int j = start;
        if (j < text.length() && text.charAt(j) == 'b') {
            j++;
        }
        if (j >= text.length() || text.charAt(j) != 'r') {
            return -1;
        }
        if (start > 0 && Character.isJavaIdentifierPart(
                text.charAt(start - 1))) {
            return -1;
        }
        j++;
        int hashes = 0;
        while (j < text.length() && text.charAt(j) == '#') {
            hashes++;
            j++;
        }
        if (j < text.length() && text.charAt(j) == '"') {
            return hashes;
        }
        return -1;
    }

    private static int maskRawString(final String text, final char[] out,
            final int start) {
        final int hashes = rawStringHashes(text, start);
        final int open = text.indexOf('"', start);
        final String terminator = "\"" + "#".repeat(hashes);

        int j = open + 1;
        while (j < text.length()) {
            if (text.startsWith(terminator, j)) {
                return j + terminator.length();
            }
            blank(out, j);
            j++;
        }
        return text.length();
    }

    private static void blank(final char[] out, final int index) {
        if (index < out.length && out[index] != '\n' && out[index] != '\r') {
            out[index] = ' ';
        }
    }

}
