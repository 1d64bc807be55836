package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.Preconditions;

/**
 * Finds the extent of the body that follows a guard condition or a
 * declaration.
 *
 * <p>A body is either a brace-delimited block, matched by counting nested
 * braces, or a single statement running up to the end of the line. Both
 * shapes exist in every supported language ({@code if (x == null) return}
 * vs {@code if (x == null) { ... }}).</p>
 *
 * <p>Callers pass masked text so that braces inside comments and literals
 * do not unbalance the count.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class BlockExtractor {

    private BlockExtractor() {
    }

    /**
     * Extracts the body starting at the first non-whitespace character at
     * or after the given offset.
     *
     * @param text the (masked) source text
     * @param offset the offset just past the guard's introducing syntax
     * @return the body text and the offset immediately following it
     */
    public static Block extract(final String text, final int offset) {
        Preconditions.requireNonNull(text, "Text is required");
        Preconditions.requireOffset(offset, text, "Offset out of range");

        int start = offset;
        while (start < text.length()
                && Character.isWhitespace(text.charAt(start))) {
            start++;
        }

        if (start < text.length() && text.charAt(start) == '{') {
            final int close = closingBrace(text, start);
            return new Block(text.substring(start, close + 1), close + 1);
        }

        int newline = text.indexOf('\n', start);
        if (newline < 0) {
            newline = text.length();
        }
        return new Block(text.substring(start, newline), newline);
    }

    /**
     * Returns the offset of the brace closing the one at {@code open}.
     *
     * <p>An unbalanced block extends to the end of the text.</p>
     *
     * @param text the (masked) source text
     * @param open the offset of an opening brace
     * @return the offset of the matching closing brace, or the last offset
     */
    public static int closingBrace(final String text, final int open) {
        return closing(text, open, '{', '}', text.length() - 1);
    }

    /**
     * Returns the offset of the parenthesis closing the one at {@code open}.
     *
     * @param text the (masked) source text
     * @param open the offset of an opening parenthesis
     * @return the offset of the matching parenthesis, or -1 if unbalanced
     */
    public static int closingParen(final String text, final int open) {
        return closing(text, open, '(', ')', -1);
    }

    private static int closing(final String text, final int open,
            final char opener, final char closer, final int unbalanced) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            final char ch = text.charAt(i);
            if (ch == opener) {
                depth++;
            } else if (ch == closer) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return unbalanced;
    }

    /**
     * An extracted guard body.
     *
     * @param text the body text, braces included for block bodies
     * @param end the offset immediately following the body
     */
    public record Block(String text, int end) {}

}
