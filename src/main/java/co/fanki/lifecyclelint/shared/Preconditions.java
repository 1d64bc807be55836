package co.fanki.lifecyclelint.shared;

/**
 * Argument checks used at the public entry points of the analyzers.
 *
 * <p>Every check throws {@link IllegalArgumentException}: a failed check is
 * a programming error in the caller, never a property of the source tree
 * being analyzed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Ensures that a reference is present.
     *
     * @param reference the reference to check
     * @param message the exception message if the reference is null
     * @param <T> the type of the reference
     * @return the same reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference,
            final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string carries at least one non-whitespace character.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the same string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a condition holds.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition,
            final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a 1-based source position (line or column) is valid.
     *
     * @param value the position to check
     * @param message the exception message if lower than one
     * @return the same position
     * @throws IllegalArgumentException if value is lower than one
     */
    public static int requirePosition(final int value, final String message) {
        if (value < 1) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a character offset lies within a text.
     *
     * @param offset the offset to check, may be equal to the length
     * @param text the text the offset points into
     * @param message the exception message if out of range
     * @return the same offset
     * @throws IllegalArgumentException if offset is negative or past the end
     */
    public static int requireOffset(final int offset, final CharSequence text,
            final String message) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException(message);
        }
        return offset;
    }

}
