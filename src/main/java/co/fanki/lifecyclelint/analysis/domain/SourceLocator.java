package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Translates character offsets of a source text into 1-based line and
 * column numbers.
 *
 * <p>Offsets computed on a masked text are valid here as well, since
 * masking never moves a newline.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceLocator {

    /** Offsets at which each line starts, in ascending order. */
    private final int[] lineStarts;

    private final int length;

    /**
     * Indexes the line starts of the given text.
     *
     * @param text the source text, never null
     */
    public SourceLocator(final CharSequence text) {
        Preconditions.requireNonNull(text, "Text is required");

        final List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue)
                .toArray();
        this.length = text.length();
    }

    /**
     * Returns the position of the given offset.
     *
     * @param offset the character offset, between 0 and the text length
     * @return the 1-based line and column
     */
    public Position locate(final int offset) {
        Preconditions.require(offset >= 0 && offset <= length,
                "Offset out of range: " + offset);

        int index = Arrays.binarySearch(lineStarts, offset);
        if (index < 0) {
            index = -index - 2;
        }
        return new Position(index + 1, offset - lineStarts[index] + 1);
    }

    /**
     * Returns the 1-based line of the given offset.
     *
     * @param offset the character offset
     * @return the line number
     */
    public int line(final int offset) {
        return locate(offset).line();
    }

    /**
     * A 1-based line and column pair.
     *
     * @param line the line number
     * @param column the column number
     */
    public record Position(int line, int column) {}

}
