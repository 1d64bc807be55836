package co.fanki.lifecyclelint.analysis.domain;

/**
 * Converts UTF-8 byte offsets, as produced by external structural matchers,
 * into character offsets of a Java string.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Utf8Offsets {

    private Utf8Offsets() {
    }

    /**
     * Returns the character index at which the given byte offset falls.
     *
     * <p>Offsets past the end of the text are clamped to its length; an
     * offset pointing into the middle of a multi-byte sequence resolves to
     * the character that sequence encodes.</p>
     *
     * @param text the decoded text
     * @param byteOffset the UTF-8 byte offset
     * @return the character index
     */
    public static int toCharIndex(final String text, final long byteOffset) {
        if (byteOffset <= 0) {
            return 0;
        }
        long bytes = 0;
        int index = 0;
        while (index < text.length()) {
            final int codePoint = text.codePointAt(index);
            final int width = utf8Width(codePoint);
            if (bytes + width > byteOffset) {
                return index;
            }
            bytes += width;
            index += Character.charCount(codePoint);
        }
        return text.length();
    }

    private static int utf8Width(final int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

}
