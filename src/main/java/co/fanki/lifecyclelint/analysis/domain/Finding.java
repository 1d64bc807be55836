package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.Preconditions;
import co.fanki.lifecyclelint.shared.ValueObject;

/**
 * A single defect reported by a detector.
 *
 * <p>Findings are the unit of output: one finding becomes one line on
 * standard output. The column is only known to the text pattern detectors,
 * and the message is absent for detectors whose kind tag is self
 * describing (JDBC handles).</p>
 *
 * @param path the file path relative to the analyzed project root
 * @param line the 1-based line number
 * @param column the 1-based column, or null when not tracked
 * @param kind the kind tag (e.g. "file_handle", "guard_unwrap")
 * @param message the human readable message, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Finding(
        String path,
        int line,
        Integer column,
        String kind,
        String message
) implements ValueObject {

    /** Validates the finding on construction. */
    public Finding {
        Preconditions.requireNonBlank(path, "Finding path is required");
        Preconditions.requirePosition(line, "Finding line must be >= 1");
        if (column != null) {
            Preconditions.requirePosition(column,
                    "Finding column must be >= 1");
        }
        Preconditions.requireNonBlank(kind, "Finding kind is required");
    }

    /**
     * Creates a finding that carries no column.
     *
     * @param path the relative file path
     * @param line the 1-based line number
     * @param kind the kind tag
     * @param message the message, may be null
     * @return the finding
     */
    public static Finding atLine(final String path, final int line,
            final String kind, final String message) {
        return new Finding(path, line, null, kind, message);
    }

    /**
     * Creates a finding at an exact line and column.
     *
     * @param path the relative file path
     * @param position the source position
     * @param kind the kind tag
     * @param message the message
     * @return the finding
     */
    public static Finding at(final String path,
            final SourceLocator.Position position, final String kind,
            final String message) {
        return new Finding(path, position.line(), position.column(),
                kind, message);
    }

}
