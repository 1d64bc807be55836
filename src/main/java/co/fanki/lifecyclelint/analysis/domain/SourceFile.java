package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.Preconditions;

import java.nio.file.Path;

/**
 * A source file read from the analyzed tree.
 *
 * @param path the absolute path of the file
 * @param displayPath the path printed in findings, relative to the root
 * @param text the decoded file content
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceFile(Path path, String displayPath, String text) {

    /** Validates the source file on construction. */
    public SourceFile {
        Preconditions.requireNonNull(path, "File path is required");
        Preconditions.requireNonBlank(displayPath, "Display path is required");
        Preconditions.requireNonNull(text, "File text is required");
    }

    /**
     * Computes the path printed for a file below the project root.
     *
     * <p>Files outside the root keep their full path. Separators are
     * always forward slashes.</p>
     *
     * @param projectRoot the analyzed project root
     * @param file the file
     * @return the display path
     */
    public static String displayPath(final Path projectRoot, final Path file) {
        final Path normalized = file.toAbsolutePath().normalize();
        final Path shown = normalized.startsWith(projectRoot)
                ? projectRoot.relativize(normalized)
                : normalized;
        return shown.toString().replace('\\', '/');
    }

}
