package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects the source files of one language below a root.
 *
 * <p>Directories whose name is in the excluded set are not entered (build
 * output, vendored code, VCS metadata). Unreadable directories are skipped
 * without failing the walk. The result is sorted so that every run visits
 * files in the same order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceFileWalker {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceFileWalker.class);

    private final Set<String> extensions;

    private final Set<String> excludedDirs;

    /**
     * Creates a walker.
     *
     * @param theExtensions the accepted file extensions, lower case with
     *        the leading dot (e.g. ".py")
     * @param theExcludedDirs directory names never entered
     */
    public SourceFileWalker(final Set<String> theExtensions,
            final Set<String> theExcludedDirs) {
        Preconditions.require(!theExtensions.isEmpty(),
                "At least one extension is required");
        this.extensions = Set.copyOf(theExtensions);
        this.excludedDirs = Set.copyOf(theExcludedDirs);
    }

    /**
     * Lists the files to analyze.
     *
     * <p>A regular file root yields itself when its extension matches.</p>
     *
     * @param root the directory or file to walk
     * @return the matching files in path order
     * @throws IOException if the root itself cannot be walked
     */
    public List<Path> walk(final Path root) throws IOException {
        Preconditions.requireNonNull(root, "Root is required");

        if (Files.isRegularFile(root)) {
            return matches(root) ? List.of(root) : List.of();
        }

        final List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {

            @Override
            public FileVisitResult preVisitDirectory(final Path dir,
                    final BasicFileAttributes attrs) {
                if (!dir.equals(root) && dir.getFileName() != null
                        && excludedDirs.contains(
                                dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file,
                    final BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && matches(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file,
                    final IOException e) {
                LOG.debug("Skipping unreadable entry {}: {}", file,
                        e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(Path::compareTo);
        return files;
    }

    private boolean matches(final Path file) {
        final String name = file.getFileName().toString()
                .toLowerCase(Locale.ROOT);
        for (final String extension : extensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

}
