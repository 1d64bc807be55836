package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.Preconditions;

import java.nio.file.Path;

/**
 * What a detector is asked to analyze.
 *
 * @param target the project directory or single file to analyze
 * @param structuralFeed the optional line-delimited JSON feed of
 *        precomputed guard matches, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScanRequest(Path target, Path structuralFeed) {

    /** Validates the request on construction. */
    public ScanRequest {
        Preconditions.requireNonNull(target, "Scan target is required");
    }

    /**
     * Creates a request without structural feed.
     *
     * @param target the directory or file to analyze
     * @return the request
     */
    public static ScanRequest of(final Path target) {
        return new ScanRequest(target, null);
    }

    /**
     * Checks whether a structural feed was supplied.
     *
     * @return true if a feed path is present
     */
    public boolean hasStructuralFeed() {
        return structuralFeed != null;
    }

}
