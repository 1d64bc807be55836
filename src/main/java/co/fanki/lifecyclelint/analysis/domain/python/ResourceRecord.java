package co.fanki.lifecyclelint.analysis.domain.python;

import co.fanki.lifecyclelint.analysis.domain.ResourceKind;
import co.fanki.lifecyclelint.shared.Preconditions;
import co.fanki.lifecyclelint.shared.ValueObject;

/**
 * One acquisition of a resource in a Python module.
 *
 * @param name the variable the resource was bound to, null if discarded
 * @param kind the kind of resource
 * @param line the line of the acquiring call
 * @param released whether a release event was seen
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ResourceRecord(
        String name,
        ResourceKind kind,
        int line,
        boolean released
) implements ValueObject {

    /** Validates the record on construction. */
    public ResourceRecord {
        Preconditions.requireNonNull(kind, "Resource kind is required");
        Preconditions.requirePosition(line, "Record line must be >= 1");
    }

    /**
     * Creates a record for a fresh, not yet released acquisition.
     *
     * @param name the bound name, may be null
     * @param kind the resource kind
     * @param line the line of the acquiring call
     * @return the open record
     */
    public static ResourceRecord acquired(final String name,
            final ResourceKind kind, final int line) {
        return new ResourceRecord(name, kind, line, false);
    }

    /**
     * Returns this record marked as released.
     *
     * @return the released copy
     */
    public ResourceRecord release() {
        return new ResourceRecord(name, kind, line, true);
    }

}
