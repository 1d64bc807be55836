package co.fanki.lifecyclelint.analysis.domain.python;

import co.fanki.lifecyclelint.shared.Preconditions;
import co.fanki.lifecyclelint.shared.ValueObject;

/**
 * The resolved (owner, attribute) pair identifying which API a call
 * expression invokes, e.g. {@code ("subprocess", "Popen")}.
 *
 * @param owner the owning module or dotted receiver, null for a bare
 *        builtin name
 * @param attribute the called attribute or function name
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CallSignature(String owner, String attribute)
        implements ValueObject {

    /** Validates the signature on construction. */
    public CallSignature {
        Preconditions.requireNonNull(attribute, "Attribute is required");
    }

    /**
     * Creates the signature of a call to an unqualified name.
     *
     * @param attribute the function name
     * @return the signature with no owner
     */
    public static CallSignature bare(final String attribute) {
        return new CallSignature(null, attribute);
    }

}
