package co.fanki.lifecyclelint.analysis.domain;

import co.fanki.lifecyclelint.shared.DomainException;

/**
 * Thrown by a syntax tree front end when a file cannot be parsed.
 *
 * <p>The detector template catches it, warns and moves on to the next
 * file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class UnparsableSourceException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param message the parser's description of the syntax error
     */
    public UnparsableSourceException(final String message) {
        super(message, "UNPARSABLE_SOURCE");
    }

}
