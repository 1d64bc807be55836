package co.fanki.lifecyclelint.analysis.application;

import co.fanki.lifecyclelint.shared.DomainException;

/**
 * Thrown when the command line cannot be understood.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class UsageException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param message what was wrong with the arguments
     */
    public UsageException(final String message) {
        super(message, "USAGE");
    }

}
