package co.fanki.lifecyclelint.analysis.domain.python;

import co.fanki.lifecyclelint.shared.DomainException;

/**
 * Thrown when the embedded Python runtime cannot be started or fails
 * outside of a syntax error in the analyzed file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonAstException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param message the failure description
     * @param cause the underlying failure
     */
    public PythonAstException(final String message, final Throwable cause) {
        super(message, "PYTHON_AST", cause);
    }

}
