package co.fanki.lifecyclelint.shared;

/**
 * Base exception for failures that the analyzers report to their caller.
 *
 * <p>Each subclass carries an error code that the command layer uses to
 * pick a process exit status and a log level.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new domain exception with the generic error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, "DOMAIN_ERROR");
    }

    /**
     * Creates a new domain exception with a specific error code.
     *
     * @param message the error message
     * @param theErrorCode the error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception wrapping a lower level failure.
     *
     * @param message the error message
     * @param theErrorCode the error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
