package co.fanki.lifecyclelint.analysis.domain;

/**
 * The kinds of acquired handles tracked by the resource lifecycle
 * detectors.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ResourceKind {

    /** A file object from open() and its variants. */
    FILE_HANDLE("file_handle",
            "File handle %s opened without context manager or close()"),

    /** A socket object. */
    SOCKET_HANDLE("socket_handle", "Socket %s opened without close()"),

    /** A spawned subprocess. */
    POPEN_HANDLE("popen_handle",
            "subprocess handle %s never waited/terminated"),

    /** A scheduled asyncio task. */
    ASYNCIO_TASK("asyncio_task",
            "asyncio task %s neither awaited nor cancelled"),

    /** A JDBC Statement, PreparedStatement or CallableStatement. */
    STATEMENT_HANDLE("statement_handle", null),

    /** A JDBC ResultSet. */
    RESULTSET_HANDLE("resultset_handle", null);

    private final String tag;

    private final String messageTemplate;

    ResourceKind(final String theTag, final String theMessageTemplate) {
        this.tag = theTag;
        this.messageTemplate = theMessageTemplate;
    }

    /**
     * Returns the tag printed in the kind column of a finding.
     *
     * @return the tag, e.g. "file_handle"
     */
    public String tag() {
        return tag;
    }

    /**
     * Builds the finding message for a leaked resource.
     *
     * <p>Unnamed resources are described by their tag.</p>
     *
     * @param name the variable holding the resource, may be null
     * @return the message, or null for kinds reported without message
     */
    public String describe(final String name) {
        if (messageTemplate == null) {
            return null;
        }
        return String.format(messageTemplate, name != null ? name : tag);
    }

}
