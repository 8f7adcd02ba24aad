package co.fanki.callgraphmcp.shared;

/**
 * Base exception for errors surfaced to the interface layer.
 *
 * <p>Every domain exception carries an error code that the MCP tools and
 * the REST controller expose verbatim, so agents can tell a malformed
 * request apart from an extractor that could not run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** A request argument was null, blank or otherwise malformed. */
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    /** The source extraction collaborator could not run at all. */
    public static final String PARSE_UNAVAILABLE = "PARSE_UNAVAILABLE";

    /** The sources to analyze could not be read from disk. */
    public static final String SOURCE_UNREADABLE = "SOURCE_UNREADABLE";

    private final String errorCode;

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates an {@link #INVALID_ARGUMENT} exception.
     *
     * @param message the error message
     * @return the exception, ready to be thrown
     */
    public static DomainException invalidArgument(final String message) {
        return new DomainException(message, INVALID_ARGUMENT);
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
