package co.fanki.callgraphmcp.callgraph.domain;

import co.fanki.callgraphmcp.shared.DomainException;

/**
 * Raised when a {@link SourceExtractor} cannot run at all, for example
 * because its native grammar failed to load.
 *
 * <p>Finding no functions is not this error: that is a successful
 * extraction with an empty result.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ParseUnavailableException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param message the error message
     * @param cause the underlying failure
     */
    public ParseUnavailableException(final String message,
            final Throwable cause) {
        super(message, PARSE_UNAVAILABLE, cause);
    }

}
