package co.fanki.callgraphmcp.shared;

/**
 * Argument validation helpers shared by the graph model and the services.
 *
 * <p>Violations raise {@link IllegalArgumentException}; the application
 * layer translates them into {@link DomainException#INVALID_ARGUMENT}
 * before they reach an agent.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a string is a usable function identifier.
     *
     * <p>Unlike {@link #requireNonBlank}, the failure is reported as a
     * {@link DomainException} with the {@code INVALID_ARGUMENT} code, since
     * identifiers come straight from agent requests.</p>
     *
     * @param functionName the identifier to check
     * @return the identifier with surrounding whitespace removed
     * @throws DomainException if the identifier is null or blank
     */
    public static String requireFunctionName(final String functionName) {
        if (functionName == null || functionName.isBlank()) {
            throw DomainException.invalidArgument(
                    "Function name is required and must not be blank");
        }
        return functionName.strip();
    }

}
