package taskapp.api.exception;

/**
 * Thrown when a requested task does not exist.
 *
 * <p>This exception is caught by {@link taskapp.api.GlobalExceptionHandler}
 * and converted to an HTTP 404 Not Found response with a JSON error body.
 *
 * @see taskapp.api.GlobalExceptionHandler
 */
public class ResourceNotFoundException extends RuntimeException {

    /**
     * Creates a new ResourceNotFoundException with the given message.
     *
     * @param message descriptive message indicating which resource was not found
     */
    public ResourceNotFoundException(final String message) {
        super(message);
    }
}
