package taskapp.api.exception;

/**
 * Thrown when a write succeeded but the affected row could not be read back.
 *
 * <p>Mapped to HTTP 500 by {@link taskapp.api.GlobalExceptionHandler}.
 */
public class TaskConsistencyException extends RuntimeException {

    public TaskConsistencyException(final String message) {
        super(message);
    }
}
