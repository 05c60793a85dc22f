package taskapp.api.dto;

/**
 * Standard error response format for REST API errors.
 *
 * <p>Returns a consistent JSON structure: {@code {"error": "error description"}}
 *
 * <p>Used by {@link taskapp.api.GlobalExceptionHandler} to wrap
 * all error responses in a uniform format.
 *
 * @param error the error message to display to the client
 */
public record ErrorResponse(String error) {
}
