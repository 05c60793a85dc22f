package taskapp.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedRuntimeException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import taskapp.api.dto.ErrorResponse;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.api.exception.TaskConsistencyException;
import taskapp.service.TaskService;

/**
 * Maps exceptions to HTTP responses with the {@code {"error": "..."}} body.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} and unreadable bodies: 400</li>
 *   <li>{@link ResourceNotFoundException} and non-numeric ids: 404</li>
 *   <li>{@link DataAccessException}, {@link TransactionException}: 500 {@code DB issue: ...}</li>
 *   <li>{@link TaskConsistencyException}: 500</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String INVALID_BODY_MESSAGE = "Invalid JSON payload";
    static final String NO_BODY_MESSAGE = "No JSON data provided";
    static final String STORE_ERROR_PREFIX = "DB issue: ";

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(final IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(final HttpMessageNotReadableException ex) {
        LOG.debug("Rejected unreadable request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, INVALID_BODY_MESSAGE);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedMediaType(
            final HttpMediaTypeNotSupportedException ex) {
        return respond(HttpStatus.BAD_REQUEST, NO_BODY_MESSAGE);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(final ResourceNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    /**
     * An id that is not a number can never match a task, so it is reported as not found.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(final MethodArgumentTypeMismatchException ex) {
        return respond(HttpStatus.NOT_FOUND, TaskService.NOT_FOUND_MESSAGE);
    }

    @ExceptionHandler(TaskConsistencyException.class)
    public ResponseEntity<ErrorResponse> handleConsistency(final TaskConsistencyException ex) {
        LOG.error("Task store returned no row after a successful write: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(final DataAccessException ex) {
        return storeFailure(ex);
    }

    @ExceptionHandler(TransactionException.class)
    public ResponseEntity<ErrorResponse> handleTransaction(final TransactionException ex) {
        return storeFailure(ex);
    }

    private ResponseEntity<ErrorResponse> storeFailure(final NestedRuntimeException ex) {
        LOG.error("Task store operation failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                STORE_ERROR_PREFIX + ex.getMostSpecificCause().getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(final HttpStatus status, final String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(message));
    }
}
