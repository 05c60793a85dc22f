package taskapp.domain;

/**
 * Shared validation helpers for task values.
 *
 * <p>Every helper throws {@link IllegalArgumentException} so the API layer can turn
 * the message straight into a 400 response.
 */
public final class Validation {

    /** Message used whenever a title is missing, not a string, or blank. */
    public static final String TITLE_MESSAGE = "Task title must be a non-empty string";

    /** Message used whenever a status is not one of the known values. */
    public static final String STATUS_MESSAGE = "Status must be pending or done";

    private Validation() {
    }

    /**
     * Validates that the value is non-null and not blank, returning it trimmed.
     *
     * @param value   value to check
     * @param message message for the thrown exception
     * @return the trimmed value
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static String validateNotBlank(final String value, final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value.trim();
    }

    /**
     * Validates and trims a task title.
     *
     * @param title raw title
     * @return the trimmed title
     * @throws IllegalArgumentException if the title is null or blank
     */
    public static String validateTitle(final String title) {
        return validateNotBlank(title, TITLE_MESSAGE);
    }

    /**
     * Parses a status value supplied by a client.
     *
     * @param status raw status
     * @return the parsed status
     * @throws IllegalArgumentException if the value is null or not recognized
     */
    public static TaskStatus validateStatus(final String status) {
        if (status == null) {
            throw new IllegalArgumentException(STATUS_MESSAGE);
        }
        return TaskStatus.fromValue(status)
                .orElseThrow(() -> new IllegalArgumentException(STATUS_MESSAGE));
    }
}
