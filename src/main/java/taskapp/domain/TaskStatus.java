package taskapp.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle states a {@link Task} can be in.
 *
 * <p>The wire and column representation is the lowercase {@link #value()}; values
 * are matched exactly, so {@code "Done"} or {@code " done"} are not recognized.
 */
public enum TaskStatus {
    PENDING("pending"),
    DONE("done");

    private final String value;

    TaskStatus(final String value) {
        this.value = value;
    }

    /**
     * @return the lowercase representation used in JSON and in the {@code tasks} table
     */
    public String value() {
        return value;
    }

    /**
     * Looks up a status by its exact wire value.
     *
     * @param value candidate value, may be null
     * @return the matching status, or empty when the value is not recognized
     */
    public static Optional<TaskStatus> fromValue(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst();
    }

    @Override
    public String toString() {
        return value;
    }
}
