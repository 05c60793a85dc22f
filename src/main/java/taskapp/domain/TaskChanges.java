package taskapp.domain;

import java.util.Optional;

/**
 * The subset of mutable task fields a client asked to change.
 *
 * <p>Both fields are nullable; null means "leave as is". A non-null title is
 * always trimmed and non-blank.
 *
 * @param title  new title, or null
 * @param status new status, or null
 */
public record TaskChanges(String title, TaskStatus status) {

    public TaskChanges {
        if (title != null) {
            title = Validation.validateTitle(title);
        }
    }

    /**
     * @return changes that touch nothing
     */
    public static TaskChanges none() {
        return new TaskChanges(null, null);
    }

    public Optional<String> newTitle() {
        return Optional.ofNullable(title);
    }

    public Optional<TaskStatus> newStatus() {
        return Optional.ofNullable(status);
    }

    /**
     * @return true when neither field would change
     */
    public boolean isEmpty() {
        return title == null && status == null;
    }
}
