package taskapp.domain;

/**
 * A persisted task as read back from the store.
 *
 * <p>Enforces the Task invariants:
 * <ul>
 *   <li>taskId: assigned by the store, always positive</li>
 *   <li>title: required, stored trimmed, never blank</li>
 *   <li>status: required, one of {@link TaskStatus}</li>
 *   <li>createdAt: ISO-8601 local date-time string, set once on insert</li>
 * </ul>
 *
 * <p>Instances are immutable; changes go through the store and produce a fresh record.
 *
 * @param taskId    store-assigned identifier
 * @param title     trimmed title
 * @param status    current status
 * @param createdAt creation timestamp as written on insert
 */
public record Task(long taskId, String title, TaskStatus status, String createdAt) {

    public Task {
        if (taskId <= 0) {
            throw new IllegalArgumentException("taskId must be positive");
        }
        title = Validation.validateTitle(title);
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        createdAt = Validation.validateNotBlank(createdAt, "createdAt must not be null or blank");
    }
}
