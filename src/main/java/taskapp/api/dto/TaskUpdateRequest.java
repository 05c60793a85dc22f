package taskapp.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskapp.domain.TaskChanges;
import taskapp.domain.TaskStatus;

/**
 * Request body for {@code PUT /tasks/{id}}.
 *
 * <p>Fields are bound untyped because unusable values are dropped rather than rejected:
 * a title counts only if it is a non-blank string, a status only if it is exactly
 * {@code pending} or {@code done}.
 *
 * @param taskTitle  raw title value, any JSON type
 * @param taskStatus raw status value, any JSON type
 */
public record TaskUpdateRequest(
        @JsonProperty("task_title") Object taskTitle,
        @JsonProperty("task_status") Object taskStatus
) {
    /**
     * Keeps the usable fields and drops the rest.
     *
     * @return filtered changes, possibly empty
     */
    public TaskChanges toChanges() {
        String title = null;
        if (taskTitle instanceof String text && !text.isBlank()) {
            title = text;
        }
        TaskStatus status = null;
        if (taskStatus instanceof String value) {
            status = TaskStatus.fromValue(value).orElse(null);
        }
        return new TaskChanges(title, status);
    }
}
