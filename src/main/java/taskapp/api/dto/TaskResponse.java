package taskapp.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;
import taskapp.domain.Task;

/**
 * Response DTO for Task data returned by the API.
 *
 * <p>Serialized with the column names of the {@code tasks} table as keys, always in
 * column order.
 *
 * @param taskId    the task's unique identifier
 * @param taskTitle the trimmed title
 * @param taskStatus {@code pending} or {@code done}
 * @param createdAt ISO-8601 creation timestamp
 */
@JsonPropertyOrder({"task_id", "task_title", "task_status", "created_at"})
public record TaskResponse(
        @JsonProperty("task_id") long taskId,
        @JsonProperty("task_title") String taskTitle,
        @JsonProperty("task_status") String taskStatus,
        @JsonProperty("created_at") String createdAt
) {
    /**
     * Creates a TaskResponse from a Task domain object.
     *
     * @param task the domain object to convert (must not be null)
     * @return a new TaskResponse with the task's data
     * @throws NullPointerException if task is null
     */
    public static TaskResponse from(final Task task) {
        Objects.requireNonNull(task, "task must not be null");
        return new TaskResponse(
                task.taskId(),
                task.title(),
                task.status().value(),
                task.createdAt()
        );
    }
}
