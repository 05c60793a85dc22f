package taskapp.api.dto;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonSetter;
import taskapp.domain.TaskStatus;
import taskapp.domain.Validation;

/**
 * Request body for {@code POST /tasks}.
 *
 * <p>Both fields are bound as strings; strict coercion in
 * {@link taskapp.config.JacksonConfig} rejects numbers and booleans before the
 * setters run. The request remembers which keys the client sent, so an omitted
 * {@code task_status} defaults to {@code pending} while an explicit {@code null} is
 * rejected, and a body with no keys at all reads as no data.
 */
public final class TaskCreateRequest {

    private String taskTitle;
    private String taskStatus;
    private boolean statusPresent;
    private boolean anyKeyPresent;

    @JsonSetter("task_title")
    public void setTaskTitle(final String taskTitle) {
        this.taskTitle = taskTitle;
        this.anyKeyPresent = true;
    }

    @JsonSetter("task_status")
    public void setTaskStatus(final String taskStatus) {
        this.taskStatus = taskStatus;
        this.statusPresent = true;
        this.anyKeyPresent = true;
    }

    /** Unknown keys are ignored but still count towards a non-empty body. */
    @JsonAnySetter
    void setOther(final String key, final Object value) {
        this.anyKeyPresent = true;
    }

    public String taskTitle() {
        return taskTitle;
    }

    public String taskStatus() {
        return taskStatus;
    }

    /**
     * @return {@code true} when the JSON object had no keys
     */
    public boolean carriesNoFields() {
        return !anyKeyPresent;
    }

    /**
     * @return the trimmed title
     * @throws IllegalArgumentException if the title is missing or blank
     */
    public String validatedTitle() {
        return Validation.validateTitle(taskTitle);
    }

    /**
     * @return the requested status, or {@link TaskStatus#PENDING} when the key was omitted
     * @throws IllegalArgumentException if the key is present with a null or unknown value
     */
    public TaskStatus validatedStatus() {
        if (!statusPresent) {
            return TaskStatus.PENDING;
        }
        return Validation.validateStatus(taskStatus);
    }
}
