package taskapp.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.api.exception.TaskConsistencyException;
import taskapp.domain.Task;
import taskapp.domain.TaskChanges;
import taskapp.domain.TaskStatus;
import taskapp.domain.Validation;
import taskapp.persistence.store.TaskStore;

/**
 * Service responsible for listing, creating, reading, updating, and deleting {@link Task}s.
 *
 * <p>Each public method is one transaction, which is the connection scope for the
 * operation; it is released on success and on every failure path. Concurrent updates
 * to the same task are last-write-wins.
 *
 * <p>Store failures are not caught here. They propagate as
 * {@link org.springframework.dao.DataAccessException} and are mapped to 500 by
 * {@link taskapp.api.GlobalExceptionHandler}.
 */
@Service
public class TaskService {

    /** Message shared by every not-found outcome. */
    public static final String NOT_FOUND_MESSAGE = "Task not found";

    /** Message used when an update carries no usable fields. */
    public static final String NOTHING_TO_UPDATE_MESSAGE = "Nothing to update";

    private final TaskStore store;
    private final Clock clock;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton keeps the injected store and clock beans")
    public TaskService(final TaskStore store, final Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * @return every task in insertion order
     */
    @Transactional(readOnly = true)
    public List<Task> getAllTasks() {
        return store.findAll();
    }

    /**
     * Creates a task stamped with the current time and returns it as stored.
     *
     * @param title  raw title, trimmed before insert
     * @param status initial status, {@link TaskStatus#PENDING} when null
     * @return the freshly inserted task
     * @throws IllegalArgumentException if the title is null or blank
     * @throws TaskConsistencyException if the inserted row cannot be read back
     */
    @Transactional
    public Task createTask(final String title, final TaskStatus status) {
        final String normalizedTitle = Validation.validateTitle(title);
        final TaskStatus initialStatus = status == null ? TaskStatus.PENDING : status;

        final long taskId = store.insert(normalizedTitle, initialStatus, now());
        return store.findById(taskId)
                .orElseThrow(() -> new TaskConsistencyException("Could not fetch new task"));
    }

    /**
     * @param taskId id to look up
     * @return the task, or empty if no task has that id
     */
    @Transactional(readOnly = true)
    public Optional<Task> getTaskById(final long taskId) {
        return store.findById(taskId);
    }

    /**
     * Applies the given changes to an existing task.
     *
     * <p>Empty changes are rejected before the store is touched, so an update that
     * carries nothing usable is a 400 even when the id does not exist.
     *
     * @param taskId  id of the task to update
     * @param changes already filtered changes
     * @return the task as stored after the update
     * @throws IllegalArgumentException   if {@code changes} is empty
     * @throws ResourceNotFoundException  if no task has that id
     * @throws TaskConsistencyException   if the updated row cannot be read back
     */
    @Transactional
    public Task updateTask(final long taskId, final TaskChanges changes) {
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException(NOTHING_TO_UPDATE_MESSAGE);
        }
        if (!store.update(taskId, changes)) {
            throw new ResourceNotFoundException(NOT_FOUND_MESSAGE);
        }
        return store.findById(taskId)
                .orElseThrow(() -> new TaskConsistencyException("Could not fetch updated task"));
    }

    /**
     * Permanently deletes a task.
     *
     * @param taskId id to remove
     * @throws ResourceNotFoundException if no task has that id
     */
    @Transactional
    public void deleteTask(final long taskId) {
        if (!store.deleteById(taskId)) {
            throw new ResourceNotFoundException(NOT_FOUND_MESSAGE);
        }
    }

    /**
     * Removes all tasks.
     *
     * <p>Package-private to limit usage to test code within the same package.
     */
    void clearAllTasks() {
        store.deleteAll();
    }

    private String now() {
        return LocalDateTime.now(clock)
                .truncatedTo(ChronoUnit.MICROS)
                .format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
