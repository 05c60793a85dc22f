package taskapp.persistence.store;

import java.util.List;
import java.util.Optional;
import taskapp.domain.Task;
import taskapp.domain.TaskChanges;
import taskapp.domain.TaskStatus;

/**
 * Persistence contract for tasks.
 *
 * <p>{@link taskapp.service.TaskService} depends on this interface rather than Spring Data
 * directly so it can run against {@link JpaTaskStore} in the application and
 * {@link InMemoryTaskStore} in plain unit tests.
 *
 * <p>Implementations report store failures as unchecked
 * {@link org.springframework.dao.DataAccessException}s.
 */
public interface TaskStore {

    /**
     * @return every task in id order
     */
    List<Task> findAll();

    /**
     * @param taskId identifier to look up
     * @return the task if present
     */
    Optional<Task> findById(long taskId);

    /**
     * Inserts a new row. Values are expected to be validated already.
     *
     * @param title     trimmed title
     * @param status    initial status
     * @param createdAt creation timestamp
     * @return the identifier assigned by the store
     */
    long insert(String title, TaskStatus status, String createdAt);

    /**
     * Applies the supplied changes to an existing row.
     *
     * @param taskId  row to change
     * @param changes non-empty changes
     * @return {@code true} if the row existed
     */
    boolean update(long taskId, TaskChanges changes);

    /**
     * @param taskId identifier to delete
     * @return {@code true} if something was removed
     */
    boolean deleteById(long taskId);

    /**
     * Utility hook for test isolation.
     */
    void deleteAll();
}
