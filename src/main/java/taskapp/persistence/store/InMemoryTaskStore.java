package taskapp.persistence.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import taskapp.domain.Task;
import taskapp.domain.TaskChanges;
import taskapp.domain.TaskStatus;

/**
 * In-memory {@link TaskStore} for callers that run outside Spring, mainly unit tests.
 *
 * <p>Ids come from a counter that is never reset by deletes, matching the
 * identity column of the real table.
 */
public class InMemoryTaskStore implements TaskStore {

    private final Map<Long, Task> database = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public List<Task> findAll() {
        return new ArrayList<>(database.values());
    }

    @Override
    public Optional<Task> findById(final long taskId) {
        return Optional.ofNullable(database.get(taskId));
    }

    @Override
    public long insert(final String title, final TaskStatus status, final String createdAt) {
        final long id = sequence.incrementAndGet();
        database.put(id, new Task(id, title, status, createdAt));
        return id;
    }

    @Override
    public boolean update(final long taskId, final TaskChanges changes) {
        // computeIfPresent is atomic: lookup + replace happen as one operation
        return database.computeIfPresent(taskId, (key, task) -> new Task(
                task.taskId(),
                changes.newTitle().orElse(task.title()),
                changes.newStatus().orElse(task.status()),
                task.createdAt())) != null;
    }

    @Override
    public boolean deleteById(final long taskId) {
        return database.remove(taskId) != null;
    }

    @Override
    public void deleteAll() {
        database.clear();
    }
}
