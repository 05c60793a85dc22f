package taskapp.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.api.exception.TaskConsistencyException;
import taskapp.domain.Task;
import taskapp.domain.TaskChanges;
import taskapp.domain.TaskStatus;
import taskapp.persistence.store.InMemoryTaskStore;
import taskapp.persistence.store.TaskStore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests {@link TaskService} against {@link InMemoryTaskStore} with a fixed clock, so
 * no Spring context or database is needed.
 */
class TaskServiceTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2025-03-01T09:30:15.123456Z"), ZoneOffset.UTC);

    private TaskService service;

    @BeforeEach
    void setUp() {
        service = new TaskService(new InMemoryTaskStore(), CLOCK);
        service.clearAllTasks();
    }

    @Test
    void createTrimsTitleDefaultsStatusAndStampsCreatedAt() {
        final Task task = service.createTask(" Buy milk ", null);

        assertThat(task.title()).isEqualTo("Buy milk");
        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.createdAt()).isEqualTo("2025-03-01T09:30:15.123456");
    }

    @Test
    void createdAtIsTruncatedToMicroseconds() {
        final Clock nanosClock =
                Clock.fixed(Instant.parse("2025-03-01T09:30:15.123456789Z"), ZoneOffset.UTC);
        final TaskService nanosService = new TaskService(new InMemoryTaskStore(), nanosClock);

        assertThat(nanosService.createTask("Precise", null).createdAt())
                .isEqualTo("2025-03-01T09:30:15.123456");
    }

    @Test
    void createAssignsStrictlyIncreasingIds() {
        final long first = service.createTask("one", null).taskId();
        final long second = service.createTask("two", TaskStatus.DONE).taskId();
        service.deleteTask(second);
        final long third = service.createTask("three", null).taskId();

        assertThat(second).isGreaterThan(first);
        assertThat(third).isGreaterThan(second);
    }

    @Test
    void createRejectsBlankTitle() {
        assertThatThrownBy(() -> service.createTask("   ", TaskStatus.DONE))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Task title must be a non-empty string");
        assertThat(service.getAllTasks()).isEmpty();
    }

    @Test
    void createFailsWhenRowCannotBeReadBack() {
        final TaskStore store = mock(TaskStore.class);
        when(store.insert(anyString(), any(TaskStatus.class), anyString())).thenReturn(5L);
        when(store.findById(5L)).thenReturn(Optional.empty());
        final TaskService brokenService = new TaskService(store, CLOCK);

        assertThatThrownBy(() -> brokenService.createTask("Title", null))
                .isInstanceOf(TaskConsistencyException.class)
                .hasMessage("Could not fetch new task");
    }

    @Test
    void getAllTasksReturnsInsertionOrder() {
        service.createTask("first", null);
        service.createTask("second", null);

        final List<Task> tasks = service.getAllTasks();

        assertThat(tasks).extracting(Task::title).containsExactly("first", "second");
    }

    @Test
    void getTaskByIdRoundTripsStoredValues() {
        final Task created = service.createTask("Walk dog", TaskStatus.DONE);

        assertThat(service.getTaskById(created.taskId())).contains(created);
        assertThat(service.getTaskById(999_999L)).isEmpty();
    }

    @Test
    void updateAppliesOnlySuppliedFields() {
        final Task created = service.createTask("Walk dog", TaskStatus.PENDING);

        final Task updated = service.updateTask(created.taskId(), new TaskChanges("Walk cat", null));

        assertThat(updated.title()).isEqualTo("Walk cat");
        assertThat(updated.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(updated.createdAt()).isEqualTo(created.createdAt());
        assertThat(updated.taskId()).isEqualTo(created.taskId());
    }

    @Test
    void updateStatusOnly() {
        final Task created = service.createTask("Walk dog", null);

        final Task updated = service.updateTask(created.taskId(), new TaskChanges(null, TaskStatus.DONE));

        assertThat(updated.title()).isEqualTo("Walk dog");
        assertThat(updated.status()).isEqualTo(TaskStatus.DONE);
    }

    @Test
    void updateWithNoChangesNeverTouchesStore() {
        final TaskStore store = mock(TaskStore.class);
        final TaskService isolated = new TaskService(store, CLOCK);

        assertThatThrownBy(() -> isolated.updateTask(1L, TaskChanges.none()))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Nothing to update");
        verifyNoInteractions(store);
    }

    @Test
    void updateMissingTaskThrowsNotFound() {
        assertThatThrownBy(() -> service.updateTask(42L, new TaskChanges("Title", null)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Task not found");
    }

    @Test
    void updateFailsWhenRowCannotBeReadBack() {
        final TaskStore store = mock(TaskStore.class);
        when(store.update(anyLong(), any(TaskChanges.class))).thenReturn(true);
        when(store.findById(3L)).thenReturn(Optional.empty());
        final TaskService brokenService = new TaskService(store, CLOCK);

        assertThatThrownBy(() -> brokenService.updateTask(3L, new TaskChanges("Title", null)))
                .isInstanceOf(TaskConsistencyException.class)
                .hasMessage("Could not fetch updated task");
    }

    @Test
    void deleteIsPermanentAndNotRepeatable() {
        final Task created = service.createTask("Walk dog", null);

        service.deleteTask(created.taskId());

        assertThat(service.getTaskById(created.taskId())).isEmpty();
        assertThatThrownBy(() -> service.deleteTask(created.taskId()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Task not found");
    }
}
