package taskapp.persistence.mapper;

import org.springframework.stereotype.Component;
import taskapp.domain.Task;
import taskapp.domain.TaskChanges;
import taskapp.persistence.entity.TaskEntity;

/**
 * Converts between {@link TaskEntity} rows and {@link Task} records.
 */
@Component
public class TaskMapper {

    /**
     * Builds a fixed-shape {@link Task} from a stored row.
     *
     * @param entity stored row, may be null
     * @return the task, or null when no row was given
     */
    public Task toDomain(final TaskEntity entity) {
        if (entity == null) {
            return null;
        }
        return new Task(entity.getId(), entity.getTitle(), entity.getStatus(), entity.getCreatedAt());
    }

    /**
     * Applies only the fields present in {@code changes}; id and createdAt are never touched.
     *
     * @param entity  managed row to modify
     * @param changes filtered changes
     */
    public void updateEntity(final TaskEntity entity, final TaskChanges changes) {
        changes.newTitle().ifPresent(entity::setTitle);
        changes.newStatus().ifPresent(entity::setStatus);
    }
}
