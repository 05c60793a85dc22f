package taskapp.persistence.store;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import taskapp.domain.Task;
import taskapp.domain.TaskChanges;
import taskapp.domain.TaskStatus;
import taskapp.persistence.entity.TaskEntity;
import taskapp.persistence.mapper.TaskMapper;
import taskapp.persistence.repository.TaskRepository;

/**
 * JPA-backed {@link TaskStore}.
 *
 * <p>Writes are flushed immediately so constraint violations surface inside the
 * calling operation instead of at commit time.
 */
@Component
public class JpaTaskStore implements TaskStore {

    private static final Sort BY_ID = Sort.by(Sort.Direction.ASC, "id");

    private final TaskRepository repository;
    private final TaskMapper mapper;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores repository and mapper references; "
                    + "these are framework-managed beans with controlled lifecycle")
    public JpaTaskStore(final TaskRepository repository, final TaskMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Task> findAll() {
        return repository.findAll(BY_ID).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Task> findById(final long taskId) {
        return repository.findById(taskId).map(mapper::toDomain);
    }

    @Override
    @Transactional
    public long insert(final String title, final TaskStatus status, final String createdAt) {
        final TaskEntity saved = repository.saveAndFlush(new TaskEntity(title, status, createdAt));
        return saved.getId();
    }

    @Override
    @Transactional
    public boolean update(final long taskId, final TaskChanges changes) {
        final Optional<TaskEntity> existing = repository.findById(taskId);
        if (existing.isEmpty()) {
            return false;
        }
        final TaskEntity entity = existing.get();
        mapper.updateEntity(entity, changes);
        repository.saveAndFlush(entity);
        return true;
    }

    @Override
    @Transactional
    public boolean deleteById(final long taskId) {
        if (!repository.existsById(taskId)) {
            return false;
        }
        repository.deleteById(taskId);
        repository.flush();
        return true;
    }

    @Override
    @Transactional
    public void deleteAll() {
        repository.deleteAllInBatch();
    }
}
