package taskapp.persistence.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import taskapp.persistence.entity.TaskEntity;

/**
 * Spring Data repository for {@link TaskEntity}.
 */
@Repository
public interface TaskRepository extends JpaRepository<TaskEntity, Long> {
}
