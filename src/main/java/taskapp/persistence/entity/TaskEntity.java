package taskapp.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import taskapp.domain.TaskStatus;
import taskapp.persistence.converter.TaskStatusConverter;

/**
 * JPA entity mapped to the {@code tasks} table.
 *
 * <p>The table itself is created by {@link taskapp.persistence.TaskSchemaInitializer};
 * Hibernate does not manage the schema. {@code created_at} is written on insert and
 * excluded from UPDATE statements.
 */
@Entity
@Table(name = "tasks")
public class TaskEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "task_id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "task_title", nullable = false)
    private String title;

    @Convert(converter = TaskStatusConverter.class)
    @Column(name = "task_status", nullable = false)
    private TaskStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private String createdAt;

    protected TaskEntity() {
        // JPA only
    }

    public TaskEntity(final String title, final TaskStatus status, final String createdAt) {
        this.title = title;
        this.status = status;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(final String title) {
        this.title = title;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(final TaskStatus status) {
        this.status = status;
    }

    public String getCreatedAt() {
        return createdAt;
    }
}
