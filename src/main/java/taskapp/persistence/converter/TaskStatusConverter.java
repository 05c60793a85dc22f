package taskapp.persistence.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import taskapp.domain.TaskStatus;

/**
 * Stores {@link TaskStatus} as its lowercase value so the column satisfies the
 * {@code CHECK (task_status IN ('pending', 'done'))} constraint.
 */
@Converter
public class TaskStatusConverter implements AttributeConverter<TaskStatus, String> {

    @Override
    public String convertToDatabaseColumn(final TaskStatus attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public TaskStatus convertToEntityAttribute(final String dbData) {
        if (dbData == null) {
            return null;
        }
        return TaskStatus.fromValue(dbData)
                .orElseThrow(() -> new IllegalStateException("Unknown task_status in store: " + dbData));
    }
}
