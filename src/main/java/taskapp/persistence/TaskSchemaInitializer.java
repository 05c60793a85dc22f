package taskapp.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the {@code tasks} table on startup if it does not exist yet.
 *
 * <p>Runs while the application context is refreshed, so the embedded server only
 * starts accepting requests once the table is in place. A failure here propagates
 * and aborts startup. Safe to run against an existing database.
 */
@Component
public class TaskSchemaInitializer implements InitializingBean {

    private static final Logger LOG = LoggerFactory.getLogger(TaskSchemaInitializer.class);

    static final String CREATE_TASKS_TABLE = """
            CREATE TABLE IF NOT EXISTS tasks (
                task_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                task_title CHARACTER VARYING NOT NULL CHECK (TRIM(task_title) <> ''),
                task_status VARCHAR(16) NOT NULL CHECK (task_status IN ('pending', 'done')),
                created_at VARCHAR(64) NOT NULL
            )
            """;

    private final JdbcTemplate jdbcTemplate;

    public TaskSchemaInitializer(final JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void afterPropertiesSet() {
        initializeSchema();
    }

    /**
     * Ensures the {@code tasks} table exists with its constraints.
     */
    public void initializeSchema() {
        jdbcTemplate.execute(CREATE_TASKS_TABLE);
        LOG.info("Task schema ready");
    }
}
