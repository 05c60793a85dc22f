package taskapp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the task tracker API.
 *
 * <p>The {@code tasks} table is created during context startup, before the
 * embedded server starts listening (port 3001 by default).
 */
@SpringBootApplication
public class Application {

    public static void main(final String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
