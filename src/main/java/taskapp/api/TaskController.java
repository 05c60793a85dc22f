package taskapp.api;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import taskapp.api.dto.ErrorResponse;
import taskapp.api.dto.TaskCreateRequest;
import taskapp.api.dto.TaskResponse;
import taskapp.api.dto.TaskUpdateRequest;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.domain.TaskStatus;
import taskapp.service.TaskService;

/**
 * REST controller for task CRUD operations.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>GET /tasks - List all tasks (200 OK)</li>
 *   <li>POST /tasks - Create a task (201 Created)</li>
 *   <li>GET /tasks/{id} - Get one task (200 OK / 404 Not Found)</li>
 *   <li>PUT /tasks/{id} - Update title and/or status (200 OK / 400 / 404)</li>
 *   <li>DELETE /tasks/{id} - Delete a task (204 No Content / 404 Not Found)</li>
 * </ul>
 *
 * <p>Request bodies are optional at the binding level so a missing body yields the
 * same 400 message as a JSON {@code null}. Errors are rendered by
 * {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping(value = "/tasks", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Tasks", description = "Task CRUD operations")
public class TaskController {

    private final TaskService taskService;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton keeps the injected service bean")
    public TaskController(final TaskService taskService) {
        this.taskService = taskService;
    }

    @Operation(summary = "List all tasks")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "All tasks, possibly empty"),
            @ApiResponse(responseCode = "500", description = "Store failure",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping
    public List<TaskResponse> getAll() {
        return taskService.getAllTasks().stream()
                .map(TaskResponse::from)
                .toList();
    }

    @Operation(summary = "Create a task")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Task created"),
            @ApiResponse(responseCode = "400", description = "Missing body, blank title or unknown status",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "500", description = "Store failure",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public TaskResponse create(@RequestBody(required = false) final TaskCreateRequest request) {
        if (request == null || request.carriesNoFields()) {
            throw new IllegalArgumentException(GlobalExceptionHandler.NO_BODY_MESSAGE);
        }
        final String title = request.validatedTitle();
        final TaskStatus status = request.validatedStatus();
        return TaskResponse.from(taskService.createTask(title, status));
    }

    @Operation(summary = "Get a task by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task found"),
            @ApiResponse(responseCode = "404", description = "Task not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{id}")
    public TaskResponse getById(@PathVariable("id") final long id) {
        return taskService.getTaskById(id)
                .map(TaskResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException(TaskService.NOT_FOUND_MESSAGE));
    }

    @Operation(summary = "Update a task's title and/or status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task updated"),
            @ApiResponse(responseCode = "400", description = "Missing body or nothing to update",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "Task not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TaskResponse update(
            @PathVariable("id") final long id,
            @RequestBody(required = false) final TaskUpdateRequest request) {
        if (request == null) {
            throw new IllegalArgumentException(GlobalExceptionHandler.NO_BODY_MESSAGE);
        }
        return TaskResponse.from(taskService.updateTask(id, request.toChanges()));
    }

    @Operation(summary = "Delete a task")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Task deleted"),
            @ApiResponse(responseCode = "404", description = "Task not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") final long id) {
        taskService.deleteTask(id);
    }
}
