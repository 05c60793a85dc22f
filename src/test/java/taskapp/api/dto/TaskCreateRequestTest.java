package taskapp.api.dto;

import org.junit.jupiter.api.Test;
import taskapp.domain.TaskStatus;
import taskapp.domain.Validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskCreateRequestTest {

    private static TaskCreateRequest request(final String title) {
        final TaskCreateRequest request = new TaskCreateRequest();
        request.setTaskTitle(title);
        return request;
    }

    @Test
    void trimsTitleAndDefaultsStatusWhenOmitted() {
        final TaskCreateRequest request = request(" Buy milk ");

        assertThat(request.validatedTitle()).isEqualTo("Buy milk");
        assertThat(request.validatedStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(request.carriesNoFields()).isFalse();
    }

    @Test
    void rejectsMissingTitle() {
        final TaskCreateRequest request = new TaskCreateRequest();
        request.setTaskStatus("done");

        assertThatThrownBy(request::validatedTitle)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage(Validation.TITLE_MESSAGE);
    }

    @Test
    void rejectsUnknownStatus() {
        final TaskCreateRequest request = request("Title");
        request.setTaskStatus("archived");

        assertThatThrownBy(request::validatedStatus)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage(Validation.STATUS_MESSAGE);
    }

    @Test
    void rejectsExplicitNullStatus() {
        final TaskCreateRequest request = request("Title");
        request.setTaskStatus(null);

        assertThatThrownBy(request::validatedStatus)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage(Validation.STATUS_MESSAGE);
    }

    @Test
    void emptyRequestCarriesNoFields() {
        assertThat(new TaskCreateRequest().carriesNoFields()).isTrue();
    }
}
