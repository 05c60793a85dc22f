package taskapp.logging;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class RequestLogWriterTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2025-03-01T09:30:15.123456Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void formatLineUsesNoneForMissingPayload() {
        final String line = RequestLogWriter.formatLine(
                LocalDateTime.of(2025, 3, 1, 9, 30, 15, 123_456_000), "GET", "/tasks", null);

        assertThat(line).isEqualTo("[2025-03-01 09:30:15.123456] GET /tasks | Data: None"
                + System.lineSeparator());
    }

    @Test
    void formatLineFoldsMultilinePayload() {
        final String line = RequestLogWriter.formatLine(
                LocalDateTime.of(2025, 3, 1, 9, 30), "POST", "/tasks", "{\n  \"task_title\": \"x\"\n}\n");

        assertThat(line).isEqualTo("[2025-03-01 09:30:00.000000] POST /tasks | Data: {"
                + " \"task_title\": \"x\" }" + System.lineSeparator());
    }

    @Test
    void appendCreatesFileAndAppendsLines() throws IOException {
        final Path file = tempDir.resolve("logs").resolve("api_logs.txt");
        final RequestLogWriter writer = new RequestLogWriter(file.toString(), CLOCK);

        assertThat(writer.append("GET", "/tasks", null)).isTrue();
        assertThat(writer.append("PUT", "/tasks/1", "{\"task_status\":\"done\"}")).isTrue();

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).containsExactly(
                "[2025-03-01 09:30:15.123456] GET /tasks | Data: None",
                "[2025-03-01 09:30:15.123456] PUT /tasks/1 | Data: {\"task_status\":\"done\"}");
    }

    @Test
    void appendReportsFailureWithoutThrowing() {
        // a directory cannot be opened for appending
        final RequestLogWriter writer = new RequestLogWriter(tempDir.toString(), CLOCK);

        assertThat(writer.append("DELETE", "/tasks/1", null)).isFalse();
    }

    @Test
    void concurrentAppendsKeepOneLinePerRequest() throws Exception {
        final Path file = tempDir.resolve("api_logs.txt");
        final RequestLogWriter writer = new RequestLogWriter(file.toString(), CLOCK);
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            final List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                final String endpoint = "/tasks/" + i;
                results.add(executor.submit(() -> writer.append("GET", endpoint, null)));
            }
            for (final Future<Boolean> result : results) {
                assertThat(result.get()).isTrue();
            }
        } finally {
            executor.shutdownNow();
        }

        final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(200);
        assertThat(lines).allMatch(line -> line.matches("\\[[^]]+] GET /tasks/\\d+ \\| Data: None"));
    }
}
