package taskapp.logging;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Appends one line per API request to a plain text file.
 *
 * <p>Line format: {@code [<timestamp>] <METHOD> <path> | Data: <payload-or-None>}.
 *
 * <p>Appends are serialized on this instance so lines from concurrent requests never
 * interleave. Write failures are reported through SLF4J and never thrown, so a broken
 * log file cannot fail a request.
 */
@Component
public class RequestLogWriter {

    private static final Logger LOG = LoggerFactory.getLogger(RequestLogWriter.class);

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
    static final String NO_PAYLOAD = "None";

    private final Path logFile;
    private final Clock clock;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Clock is an immutable Spring-managed bean")
    public RequestLogWriter(
            @Value("${app.request-log.path:api_logs.txt}") final String logFile,
            final Clock clock) {
        this.logFile = Paths.get(logFile);
        this.clock = clock;
    }

    public Path getLogFile() {
        return logFile;
    }

    /**
     * Appends a line for one request.
     *
     * @param method   HTTP method name
     * @param endpoint request path
     * @param payload  raw request body, or null when there was none
     * @return {@code true} if the line was written
     */
    public synchronized boolean append(final String method, final String endpoint, final String payload) {
        final String line = formatLine(LocalDateTime.now(clock), method, endpoint, payload);
        try {
            final Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            return true;
        } catch (IOException | SecurityException ex) {
            LOG.warn("Could not append request log line to {}: {}", logFile, ex.toString());
            return false;
        }
    }

    /**
     * Builds a log line, newline included. Payload line breaks are folded into single
     * spaces so every request stays on one line.
     */
    static String formatLine(
            final LocalDateTime timestamp,
            final String method,
            final String endpoint,
            final String payload) {
        final String data = (payload == null || payload.isBlank())
                ? NO_PAYLOAD
                : payload.strip().replaceAll("\\s*\\R\\s*", " ");
        return "[" + TIMESTAMP_FORMAT.format(timestamp) + "] " + method + " " + endpoint
                + " | Data: " + data + System.lineSeparator();
    }
}
