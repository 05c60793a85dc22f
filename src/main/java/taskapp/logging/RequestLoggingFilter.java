package taskapp.logging;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

/**
 * Records every {@code /tasks} request through {@link RequestLogWriter}.
 *
 * <p>The body is captured while the controller reads it, so the line is written once the
 * request has been handled. CORS preflight requests are not recorded.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

    static final String TASKS_PATH = "/tasks";
    private static final int MAX_PAYLOAD_BYTES = 64 * 1024;

    private final RequestLogWriter writer;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton keeps the injected writer bean")
    public RequestLoggingFilter(final RequestLogWriter writer) {
        this.writer = writer;
    }

    @Override
    protected boolean shouldNotFilter(final HttpServletRequest request) {
        final String path = request.getRequestURI().substring(request.getContextPath().length());
        final boolean tasksPath = path.equals(TASKS_PATH) || path.startsWith(TASKS_PATH + "/");
        return !tasksPath || HttpMethod.OPTIONS.matches(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
            final HttpServletRequest request,
            final HttpServletResponse response,
            final FilterChain filterChain) throws ServletException, IOException {
        final ContentCachingRequestWrapper wrapper =
                new ContentCachingRequestWrapper(request, MAX_PAYLOAD_BYTES);
        try {
            filterChain.doFilter(wrapper, response);
        } finally {
            writer.append(request.getMethod(), request.getRequestURI(), payloadOf(wrapper));
        }
    }

    private static String payloadOf(final ContentCachingRequestWrapper wrapper) {
        final byte[] content = wrapper.getContentAsByteArray();
        if (content.length == 0) {
            return null;
        }
        return new String(content, StandardCharsets.UTF_8);
    }
}
