package taskapp.config;

import java.util.Arrays;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Cross-origin configuration for the browser client, which is hosted separately.
 *
 * <p>Allowed origins come from {@code cors.allowed-origins} (comma separated) and
 * default to any origin. Credentials are not allowed, so a wildcard stays valid.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private static final long MAX_AGE_SECONDS = 3_600L;

    private final String[] allowedOrigins;

    public CorsConfig(@Value("${cors.allowed-origins:*}") final String allowedOrigins) {
        this.allowedOrigins = Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toArray(String[]::new);
    }

    @Override
    public void addCorsMappings(final CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(MAX_AGE_SECONDS);
    }
}
