package taskapp.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides an application-wide {@link Clock} bean.
 *
 * <p>Used for the {@code created_at} stamp of new tasks and for the timestamps in the
 * request log. Tests replace it with a fixed clock.
 *
 * <p>Set the timezone in application.yml:
 * <pre>
 * app:
 *   timezone: Europe/Berlin
 * </pre>
 *
 * <p>If not specified, defaults to the JVM's system default zone.
 */
@Configuration
public class ClockConfig {

    /**
     * Creates a Clock bean in the configured timezone.
     *
     * @param timezone the IANA timezone ID (e.g., "America/New_York", "UTC"), blank for system default
     * @return a Clock in the configured timezone
     */
    @Bean
    public Clock clock(@Value("${app.timezone:}") final String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(timezone));
    }
}
