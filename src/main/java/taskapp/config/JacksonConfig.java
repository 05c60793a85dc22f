package taskapp.config;

import org.springframework.boot.jackson.autoconfigure.JsonMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.cfg.CoercionAction;
import tools.jackson.databind.cfg.CoercionInputShape;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.type.LogicalType;

/**
 * Jackson configuration to enforce strict type checking.
 *
 * <p>By default, Jackson coerces scalars to strings, so {@code {"task_title": 42}} would
 * create a task titled {@code "42"}. This configuration makes such payloads fail to
 * bind, which the API reports as a 400.
 *
 * <p>Update requests bind their fields as untyped values and are not affected.
 *
 * @see <a href="https://github.com/FasterXML/jackson-databind/issues/3013">Jackson coercion config</a>
 */
@Configuration
public class JacksonConfig {

    /**
     * Customizes Jackson 3 JsonMapper to reject type coercion for string fields.
     *
     * @return customizer for the JsonMapper builder
     */
    @Bean
    public JsonMapperBuilderCustomizer strictCoercionCustomizer() {
        return builder -> configureStrictCoercion(builder);
    }

    private void configureStrictCoercion(final JsonMapper.Builder builder) {
        builder.withCoercionConfig(LogicalType.Textual, config -> {
            config.setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
            config.setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
            config.setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        });
    }
}
