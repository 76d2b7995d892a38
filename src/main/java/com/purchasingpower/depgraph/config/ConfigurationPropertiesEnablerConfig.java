package com.purchasingpower.depgraph.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables all @ConfigurationProperties classes of the service.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link InferenceProperties} - inference engine, cache and auto-inference settings
 *   <li>{@link QueryProperties} - query execution and result cache settings
 *   <li>{@link RealtimeProperties} - polling, connection cap and query timeout
 * </ul>
 *
 * @since 2.0.0
 */
@Configuration
@EnableConfigurationProperties({
    InferenceProperties.class,
    QueryProperties.class,
    RealtimeProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
