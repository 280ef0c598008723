package com.purchasingpower.studygraph.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes that are not
 * themselves Spring components.
 *
 * <ul>
 *   <li>{@link GlobalRetryConfig} - retry and backoff settings for external calls</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
