package com.purchasingpower.chemflow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link InferenceProperties} - thresholds, filters and batching for inference runs
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    InferenceProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
