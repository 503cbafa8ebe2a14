/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.web.config;

import com.alertpull.common.config.AlertPullProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertySource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies Spring's {@link Environment} into an {@link AlertPullProperties} so the
 * non-Spring modules can read {@code alertpull.*} settings.
 *
 * <p>Only enumerable sources (application.properties, YAML, system properties,
 * environment variables) are captured; earlier sources win.</p>
 */
public final class EnvironmentPropertiesBridge {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentPropertiesBridge.class);

    private EnvironmentPropertiesBridge() {}

    public static AlertPullProperties collect(Environment environment) {
        Map<String, String> props = new LinkedHashMap<>();
        if (environment instanceof ConfigurableEnvironment configurable) {
            for (PropertySource<?> source : configurable.getPropertySources()) {
                if (source instanceof EnumerablePropertySource<?> enumerable) {
                    for (String key : enumerable.getPropertyNames()) {
                        if (props.containsKey(key)) continue;
                        try {
                            String resolved = environment.getProperty(key);
                            if (resolved != null) props.put(key, resolved);
                        } catch (IllegalArgumentException e) {
                            log.debug("Skipping unresolvable property {}: {}", key, e.getMessage());
                        }
                    }
                }
            }
        }
        AlertPullProperties properties = AlertPullProperties.of(props);
        log.info("AlertPullProperties initialized with {} properties", properties.size());
        if (log.isDebugEnabled()) {
            props.entrySet().stream()
                    .filter(e -> e.getKey().startsWith("alertpull."))
                    .forEach(e -> log.debug("  {} = {}", e.getKey(), e.getValue()));
        }
        return properties;
    }
}
