/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.config;

import com.alertpull.common.exception.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigPropertyResolverTest {

    private static final String SYSTEM_KEY = "alertpull.test.resolver.project";

    private final ConfigPropertyResolver resolver = new ConfigPropertyResolver(Map.of(
            "alertpull.broker.project-id", "ztf-consumer",
            "alertpull.broker.host", "mq"));

    @AfterEach
    void clearSystemProperty() {
        System.clearProperty(SYSTEM_KEY);
    }

    @Test
    void plainValuesPassThrough() {
        assertThat(resolver.resolve("amqp://mq:5672/")).isEqualTo("amqp://mq:5672/");
        assertThat(resolver.resolve(null)).isNull();
    }

    @Test
    void resolvesFromConfigurationAndDefaults() {
        assertThat(resolver.resolve("projects/${alertpull.broker.project-id}/subscriptions/ztf"))
                .isEqualTo("projects/ztf-consumer/subscriptions/ztf");
        assertThat(resolver.resolve("amqp://${alertpull.broker.host}:${alertpull.test.unset.port:5672}/"))
                .isEqualTo("amqp://mq:5672/");
    }

    @Test
    void escapedColonsSurviveInDefaults() {
        assertThat(resolver.resolve("${alertpull.test.unset.uri:amqp\\://localhost\\:5672}"))
                .isEqualTo("amqp://localhost:5672");
    }

    @Test
    void systemPropertyWinsOverConfiguration() {
        ConfigPropertyResolver withKey = new ConfigPropertyResolver(Map.of(SYSTEM_KEY, "from-config"));
        System.setProperty(SYSTEM_KEY, "from-jvm");

        assertThat(withKey.resolve("${" + SYSTEM_KEY + "}")).isEqualTo("from-jvm");
    }

    @Test
    void unresolvedPlaceholderWithoutDefaultFails() {
        assertThatThrownBy(() -> resolver.resolve("${alertpull.test.unset.key}"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("alertpull.test.unset.key");
    }
}
