/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.model;

import com.alertpull.common.config.AlertPullProperties;
import com.alertpull.common.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrokerConfigTest {

    @Test
    void readsBrokerNamespace() {
        BrokerConfig config = BrokerConfig.fromProperties(AlertPullProperties.of(Map.of(
                "type", "rabbitmq",
                "uri", "amqp://user:pw@mq:5672/",
                "payload-format", "avro",
                "properties.heartbeat", "15")));

        assertThat(config.getBrokerType()).isEqualTo(BrokerConfig.BrokerType.RABBITMQ);
        assertThat(config.getUri()).isEqualTo("amqp://user:pw@mq:5672/");
        assertThat(config.getExchangeType()).isEqualTo("topic");
        assertThat(config.getPayloadFormat()).isEqualTo("avro");
        assertThat(config.getProperties()).containsEntry("heartbeat", "15");
    }

    @Test
    void topicProjectFallsBackToProject() {
        BrokerConfig config = BrokerConfig.fromProperties(AlertPullProperties.of(Map.of("project-id", "consumer")));

        assertThat(config.getBrokerType()).isEqualTo(BrokerConfig.BrokerType.PUBSUB);
        assertThat(config.resolveTopicProjectId()).isEqualTo("consumer");

        config.setTopicProjectId("publisher");
        assertThat(config.resolveTopicProjectId()).isEqualTo("publisher");
    }

    @Test
    void rejectsUnknownBrokerType() {
        assertThatThrownBy(() -> BrokerConfig.fromProperties(AlertPullProperties.of(Map.of("type", "carrier-pigeon"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("carrier-pigeon");
    }

    @Test
    void resolvesPlaceholdersInBrokerSettings() {
        BrokerConfig config = BrokerConfig.fromProperties(AlertPullProperties.of(Map.of(
                "type", "${alertpull.test.unset.type:rabbitmq}",
                "uri", "${alertpull.test.unset.uri:amqp\\://mq\\:5672/}")));

        assertThat(config.getBrokerType()).isEqualTo(BrokerConfig.BrokerType.RABBITMQ);
        assertThat(config.getUri()).isEqualTo("amqp://mq:5672/");
    }

    @Test
    void unresolvablePlaceholderIsAConfigurationError() {
        assertThatThrownBy(() -> BrokerConfig.fromProperties(AlertPullProperties.of(Map.of(
                "project-id", "${alertpull.test.unset.project}"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("alertpull.test.unset.project");
    }
}
