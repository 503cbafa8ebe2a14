/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.model;

import com.alertpull.common.config.AlertPullProperties;
import com.alertpull.common.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Map;

/**
 * Connection settings for the broker a stream pulls from (Google Pub/Sub or RabbitMQ).
 *
 * <p>For Pub/Sub, {@code project_id} owns the subscriptions and {@code topic_project_id}
 * publishes the topics they bind to (defaults to the same project). For RabbitMQ the
 * {@code uri} locates the broker and {@code exchange_type} is used when binding queues.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrokerConfig {

    @JsonProperty("broker_type")
    private BrokerType brokerType = BrokerType.PUBSUB;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("topic_project_id")
    private String topicProjectId;

    @JsonProperty("credentials_file")
    private String credentialsFile;

    @JsonProperty("emulator_host")
    private String emulatorHost;

    @JsonProperty("uri")
    private String uri;

    @JsonProperty("exchange_type")
    private String exchangeType = "topic";

    @JsonProperty("payload_format")
    private String payloadFormat = "json";

    @JsonProperty("properties")
    private Map<String, String> properties;

    public enum BrokerType {
        PUBSUB, RABBITMQ
    }

    public BrokerConfig() {}

    /**
     * Build from {@code alertpull.broker.*}-style keys with the prefix already stripped:
     * {@code type}, {@code project-id}, {@code topic-project-id}, {@code credentials-file},
     * {@code emulator-host}, {@code uri}, {@code exchange-type}, {@code payload-format}.
     */
    public static BrokerConfig fromProperties(AlertPullProperties props) {
        BrokerConfig config = new BrokerConfig();
        String type = props.getString("type", BrokerType.PUBSUB.name());
        try {
            config.setBrokerType(BrokerType.valueOf(type.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown broker type '" + type + "'", e);
        }
        config.setProjectId(props.getString("project-id"));
        config.setTopicProjectId(props.getString("topic-project-id"));
        config.setCredentialsFile(props.getString("credentials-file"));
        config.setEmulatorHost(props.getString("emulator-host"));
        config.setUri(props.getString("uri"));
        config.setExchangeType(props.getString("exchange-type", "topic"));
        config.setPayloadFormat(props.getString("payload-format", "json"));
        config.setProperties(props.getSubProperties("properties."));
        return config;
    }

    /** Project that publishes topics; falls back to the subscription project. */
    public String resolveTopicProjectId() {
        return topicProjectId != null && !topicProjectId.isBlank() ? topicProjectId : projectId;
    }

    public BrokerType getBrokerType() { return brokerType; }
    public void setBrokerType(BrokerType brokerType) { this.brokerType = brokerType; }
    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }
    public String getTopicProjectId() { return topicProjectId; }
    public void setTopicProjectId(String topicProjectId) { this.topicProjectId = topicProjectId; }
    public String getCredentialsFile() { return credentialsFile; }
    public void setCredentialsFile(String credentialsFile) { this.credentialsFile = credentialsFile; }
    public String getEmulatorHost() { return emulatorHost; }
    public void setEmulatorHost(String emulatorHost) { this.emulatorHost = emulatorHost; }
    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getExchangeType() { return exchangeType; }
    public void setExchangeType(String exchangeType) { this.exchangeType = exchangeType; }
    public String getPayloadFormat() { return payloadFormat; }
    public void setPayloadFormat(String payloadFormat) { this.payloadFormat = payloadFormat; }
    public Map<String, String> getProperties() { return properties; }
    public void setProperties(Map<String, String> properties) { this.properties = properties; }
}
