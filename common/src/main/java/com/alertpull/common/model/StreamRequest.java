/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Parameters of one bounded pull, as submitted by a caller.
 *
 * <p>At least one of {@code max_results} and {@code timeout_seconds} must be set.
 * {@code max_backlog} defaults to 1000 and is clamped to {@code max_results}.
 * When {@code filter_threshold} is set, records whose {@code filter_field} is below it
 * ({@code filter_direction = "lt"}) or at/above it ({@code "gt"}) are kept and the rest
 * are acknowledged without being counted.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamRequest {

    @JsonProperty("subscription_name")
    private String subscriptionName;

    @JsonProperty("topic")
    private String topic;

    @JsonProperty("max_results")
    private Integer maxResults;

    @JsonProperty("timeout_seconds")
    private Integer timeoutSeconds;

    @JsonProperty("max_backlog")
    private Integer maxBacklog;

    @JsonProperty("lighten")
    private boolean lighten = true;

    @JsonProperty("save_metadata")
    private boolean saveMetadata = true;

    @JsonProperty("filter_field")
    private String filterField = "classtar";

    @JsonProperty("filter_threshold")
    private Double filterThreshold;

    @JsonProperty("filter_direction")
    private String filterDirection = "lt";

    public StreamRequest() {}

    public String getSubscriptionName() { return subscriptionName; }
    public void setSubscriptionName(String subscriptionName) { this.subscriptionName = subscriptionName; }
    public String getTopic() { return topic; }
    public void setTopic(String topic) { this.topic = topic; }
    public Integer getMaxResults() { return maxResults; }
    public void setMaxResults(Integer maxResults) { this.maxResults = maxResults; }
    public Integer getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(Integer timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public Integer getMaxBacklog() { return maxBacklog; }
    public void setMaxBacklog(Integer maxBacklog) { this.maxBacklog = maxBacklog; }
    public boolean isLighten() { return lighten; }
    public void setLighten(boolean lighten) { this.lighten = lighten; }
    public boolean isSaveMetadata() { return saveMetadata; }
    public void setSaveMetadata(boolean saveMetadata) { this.saveMetadata = saveMetadata; }
    public String getFilterField() { return filterField; }
    public void setFilterField(String filterField) { this.filterField = filterField; }
    public Double getFilterThreshold() { return filterThreshold; }
    public void setFilterThreshold(Double filterThreshold) { this.filterThreshold = filterThreshold; }
    public String getFilterDirection() { return filterDirection; }
    public void setFilterDirection(String filterDirection) { this.filterDirection = filterDirection; }
}
