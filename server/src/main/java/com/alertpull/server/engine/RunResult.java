/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

import com.alertpull.server.policy.TerminationReason;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one streaming pull. {@code results} is {@code null} unless the run was
 * asked to collect.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResult(
        @JsonProperty("subscription") String subscription,
        @JsonProperty("accepted_count") long acceptedCount,
        @JsonProperty("receipts") long receipts,
        @JsonProperty("termination_reason") TerminationReason terminationReason,
        @JsonProperty("elapsed_ms") long elapsedMs,
        @JsonProperty("results") List<Map<String, Object>> results) {

    @JsonIgnore
    public boolean isCollected() { return results != null; }

    public Duration elapsed() { return Duration.ofMillis(elapsedMs); }
}
