/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

import com.alertpull.messaging.core.StreamingPullTransport;
import com.alertpull.messaging.decode.MessageDecoder;
import com.alertpull.server.metrics.PullMetrics;
import com.alertpull.server.policy.StoppingConditionPolicy;

import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators a {@link StreamingPullController} needs for one subscription.
 */
public record StreamContext(
        StreamingPullTransport transport,
        String subscriptionPath,
        MessageDecoder decoder,
        StoppingConditionPolicy policy,
        PullMetrics metrics,
        Clock clock) {

    public StreamContext {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(subscriptionPath, "subscriptionPath");
        if (decoder == null) decoder = new MessageDecoder();
        if (policy == null) policy = new StoppingConditionPolicy();
        if (metrics == null) metrics = new PullMetrics();
        if (clock == null) clock = Clock.systemUTC();
    }

    public static StreamContext of(StreamingPullTransport transport, String subscriptionPath) {
        return new StreamContext(transport, subscriptionPath, null, null, null, null);
    }
}
