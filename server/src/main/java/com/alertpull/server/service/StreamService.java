/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.service;

import com.alertpull.common.exception.ConfigurationException;
import com.alertpull.common.model.StreamRequest;
import com.alertpull.messaging.core.StreamingPullTransport;
import com.alertpull.messaging.core.Subscription;
import com.alertpull.messaging.decode.FieldSpec;
import com.alertpull.messaging.decode.MessageDecoder;
import com.alertpull.messaging.subscription.SubscriptionManager;
import com.alertpull.server.engine.PipelineHooks;
import com.alertpull.server.engine.ResultSink;
import com.alertpull.server.engine.RunResult;
import com.alertpull.server.engine.StreamContext;
import com.alertpull.server.engine.StreamingPullController;
import com.alertpull.server.filter.ThresholdFilter;
import com.alertpull.server.metrics.PullMetrics;
import com.alertpull.server.policy.StopSettings;
import com.alertpull.server.policy.StoppingConditionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs bounded pulls on behalf of callers: ensures the subscription exists, builds the
 * pipeline from a {@link StreamRequest} and drives a fresh {@link StreamingPullController}.
 */
public class StreamService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamService.class);

    private final StreamingPullTransport transport;
    private final SubscriptionManager subscriptions;
    private final MessageDecoder decoder;
    private final StoppingConditionPolicy policy;
    private final PullMetrics metrics;
    private final StreamDefaults defaults;
    private final Clock clock;
    private final Set<StreamingPullController> active = ConcurrentHashMap.newKeySet();

    public StreamService(StreamingPullTransport transport, SubscriptionManager subscriptions,
                         MessageDecoder decoder, StoppingConditionPolicy policy,
                         PullMetrics metrics, StreamDefaults defaults) {
        this(transport, subscriptions, decoder, policy, metrics, defaults, Clock.systemUTC());
    }

    public StreamService(StreamingPullTransport transport, SubscriptionManager subscriptions,
                         MessageDecoder decoder, StoppingConditionPolicy policy,
                         PullMetrics metrics, StreamDefaults defaults, Clock clock) {
        this.transport = transport;
        this.subscriptions = subscriptions;
        this.decoder = decoder != null ? decoder : new MessageDecoder();
        this.policy = policy != null ? policy : new StoppingConditionPolicy();
        this.metrics = metrics != null ? metrics : new PullMetrics();
        this.defaults = defaults != null ? defaults : StreamDefaults.none();
        this.clock = clock;
    }

    public RunResult fetch(StreamRequest request) {
        return fetch(request, null);
    }

    /**
     * Pull from the request's subscription until a stopping condition holds.
     *
     * @param sink optional consumer of each counted result as it is recorded
     * @throws ConfigurationException on invalid stop settings, a blank subscription name
     *                                or a missing topic; nothing is provisioned or pulled then
     */
    public RunResult fetch(StreamRequest request, ResultSink sink) {
        String name = requireName(request.getSubscriptionName());
        StopSettings settings = stopSettings(request);
        policy.validate(settings);
        ThresholdFilter filter = new ThresholdFilter(request.getFilterField(), request.getFilterThreshold(),
                ThresholdFilter.Direction.parse(request.getFilterDirection()));

        Subscription subscription = ensureSubscription(name, request.getTopic());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("subscription", subscription.name());
        if (subscription.topic() != null) context.put("topic", subscription.topic());
        PipelineHooks hooks = PipelineHooks.builder()
                .fieldSpec(request.isLighten() ? FieldSpec.ALERT_LITE : null)
                .metadataKeys(request.isSaveMetadata() ? defaults.metadataKeys() : null)
                .userCallback(filter.getThreshold() != null ? filter : null)
                .context(context)
                .collect(true)
                .resultSink(sink)
                .build();

        StreamingPullController controller = new StreamingPullController(
                new StreamContext(transport, subscription.path(), decoder, policy, metrics, clock));
        active.add(controller);
        try {
            RunResult result = controller.run(settings, hooks);
            log.info("Fetched {} record(s) from {} ({})", result.acceptedCount(), name, result.terminationReason());
            return result;
        } finally {
            active.remove(controller);
        }
    }

    /** Get or create; {@code topic} {@code null} means the topic of the same name. */
    public Subscription ensureSubscription(String name, String topic) {
        requireName(name);
        return topic != null && !topic.isBlank()
                ? subscriptions.getOrCreate(name, topic)
                : subscriptions.getOrCreate(name);
    }

    public void deleteSubscription(String name) {
        subscriptions.delete(requireName(name));
    }

    public int activeRuns() { return active.size(); }

    /** Stops every pull still running. */
    @Override
    public void close() {
        for (StreamingPullController controller : active) {
            controller.stop();
        }
    }

    private StopSettings stopSettings(StreamRequest request) {
        StopSettings d = defaults.stopSettings();
        Integer maxResults = request.getMaxResults() != null ? request.getMaxResults() : d.maxResults();
        Duration idle = request.getTimeoutSeconds() != null
                ? Duration.ofSeconds(request.getTimeoutSeconds()) : d.idleTimeout();
        Integer backlog = request.getMaxBacklog() != null ? request.getMaxBacklog() : d.maxBacklog();
        return new StopSettings(maxResults, idle, backlog);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Subscription name is required");
        }
        return name;
    }
}
