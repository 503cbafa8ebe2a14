/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.metrics;

import com.alertpull.server.engine.NackReason;
import com.alertpull.server.policy.TerminationReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation of streaming pulls.
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>alertpull.messages.received</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>alertpull.messages.acked</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>alertpull.messages.nacked</td><td>Counter</td><td>reason</td></tr>
 *   <tr><td>alertpull.messages.accepted</td><td>Counter</td><td>-</td></tr>
 *   <tr><td>alertpull.runs.duration</td><td>Timer</td><td>termination</td></tr>
 *   <tr><td>alertpull.runs.active</td><td>Gauge</td><td>-</td></tr>
 * </table>
 */
public class PullMetrics {

    private static final Logger log = LoggerFactory.getLogger(PullMetrics.class);

    private final MeterRegistry registry;
    private final Counter received;
    private final Counter acked;
    private final Counter accepted;
    private final AtomicInteger activeRuns = new AtomicInteger(0);

    private final Map<NackReason, Counter> nackCounters = new ConcurrentHashMap<>();
    private final Map<TerminationReason, Timer> runTimers = new ConcurrentHashMap<>();

    public PullMetrics() {
        this(new SimpleMeterRegistry());
    }

    public PullMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.received = Counter.builder("alertpull.messages.received")
                .description("Messages delivered by the broker")
                .register(registry);
        this.acked = Counter.builder("alertpull.messages.acked")
                .description("Messages acknowledged")
                .register(registry);
        this.accepted = Counter.builder("alertpull.messages.accepted")
                .description("Messages counted towards a run's results")
                .register(registry);
        Gauge.builder("alertpull.runs.active", activeRuns, AtomicInteger::get)
                .description("Streaming pulls currently running")
                .register(registry);
        log.debug("PullMetrics registered on {}", registry.getClass().getSimpleName());
    }

    public void recordReceived() { received.increment(); }

    public void recordAcked() { acked.increment(); }

    public void recordAccepted() { accepted.increment(); }

    public void recordNacked(NackReason reason) {
        nackCounters.computeIfAbsent(reason, r ->
                Counter.builder("alertpull.messages.nacked")
                        .description("Messages negatively acknowledged")
                        .tag("reason", r.tag())
                        .register(registry)
        ).increment();
    }

    public void recordRunStart() { activeRuns.incrementAndGet(); }

    public void recordRunEnd(TerminationReason reason, Duration elapsed) {
        activeRuns.decrementAndGet();
        runTimers.computeIfAbsent(reason, r ->
                Timer.builder("alertpull.runs.duration")
                        .description("Streaming pull run duration")
                        .tag("termination", r.name().toLowerCase())
                        .register(registry)
        ).record(elapsed);
    }

    public MeterRegistry getRegistry() { return registry; }
}
