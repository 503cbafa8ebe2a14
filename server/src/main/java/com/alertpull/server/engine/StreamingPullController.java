/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

import com.alertpull.common.exception.DecodeException;
import com.alertpull.common.exception.TransportException;
import com.alertpull.messaging.core.FlowControl;
import com.alertpull.messaging.core.ReceivedMessage;
import com.alertpull.messaging.core.StreamingPull;
import com.alertpull.messaging.decode.MessageDecoder;
import com.alertpull.server.channel.Handshake;
import com.alertpull.server.channel.HandshakeChannel;
import com.alertpull.server.metrics.PullMetrics;
import com.alertpull.server.policy.RunState;
import com.alertpull.server.policy.StopConfig;
import com.alertpull.server.policy.StopSettings;
import com.alertpull.server.policy.StoppingConditionPolicy;
import com.alertpull.server.policy.TerminationReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one bounded streaming pull.
 *
 * <p>The transport pushes messages into {@link #onMessage(ReceivedMessage)} on its own
 * thread. Each message is decoded, projected, enriched with metadata and passed to the
 * user callback; then the pipeline hands a {@link Handshake} to the driver thread and,
 * when a result ceiling is configured, acknowledges only after the driver has counted
 * it. The driver ({@link #awaitStopCondition()}) records handshakes and evaluates the
 * {@link StoppingConditionPolicy} after each one, or when the idle window closes.</p>
 *
 * <p>A controller is single-use: IDLE, RUNNING, STOPPING, STOPPED.</p>
 */
public class StreamingPullController {

    private static final Logger log = LoggerFactory.getLogger(StreamingPullController.class);
    private static final long DRIVER_POLL_MILLIS = 50;

    private final StreamContext context;
    private final StoppingConditionPolicy policy;
    private final PullMetrics metrics;
    private final HandshakeChannel channel = new HandshakeChannel();
    private final ReentrantLock pipelineLock = new ReentrantLock();
    private final AtomicReference<ControllerState> state = new AtomicReference<>(ControllerState.IDLE);
    private final AtomicReference<Throwable> transportFailure = new AtomicReference<>();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile StopConfig config;
    private volatile PipelineHooks hooks;
    private volatile MessageDecoder decoder;
    private volatile StreamingPull pull;
    private volatile boolean stopRequested;
    private volatile Thread driverThread;

    private RunState runState;
    private Instant startedAt;
    private volatile RunResult result;

    public StreamingPullController(StreamContext context) {
        this.context = context;
        this.policy = context.policy();
        this.metrics = context.metrics();
    }

    // ─── Lifecycle ─────────────────────────────────────────────────────────

    /**
     * Validate the stopping conditions, run until one is met, stop, and return the result.
     *
     * @throws com.alertpull.common.exception.ConfigurationException if the conditions are invalid
     * @throws TransportException if the pull cannot start or fails while running
     */
    public RunResult run(StopSettings settings, PipelineHooks pipelineHooks) {
        start(settings, pipelineHooks);
        TerminationReason reason = TerminationReason.STOPPED;
        try {
            reason = awaitStopCondition();
        } finally {
            shutdown(reason);
        }
        Throwable failure = transportFailure.get();
        if (failure != null) {
            throw failure instanceof TransportException te
                    ? te : new TransportException("Streaming pull on " + context.subscriptionPath() + " failed", failure);
        }
        return result;
    }

    /**
     * Validate the stopping conditions and open the pull. Nothing is delivered before
     * validation succeeds.
     *
     * @throws IllegalStateException if the controller was already started
     */
    public synchronized void start(StopSettings settings, PipelineHooks pipelineHooks) {
        if (state.get() != ControllerState.IDLE) {
            throw new IllegalStateException("Controller already started (state=" + state.get() + ")");
        }
        this.config = policy.validate(settings);
        this.hooks = pipelineHooks != null ? pipelineHooks : PipelineHooks.collecting();
        this.decoder = hooks.getDecoder() != null ? hooks.getDecoder() : context.decoder();
        this.startedAt = now();
        this.runState = new RunState(hooks.isCollect(), startedAt);

        state.set(ControllerState.RUNNING);
        metrics.recordRunStart();
        log.info("Streaming pull on {} started (maxResults={}, idleTimeout={}, maxBacklog={})",
                context.subscriptionPath(), config.maxResults(), config.idleTimeout(), config.maxBacklog());
        try {
            this.pull = context.transport().subscribe(context.subscriptionPath(),
                    new FlowControl(config.maxBacklog()), this::onMessage, this::onTransportFailure);
        } catch (RuntimeException e) {
            transportFailure.compareAndSet(null, e);
            channel.close();
            shutdown(TerminationReason.TRANSPORT_FAILURE);
            throw e;
        }
    }

    /**
     * Run the driver loop on the calling thread until a stopping condition holds, the
     * controller is stopped, or the transport fails. Returns at once if {@link #stop()}
     * already ran after {@link #start}.
     *
     * @throws IllegalStateException if the controller was never started
     */
    public TerminationReason awaitStopCondition() {
        ControllerState current = state.get();
        if (current != ControllerState.RUNNING) {
            // stopped between start() and here
            if (stopRequested && current != ControllerState.IDLE) {
                RunResult finished = result;
                return finished != null ? finished.terminationReason() : TerminationReason.STOPPED;
            }
            throw new IllegalStateException("Controller is not running (state=" + current + ")");
        }
        driverThread = Thread.currentThread();
        TerminationReason reason = TerminationReason.STOPPED;
        try {
            reason = drive();
            runState.terminate(reason);
            return reason;
        } finally {
            driverThread = null;
            if (stopRequested) shutdown(reason);
        }
    }

    /**
     * Stop the pull and return the result. Idempotent and safe to call from any thread;
     * while another thread is driving, waits for that thread to finish shutting down.
     */
    public RunResult stop() {
        if (state.get() == ControllerState.STOPPED) return result;
        stopRequested = true;
        channel.close();
        try {
            while (true) {
                Thread driver = driverThread;
                if (driver == null || driver == Thread.currentThread()) break;
                if (stopped.await(DRIVER_POLL_MILLIS, TimeUnit.MILLISECONDS)) return result;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} to stop", context.subscriptionPath());
        }
        return shutdown(TerminationReason.STOPPED);
    }

    public ControllerState getState() { return state.get(); }

    public StopConfig getConfig() { return config; }

    // ─── Driver ────────────────────────────────────────────────────────────

    private TerminationReason drive() {
        while (true) {
            if (stopRequested) return TerminationReason.STOPPED;
            if (transportFailure.get() != null) return TerminationReason.TRANSPORT_FAILURE;

            Duration wait = policy.remainingIdle(runState, config, now());
            if (wait != null && (wait.isZero() || wait.isNegative())) return TerminationReason.IDLE_TIMEOUT;

            Optional<Handshake> handshake;
            try {
                handshake = channel.receive(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Driver for {} interrupted", context.subscriptionPath());
                return TerminationReason.STOPPED;
            }
            if (handshake.isEmpty()) {
                if (channel.isClosed()) {
                    return transportFailure.get() != null && !stopRequested
                            ? TerminationReason.TRANSPORT_FAILURE : TerminationReason.STOPPED;
                }
                continue;
            }

            try {
                record(handshake.get());
            } finally {
                channel.markDrained();
            }
            if (!policy.shouldContinue(runState, config, now())) {
                return config.hasMaxResults() && runState.getAcceptedCount() >= config.maxResults()
                        ? TerminationReason.MAX_RESULTS : TerminationReason.IDLE_TIMEOUT;
            }
        }
    }

    private void record(Handshake handshake) {
        runState.record(handshake.increment(), handshake.result(), now());
        if (!handshake.counted()) return;
        metrics.recordAccepted();
        ResultSink sink = hooks.getResultSink();
        if (sink != null && handshake.result() != null) {
            try {
                sink.accept(handshake.result());
            } catch (RuntimeException e) {
                log.error("Result sink failed for {}", context.subscriptionPath(), e);
            }
        }
    }

    private synchronized RunResult shutdown(TerminationReason reason) {
        if (result != null) return result;
        state.set(ControllerState.STOPPING);
        if (runState == null) {
            runState = new RunState(false, now());
            startedAt = runState.getLastActivity();
        }
        runState.terminate(reason);
        try {
            StreamingPull current = pull;
            if (current != null) current.cancel();
            channel.close();
            if (current != null) current.awaitTermination();
            // a sender that did not await the drain has acked already
            channel.pollRemaining().ifPresent(h -> {
                record(h);
                channel.markDrained();
            });
        } catch (RuntimeException e) {
            log.warn("Error while shutting down pull on {}", context.subscriptionPath(), e);
        } finally {
            Duration elapsed = Duration.between(startedAt, now());
            result = new RunResult(context.subscriptionPath(), runState.getAcceptedCount(), runState.getReceipts(),
                    runState.getTerminationReason(), elapsed.toMillis(), runState.getResults());
            if (config != null) metrics.recordRunEnd(result.terminationReason(), elapsed);
            state.set(ControllerState.STOPPED);
            stopped.countDown();
            log.info("Streaming pull on {} stopped: reason={}, accepted={}, receipts={}, elapsed={}ms",
                    context.subscriptionPath(), result.terminationReason(), result.acceptedCount(),
                    result.receipts(), result.elapsedMs());
        }
        return result;
    }

    private void onTransportFailure(Throwable failure) {
        if (transportFailure.compareAndSet(null, failure)) {
            log.error("Streaming pull on {} failed", context.subscriptionPath(), failure);
        }
        channel.close();
    }

    // ─── Message pipeline ──────────────────────────────────────────────────

    /**
     * Entry point for the transport. Serialized so the user callback never runs for two
     * messages at once.
     */
    void onMessage(ReceivedMessage message) {
        pipelineLock.lock();
        try {
            metrics.recordReceived();
            if (state.get() != ControllerState.RUNNING || channel.isClosed()) {
                nack(message, NackReason.STOPPING);
                return;
            }
            process(message);
        } finally {
            pipelineLock.unlock();
        }
    }

    private void process(ReceivedMessage message) {
        Map<String, Object> record;
        try {
            record = decoder.decode(message.data());
            if (hooks.getFieldSpec() != null) {
                record = decoder.project(record, hooks.getFieldSpec());
            }
        } catch (DecodeException e) {
            log.warn("Dropping message {} from {}: {}", message.messageId(), context.subscriptionPath(), e.getMessage());
            nack(message, NackReason.DECODE_ERROR);
            return;
        }
        record = attachMetadata(record, message);

        CallbackResult verdict = CallbackResult.acceptUnchanged();
        UserCallback callback = hooks.getUserCallback();
        if (callback != null) {
            try {
                CallbackResult returned = callback.process(record, hooks.getContext());
                if (returned != null) verdict = returned;
            } catch (Exception e) {
                log.warn("Callback failed for message {} from {}", message.messageId(), context.subscriptionPath(), e);
                nack(message, NackReason.CALLBACK_ERROR);
                return;
            }
        }
        if (!verdict.ack()) {
            nack(message, NackReason.REJECTED);
            return;
        }

        Handshake handshake = verdict.excluded() ? Handshake.excluded() : Handshake.accepted(verdict.resultOr(record));
        boolean recorded;
        try {
            recorded = channel.send(handshake, config.hasMaxResults());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recorded = false;
        }
        if (recorded) {
            ack(message);
        } else {
            nack(message, NackReason.STOPPING);
        }
    }

    private Map<String, Object> attachMetadata(Map<String, Object> record, ReceivedMessage message) {
        if (hooks.getMetadataKeys().isEmpty()) return record;
        Map<String, String> metadata = decoder.extractMetadata(message, hooks.getMetadataKeys());
        Map<String, Object> enriched = new LinkedHashMap<>(record);
        String field = hooks.getMetadataField();
        if (enriched.containsKey(field)) {
            log.debug("Record from message {} already has '{}'; metadata not attached", message.messageId(), field);
        } else {
            enriched.put(field, metadata);
        }
        return enriched;
    }

    private void ack(ReceivedMessage message) {
        try {
            message.ack();
            metrics.recordAcked();
        } catch (RuntimeException e) {
            onTransportFailure(e);
        }
    }

    private void nack(ReceivedMessage message, NackReason reason) {
        try {
            message.nack();
            metrics.recordNacked(reason);
        } catch (RuntimeException e) {
            onTransportFailure(e);
        }
    }

    private Instant now() {
        return context.clock().instant();
    }
}
