/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.policy;

import com.alertpull.common.exception.ConfigurationException;

import java.time.Duration;
import java.time.Instant;

/**
 * Validates stopping conditions and decides, after every handshake, whether the pull
 * keeps going.
 */
public class StoppingConditionPolicy {

    /** Matches the Pub/Sub client's own default outstanding-message limit. */
    public static final int DEFAULT_MAX_BACKLOG = 1000;

    private final int defaultMaxBacklog;

    public StoppingConditionPolicy() {
        this(DEFAULT_MAX_BACKLOG);
    }

    public StoppingConditionPolicy(int defaultMaxBacklog) {
        if (defaultMaxBacklog <= 0) {
            throw new ConfigurationException("Default max backlog must be positive: " + defaultMaxBacklog);
        }
        this.defaultMaxBacklog = defaultMaxBacklog;
    }

    /**
     * Apply defaults and check bounds.
     *
     * <p>The backlog defaults to {@code min(defaultMaxBacklog, maxResults)} and is clamped
     * to {@code maxResults}, so a small run does not pull far more than it will keep.</p>
     *
     * @throws ConfigurationException if no stopping condition is set or a bound is not positive
     */
    public StopConfig validate(StopSettings raw) {
        if (raw == null || (raw.maxResults() == null && raw.idleTimeout() == null)) {
            throw new ConfigurationException(
                    "At least one stopping condition is required: maxResults and idleTimeout cannot both be unset");
        }
        Integer maxResults = raw.maxResults();
        if (maxResults != null && maxResults <= 0) {
            throw new ConfigurationException("maxResults must be positive: " + maxResults);
        }
        Duration idleTimeout = raw.idleTimeout();
        if (idleTimeout != null && (idleTimeout.isZero() || idleTimeout.isNegative())) {
            throw new ConfigurationException("idleTimeout must be positive: " + idleTimeout);
        }
        if (raw.maxBacklog() != null && raw.maxBacklog() <= 0) {
            throw new ConfigurationException("maxBacklog must be positive: " + raw.maxBacklog());
        }
        int backlog = raw.maxBacklog() != null ? raw.maxBacklog() : defaultMaxBacklog;
        if (maxResults != null) {
            backlog = Math.min(backlog, maxResults);
        }
        return new StopConfig(maxResults, idleTimeout, backlog);
    }

    /**
     * True while the count ceiling (if any) is not reached <em>and</em> the idle window
     * (if any) has not elapsed since the last handshake.
     */
    public boolean shouldContinue(RunState state, StopConfig config, Instant now) {
        boolean underCeiling = !config.hasMaxResults() || state.getAcceptedCount() < config.maxResults();
        boolean notIdle = !config.hasIdleTimeout()
                || Duration.between(state.getLastActivity(), now).compareTo(config.idleTimeout()) < 0;
        return underCeiling && notIdle;
    }

    /**
     * Time left before the idle window closes, or {@code null} when there is no idle timeout.
     * May be zero or negative once the window has elapsed.
     */
    public Duration remainingIdle(RunState state, StopConfig config, Instant now) {
        if (!config.hasIdleTimeout()) return null;
        return config.idleTimeout().minus(Duration.between(state.getLastActivity(), now));
    }
}
