/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.policy;

import java.time.Duration;

/**
 * Validated stopping conditions. {@code maxResults} and {@code idleTimeout} are
 * {@code null} when unset, but never both; {@code maxBacklog} is always positive and
 * no larger than {@code maxResults}.
 */
public record StopConfig(Integer maxResults, Duration idleTimeout, int maxBacklog) {

    public boolean hasMaxResults() {
        return maxResults != null;
    }

    public boolean hasIdleTimeout() {
        return idleTimeout != null;
    }
}
