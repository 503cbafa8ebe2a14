/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.policy;

import com.alertpull.common.config.AlertPullProperties;

import java.time.Duration;

/**
 * Stopping conditions as supplied by a caller, before validation. Any field may be
 * {@code null} (unset).
 */
public record StopSettings(Integer maxResults, Duration idleTimeout, Integer maxBacklog) {

    public static StopSettings maxResults(int maxResults) {
        return new StopSettings(maxResults, null, null);
    }

    public static StopSettings idleTimeout(Duration idleTimeout) {
        return new StopSettings(null, idleTimeout, null);
    }

    public StopSettings withMaxBacklog(Integer backlog) {
        return new StopSettings(maxResults, idleTimeout, backlog);
    }

    /**
     * Read {@code max-results}, {@code idle-timeout} and {@code max-backlog} from a
     * property view whose prefix has already been stripped.
     */
    public static StopSettings fromProperties(AlertPullProperties props, String prefix) {
        return fromProperties(props.withPrefix(prefix));
    }

    public static StopSettings fromProperties(AlertPullProperties props) {
        return new StopSettings(
                props.getInteger("max-results"),
                props.getDuration("idle-timeout", null),
                props.getInteger("max-backlog"));
    }
}
