/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.service;

import com.alertpull.common.config.AlertPullProperties;
import com.alertpull.server.policy.StopSettings;

import java.util.List;

/**
 * Defaults applied to a {@link com.alertpull.common.model.StreamRequest} where it leaves
 * a field unset.
 */
public record StreamDefaults(StopSettings stopSettings, List<String> metadataKeys) {

    public static final String PREFIX = "alertpull.stream.";

    public StreamDefaults {
        if (stopSettings == null) stopSettings = new StopSettings(null, null, null);
        metadataKeys = metadataKeys != null ? List.copyOf(metadataKeys) : List.of();
    }

    public static StreamDefaults none() {
        return new StreamDefaults(null, null);
    }

    /** Reads {@code alertpull.stream.*}. */
    public static StreamDefaults fromProperties(AlertPullProperties props) {
        AlertPullProperties stream = props.withPrefix(PREFIX);
        return new StreamDefaults(StopSettings.fromProperties(stream), stream.getList("metadata-keys"));
    }
}
