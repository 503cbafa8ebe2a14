/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.channel;

import java.util.Map;

/**
 * One notification from the message pipeline to the driver: whether the message
 * counts towards the result ceiling, and the result to collect when it does.
 */
public record Handshake(int increment, Map<String, Object> result) {

    public Handshake {
        if (increment != 0 && increment != 1) {
            throw new IllegalArgumentException("increment must be 0 or 1: " + increment);
        }
    }

    public static Handshake accepted(Map<String, Object> result) {
        return new Handshake(1, result);
    }

    /** Acknowledged but excluded from the results. */
    public static Handshake excluded() {
        return new Handshake(0, null);
    }

    public boolean counted() { return increment > 0; }
}
