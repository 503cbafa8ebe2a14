/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.core;

/**
 * Backlog bound handed to the transport: at most {@code maxOutstandingMessages}
 * delivered-but-unsettled messages at any time.
 */
public record FlowControl(int maxOutstandingMessages) {
    public FlowControl {
        if (maxOutstandingMessages <= 0) {
            throw new IllegalArgumentException("maxOutstandingMessages must be positive: " + maxOutstandingMessages);
        }
    }
}
