/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.core;

/**
 * Handle on a running streaming pull.
 */
public interface StreamingPull {

    /** Ask the transport to stop delivering. Returns immediately. */
    void cancel();

    /**
     * Block until the pull has shut down and every message already handed to the
     * receiver has returned. Must be called after {@link #cancel()}.
     */
    void awaitTermination();
}
