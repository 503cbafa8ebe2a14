/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.policy;

/**
 * Why a streaming pull stopped.
 */
public enum TerminationReason {
    /** The accepted count reached {@code maxResults}. */
    MAX_RESULTS,
    /** Nothing arrived within {@code idleTimeout}. */
    IDLE_TIMEOUT,
    /** The caller stopped the controller. */
    STOPPED,
    /** The broker connection failed underneath the pull. */
    TRANSPORT_FAILURE
}
