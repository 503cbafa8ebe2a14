/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

/**
 * Lifecycle of a {@link StreamingPullController}. Transitions only move forward:
 * IDLE, RUNNING, STOPPING, STOPPED.
 */
public enum ControllerState {
    IDLE,
    RUNNING,
    STOPPING,
    STOPPED
}
