/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

/**
 * Why a delivered message was negatively acknowledged.
 */
public enum NackReason {
    DECODE_ERROR("decode_error"),
    CALLBACK_ERROR("callback_error"),
    REJECTED("rejected"),
    STOPPING("stopping");

    private final String tag;

    NackReason(String tag) { this.tag = tag; }

    public String tag() { return tag; }
}
