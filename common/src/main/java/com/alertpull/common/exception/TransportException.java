/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.exception;

/**
 * Failure reported by the broker client while pulling, acknowledging, or managing
 * subscriptions. Surfaced to the caller as-is; nothing here retries transport calls.
 */
public class TransportException extends AlertPullException {
    public TransportException(String message, Throwable cause) {
        super("APL_TRANSPORT", message, cause);
    }

    protected TransportException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
