/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.exception;

/**
 * Base exception for all AlertPull errors. Carries a stable error code so that
 * callers (and the REST layer) can classify failures without parsing messages.
 */
public class AlertPullException extends RuntimeException {
    private final String errorCode;

    public AlertPullException(String message) {
        super(message);
        this.errorCode = "APL_GENERIC";
    }

    public AlertPullException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AlertPullException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
