/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.exception;

/**
 * A payload that cannot be decoded, or a projection that asks for a field the record
 * does not have. Handled per message; never fatal to a stream.
 */
public class DecodeException extends AlertPullException {
    public DecodeException(String message) {
        super("APL_DECODE", message);
    }

    public DecodeException(String message, Throwable cause) {
        super("APL_DECODE", message, cause);
    }
}
