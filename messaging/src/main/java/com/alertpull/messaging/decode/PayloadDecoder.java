/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.decode;

import com.alertpull.common.exception.DecodeException;

import java.util.Map;

/**
 * Turns raw payload bytes into a structured record. Implementations must be stateless
 * and thread-safe.
 */
@FunctionalInterface
public interface PayloadDecoder {
    Map<String, Object> decode(byte[] payload) throws DecodeException;
}
