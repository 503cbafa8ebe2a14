/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.decode;

import com.alertpull.common.exception.DecodeException;
import com.alertpull.common.util.JsonUtil;

import java.io.IOException;
import java.util.Map;

/**
 * Decodes payloads that are a single JSON object.
 */
public class JsonPayloadDecoder implements PayloadDecoder {

    @Override
    public Map<String, Object> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new DecodeException("Empty payload");
        }
        try {
            Map<String, Object> record = JsonUtil.readObject(payload);
            if (record == null) {
                throw new DecodeException("Payload is JSON null, expected an object");
            }
            return record;
        } catch (IOException e) {
            throw new DecodeException("Malformed JSON payload: " + e.getMessage(), e);
        }
    }
}
