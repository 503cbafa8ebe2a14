/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.decode;

import com.alertpull.common.exception.ConfigurationException;

import java.util.Locale;

/**
 * Wire format of message payloads on a broker, selected by {@code alertpull.broker.payload-format}.
 */
public enum PayloadFormat {
    JSON {
        @Override
        public PayloadDecoder newDecoder() { return new JsonPayloadDecoder(); }
    },
    AVRO {
        @Override
        public PayloadDecoder newDecoder() { return new AvroPayloadDecoder(); }
    };

    public abstract PayloadDecoder newDecoder();

    /**
     * Case-insensitive lookup; {@code null} or blank means {@link #JSON}.
     *
     * @throws ConfigurationException for an unknown format
     */
    public static PayloadFormat parse(String value) {
        if (value == null || value.isBlank()) return JSON;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown payload format '" + value + "'", e);
        }
    }
}
