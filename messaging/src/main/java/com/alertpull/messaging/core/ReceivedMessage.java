/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.core;

import java.time.Instant;
import java.util.Map;

/**
 * One delivery from a subscription. The pipeline settles every message exactly once,
 * with either {@link #ack()} (the message leaves the subscription) or {@link #nack()}
 * (the broker may redeliver it).
 */
public interface ReceivedMessage {

    /** Raw payload bytes. */
    byte[] data();

    String messageId();

    /** When the broker accepted the message, or {@code null} if the broker does not say. */
    Instant publishTime();

    /** Origin attributes set by the publisher, possibly including broker provenance fields. */
    Map<String, String> attributes();

    void ack();

    void nack();
}
