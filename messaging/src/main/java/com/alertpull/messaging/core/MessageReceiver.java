/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.core;

/**
 * Callback the transport invokes for every delivered message.
 * The receiver is responsible for settling the message (ack or nack).
 */
@FunctionalInterface
public interface MessageReceiver {
    void receive(ReceivedMessage message);
}
