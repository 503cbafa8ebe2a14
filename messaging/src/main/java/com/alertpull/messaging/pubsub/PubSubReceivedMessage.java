/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.pubsub;

import com.alertpull.messaging.core.ReceivedMessage;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.protobuf.Timestamp;
import com.google.pubsub.v1.PubsubMessage;

import java.time.Instant;
import java.util.Map;

/**
 * Adapts a Pub/Sub delivery and its {@link AckReplyConsumer}.
 */
class PubSubReceivedMessage implements ReceivedMessage {

    private final PubsubMessage message;
    private final AckReplyConsumer consumer;

    PubSubReceivedMessage(PubsubMessage message, AckReplyConsumer consumer) {
        this.message = message;
        this.consumer = consumer;
    }

    @Override
    public byte[] data() { return message.getData().toByteArray(); }

    @Override
    public String messageId() { return message.getMessageId(); }

    @Override
    public Instant publishTime() {
        if (!message.hasPublishTime()) return null;
        Timestamp ts = message.getPublishTime();
        return Instant.ofEpochSecond(ts.getSeconds(), ts.getNanos());
    }

    @Override
    public Map<String, String> attributes() { return message.getAttributesMap(); }

    @Override
    public void ack() { consumer.ack(); }

    @Override
    public void nack() { consumer.nack(); }
}
