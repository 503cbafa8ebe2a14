/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.rabbitmq;

import com.alertpull.common.exception.TransportException;
import com.alertpull.messaging.core.ReceivedMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A RabbitMQ delivery consumed with manual acknowledgement. A nack requeues the message.
 */
class RabbitMQReceivedMessage implements ReceivedMessage {

    private final Channel channel;
    private final Envelope envelope;
    private final AMQP.BasicProperties properties;
    private final byte[] body;

    RabbitMQReceivedMessage(Channel channel, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        this.channel = channel;
        this.envelope = envelope;
        this.properties = properties;
        this.body = body;
    }

    @Override
    public byte[] data() { return body; }

    @Override
    public String messageId() {
        if (properties.getMessageId() != null) return properties.getMessageId();
        return String.valueOf(envelope.getDeliveryTag());
    }

    @Override
    public Instant publishTime() {
        return properties.getTimestamp() != null ? properties.getTimestamp().toInstant() : null;
    }

    @Override
    public Map<String, String> attributes() {
        Map<String, String> attrs = new HashMap<>();
        if (properties.getHeaders() != null) {
            properties.getHeaders().forEach((k, v) -> attrs.put(k, String.valueOf(v)));
        }
        attrs.put("rabbitmq.exchange", envelope.getExchange());
        attrs.put("rabbitmq.routing_key", envelope.getRoutingKey());
        attrs.put("rabbitmq.redelivered", String.valueOf(envelope.isRedeliver()));
        return attrs;
    }

    @Override
    public void ack() {
        try {
            channel.basicAck(envelope.getDeliveryTag(), false);
        } catch (IOException e) {
            throw new TransportException("Failed to ack delivery " + envelope.getDeliveryTag(), e);
        }
    }

    @Override
    public void nack() {
        try {
            channel.basicNack(envelope.getDeliveryTag(), false, true);
        } catch (IOException e) {
            throw new TransportException("Failed to nack delivery " + envelope.getDeliveryTag(), e);
        }
    }
}
