/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.rabbitmq;

import com.alertpull.common.exception.TopicNotFoundException;
import com.alertpull.common.exception.TransportException;
import com.alertpull.common.model.BrokerConfig;
import com.alertpull.messaging.core.Subscription;
import com.alertpull.messaging.core.SubscriptionAdmin;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * RabbitMQ flavour of subscription management: a subscription is a durable queue and a
 * topic is an exchange the queue is bound to with the catch-all routing key.
 *
 * <p>AMQP offers no way to read a queue's bindings, so an existing queue is reported
 * with an unknown ({@code null}) topic. Passive declares close their channel on 404,
 * so every call uses a fresh channel.</p>
 */
public class RabbitMQSubscriptionAdmin implements SubscriptionAdmin {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQSubscriptionAdmin.class);
    private static final String BIND_ALL = "#";

    private final Connection connection;

    public RabbitMQSubscriptionAdmin(BrokerConfig config) {
        this(RabbitMQConnections.open(config, "alertpull-admin"));
    }

    RabbitMQSubscriptionAdmin(Connection connection) {
        this.connection = connection;
    }

    @Override
    public String subscriptionPath(String name) {
        return name;
    }

    @Override
    public String defaultTopic(String name) {
        return name;
    }

    @Override
    public Optional<Subscription> get(String name) {
        Channel channel = openChannel();
        try {
            channel.queueDeclarePassive(name);
            return Optional.of(new Subscription(name, name, null));
        } catch (IOException e) {
            if (RabbitMQConnections.isNotFound(e)) return Optional.empty();
            throw new TransportException("Failed to look up queue " + name, e);
        } finally {
            RabbitMQConnections.closeQuietly(channel);
        }
    }

    @Override
    public Subscription create(String name, String topic) {
        Channel channel = openChannel();
        try {
            channel.exchangeDeclarePassive(topic);
        } catch (IOException e) {
            RabbitMQConnections.closeQuietly(channel);
            if (RabbitMQConnections.isNotFound(e)) throw new TopicNotFoundException(topic, e);
            throw new TransportException("Failed to look up exchange " + topic, e);
        }
        try {
            channel.queueDeclare(name, true, false, false, null);
            channel.queueBind(name, topic, BIND_ALL);
            log.info("Created queue {} bound to exchange {}", name, topic);
            return new Subscription(name, name, topic);
        } catch (IOException e) {
            throw new TransportException("Failed to create queue " + name, e);
        } finally {
            RabbitMQConnections.closeQuietly(channel);
        }
    }

    @Override
    public boolean delete(String name) {
        if (get(name).isEmpty()) return false;
        Channel channel = openChannel();
        try {
            channel.queueDelete(name);
            return true;
        } catch (IOException e) {
            if (RabbitMQConnections.isNotFound(e)) return false;
            throw new TransportException("Failed to delete queue " + name, e);
        } finally {
            RabbitMQConnections.closeQuietly(channel);
        }
    }

    @Override
    public void close() {
        RabbitMQConnections.closeQuietly(connection);
    }

    private Channel openChannel() {
        try {
            return connection.createChannel();
        } catch (IOException e) {
            throw new TransportException("Could not open RabbitMQ channel", e);
        }
    }
}
