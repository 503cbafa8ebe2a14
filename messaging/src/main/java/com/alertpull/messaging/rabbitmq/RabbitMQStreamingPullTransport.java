/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.rabbitmq;

import com.alertpull.common.exception.TransportException;
import com.alertpull.common.model.BrokerConfig;
import com.alertpull.messaging.core.FlowControl;
import com.alertpull.messaging.core.MessageReceiver;
import com.alertpull.messaging.core.StreamingPull;
import com.alertpull.messaging.core.StreamingPullTransport;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Streaming pull from a RabbitMQ queue using AMQP 0-9-1 push consumers.
 *
 * <p>Each pull gets its own channel with {@code basic.qos} set to the backlog bound and
 * manual acknowledgement. The client dispatches deliveries for one channel in order on
 * one thread at a time, and delivers {@code cancel-ok} only after the deliveries queued
 * ahead of it, which is what {@link StreamingPull#awaitTermination()} waits for.
 * Unsettled messages return to the queue when the channel closes.</p>
 */
public class RabbitMQStreamingPullTransport implements StreamingPullTransport {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQStreamingPullTransport.class);

    private final Connection connection;

    public RabbitMQStreamingPullTransport(BrokerConfig config) {
        this(RabbitMQConnections.open(config, "alertpull-subscriber"));
    }

    RabbitMQStreamingPullTransport(Connection connection) {
        this.connection = connection;
    }

    @Override
    public StreamingPull subscribe(String queueName, FlowControl flowControl,
                                   MessageReceiver receiver, Consumer<Throwable> failureListener) {
        Channel channel = null;
        try {
            channel = connection.createChannel();
            channel.basicQos(flowControl.maxOutstandingMessages());
            QueuePull pull = new QueuePull(channel, queueName, receiver, failureListener);
            pull.consumerTag = channel.basicConsume(queueName, false, "alertpull-" + queueName, pull);
            log.info("RabbitMQ streaming pull started on queue {} (prefetch {})",
                    queueName, flowControl.maxOutstandingMessages());
            return pull;
        } catch (IOException e) {
            RabbitMQConnections.closeQuietly(channel);
            throw new TransportException("Could not start consuming from queue " + queueName, e);
        }
    }

    @Override
    public void close() {
        RabbitMQConnections.closeQuietly(connection);
    }

    private static final class QueuePull extends DefaultConsumer implements StreamingPull {
        private final String queueName;
        private final MessageReceiver receiver;
        private final Consumer<Throwable> failureListener;
        private final CountDownLatch finished = new CountDownLatch(1);
        private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
        private volatile String consumerTag;

        QueuePull(Channel channel, String queueName, MessageReceiver receiver,
                  Consumer<Throwable> failureListener) {
            super(channel);
            this.queueName = queueName;
            this.receiver = receiver;
            this.failureListener = failureListener;
        }

        @Override
        public void handleDelivery(String tag, Envelope envelope,
                                   AMQP.BasicProperties properties, byte[] body) {
            receiver.receive(new RabbitMQReceivedMessage(getChannel(), envelope, properties, body));
        }

        @Override
        public void handleCancelOk(String tag) {
            finished.countDown();
        }

        @Override
        public void handleCancel(String tag) {
            log.warn("Consumer on queue {} cancelled by the broker", queueName);
            failureListener.accept(new IllegalStateException("Queue " + queueName + " consumer cancelled by broker"));
            finished.countDown();
        }

        @Override
        public void handleShutdownSignal(String tag, ShutdownSignalException sig) {
            if (!cancelRequested.get() && !sig.isInitiatedByApplication()) {
                log.error("Channel for queue {} shut down unexpectedly", queueName, sig);
                failureListener.accept(sig);
            }
            finished.countDown();
        }

        @Override
        public void cancel() {
            if (!cancelRequested.compareAndSet(false, true)) return;
            try {
                getChannel().basicCancel(consumerTag);
            } catch (IOException | ShutdownSignalException e) {
                log.warn("Error cancelling consumer on queue {}: {}", queueName, e.getMessage());
                finished.countDown();
            }
        }

        @Override
        public void awaitTermination() {
            try {
                finished.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                RabbitMQConnections.closeQuietly(getChannel());
            }
            log.info("RabbitMQ streaming pull on queue {} terminated", queueName);
        }
    }
}
