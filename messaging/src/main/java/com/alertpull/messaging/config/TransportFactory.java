/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.config;

import com.alertpull.common.model.BrokerConfig;
import com.alertpull.messaging.core.StreamingPullTransport;
import com.alertpull.messaging.core.SubscriptionAdmin;
import com.alertpull.messaging.pubsub.PubSubClientSettings;
import com.alertpull.messaging.pubsub.PubSubStreamingPullTransport;
import com.alertpull.messaging.pubsub.PubSubSubscriptionAdmin;
import com.alertpull.messaging.rabbitmq.RabbitMQStreamingPullTransport;
import com.alertpull.messaging.rabbitmq.RabbitMQSubscriptionAdmin;
import com.google.api.gax.core.CredentialsProvider;

import java.util.function.Supplier;

/**
 * Builds the transport and subscription admin for a {@link BrokerConfig}.
 * Supports: Google Pub/Sub, RabbitMQ.
 */
public final class TransportFactory {

    private TransportFactory() {}

    /**
     * A transport/admin pair sharing one set of client settings. Closing the pair closes both.
     */
    public record Broker(StreamingPullTransport transport, SubscriptionAdmin admin) implements AutoCloseable {
        @Override
        public void close() {
            admin.close();
            transport.close();
        }
    }

    public static Broker create(BrokerConfig config) {
        return create(config, null);
    }

    /**
     * @param credentials overrides Pub/Sub credential resolution; ignored for RabbitMQ
     */
    public static Broker create(BrokerConfig config, CredentialsProvider credentials) {
        return switch (config.getBrokerType()) {
            case PUBSUB -> {
                PubSubClientSettings settings = new PubSubClientSettings(config, credentials);
                yield assemble(new PubSubStreamingPullTransport(settings), () -> new PubSubSubscriptionAdmin(settings));
            }
            case RABBITMQ -> assemble(new RabbitMQStreamingPullTransport(config), () -> new RabbitMQSubscriptionAdmin(config));
        };
    }

    /**
     * Pair a transport with its admin. If the admin cannot be built, the transport (and
     * the connection or channel it holds) is closed before the failure propagates.
     */
    static Broker assemble(StreamingPullTransport transport, Supplier<SubscriptionAdmin> adminFactory) {
        try {
            return new Broker(transport, adminFactory.get());
        } catch (RuntimeException e) {
            try {
                transport.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }
}
