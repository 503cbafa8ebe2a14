/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.core;

import java.util.Optional;

/**
 * Broker-side subscription management. Also owns how short names map to broker paths,
 * since each broker addresses subscriptions and topics differently.
 */
public interface SubscriptionAdmin extends AutoCloseable {

    /** Broker path of the subscription called {@code name}. */
    String subscriptionPath(String name);

    /** Topic a new subscription called {@code name} binds to when none is given. */
    String defaultTopic(String name);

    /** Broker path of a topic given either by bare name or by full path. */
    default String topicPath(String topic) {
        return topic;
    }

    Optional<Subscription> get(String name);

    default boolean exists(String name) {
        return get(name).isPresent();
    }

    /**
     * Create the subscription bound to {@code topic}.
     *
     * @throws com.alertpull.common.exception.TopicNotFoundException if the topic does not exist
     * @throws com.alertpull.common.exception.TransportException      on any other broker failure
     */
    Subscription create(String name, String topic);

    /**
     * Delete the subscription.
     *
     * @return {@code false} if there was nothing to delete
     */
    boolean delete(String name);

    @Override
    void close();
}
