/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.core;

import java.util.function.Consumer;

/**
 * Broker-agnostic source of streaming pulls. Implementations exist for Google Pub/Sub
 * and RabbitMQ.
 *
 * <p>The transport owns its own delivery threads; callers only see the
 * {@link MessageReceiver} callbacks. Backpressure is the transport's job: no more than
 * {@link FlowControl#maxOutstandingMessages()} unsettled messages are delivered.</p>
 */
public interface StreamingPullTransport extends AutoCloseable {

    /**
     * Start pulling from a subscription.
     *
     * @param subscriptionPath broker address of the subscription
     * @param flowControl      backlog bound
     * @param receiver         invoked for every delivery
     * @param failureListener  invoked at most once if the pull dies on its own
     * @return a handle used to cancel and drain the pull
     * @throws com.alertpull.common.exception.TransportException if the pull cannot be started
     */
    StreamingPull subscribe(String subscriptionPath, FlowControl flowControl,
                            MessageReceiver receiver, Consumer<Throwable> failureListener);

    @Override
    void close();
}
