/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.pubsub;

import com.alertpull.common.exception.TransportException;
import com.alertpull.messaging.core.FlowControl;
import com.alertpull.messaging.core.MessageReceiver;
import com.alertpull.messaging.core.StreamingPull;
import com.alertpull.messaging.core.StreamingPullTransport;
import com.google.api.core.ApiService;
import com.google.api.gax.batching.FlowControlSettings;
import com.google.api.gax.batching.FlowController;
import com.google.api.gax.core.InstantiatingExecutorProvider;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.pubsub.v1.PubsubMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Streaming pull over the Google Pub/Sub client library.
 *
 * <p>Each pull is one {@link Subscriber} with a single stream and a single callback
 * thread, so the receiver sees one logical stream. The backlog bound maps onto the
 * client's outstanding-element flow control; the client blocks instead of pulling
 * further once it is reached.</p>
 */
public class PubSubStreamingPullTransport implements StreamingPullTransport {

    private static final Logger log = LoggerFactory.getLogger(PubSubStreamingPullTransport.class);

    private final PubSubClientSettings settings;

    public PubSubStreamingPullTransport(PubSubClientSettings settings) {
        this.settings = settings;
    }

    @Override
    public StreamingPull subscribe(String subscriptionPath, FlowControl flowControl,
                                   MessageReceiver receiver, Consumer<Throwable> failureListener) {
        FlowControlSettings flow = FlowControlSettings.newBuilder()
                .setMaxOutstandingElementCount((long) flowControl.maxOutstandingMessages())
                .setLimitExceededBehavior(FlowController.LimitExceededBehavior.Block)
                .build();

        Subscriber.Builder builder = Subscriber.newBuilder(subscriptionPath,
                        (PubsubMessage message, AckReplyConsumer consumer) ->
                                receiver.receive(new PubSubReceivedMessage(message, consumer)))
                .setFlowControlSettings(flow)
                .setParallelPullCount(1)
                .setExecutorProvider(InstantiatingExecutorProvider.newBuilder()
                        .setExecutorThreadCount(1)
                        .build())
                .setCredentialsProvider(settings.getCredentialsProvider());
        if (settings.getChannelProvider() != null) {
            builder.setChannelProvider(settings.getChannelProvider());
        }
        Subscriber subscriber = builder.build();

        subscriber.addListener(new ApiService.Listener() {
            @Override
            public void failed(ApiService.State from, Throwable failure) {
                log.error("Streaming pull on {} failed while {}", subscriptionPath, from, failure);
                failureListener.accept(failure);
            }
        }, MoreExecutors.directExecutor());

        try {
            subscriber.startAsync().awaitRunning();
        } catch (IllegalStateException e) {
            throw new TransportException("Could not start streaming pull on " + subscriptionPath,
                    e.getCause() != null ? e.getCause() : e);
        }
        log.info("Streaming pull started on {} (max outstanding {})",
                subscriptionPath, flowControl.maxOutstandingMessages());
        return new SubscriberPull(subscriber, subscriptionPath);
    }

    @Override
    public void close() {
        settings.close();
    }

    private static final class SubscriberPull implements StreamingPull {
        private final Subscriber subscriber;
        private final String subscriptionPath;

        SubscriberPull(Subscriber subscriber, String subscriptionPath) {
            this.subscriber = subscriber;
            this.subscriptionPath = subscriptionPath;
        }

        @Override
        public void cancel() {
            subscriber.stopAsync();
        }

        @Override
        public void awaitTermination() {
            try {
                subscriber.awaitTerminated();
                log.info("Streaming pull on {} terminated", subscriptionPath);
            } catch (IllegalStateException e) {
                // The failure was already delivered through the listener.
                log.warn("Streaming pull on {} ended in state {}", subscriptionPath, subscriber.state());
            }
        }
    }
}
