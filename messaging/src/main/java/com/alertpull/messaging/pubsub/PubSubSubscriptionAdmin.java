/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.pubsub;

import com.alertpull.common.exception.TopicNotFoundException;
import com.alertpull.common.exception.TransportException;
import com.alertpull.messaging.core.Subscription;
import com.alertpull.messaging.core.SubscriptionAdmin;
import com.google.api.gax.rpc.AlreadyExistsException;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.NotFoundException;
import com.google.cloud.pubsub.v1.SubscriptionAdminClient;
import com.google.cloud.pubsub.v1.SubscriptionAdminSettings;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.TopicName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Subscription management through the Pub/Sub admin API.
 *
 * <p>Subscriptions live in the consumer's project; by default each binds to the topic of
 * the same name in the publisher's project.</p>
 */
public class PubSubSubscriptionAdmin implements SubscriptionAdmin {

    private static final Logger log = LoggerFactory.getLogger(PubSubSubscriptionAdmin.class);

    private final PubSubClientSettings settings;
    private final SubscriptionAdminClient client;

    public PubSubSubscriptionAdmin(PubSubClientSettings settings) {
        this.settings = settings;
        try {
            SubscriptionAdminSettings.Builder builder = SubscriptionAdminSettings.newBuilder()
                    .setCredentialsProvider(settings.getCredentialsProvider());
            if (settings.getChannelProvider() != null) {
                builder.setTransportChannelProvider(settings.getChannelProvider());
            }
            this.client = SubscriptionAdminClient.create(builder.build());
        } catch (IOException e) {
            throw new TransportException("Could not create Pub/Sub subscription admin client", e);
        }
    }

    @Override
    public String subscriptionPath(String name) {
        return ProjectSubscriptionName.format(settings.getProjectId(), name);
    }

    @Override
    public String defaultTopic(String name) {
        return TopicName.format(settings.getTopicProjectId(), name);
    }

    @Override
    public String topicPath(String topic) {
        return TopicName.isParsableFrom(topic) ? topic : TopicName.format(settings.getTopicProjectId(), topic);
    }

    @Override
    public Optional<Subscription> get(String name) {
        String path = subscriptionPath(name);
        try {
            com.google.pubsub.v1.Subscription sub = client.getSubscription(path);
            return Optional.of(new Subscription(name, path, sub.getTopic()));
        } catch (NotFoundException e) {
            return Optional.empty();
        } catch (ApiException e) {
            throw new TransportException("Failed to look up subscription " + path, e);
        }
    }

    @Override
    public Subscription create(String name, String topic) {
        String path = subscriptionPath(name);
        try {
            com.google.pubsub.v1.Subscription created = client.createSubscription(
                    com.google.pubsub.v1.Subscription.newBuilder()
                            .setName(path)
                            .setTopic(topic)
                            .build());
            log.info("Created subscription {} on topic {}", path, created.getTopic());
            return new Subscription(name, path, created.getTopic());
        } catch (NotFoundException e) {
            throw new TopicNotFoundException(topic, e);
        } catch (AlreadyExistsException e) {
            // Lost a creation race; report whatever won.
            return get(name).orElseThrow(() -> new TransportException(
                    "Subscription " + path + " reported as existing but cannot be read", e));
        } catch (ApiException e) {
            throw new TransportException("Failed to create subscription " + path, e);
        }
    }

    @Override
    public boolean delete(String name) {
        String path = subscriptionPath(name);
        try {
            client.deleteSubscription(path);
            return true;
        } catch (NotFoundException e) {
            return false;
        } catch (ApiException e) {
            throw new TransportException("Failed to delete subscription " + path, e);
        }
    }

    @Override
    public void close() {
        client.close();
    }
}
