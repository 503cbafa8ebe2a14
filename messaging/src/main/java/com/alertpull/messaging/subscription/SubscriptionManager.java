/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.subscription;

import com.alertpull.common.exception.ConfigurationException;
import com.alertpull.common.exception.TopicNotFoundException;
import com.alertpull.messaging.core.Subscription;
import com.alertpull.messaging.core.SubscriptionAdmin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Idempotent provisioning of named subscriptions on top of a {@link SubscriptionAdmin}.
 * Stateless apart from the admin it wraps.
 */
public class SubscriptionManager {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    private final SubscriptionAdmin admin;

    public SubscriptionManager(SubscriptionAdmin admin) {
        this.admin = Objects.requireNonNull(admin, "admin");
    }

    public boolean exists(String name) {
        return admin.exists(name);
    }

    public String subscriptionPath(String name) {
        return admin.subscriptionPath(name);
    }

    /**
     * Get-or-create against the topic of the same name.
     */
    public Subscription getOrCreate(String name) {
        return getOrCreate(name, admin.defaultTopic(name));
    }

    /**
     * Make sure {@code name} exists, creating it bound to {@code topic} (a bare name or a broker path) if needed.
     *
     * <p>An existing subscription bound to a different topic is returned as it is; the
     * mismatch is only logged. Messages published before creation are not available.</p>
     *
     * @throws ConfigurationException if the subscription is absent and the topic does not exist
     */
    public Subscription getOrCreate(String name, String topic) {
        String expectedTopic = admin.topicPath(topic);
        Optional<Subscription> existing = admin.get(name);
        if (existing.isPresent()) {
            Subscription sub = existing.get();
            if (sub.topic() == null) {
                log.debug("Subscription {} exists; broker does not report its binding, assuming {}",
                        sub.path(), expectedTopic);
                return new Subscription(sub.name(), sub.path(), expectedTopic);
            }
            if (!sub.topic().equals(expectedTopic)) {
                log.warn("Subscription {} is bound to topic {}, not {}; using the existing binding",
                        sub.path(), sub.topic(), expectedTopic);
            } else {
                log.info("Subscription exists: {} (topic {})", sub.path(), sub.topic());
            }
            return sub;
        }
        try {
            Subscription created = admin.create(name, expectedTopic);
            log.info("Created subscription: {} (topic {})", created.path(), created.topic());
            return created;
        } catch (TopicNotFoundException e) {
            throw new ConfigurationException("Subscription '" + name + "' does not exist and cannot be created: "
                    + "topic " + expectedTopic + " does not exist", e);
        }
    }

    /**
     * Delete {@code name}. Deleting an absent subscription is a no-op.
     */
    public void delete(String name) {
        if (admin.delete(name)) {
            log.info("Deleted subscription: {}", admin.subscriptionPath(name));
        } else {
            log.info("Nothing to delete, subscription does not exist: {}", admin.subscriptionPath(name));
        }
    }
}
