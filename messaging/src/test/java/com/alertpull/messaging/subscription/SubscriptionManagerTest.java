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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionManagerTest {

    private InMemoryAdmin admin;
    private SubscriptionManager manager;

    @BeforeEach
    void setUp() {
        admin = new InMemoryAdmin();
        admin.topics.add("topics/ztf_alerts");
        manager = new SubscriptionManager(admin);
    }

    @Test
    void createsAgainstSameNamedTopic() {
        Subscription sub = manager.getOrCreate("ztf_alerts");

        assertThat(sub.path()).isEqualTo("subs/ztf_alerts");
        assertThat(sub.topic()).isEqualTo("topics/ztf_alerts");
        assertThat(manager.exists("ztf_alerts")).isTrue();
    }

    @Test
    void getOrCreateIsIdempotent() {
        manager.getOrCreate("ztf_alerts");
        manager.getOrCreate("ztf_alerts");

        assertThat(admin.creates).isEqualTo(1);
    }

    @Test
    void existingBindingWinsOverExpectedTopic() {
        admin.topics.add("topics/other");
        admin.subscriptions.put("mine", "topics/other");

        Subscription sub = manager.getOrCreate("mine", "ztf_alerts");

        assertThat(sub.topic()).isEqualTo("topics/other");
        assertThat(admin.creates).isZero();
    }

    @Test
    void unreportedBindingIsAssumedExpected() {
        admin.subscriptions.put("queue", null);

        assertThat(manager.getOrCreate("queue", "ztf_alerts").topic()).isEqualTo("topics/ztf_alerts");
    }

    @Test
    void missingTopicIsConfigurationError() {
        assertThatThrownBy(() -> manager.getOrCreate("nope"))
                .isInstanceOf(ConfigurationException.class)
                .hasCauseInstanceOf(TopicNotFoundException.class);
        assertThat(manager.exists("nope")).isFalse();
    }

    @Test
    void deleteIsIdempotent() {
        manager.getOrCreate("ztf_alerts");

        manager.delete("ztf_alerts");
        manager.delete("ztf_alerts");

        assertThat(manager.exists("ztf_alerts")).isFalse();
    }

    /** Subscriptions under subs/, topics under topics/. A null binding means "not reported". */
    static class InMemoryAdmin implements SubscriptionAdmin {
        final Map<String, String> subscriptions = new HashMap<>();
        final Set<String> topics = new HashSet<>();
        int creates;

        @Override public String subscriptionPath(String name) { return "subs/" + name; }
        @Override public String defaultTopic(String name) { return "topics/" + name; }
        @Override public String topicPath(String topic) { return topic.startsWith("topics/") ? topic : "topics/" + topic; }

        @Override
        public Optional<Subscription> get(String name) {
            if (!subscriptions.containsKey(name)) return Optional.empty();
            return Optional.of(new Subscription(name, subscriptionPath(name), subscriptions.get(name)));
        }

        @Override
        public Subscription create(String name, String topic) {
            if (!topics.contains(topic)) throw new TopicNotFoundException(topic, null);
            creates++;
            subscriptions.put(name, topic);
            return new Subscription(name, subscriptionPath(name), topic);
        }

        @Override
        public boolean delete(String name) {
            if (!subscriptions.containsKey(name)) return false;
            subscriptions.remove(name);
            return true;
        }

        @Override public void close() {}
    }
}
