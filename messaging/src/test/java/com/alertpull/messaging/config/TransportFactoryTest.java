/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.messaging.config;

import com.alertpull.common.exception.ConfigurationException;
import com.alertpull.common.exception.TransportException;
import com.alertpull.common.model.BrokerConfig;
import com.alertpull.messaging.core.FlowControl;
import com.alertpull.messaging.core.MessageReceiver;
import com.alertpull.messaging.core.StreamingPull;
import com.alertpull.messaging.core.StreamingPullTransport;
import com.alertpull.messaging.core.Subscription;
import com.alertpull.messaging.core.SubscriptionAdmin;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class TransportFactoryTest {

    @Test
    void adminFailureClosesTheTransport() {
        ClosingTransport transport = new ClosingTransport(null);

        assertThatThrownBy(() -> TransportFactory.assemble(transport, () -> {
            throw new TransportException("admin connection refused", null);
        })).isInstanceOf(TransportException.class).hasMessageContaining("admin connection refused");

        assertThat(transport.closed).isTrue();
    }

    @Test
    void closeFailureIsKeptAsSuppressed() {
        ClosingTransport transport = new ClosingTransport(new IllegalStateException("channel already gone"));

        Throwable thrown = catchThrowable(() -> TransportFactory.assemble(transport, () -> {
            throw new TransportException("admin connection refused", null);
        }));

        assertThat(thrown).isInstanceOf(TransportException.class);
        assertThat(thrown.getSuppressed()).hasSize(1);
        assertThat(thrown.getSuppressed()[0]).hasMessage("channel already gone");
    }

    @Test
    void successfulPairClosesBoth() {
        ClosingTransport transport = new ClosingTransport(null);
        ClosingAdmin admin = new ClosingAdmin();

        TransportFactory.assemble(transport, () -> admin).close();

        assertThat(transport.closed).isTrue();
        assertThat(admin.closed).isTrue();
    }

    @Test
    void pubSubWithoutProjectIsRejectedBeforeConnecting() {
        BrokerConfig config = new BrokerConfig();

        assertThatThrownBy(() -> TransportFactory.create(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("project_id");
    }

    private static final class ClosingTransport implements StreamingPullTransport {
        private final RuntimeException closeFailure;
        private boolean closed;

        ClosingTransport(RuntimeException closeFailure) {
            this.closeFailure = closeFailure;
        }

        @Override
        public StreamingPull subscribe(String subscriptionPath, FlowControl flowControl,
                                       MessageReceiver receiver, Consumer<Throwable> failureListener) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void close() {
            closed = true;
            if (closeFailure != null) throw closeFailure;
        }
    }

    private static final class ClosingAdmin implements SubscriptionAdmin {
        private boolean closed;

        @Override public String subscriptionPath(String name) { return name; }
        @Override public String defaultTopic(String name) { return name; }
        @Override public Optional<Subscription> get(String name) { return Optional.empty(); }
        @Override public Subscription create(String name, String topic) { throw new UnsupportedOperationException(); }
        @Override public boolean delete(String name) { return false; }
        @Override public void close() { closed = true; }
    }
}
