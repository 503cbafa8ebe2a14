/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.channel;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(10)
class HandshakeChannelTest {

    private final HandshakeChannel channel = new HandshakeChannel();
    private final ExecutorService senders = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        channel.close();
        senders.shutdownNow();
    }

    @Test
    void receiveTimesOutWhenNothingSent() throws Exception {
        assertThat(channel.receive(Duration.ofMillis(50))).isEmpty();
    }

    @Test
    void sendWithoutDrainReturnsOnceQueued() throws Exception {
        assertThat(channel.send(Handshake.accepted(Map.of("a", 1)), false)).isTrue();

        Optional<Handshake> received = channel.receive(Duration.ofSeconds(1));
        assertThat(received).isPresent();
        assertThat(received.get().increment()).isEqualTo(1);
        assertThat(received.get().result()).containsEntry("a", 1);
    }

    @Test
    void drainingSenderWaitsForMarkDrained() throws Exception {
        Future<Boolean> sent = senders.submit(() -> channel.send(Handshake.excluded(), true));

        Optional<Handshake> received = channel.receive(Duration.ofSeconds(5));
        assertThat(received).isPresent();
        assertThat(received.get().counted()).isFalse();
        assertThatThrownBy(() -> sent.get(100, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

        channel.markDrained();
        assertThat(sent.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void secondSenderBlocksWhileSlotOccupied() throws Exception {
        assertThat(channel.send(Handshake.accepted(null), false)).isTrue();
        Future<Boolean> second = senders.submit(() -> channel.send(Handshake.excluded(), false));

        assertThatThrownBy(() -> second.get(100, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
        channel.receive(Duration.ofSeconds(1));
        assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void closeWithdrawsUnreceivedHandshake() throws Exception {
        Future<Boolean> sent = senders.submit(() -> channel.send(Handshake.accepted(Map.of()), true));
        waitUntilPending();

        channel.close();

        assertThat(sent.get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(channel.hasPending()).isFalse();
        assertThat(channel.receive(Duration.ofMillis(10))).isEmpty();
        assertThat(channel.send(Handshake.excluded(), false)).isFalse();
    }

    @Test
    void receivedHandshakeStillCompletesAfterClose() throws Exception {
        Future<Boolean> sent = senders.submit(() -> channel.send(Handshake.accepted(Map.of()), true));
        assertThat(channel.receive(Duration.ofSeconds(5))).isPresent();

        channel.close();
        assertThatThrownBy(() -> sent.get(100, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

        channel.markDrained();
        assertThat(sent.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void closeWakesBlockedReceiver() throws Exception {
        Future<Optional<Handshake>> receiving = senders.submit(() -> channel.receive(null));
        Thread.sleep(50);

        channel.close();

        assertThat(receiving.get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void leftoverNonDrainingHandshakeCanBePolledAfterClose() throws Exception {
        channel.send(Handshake.accepted(Map.of("late", true)), false);
        channel.close();

        assertThat(channel.pollRemaining()).hasValueSatisfying(h -> assertThat(h.result()).containsKey("late"));
        assertThat(channel.pollRemaining()).isEmpty();
    }

    @Test
    void rejectsInvalidIncrement() {
        assertThatThrownBy(() -> new Handshake(2, null)).isInstanceOf(IllegalArgumentException.class);
    }

    private void waitUntilPending() throws InterruptedException {
        while (!channel.hasPending()) {
            Thread.sleep(5);
        }
    }
}
