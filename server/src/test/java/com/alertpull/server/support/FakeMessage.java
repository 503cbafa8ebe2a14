/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.support;

import com.alertpull.messaging.core.ReceivedMessage;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/** A delivery that remembers how it was settled. */
public class FakeMessage implements ReceivedMessage {

    public enum Outcome { PENDING, ACKED, NACKED }

    private final String id;
    private final byte[] data;
    private final Map<String, String> attributes;
    private final Instant publishTime;
    private final AtomicReference<Outcome> outcome = new AtomicReference<>(Outcome.PENDING);

    public FakeMessage(String id, String json) {
        this(id, json, Map.of());
    }

    public FakeMessage(String id, String json, Map<String, String> attributes) {
        this.id = id;
        this.data = json.getBytes(StandardCharsets.UTF_8);
        this.attributes = attributes;
        this.publishTime = Instant.parse("2024-05-01T00:00:00Z");
    }

    @Override public byte[] data() { return data; }
    @Override public String messageId() { return id; }
    @Override public Instant publishTime() { return publishTime; }
    @Override public Map<String, String> attributes() { return attributes; }

    @Override
    public void ack() {
        if (!outcome.compareAndSet(Outcome.PENDING, Outcome.ACKED)) {
            throw new IllegalStateException(id + " already " + outcome.get());
        }
    }

    @Override
    public void nack() {
        if (!outcome.compareAndSet(Outcome.PENDING, Outcome.NACKED)) {
            throw new IllegalStateException(id + " already " + outcome.get());
        }
    }

    public Outcome outcome() { return outcome.get(); }
    public boolean isAcked() { return outcome.get() == Outcome.ACKED; }
    public boolean isNacked() { return outcome.get() == Outcome.NACKED; }
}
