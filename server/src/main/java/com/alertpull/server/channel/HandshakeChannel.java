/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.channel;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Capacity-one rendezvous between the thread running the message pipeline (sender)
 * and the driver thread (receiver).
 *
 * <p>A sender that asks to await the drain stays blocked until the driver has recorded
 * its handshake and called {@link #markDrained()}, so the sender only acknowledges a
 * message the driver has already counted. {@link #close()} releases every waiter: a
 * sender whose handshake was not yet taken withdraws it and gets {@code false}; a
 * sender whose handshake was taken still waits for the drain, since the driver always
 * drains what it receives.</p>
 */
public final class HandshakeChannel {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFree = lock.newCondition();
    private final Condition slotFilled = lock.newCondition();
    private final Condition drained = lock.newCondition();

    private Handshake slot;
    private long sentSeq;
    private long receivedSeq;
    private long drainedSeq;
    private boolean closed;

    /**
     * Hand a handshake to the driver.
     *
     * @param awaitDrain block until the driver has recorded it
     * @return {@code true} if the handshake was accepted (and, with {@code awaitDrain},
     *         recorded); {@code false} if the channel closed first
     */
    public boolean send(Handshake handshake, boolean awaitDrain) throws InterruptedException {
        lock.lock();
        try {
            while (slot != null && !closed) {
                slotFree.await();
            }
            if (closed) return false;
            slot = handshake;
            long seq = ++sentSeq;
            slotFilled.signalAll();
            if (!awaitDrain) return true;

            while (drainedSeq < seq) {
                if (closed && receivedSeq < seq) {
                    if (slot == handshake) {
                        slot = null;
                    }
                    return false;
                }
                drained.await();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the pending handshake, waiting at most {@code timeout} ({@code null} waits
     * until one arrives or the channel closes).
     *
     * @return the handshake, or empty on timeout or once closed
     */
    public Optional<Handshake> receive(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long nanos = timeout != null ? Math.max(0, timeout.toNanos()) : 0;
            while (slot == null && !closed) {
                if (timeout == null) {
                    slotFilled.await();
                } else {
                    if (nanos <= 0) return Optional.empty();
                    nanos = slotFilled.awaitNanos(nanos);
                }
            }
            if (closed) return Optional.empty();
            return Optional.of(take());
        } finally {
            lock.unlock();
        }
    }

    /**
     * After {@link #close()}, take a handshake left behind by a sender that did not
     * await the drain. Such a sender has already acknowledged its message.
     */
    public Optional<Handshake> pollRemaining() {
        lock.lock();
        try {
            return slot != null ? Optional.of(take()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /** The last received handshake has been recorded. */
    public void markDrained() {
        lock.lock();
        try {
            drainedSeq = receivedSeq;
            drained.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Idempotent. Wakes blocked senders and a blocked receiver. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            slotFree.signalAll();
            slotFilled.signalAll();
            drained.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Whether a handshake is waiting to be received. */
    public boolean hasPending() {
        lock.lock();
        try {
            return slot != null;
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private Handshake take() {
        Handshake h = slot;
        slot = null;
        receivedSeq++;
        slotFree.signalAll();
        return h;
    }
}
