/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.bus;

import com.fsdrelay.protocol.ConnectionId;

import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One subscriber's view of the {@link BroadcastBus}: a bounded backlog that drops
 * its oldest entry when a new one arrives while full.
 *
 * <p>Producers call {@link #offer} from any thread; the owner drains with
 * {@link #poll()}. The backlog is guarded by the subscription's own monitor,
 * so subscriptions never block each other.
 */
public final class Subscription implements AutoCloseable {

    private final BroadcastBus bus;
    private final ConnectionId owner;
    private final int capacity;
    private final Runnable wakeup;

    private final ArrayDeque<BroadcastMessage> backlog;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private long lagged;

    Subscription(BroadcastBus bus, ConnectionId owner, int capacity, Runnable wakeup) {
        this.bus = bus;
        this.owner = owner;
        this.capacity = capacity;
        this.wakeup = wakeup;
        this.backlog = new ArrayDeque<>(Math.min(capacity, 64));
    }

    public ConnectionId getOwner() {
        return owner;
    }

    /**
     * Enqueue a published message, evicting the oldest one if the backlog is full.
     * Messages targeted at another connection are not enqueued and do not wake
     * the owner.
     *
     * @return false if nothing was enqueued
     */
    boolean offer(BroadcastMessage message) {
        if (closed.get()) {
            return false;
        }
        if (message.isTargeted() && !message.getTarget().equals(owner)) {
            return false;
        }
        synchronized (this) {
            if (backlog.size() >= capacity) {
                backlog.pollFirst();
                lagged++;
            }
            backlog.addLast(message);
        }
        if (wakeup != null) {
            wakeup.run();
        }
        return true;
    }

    /**
     * Next message addressed to the owner, skipping messages the delivery rule
     * excludes (for example the owner's own relayed packets).
     *
     * @return the message, or null if nothing deliverable is pending
     */
    public BroadcastMessage poll() {
        synchronized (this) {
            BroadcastMessage message;
            while ((message = backlog.pollFirst()) != null) {
                if (message.isDeliverableTo(owner)) {
                    return message;
                }
            }
            return null;
        }
    }

    /**
     * Number of messages dropped since the last call, then resets the counter.
     */
    public synchronized long takeLagged() {
        long count = lagged;
        lagged = 0;
        return count;
    }

    public synchronized int pending() {
        return backlog.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            bus.unsubscribe(this);
            synchronized (this) {
                backlog.clear();
            }
        }
    }

    @Override
    public String toString() {
        return "Subscription[" + owner + ", pending=" + pending() + "]";
    }
}
