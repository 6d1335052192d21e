/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.bus;

import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.utils.LoggerUtil;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out channel between command handlers (and the heartbeat) and every
 * connection's writer.
 *
 * <p>Delivery is best-effort and at most once per subscriber. Publishing never
 * blocks: each {@link Subscription} keeps a bounded backlog and a slow subscriber
 * loses its oldest messages rather than stalling the publisher. Which
 * subscriber actually writes a message is decided at consumption time by
 * {@link BroadcastMessage#isDeliverableTo}.
 */
public class BroadcastBus {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public BroadcastBus() {
        this(DEFAULT_CAPACITY);
    }

    public BroadcastBus(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Broadcast capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    /**
     * Subscribe a connection.
     *
     * @param owner  connection the subscription delivers to
     * @param wakeup invoked after every enqueue; must not block (may be null)
     */
    public Subscription subscribe(ConnectionId owner, Runnable wakeup) {
        if (owner == null) {
            throw new IllegalArgumentException("Subscription owner cannot be null");
        }
        Subscription subscription = new Subscription(this, owner, capacity, wakeup);
        subscriptions.add(subscription);
        LoggerUtil.debug(() -> "Bus subscriber added: " + owner + " (subscribers: " + subscriptions.size() + ")");
        return subscription;
    }

    /**
     * Publish to every current subscriber. A targeted message is only enqueued
     * on its target's subscription.
     *
     * @return number of subscriptions the message was enqueued on
     */
    public int publish(BroadcastMessage message) {
        if (message == null) {
            LoggerUtil.warn("Cannot publish null broadcast message");
            return 0;
        }
        int enqueued = 0;
        for (Subscription subscription : subscriptions) {
            if (subscription.offer(message)) {
                enqueued++;
            }
        }
        LoggerUtil.debug(() -> "Published " + message);
        return enqueued;
    }

    void unsubscribe(Subscription subscription) {
        subscriptions.remove(subscription);
        LoggerUtil.debug(() -> "Bus subscriber removed: " + subscription.getOwner()
                + " (subscribers: " + subscriptions.size() + ")");
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
