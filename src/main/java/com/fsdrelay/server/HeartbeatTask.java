/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.server;

import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.bus.BroadcastMessage;
import com.fsdrelay.bus.Origin;
import com.fsdrelay.protocol.core.ServerPackets;
import com.fsdrelay.utils.LoggerUtil;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sends {@code #DLSERVER:*:0:0} to every connected client.
 */
public class HeartbeatTask implements Runnable {

    private final BroadcastBus bus;
    private final int intervalSeconds;
    private ScheduledExecutorService scheduler;

    public HeartbeatTask(BroadcastBus bus, int intervalSeconds) {
        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("Heartbeat interval must be at least 1 second");
        }
        this.bus = bus;
        this.intervalSeconds = intervalSeconds;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fsd-heartbeat");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        LoggerUtil.info("Heartbeat scheduled every " + intervalSeconds + "s");
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
    }

    @Override
    public void run() {
        try {
            int recipients = bus.publish(BroadcastMessage.relay(Origin.server(), ServerPackets.heartbeat()));
            LoggerUtil.debug(() -> "Heartbeat sent to " + recipients + " clients");
        } catch (RuntimeException e) {
            // an escaping exception would cancel the schedule
            LoggerUtil.error("Heartbeat failed", e);
        }
    }
}
