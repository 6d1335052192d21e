/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.server;

import java.util.Properties;

/**
 * Server settings, read once at startup from application properties.
 */
public final class ServerConfig {

    public static final String BIND_ADDRESS = "bind.address";
    public static final String PORT = "server.port";
    public static final String NAME = "server.name";
    public static final String VERSION = "server.version";
    public static final String PROTOCOL_VERSION = "server.protocol.version";
    public static final String MAX_CLIENTS = "server.max.clients";
    public static final String HEARTBEAT_INTERVAL = "heartbeat.interval.seconds";
    public static final String BROADCAST_CAPACITY = "broadcast.capacity";
    public static final String DISPATCHER_QUEUE_CAPACITY = "dispatcher.queue.capacity";
    public static final String LOG_DEBUG = "log.debug";

    private final String bindAddress;
    private final int port;
    private final String name;
    private final String version;
    private final String protocolVersion;
    private final int maxClients;
    private final int heartbeatIntervalSeconds;
    private final int broadcastCapacity;
    private final int dispatcherQueueCapacity;
    private final boolean debug;

    private ServerConfig(Properties props) {
        this.bindAddress = props.getProperty(BIND_ADDRESS, "0.0.0.0").trim();
        this.port = intProperty(props, PORT, 6809, 0, 65535);
        this.name = props.getProperty(NAME, "FSD Relay").trim();
        this.version = props.getProperty(VERSION, "1.0.0").trim();
        this.protocolVersion = props.getProperty(PROTOCOL_VERSION, "VATSIM FSD V3.13").trim();
        this.maxClients = intProperty(props, MAX_CLIENTS, 1000, 1, Integer.MAX_VALUE);
        this.heartbeatIntervalSeconds = intProperty(props, HEARTBEAT_INTERVAL, 30, 1, Integer.MAX_VALUE);
        this.broadcastCapacity = intProperty(props, BROADCAST_CAPACITY, 1000, 1, Integer.MAX_VALUE);
        this.dispatcherQueueCapacity = intProperty(props, DISPATCHER_QUEUE_CAPACITY, 1000, 1, Integer.MAX_VALUE);
        this.debug = Boolean.parseBoolean(props.getProperty(LOG_DEBUG, "false").trim());

        if (bindAddress.isEmpty()) {
            throw new IllegalArgumentException(BIND_ADDRESS + " must not be empty");
        }
    }

    /**
     * @throws IllegalArgumentException naming the offending key when a value is not a valid number
     */
    public static ServerConfig fromProperties(Properties props) {
        return new ServerConfig(props != null ? props : new Properties());
    }

    public static ServerConfig defaults() {
        return fromProperties(new Properties());
    }

    private static int intProperty(Properties props, String key, int defaultValue, int min, int max) {
        String raw = props.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + raw + "' is not a number", e);
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value
                    + " (expected " + min + ".." + max + ")");
        }
        return value;
    }

    public String getBindAddress() { return bindAddress; }
    public int getPort() { return port; }
    public String getName() { return name; }
    public String getVersion() { return version; }
    public String getProtocolVersion() { return protocolVersion; }
    public int getMaxClients() { return maxClients; }
    public int getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
    public int getBroadcastCapacity() { return broadcastCapacity; }
    public int getDispatcherQueueCapacity() { return dispatcherQueueCapacity; }
    public boolean isDebug() { return debug; }

    @Override
    public String toString() {
        return String.format("ServerConfig[%s:%d, name=%s, protocol=%s, maxClients=%d, heartbeat=%ds]",
                bindAddress, port, name, protocolVersion, maxClients, heartbeatIntervalSeconds);
    }
}
