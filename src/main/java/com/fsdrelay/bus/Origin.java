/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.bus;

import com.fsdrelay.protocol.ConnectionId;

import java.util.Objects;

/**
 * Who put a message on the bus: the server itself, or one client connection.
 */
public final class Origin {

    private static final Origin SERVER = new Origin(ConnectionId.SERVER);

    private final ConnectionId connectionId;

    private Origin(ConnectionId connectionId) {
        this.connectionId = connectionId;
    }

    public static Origin server() {
        return SERVER;
    }

    /**
     * Origin for a client connection. A port-0 id maps to {@link #server()}.
     */
    public static Origin connection(ConnectionId connectionId) {
        Objects.requireNonNull(connectionId, "connectionId");
        return connectionId.isServerSentinel() ? SERVER : new Origin(connectionId);
    }

    public boolean isServer() {
        return connectionId.isServerSentinel();
    }

    public ConnectionId getConnectionId() {
        return connectionId;
    }

    public boolean isConnection(ConnectionId id) {
        return !isServer() && connectionId.equals(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Origin)) return false;
        return connectionId.equals(((Origin) o).connectionId);
    }

    @Override
    public int hashCode() {
        return connectionId.hashCode();
    }

    @Override
    public String toString() {
        return isServer() ? "server" : connectionId.toString();
    }
}
