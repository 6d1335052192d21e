/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * Identity of one live connection: the peer's transport endpoint.
 * Stable for the lifetime of the socket.
 *
 * <p>Port 0 never appears on an accepted socket, so {@link #SERVER} (and any
 * other port-0 identity) marks messages originated by the server itself.
 */
public record ConnectionId(String host, int port) {

    public static final ConnectionId SERVER = new ConnectionId("0.0.0.0", 0);

    public ConnectionId {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Connection host cannot be null or empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
    }

    /**
     * Build an identity from a channel's remote address.
     *
     * @throws IllegalArgumentException if the address is not an IP socket address
     */
    public static ConnectionId of(SocketAddress address) {
        if (!(address instanceof InetSocketAddress)) {
            throw new IllegalArgumentException("Unsupported remote address: " + address);
        }
        InetSocketAddress inet = (InetSocketAddress) address;
        String host = inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        return new ConnectionId(host, inet.getPort());
    }

    public boolean isServerSentinel() {
        return port == 0;
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
