/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

/**
 * A parsed packet together with the connection it arrived on.
 */
public record InboundRequest(ConnectionId connectionId, Packet packet) {

    public InboundRequest {
        if (connectionId == null || packet == null) {
            throw new IllegalArgumentException("Inbound request needs a connection id and a packet");
        }
    }

    public String command() {
        return packet.getCommand();
    }
}
