/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.bus;

import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.Packet;

import java.util.Objects;

/**
 * Unit carried by the {@link BroadcastBus}: a packet to write, or an order to
 * drop a connection.
 *
 * <p>Delivery rule, evaluated by each subscriber when it consumes the message:
 * <ol>
 *   <li>a message with a target goes to that connection only;</li>
 *   <li>otherwise a server-originated message goes to every connection;</li>
 *   <li>otherwise it goes to every connection except the one it came from.</li>
 * </ol>
 * Disconnect orders always carry a target, so they reach the connection they
 * name even when that connection is also their origin.
 */
public final class BroadcastMessage {

    public enum Kind {
        PACKET,
        DISCONNECT
    }

    private final Kind kind;
    private final Origin origin;
    private final ConnectionId target;
    private final Packet packet;
    private final String reason;

    private BroadcastMessage(Kind kind, Origin origin, ConnectionId target, Packet packet, String reason) {
        this.kind = kind;
        this.origin = Objects.requireNonNull(origin, "origin");
        this.target = target;
        this.packet = packet;
        this.reason = reason;
    }

    /**
     * Fan-out to every connection except the origin (or to all, for server origin).
     */
    public static BroadcastMessage relay(Origin origin, Packet packet) {
        return new BroadcastMessage(Kind.PACKET, origin, null, Objects.requireNonNull(packet, "packet"), null);
    }

    /**
     * Packet for one connection only, typically a reply to its own request.
     */
    public static BroadcastMessage directed(Origin origin, ConnectionId target, Packet packet) {
        return new BroadcastMessage(Kind.PACKET, origin, Objects.requireNonNull(target, "target"),
                Objects.requireNonNull(packet, "packet"), null);
    }

    public static BroadcastMessage disconnect(Origin origin, ConnectionId target, String reason) {
        return new BroadcastMessage(Kind.DISCONNECT, origin, Objects.requireNonNull(target, "target"), null, reason);
    }

    public Kind getKind() { return kind; }
    public Origin getOrigin() { return origin; }
    public ConnectionId getTarget() { return target; }
    public Packet getPacket() { return packet; }
    public String getReason() { return reason; }

    public boolean isDisconnect() {
        return kind == Kind.DISCONNECT;
    }

    public boolean isTargeted() {
        return target != null;
    }

    public boolean isDeliverableTo(ConnectionId subscriber) {
        if (target != null) {
            return target.equals(subscriber);
        }
        if (origin.isServer()) {
            return true;
        }
        return !origin.getConnectionId().equals(subscriber);
    }

    @Override
    public String toString() {
        String to = target != null ? " -> " + target : "";
        if (kind == Kind.DISCONNECT) {
            return "DISCONNECT[" + origin + to + (reason != null ? ", " + reason : "") + "]";
        }
        return "PACKET[" + origin + to + ", " + packet + "]";
    }
}
