/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.position;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.bus.BroadcastMessage;
import com.fsdrelay.bus.Origin;
import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.PacketType;
import com.fsdrelay.protocol.Position;
import com.fsdrelay.protocol.core.AbstractCommandHandler;
import com.fsdrelay.utils.LoggerUtil;

/**
 * Relays ATC ({@code %}) and pilot ({@code @}) position updates, records the
 * sender's last known position, and drops any pilot squawking the hijack code.
 */
public class PositionUpdateHandler extends AbstractCommandHandler {

    public static final String HIJACK_SQUAWK = "7500";
    static final int SQUAWK_INDEX = 1;

    // index of the latitude field; longitude and altitude follow
    private static final int PILOT_LATITUDE_INDEX = 1;
    private static final int ATC_LATITUDE_INDEX = 3;

    public PositionUpdateHandler(SessionRegistry registry, BroadcastBus bus) {
        super(registry, bus, "N", "S", "Y");
    }

    @Override
    public void handle(InboundRequest request) {
        ConnectionId id = request.connectionId();
        Packet packet = request.packet();

        if (packet.getPacketType() == PacketType.PILOT_UPDATE && HIJACK_SQUAWK.equals(packet.dataAt(SQUAWK_INDEX))) {
            LoggerUtil.warn(prefix(id) + "Squawk " + HIJACK_SQUAWK + " from " + packet.getDestination()
                    + ", disconnecting");
            bus.publish(BroadcastMessage.disconnect(Origin.server(), id, "squawk " + HIJACK_SQUAWK));
            return;
        }

        Position position = parsePosition(packet);
        if (position != null) {
            registry.mutate(id, session -> session.setPosition(position));
        }
        relay(id, packet);
    }

    static Position parsePosition(Packet packet) {
        int latitudeIndex;
        if (packet.getPacketType() == PacketType.PILOT_UPDATE) {
            latitudeIndex = PILOT_LATITUDE_INDEX;
        } else if (packet.getPacketType() == PacketType.ATC_UPDATE) {
            latitudeIndex = ATC_LATITUDE_INDEX;
        } else {
            return null;
        }
        String latitude = packet.dataAt(latitudeIndex);
        String longitude = packet.dataAt(latitudeIndex + 1);
        String altitude = packet.dataAt(latitudeIndex + 2);
        if (latitude == null || longitude == null || altitude == null) {
            return null;
        }
        try {
            return new Position(parseCoordinate(latitude), parseCoordinate(longitude), parseAltitude(altitude));
        } catch (NumberFormatException e) {
            LoggerUtil.debug(() -> "Unparsable position in " + packet + ": " + e.getMessage());
            return null;
        }
    }

    private static double parseCoordinate(String raw) {
        double value = Double.parseDouble(raw);
        if (!Double.isFinite(value)) {
            throw new NumberFormatException("Not a finite coordinate: " + raw);
        }
        return value;
    }

    /**
     * @throws NumberFormatException if the value does not round to an {@code int}
     */
    private static int parseAltitude(String raw) {
        double value = Double.parseDouble(raw);
        if (!Double.isFinite(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new NumberFormatException("Altitude out of range: " + raw);
        }
        return (int) Math.round(value);
    }
}
