/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.request;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.core.AbstractCommandHandler;
import com.fsdrelay.protocol.core.ServerPackets;
import com.fsdrelay.utils.LoggerUtil;

/**
 * Answers weather requests ({@code $AX<callsign>:SERVER:METAR:<ICAO>}) with a
 * fixed observation for the requested station.
 */
public class MetarRequestHandler extends AbstractCommandHandler {

    public MetarRequestHandler(SessionRegistry registry, BroadcastBus bus) {
        super(registry, bus, "AX");
    }

    @Override
    public void handle(InboundRequest request) {
        ConnectionId id = request.connectionId();
        Packet packet = request.packet();
        if (packet.getData().size() < 2) {
            LoggerUtil.warn(prefix(id) + "Invalid METAR request format: " + packet);
            return;
        }
        String icao = packet.dataAt(1);
        LoggerUtil.info(prefix(id) + "METAR request for " + icao + " from " + packet.getSource());
        reply(id, ServerPackets.metar(packet.getSource(), icao));
    }
}
