/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.flightplan;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.core.AbstractCommandHandler;
import com.fsdrelay.protocol.core.ServerPackets;
import com.fsdrelay.utils.LoggerUtil;

/**
 * Relays filed flight plans ({@code $FP}) and acknowledges them to the filer.
 */
public class FlightPlanHandler extends AbstractCommandHandler {

    public FlightPlanHandler(SessionRegistry registry, BroadcastBus bus) {
        super(registry, bus, "FP");
    }

    @Override
    public void handle(InboundRequest request) {
        Packet packet = request.packet();
        String callsign = packet.getSource();
        LoggerUtil.info(prefix(request.connectionId()) + "Flight plan filed by " + callsign);

        relay(request.connectionId(), packet);
        reply(request.connectionId(), ServerPackets.flightPlanAck(callsign, callsign));
    }
}
