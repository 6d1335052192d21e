/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.auth;

import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.core.AbstractCommandHandler;
import com.fsdrelay.utils.LoggerUtil;

/**
 * Handles controller ({@code #DA}) and pilot ({@code #DP}) logoffs: the callsign
 * is released and the other clients are told the client left. The connection
 * itself stays open until the client closes it.
 */
public class LogoffHandler extends AbstractCommandHandler {

    public LogoffHandler(SessionRegistry registry, BroadcastBus bus) {
        super(registry, bus, "DA", "DP");
    }

    @Override
    public void handle(InboundRequest request) {
        Packet packet = request.packet();
        String callsign = packet.getSource();
        boolean indexed = registry.unindexCallsign(callsign);
        LoggerUtil.info(prefix(request.connectionId()) + "Client logged off: " + callsign
                + (indexed ? "" : " (callsign was not registered)"));
        relay(request.connectionId(), packet);
    }
}
