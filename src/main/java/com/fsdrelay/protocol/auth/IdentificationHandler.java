/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.auth;

import com.fsdrelay.auth.ClientWhitelist;
import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.ClientState;
import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.Session;
import com.fsdrelay.protocol.core.AbstractCommandHandler;
import com.fsdrelay.protocol.core.ServerPackets;
import com.fsdrelay.utils.LoggerUtil;

import java.util.Optional;

/**
 * Handles the client identification packet ({@code $ID}), the first step of the
 * login sequence.
 *
 * <p>Layout: {@code $ID<callsign>:SERVER:<client id>:<client name>:<major>:<minor>:<network id>:...}
 */
public class IdentificationHandler extends AbstractCommandHandler {

    private final ClientWhitelist whitelist;

    public IdentificationHandler(SessionRegistry registry, BroadcastBus bus, ClientWhitelist whitelist) {
        super(registry, bus, "ID");
        if (whitelist == null) {
            throw new IllegalArgumentException("Client whitelist is required");
        }
        this.whitelist = whitelist;
    }

    @Override
    public void handle(InboundRequest request) {
        ConnectionId id = request.connectionId();
        Packet packet = request.packet();
        String callsign = packet.getSource();
        String clientId = packet.dataAt(0);

        if (!whitelist.isAllowed(clientId)) {
            LoggerUtil.warn(prefix(id) + "Rejected unauthorized client software '" + clientId + "' for " + callsign);
            reply(id, ServerPackets.error(callsign, ServerPackets.ERR_UNAUTHORIZED_SOFTWARE, "",
                    "Unauthorized client software"));
            return;
        }

        Optional<Session> updated;
        try {
            updated = registry.mutate(id, session -> {
                session.setCallsign(callsign);
                session.setClientString(packet.dataAt(1));
                session.setNetworkId(packet.dataAt(4));
                session.transitionTo(ClientState.IDENTIFIED);
            });
        } catch (IllegalStateException e) {
            LoggerUtil.warn(prefix(id) + "Ignoring identification: " + e.getMessage());
            return;
        }

        if (updated.isEmpty()) {
            LoggerUtil.debug(() -> prefix(id) + "Identification from vanished client " + callsign);
            return;
        }
        LoggerUtil.info(prefix(id) + "Client identified: " + callsign + " using " + packet.dataAt(1));
    }
}
