/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.auth;

import com.fsdrelay.auth.AuthResult;
import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.auth.UserAuthenticator;
import com.fsdrelay.auth.UserRecord;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.ClientState;
import com.fsdrelay.protocol.ClientType;
import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.PacketType;
import com.fsdrelay.protocol.Session;
import com.fsdrelay.protocol.core.AbstractCommandHandler;
import com.fsdrelay.protocol.core.ServerPackets;
import com.fsdrelay.utils.LoggerUtil;

import java.util.Optional;

/**
 * Handles controller ({@code #AA}) and pilot ({@code #AP}) logins.
 *
 * <p>On success the session becomes ACTIVE and is indexed by callsign, the
 * client receives the welcome text and its capability/IP exchange, and every
 * other client is told that a new client joined.
 */
public class LoginHandler extends AbstractCommandHandler {

    private final UserAuthenticator authenticator;

    /**
     * Login fields pulled out of the two packet layouts.
     */
    private static final class Credentials {
        final ClientType type;
        final String networkId;
        final String password;
        final String realName;
        final String requestedRating;

        Credentials(ClientType type, String networkId, String password, String realName, String requestedRating) {
            this.type = type;
            this.networkId = networkId;
            this.password = password;
            this.realName = realName;
            this.requestedRating = requestedRating;
        }
    }

    public LoginHandler(SessionRegistry registry, BroadcastBus bus, UserAuthenticator authenticator) {
        super(registry, bus, "AA", "AP");
        if (authenticator == null) {
            throw new IllegalArgumentException("Authenticator is required");
        }
        this.authenticator = authenticator;
    }

    @Override
    public void handle(InboundRequest request) {
        ConnectionId id = request.connectionId();
        Packet packet = request.packet();
        String callsign = packet.getSource();
        Credentials credentials = extract(packet);

        if (isBlank(credentials.networkId) || isBlank(credentials.password)) {
            LoggerUtil.warn(prefix(id) + "Login from " + callsign + " without network id or password");
            return;
        }

        AuthResult result = authenticator.authenticate(credentials.networkId, credentials.password);
        if (!result.isSuccess()) {
            LoggerUtil.warn(prefix(id) + "Login failed for " + callsign + " (" + credentials.networkId + "): "
                    + result.getFailure() + " " + result.getErrorMessage());
            reply(id, ServerPackets.error(callsign, ServerPackets.ERR_INVALID_CREDENTIALS, "", "Invalid credentials"));
            return;
        }

        UserRecord user = result.getUser();
        int rating = credentials.type == ClientType.ATC ? user.atcRating() : user.pilotRating();
        Optional<Session> updated;
        try {
            updated = registry.mutate(id, session -> {
                session.setCallsign(callsign);
                session.setClientType(credentials.type);
                session.setRealName(user.realName());
                session.setRating(rating);
                session.setNetworkId(credentials.networkId);
                session.transitionTo(ClientState.ACTIVE);
            });
        } catch (IllegalStateException e) {
            LoggerUtil.warn(prefix(id) + "Ignoring login: " + e.getMessage());
            return;
        }
        if (updated.isEmpty()) {
            LoggerUtil.debug(() -> prefix(id) + "Login from vanished client " + callsign);
            return;
        }

        registry.indexCallsign(callsign, id);
        LoggerUtil.info(prefix(id) + credentials.type + " logged in: " + callsign + " (" + credentials.networkId
                + ", " + user.realName() + ", rating " + rating + ")");
        if (!isBlank(credentials.requestedRating) && !credentials.requestedRating.equals(String.valueOf(rating))) {
            LoggerUtil.debug(() -> prefix(id) + callsign + " requested rating " + credentials.requestedRating
                    + ", granted " + rating);
        }

        for (String line : ServerPackets.WELCOME_LINES) {
            reply(id, ServerPackets.textMessage(callsign, line));
        }
        reply(id, ServerPackets.capabilitiesQuery(callsign));
        if (credentials.type == ClientType.ATC) {
            reply(id, ServerPackets.atcCapabilities(callsign));
            reply(id, ServerPackets.ipResponse(callsign, id.host()));
        } else {
            reply(id, ServerPackets.ipResponse(callsign, id.host()));
            reply(id, ServerPackets.error(callsign, ServerPackets.ERR_NO_FLIGHTPLAN, callsign, "No flightplan"));
        }

        relay(id, new Packet(PacketType.CLIENT, packet.getCommand(), callsign, "SERVER", packet.getData()));
    }

    private static Credentials extract(Packet packet) {
        if ("AA".equals(packet.getCommand())) {
            // #AA<callsign>:SERVER:<real name>:<network id>:<password>:<rating>:<protocol>
            return new Credentials(ClientType.ATC, packet.dataAt(1), packet.dataAt(2), packet.dataAt(0),
                    packet.dataAt(3));
        }
        // #AP<callsign>:SERVER:<network id>:<password>:<rating>:<protocol>:<sim type>:<real name>
        return new Credentials(ClientType.PILOT, packet.dataAt(0), packet.dataAt(1), packet.dataAt(5),
                packet.dataAt(2));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
