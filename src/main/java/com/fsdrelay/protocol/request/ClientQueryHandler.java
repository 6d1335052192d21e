/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fsdrelay.auth.SessionRegistry;
import com.fsdrelay.bus.BroadcastBus;
import com.fsdrelay.protocol.ClientType;
import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.InboundRequest;
import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.PacketType;
import com.fsdrelay.protocol.Position;
import com.fsdrelay.protocol.Session;
import com.fsdrelay.protocol.core.AbstractCommandHandler;
import com.fsdrelay.utils.JacksonConfig;
import com.fsdrelay.utils.LoggerUtil;

import java.util.List;
import java.util.Optional;

/**
 * Handles client queries ({@code $CQ}).
 *
 * <p>ATIS, real-name, system-information and aircraft-configuration queries are
 * answered by the server, directly to the requester. Every other query
 * (including CAPS) is relayed to the other clients unchanged.
 */
public class ClientQueryHandler extends AbstractCommandHandler {

    public static final String VOICE_SERVER_URL = "voice.vatsim.net/uk";

    public static final List<String> ATIS_LINES = List.of(
            "London Heathrow ATIS Information Alpha",
            "Runway 27L in use for landing",
            "Runway 27R in use for departure",
            "Wind 270 at 8 knots",
            "Visibility 10km",
            "Cloud scattered at 4000ft",
            "Temperature 15 Celsius",
            "QNH 1013",
            "Advise on first contact you have information Alpha");

    static final Position DEFAULT_POSITION = new Position(51.5, -0.1, 35000);
    static final String SYSTEM_UID = "-123456789";
    static final String PILOT_SIMULATOR = "Prepar3dV3";

    private final ObjectMapper mapper = JacksonConfig.prettyMapper();

    public ClientQueryHandler(SessionRegistry registry, BroadcastBus bus) {
        super(registry, bus, "CQ");
    }

    @Override
    public void handle(InboundRequest request) throws JsonProcessingException {
        Packet packet = request.packet();
        if (packet.getData().isEmpty()) {
            LoggerUtil.debug(() -> prefix(request.connectionId()) + "Dropping empty query from " + packet.getSource());
            return;
        }

        switch (packet.dataAt(0)) {
            case "ATIS":
                answerAtis(request);
                break;
            case "RN":
                answerRealName(request);
                break;
            case "INF":
                answerSystemInformation(request);
                break;
            case "ACC":
                answerAircraftConfiguration(request);
                break;
            default:
                relay(request.connectionId(), packet);
                break;
        }
    }

    /**
     * Voice server URL, the ATIS text, then an end marker counting every line sent.
     */
    private void answerAtis(InboundRequest request) {
        Packet packet = request.packet();
        ConnectionId id = request.connectionId();
        String station = packet.getDestination();
        String requester = packet.getSource();
        LoggerUtil.info(prefix(id) + "ATIS request from " + requester + " to " + station);

        reply(id, Packet.of(PacketType.REQUEST, "CR", station, requester, "ATIS", "V", VOICE_SERVER_URL));
        for (String line : ATIS_LINES) {
            reply(id, Packet.of(PacketType.REQUEST, "CR", station, requester, "ATIS", "T", line));
        }
        reply(id, Packet.of(PacketType.REQUEST, "CR", station, requester, "ATIS", "E",
                String.valueOf(ATIS_LINES.size() + 2)));
    }

    /**
     * Answered from the requester's own session. The field after the name is the
     * ATC sector file for controllers, which the server does not track.
     */
    private void answerRealName(InboundRequest request) {
        ConnectionId id = request.connectionId();
        Optional<Session> requester = registry.get(id);
        if (requester.isEmpty() || !requester.get().hasCallsign()) {
            LoggerUtil.debug(() -> prefix(id) + "Real name query from client without callsign");
            return;
        }
        Session session = requester.get();
        ClientType type = session.getClientType();
        if (type != ClientType.ATC && type != ClientType.PILOT) {
            LoggerUtil.debug(() -> prefix(id) + "Real name query from " + session.getCallsign() + " with type " + type);
            return;
        }
        String realName = session.getRealName() != null ? session.getRealName() : "";
        reply(id, Packet.of(PacketType.REQUEST, "CR", session.getCallsign(), request.packet().getSource(),
                "RN", realName, "", String.valueOf(session.getRating())));
    }

    private void answerSystemInformation(InboundRequest request) {
        ConnectionId id = request.connectionId();
        String target = request.packet().getDestination();
        LoggerUtil.info(prefix(id) + "System information request from " + request.packet().getSource() + " to " + target);

        Optional<Session> found = registry.findByCallsign(target);
        if (found.isEmpty()) {
            LoggerUtil.warn(prefix(id) + "System information request for unknown client: " + target);
            return;
        }
        reply(id, Packet.of(PacketType.CLIENT, "TM", target, "DATA", systemInformation(found.get())));
    }

    static String systemInformation(Session session) {
        Position position = session.getPosition() != null ? session.getPosition() : DEFAULT_POSITION;
        String simulator = session.getClientType() == ClientType.ATC || session.getClientType() == null
                ? "" : PILOT_SIMULATOR;
        return nullToEmpty(session.getClientString())
                + " PID=(" + nullToEmpty(session.getNetworkId()) + ")"
                + " ((" + nullToEmpty(session.getRealName()) + "))"
                + " IP=(" + session.getConnectionId().host() + ")"
                + " SYS_UID=" + SYSTEM_UID
                + " FSVER=" + simulator
                + " LT=" + position.latitude()
                + " LO=" + position.longitude()
                + " AL=" + position.altitude();
    }

    /**
     * The reply uses the CQ command rather than CR; clients expect it that way.
     */
    private void answerAircraftConfiguration(InboundRequest request) throws JsonProcessingException {
        ConnectionId id = request.connectionId();
        String target = request.packet().getDestination();
        LoggerUtil.info(prefix(id) + "Aircraft configuration request from " + request.packet().getSource() + " to " + target);

        if (registry.resolveCallsign(target).isEmpty()) {
            LoggerUtil.warn(prefix(id) + "ACC request for unknown client: " + target);
            return;
        }
        reply(id, Packet.of(PacketType.REQUEST, "CQ", target, request.packet().getSource(),
                "ACC", aircraftConfiguration()));
    }

    String aircraftConfiguration() throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode config = root.putObject("config");
        config.put("is_full_data", true);

        ObjectNode lights = config.putObject("lights");
        lights.put("strobe_on", false);
        lights.put("landing_on", false);
        lights.put("taxi_on", true);
        lights.put("beacon_on", true);
        lights.put("nav_on", true);
        lights.put("logo_on", false);

        ObjectNode engines = config.putObject("engines");
        engines.putObject("1").put("on", true);
        engines.putObject("2").put("on", true);

        config.put("gear_down", false);
        config.put("flaps_pct", 0);
        config.put("spoilers_out", false);
        config.put("on_ground", true);
        return mapper.writeValueAsString(root);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
