/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol.core;

import com.fsdrelay.protocol.Packet;
import com.fsdrelay.protocol.PacketType;

import java.util.List;

/**
 * Builders for packets the server originates.
 */
public final class ServerPackets {

    public static final String ERR_UNAUTHORIZED_SOFTWARE = "016";
    public static final String ERR_INVALID_CREDENTIALS = "003";
    public static final String ERR_NO_FLIGHTPLAN = "008";

    public static final List<String> WELCOME_LINES = List.of(
            "By using your VATSIM assigned identification number on this server you",
            "hereby agree to the terms of the VATSIM Code of Regulations and the",
            "VATSIM User Agreement and the VATSIM Code of Conduct which may be viewed",
            "at http://www.vatsim.net/network/docs/",
            "All logins are tracked and identification numbers are recorded.",
            "Users must enter their real full first names and surnames when logging",
            "onto any of the VATSIM.net servers.");

    static final String METAR_TEMPLATE = "%s 121200Z AUTO 09008KT 9999 FEW040 BKN100 15/08 Q1013 NOSIG";

    private ServerPackets() {}

    /**
     * {@code $DISERVER:CLIENT:<version>:<token>}, the first line every client receives.
     */
    public static Packet serverIdentification(String protocolVersion, String token) {
        return Packet.of(PacketType.REQUEST, "DI", "CLIENT", "SERVER", protocolVersion, token);
    }

    public static Packet error(String callsign, String code, String parameter, String text) {
        return Packet.of(PacketType.REQUEST, "ER", "server", callsign, code, parameter, text);
    }

    public static Packet textMessage(String to, String text) {
        return Packet.of(PacketType.CLIENT, "TM", "server", to, text);
    }

    public static Packet capabilitiesQuery(String callsign) {
        return Packet.of(PacketType.REQUEST, "CQ", "SERVER", callsign, "CAPS");
    }

    public static Packet atcCapabilities(String callsign) {
        return Packet.of(PacketType.REQUEST, "CR", "SERVER", callsign,
                "CAPS", "ATCINFO=1", "SECPOS=1", "MODELDESC=1", "ONGOINGCOORD=1");
    }

    public static Packet ipResponse(String callsign, String ip) {
        return Packet.of(PacketType.REQUEST, "CR", "SERVER", callsign, "IP", ip);
    }

    /**
     * Flight plan acknowledgment: {@code #PCserver:<to>:CCP:BC:<callsign>:0}.
     */
    public static Packet flightPlanAck(String to, String callsign) {
        return Packet.of(PacketType.CLIENT, "PC", "server", to, "CCP", "BC", callsign, "0");
    }

    public static Packet metar(String to, String icao) {
        return Packet.of(PacketType.REQUEST, "AR", "server", to, "METAR", String.format(METAR_TEMPLATE, icao));
    }

    public static Packet heartbeat() {
        return Packet.of(PacketType.CLIENT, "DL", "SERVER", "*", "0", "0");
    }
}
