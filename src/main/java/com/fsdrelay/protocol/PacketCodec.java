/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Converts between raw FSD lines and {@link Packet}s.
 *
 * <p>Wire layout: {@code <prefix><command><ident1>:<ident2>:<data0>:<data1>...\r\n}.
 * The meaning of the two identifiers depends on the command:
 * <ul>
 *   <li>{@code DI} (server identification): destination first, then source.</li>
 *   <li>ATC/pilot position updates: the single identifier is the destination
 *       (the subject of the update); the source is implicit and left empty.</li>
 *   <li>Everything else: source first, then destination.</li>
 * </ul>
 * For position updates the text between the first and second colon is not an
 * identifier and is dropped, so those packets do not round-trip.
 */
public final class PacketCodec {

    public static final char DELIMITER = ':';
    public static final String LINE_TERMINATOR = "\r\n";

    public static final String SERVER_IDENTIFICATION = "DI";

    private static final Set<String> TWO_LETTER_COMMANDS = Set.of(
            "DI", "ID", "TM", "AA", "AP", "DA", "DP", "CQ", "CR", "FP", "NV");

    private static final Set<String> ONE_LETTER_COMMANDS = Set.of("N", "S", "Y", "C", "R");

    private PacketCodec() {}

    /**
     * Parse one raw line.
     *
     * @param raw line as received, with or without its terminator
     * @return the parsed packet
     * @throws PacketParseException if the line is empty, has an unknown prefix, or no delimiter
     */
    public static Packet parse(String raw) throws PacketParseException {
        if (raw == null) {
            throw new PacketParseException(PacketParseException.Kind.INVALID_FORMAT, "Empty packet");
        }
        String line = stripTerminator(raw).trim();
        if (line.isEmpty()) {
            throw new PacketParseException(PacketParseException.Kind.INVALID_FORMAT, "Empty packet");
        }

        char prefix = line.charAt(0);
        PacketType packetType = PacketType.fromPrefix(prefix);
        if (packetType == null) {
            throw new PacketParseException(PacketParseException.Kind.INVALID_FORMAT, "Unknown prefix: " + prefix);
        }

        String withoutPrefix = line.substring(1);
        int firstColon = withoutPrefix.indexOf(DELIMITER);
        if (firstColon < 0) {
            throw new PacketParseException(PacketParseException.Kind.MISSING_FIELD, "No delimiter found in: " + line);
        }

        String commandIdent = withoutPrefix.substring(0, firstColon);
        String rest = withoutPrefix.substring(firstColon + 1);

        String command = extractCommand(commandIdent);
        String firstIdent = commandIdent.substring(command.length());

        int secondColon = rest.indexOf(DELIMITER);
        String secondIdent = secondColon < 0 ? rest : rest.substring(0, secondColon);
        List<String> data = secondColon < 0
                ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(rest.substring(secondColon + 1).split(String.valueOf(DELIMITER), -1)));

        String source;
        String destination;
        if (SERVER_IDENTIFICATION.equals(command)) {
            destination = firstIdent;
            source = secondIdent;
        } else if (packetType.isPositionUpdate()) {
            destination = firstIdent;
            source = "";
        } else {
            source = firstIdent;
            destination = secondIdent;
        }

        return new Packet(packetType, command, source, destination, data);
    }

    /**
     * Format a packet back into its wire form, terminator included.
     */
    public static String format(Packet packet) {
        StringBuilder sb = new StringBuilder(64);
        sb.append(packet.getPacketType().getPrefix()).append(packet.getCommand());

        if (SERVER_IDENTIFICATION.equals(packet.getCommand())) {
            sb.append(packet.getDestination()).append(DELIMITER).append(packet.getSource());
        } else if (packet.getPacketType().isPositionUpdate()) {
            sb.append(packet.getDestination());
        } else {
            sb.append(packet.getSource()).append(DELIMITER).append(packet.getDestination());
        }

        if (!packet.getData().isEmpty()) {
            sb.append(DELIMITER).append(String.join(String.valueOf(DELIMITER), packet.getData()));
        }

        return sb.append(LINE_TERMINATOR).toString();
    }

    /**
     * Split the leading command mnemonic off the command+identifier segment.
     * Known two-letter commands win over known one-letter ones; anything else
     * is assumed to be a two-letter command.
     */
    static String extractCommand(String commandIdent) {
        if (commandIdent.length() >= 2) {
            String firstTwo = commandIdent.substring(0, 2);
            if (TWO_LETTER_COMMANDS.contains(firstTwo)) {
                return firstTwo;
            }
        }
        if (!commandIdent.isEmpty()) {
            String firstOne = commandIdent.substring(0, 1);
            if (ONE_LETTER_COMMANDS.contains(firstOne)) {
                return firstOne;
            }
        }
        return commandIdent.length() >= 2 ? commandIdent.substring(0, 2) : commandIdent;
    }

    private static String stripTerminator(String raw) {
        int end = raw.length();
        while (end > 0 && (raw.charAt(end - 1) == '\n' || raw.charAt(end - 1) == '\r')) {
            end--;
        }
        return raw.substring(0, end);
    }
}
