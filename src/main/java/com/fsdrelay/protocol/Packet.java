/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One FSD protocol line in structured form.
 *
 * <p>Which of {@code source} and {@code destination} appears first on the wire
 * depends on the command; see {@link PacketCodec}. Instances are immutable.
 */
public final class Packet {

    private final PacketType packetType;
    private final String command;
    private final String source;
    private final String destination;
    private final List<String> data;

    public Packet(PacketType packetType, String command, String source, String destination, List<String> data) {
        this.packetType = Objects.requireNonNull(packetType, "packetType");
        this.command = Objects.requireNonNull(command, "command");
        this.source = source != null ? source : "";
        this.destination = destination != null ? destination : "";
        this.data = data != null ? Collections.unmodifiableList(new ArrayList<>(data)) : List.of();
    }

    public static Packet of(PacketType packetType, String command, String source, String destination, String... data) {
        return new Packet(packetType, command, source, destination, Arrays.asList(data));
    }

    public PacketType getPacketType() { return packetType; }
    public String getCommand() { return command; }
    public String getSource() { return source; }
    public String getDestination() { return destination; }
    public List<String> getData() { return data; }

    /**
     * @return the data field at {@code index}, or null when the packet has fewer fields
     */
    public String dataAt(int index) {
        return index >= 0 && index < data.size() ? data.get(index) : null;
    }

    public Packet withData(List<String> newData) {
        return new Packet(packetType, command, source, destination, newData);
    }

    public Packet withSource(String newSource) {
        return new Packet(packetType, command, newSource, destination, data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Packet)) return false;
        Packet other = (Packet) o;
        return packetType == other.packetType
                && command.equals(other.command)
                && source.equals(other.source)
                && destination.equals(other.destination)
                && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packetType, command, source, destination, data);
    }

    @Override
    public String toString() {
        return PacketCodec.format(this).trim();
    }
}
