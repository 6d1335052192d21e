/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

/**
 * FSD packet categories, determined by the first character of a line.
 */
public enum PacketType {
    REQUEST('$', "Requests and responses"),
    CLIENT('#', "Client add/remove and text messages"),
    ATC_UPDATE('%', "ATC position update"),
    PILOT_UPDATE('@', "Pilot position update"),
    VENDOR_SPECIFIC('!', "Vendor specific"),
    VENDOR_DATA('&', "Vendor specific data"),
    VENDOR_OTHER('-', "Vendor specific other");

    private final char prefix;
    private final String description;

    PacketType(char prefix, String description) {
        this.prefix = prefix;
        this.description = description;
    }

    public char getPrefix() {
        return prefix;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Position updates carry a single identifier (the subject of the update)
     * and no explicit source.
     */
    public boolean isPositionUpdate() {
        return this == ATC_UPDATE || this == PILOT_UPDATE;
    }

    /**
     * Look up the packet type for a line prefix.
     *
     * @param prefix first character of a raw line
     * @return the matching type, or null for an unknown prefix
     */
    public static PacketType fromPrefix(char prefix) {
        for (PacketType type : values()) {
            if (type.prefix == prefix) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("%s(%c)", name(), prefix);
    }
}
