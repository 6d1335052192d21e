/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

/**
 * Thrown when a raw line cannot be turned into a {@link Packet}.
 * The connection that produced the line stays open; only the line is discarded.
 */
public class PacketParseException extends Exception {

    public enum Kind {
        INVALID_FORMAT,
        MISSING_FIELD
    }

    private final Kind kind;

    public PacketParseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}
