/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

/**
 * Per-connection protocol state. DISCONNECTED is terminal.
 */
public enum ClientState {
    CONNECTED,
    IDENTIFIED,
    ACTIVE,
    DISCONNECTED;

    /**
     * Whether a session in this state may move to {@code next}.
     * Re-identifying and logging in again are allowed; nothing leaves DISCONNECTED.
     */
    public boolean canTransitionTo(ClientState next) {
        if (next == null || this == DISCONNECTED) {
            return false;
        }
        switch (next) {
            case CONNECTED:
                return false;
            case IDENTIFIED:
                return this == CONNECTED || this == IDENTIFIED;
            case ACTIVE:
                return this == CONNECTED || this == IDENTIFIED || this == ACTIVE;
            case DISCONNECTED:
                return true;
            default:
                return false;
        }
    }
}
