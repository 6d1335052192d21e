/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

import java.time.Duration;
import java.time.Instant;

/**
 * Protocol state of one connection, separate from the Netty channel itself.
 *
 * <p>Instances held by {@link com.fsdrelay.auth.SessionRegistry} are only changed
 * inside {@code SessionRegistry.mutate}; everything handed out by the registry is
 * a {@link #snapshot()}.
 */
public final class Session {

    private final ConnectionId connectionId;
    private final Instant connectedAt;

    private String callsign;
    private ClientState state = ClientState.CONNECTED;
    private ClientType clientType;
    private String realName;
    private String networkId;
    private int rating;
    private String clientString;
    private Position position;

    public Session(ConnectionId connectionId) {
        this(connectionId, Instant.now());
    }

    private Session(ConnectionId connectionId, Instant connectedAt) {
        if (connectionId == null) {
            throw new IllegalArgumentException("Connection id cannot be null");
        }
        this.connectionId = connectionId;
        this.connectedAt = connectedAt;
    }

    public ConnectionId getConnectionId() { return connectionId; }
    public Instant getConnectedAt() { return connectedAt; }

    public String getCallsign() { return callsign; }
    public void setCallsign(String callsign) { this.callsign = callsign; }

    public ClientState getState() { return state; }

    /**
     * Move to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public void transitionTo(ClientState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal session transition " + state + " -> " + next + " for " + connectionId);
        }
        if (next == ClientState.ACTIVE && (callsign == null || callsign.isEmpty())) {
            throw new IllegalStateException("Cannot activate session without callsign: " + connectionId);
        }
        this.state = next;
    }

    public ClientType getClientType() { return clientType; }
    public void setClientType(ClientType clientType) { this.clientType = clientType; }

    public String getRealName() { return realName; }
    public void setRealName(String realName) { this.realName = realName; }

    public String getNetworkId() { return networkId; }
    public void setNetworkId(String networkId) { this.networkId = networkId; }

    public int getRating() { return rating; }
    public void setRating(int rating) { this.rating = rating; }

    public String getClientString() { return clientString; }
    public void setClientString(String clientString) { this.clientString = clientString; }

    public Position getPosition() { return position; }
    public void setPosition(Position position) { this.position = position; }

    public boolean isActive() {
        return state == ClientState.ACTIVE;
    }

    public boolean hasCallsign() {
        return callsign != null && !callsign.isEmpty();
    }

    /**
     * Name used in log lines: the callsign once known, the endpoint before that.
     */
    public String getDisplayName() {
        return hasCallsign() ? callsign : connectionId.toString();
    }

    /**
     * Format: "HH:MM:SS" or "DDd HH:MM:SS" for sessions longer than 24 hours.
     */
    public String getSessionDuration() {
        long seconds = Duration.between(connectedAt, Instant.now()).getSeconds();
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (days > 0) {
            return String.format("%dd %02d:%02d:%02d", days, hours, minutes, secs);
        }
        return String.format("%02d:%02d:%02d", hours, minutes, secs);
    }

    public Session snapshot() {
        Session copy = new Session(connectionId, connectedAt);
        copy.callsign = callsign;
        copy.state = state;
        copy.clientType = clientType;
        copy.realName = realName;
        copy.networkId = networkId;
        copy.rating = rating;
        copy.clientString = clientString;
        copy.position = position;
        return copy;
    }

    @Override
    public String toString() {
        return "Session[" + connectionId + ", callsign=" + callsign + ", state=" + state
                + ", type=" + clientType + "]";
    }
}
