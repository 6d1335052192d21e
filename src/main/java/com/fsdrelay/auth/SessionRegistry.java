/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.auth;

import com.fsdrelay.protocol.ConnectionId;
import com.fsdrelay.protocol.Session;
import com.fsdrelay.utils.LoggerUtil;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Registry of live sessions.
 *
 * <p>Primary store: connection id -> {@link Session}. Secondary index:
 * callsign -> connection id, populated on login and cleared on logoff or
 * disconnect. The index may briefly point at a connection that is already gone;
 * lookups treat that as an unknown callsign and drop the stale entry.
 *
 * <p>Thread-safe. Mutations go through {@link ConcurrentHashMap#computeIfPresent},
 * so writers only contend on the same key and no lock is held across I/O.
 * Callsigns are matched case-insensitively.
 */
public class SessionRegistry {

    private final ConcurrentHashMap<ConnectionId, Session> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConnectionId> callsignIndex = new ConcurrentHashMap<>();

    /**
     * Create a CONNECTED session for a newly accepted connection.
     * A leftover entry for the same endpoint is replaced.
     *
     * @return snapshot of the new session
     */
    public Session register(ConnectionId id) {
        if (id == null) {
            throw new IllegalArgumentException("Cannot register null connection id");
        }
        Session session = new Session(id);
        Session previous = sessions.put(id, session);
        if (previous != null) {
            LoggerUtil.warn("Replaced stale session for " + id + " (" + previous.getDisplayName() + ")");
            unindexAll(id);
        }
        LoggerUtil.debug(() -> "Session registered: " + id + " (total: " + sessions.size() + ")");
        return session.snapshot();
    }

    public Optional<Session> get(ConnectionId id) {
        if (id == null) {
            return Optional.empty();
        }
        Session session = sessions.get(id);
        return session != null ? Optional.of(session.snapshot()) : Optional.empty();
    }

    /**
     * Apply a state change to one session under exclusive access to that entry.
     *
     * <p>The mutation runs on a copy which replaces the stored session atomically,
     * so an exception thrown by {@code mutation} leaves the stored session untouched.
     * A missing entry (client vanished mid-request) is a no-op.
     *
     * @return snapshot after the mutation, or empty if the session no longer exists
     */
    public Optional<Session> mutate(ConnectionId id, Consumer<Session> mutation) {
        if (id == null || mutation == null) {
            return Optional.empty();
        }
        Session updated = sessions.computeIfPresent(id, (key, current) -> {
            Session copy = current.snapshot();
            mutation.accept(copy);
            return copy;
        });
        return updated != null ? Optional.of(updated.snapshot()) : Optional.empty();
    }

    /**
     * Point {@code callsign} at {@code id}.
     *
     * @return false if the session is gone or has no callsign set
     */
    public boolean indexCallsign(String callsign, ConnectionId id) {
        if (callsign == null || callsign.isEmpty() || id == null) {
            return false;
        }
        Session session = sessions.get(id);
        if (session == null || !session.hasCallsign()) {
            LoggerUtil.warn("Not indexing callsign '" + callsign + "': no identified session for " + id);
            return false;
        }

        ConnectionId previous = callsignIndex.put(normalize(callsign), id);
        if (previous != null && !previous.equals(id)) {
            LoggerUtil.warn("Callsign '" + callsign + "' moved from " + previous + " to " + id);
        }
        return true;
    }

    /**
     * Resolve a callsign to its connection.
     * Index entries whose session has disappeared are removed here.
     */
    public Optional<ConnectionId> resolveCallsign(String callsign) {
        if (callsign == null || callsign.isEmpty()) {
            return Optional.empty();
        }
        String key = normalize(callsign);
        ConnectionId id = callsignIndex.get(key);
        if (id == null) {
            return Optional.empty();
        }
        if (!sessions.containsKey(id)) {
            callsignIndex.remove(key, id);
            LoggerUtil.debug(() -> "Dropped stale callsign index entry '" + callsign + "' -> " + id);
            return Optional.empty();
        }
        return Optional.of(id);
    }

    public Optional<Session> findByCallsign(String callsign) {
        return resolveCallsign(callsign).flatMap(this::get);
    }

    /**
     * @return true if an index entry was removed
     */
    public boolean unindexCallsign(String callsign) {
        if (callsign == null || callsign.isEmpty()) {
            return false;
        }
        return callsignIndex.remove(normalize(callsign)) != null;
    }

    /**
     * Remove a session and every callsign index entry that points at it.
     * Removing an unknown connection is a no-op.
     *
     * @return the removed session, if there was one
     */
    public Optional<Session> remove(ConnectionId id) {
        if (id == null) {
            return Optional.empty();
        }
        Session removed = sessions.remove(id);
        unindexAll(id);
        if (removed == null) {
            return Optional.empty();
        }
        LoggerUtil.debug(() -> "Session removed: " + id + " (total: " + sessions.size() + ")");
        return Optional.of(removed.snapshot());
    }

    public int size() {
        return sessions.size();
    }

    public int indexedCallsignCount() {
        return callsignIndex.size();
    }

    public List<Session> sessions() {
        return sessions.values().stream()
                .map(Session::snapshot)
                .collect(Collectors.toList());
    }

    /**
     * Clear all sessions. Primarily for testing purposes.
     */
    public void clear() {
        int count = sessions.size();
        sessions.clear();
        callsignIndex.clear();
        LoggerUtil.info("SessionRegistry cleared (" + count + " sessions removed)");
    }

    private void unindexAll(ConnectionId id) {
        callsignIndex.entrySet().removeIf(entry -> entry.getValue().equals(id));
    }

    private static String normalize(String callsign) {
        return callsign.trim().toUpperCase(Locale.ROOT);
    }
}
