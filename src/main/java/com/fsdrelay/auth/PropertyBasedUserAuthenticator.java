/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.auth;

import com.fsdrelay.utils.LoggerUtil;
import org.mindrot.jbcrypt.BCrypt;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Authenticates network members based on a property file configuration.
 * Members are configured as:
 * auth.users=networkId:password:Real Name:atcRating:pilotRating,...
 *
 * <p>A password that starts with a BCrypt prefix ({@code $2a$}, {@code $2b$},
 * {@code $2y$}) is treated as a hash; anything else is compared as plain text.
 */
public class PropertyBasedUserAuthenticator implements UserAuthenticator {

    public static final String PROPERTY = "auth.users";
    static final int DEFAULT_RATING = 1;

    private final Map<String, Entry> members = new HashMap<>();

    private static final class Entry {
        final String password;
        final UserRecord record;

        Entry(String password, UserRecord record) {
            this.password = password;
            this.record = record;
        }
    }

    public PropertyBasedUserAuthenticator(Properties properties) {
        parseUsers(properties);
    }

    private void parseUsers(Properties properties) {
        String usersProperty = properties.getProperty(PROPERTY, "");

        if (usersProperty.isEmpty()) {
            LoggerUtil.warn("No users configured in " + PROPERTY + " property");
            return;
        }

        for (String entry : usersProperty.split(",")) {
            String trimmedEntry = entry.trim();
            if (trimmedEntry.isEmpty()) {
                continue;
            }

            String[] parts = trimmedEntry.split(":", -1);
            if (parts.length != 5) {
                LoggerUtil.warn("Invalid user entry (expected networkId:password:name:atcRating:pilotRating): "
                        + parts[0].trim());
                continue;
            }

            String networkId = parts[0].trim();
            String password = parts[1].trim();
            if (networkId.isEmpty() || password.isEmpty()) {
                LoggerUtil.warn("Skipping user entry with empty network id or password");
                continue;
            }

            UserRecord record = new UserRecord(parts[2].trim(), parseRating(parts[3], networkId),
                    parseRating(parts[4], networkId));
            members.put(networkId, new Entry(password, record));
            LoggerUtil.debug("Registered network member: " + networkId);
        }

        LoggerUtil.info("PropertyBasedUserAuthenticator initialized with " + members.size() + " users");
    }

    private static int parseRating(String value, String networkId) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LoggerUtil.warn("Invalid rating '" + value + "' for " + networkId + ", using " + DEFAULT_RATING);
            return DEFAULT_RATING;
        }
    }

    @Override
    public AuthResult authenticate(String networkId, String password) {
        if (networkId == null || password == null || networkId.isEmpty()) {
            return AuthResult.failure(AuthResult.AuthFailure.INVALID_CREDENTIALS, "Missing network id or password");
        }

        Entry entry = members.get(networkId.trim());
        if (entry == null) {
            LoggerUtil.debug("Authentication failed: unknown network id '" + networkId + "'");
            return AuthResult.failure(AuthResult.AuthFailure.USER_NOT_FOUND, "Unknown network id");
        }

        if (!passwordMatches(entry.password, password)) {
            LoggerUtil.debug("Authentication failed: invalid password for network id '" + networkId + "'");
            return AuthResult.failure(AuthResult.AuthFailure.INVALID_CREDENTIALS, "Invalid password");
        }

        LoggerUtil.info("Successful authentication for network id: " + networkId);
        return AuthResult.success(entry.record);
    }

    private static boolean passwordMatches(String stored, String presented) {
        if (isBcryptHash(stored)) {
            try {
                // jBCrypt only knows the 2a revision; 2b and 2y hashes are computed the same way
                return BCrypt.checkpw(presented, "$2a$" + stored.substring(4));
            } catch (IllegalArgumentException e) {
                LoggerUtil.warn("Stored password hash is malformed: " + e.getMessage());
                return false;
            }
        }
        return stored.equals(presented);
    }

    static boolean isBcryptHash(String value) {
        return value.startsWith("$2a$") || value.startsWith("$2b$") || value.startsWith("$2y$");
    }

    public int getUserCount() {
        return members.size();
    }

    public boolean hasUser(String networkId) {
        return networkId != null && members.containsKey(networkId.trim());
    }
}
