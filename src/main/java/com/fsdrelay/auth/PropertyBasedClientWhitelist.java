/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.auth;

import com.fsdrelay.utils.LoggerUtil;

import java.util.HashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Whitelist configured as: auth.client.whitelist=69d7,88e4,48e2,de1e
 * Ids are matched case-insensitively. An empty list admits nobody.
 */
public class PropertyBasedClientWhitelist implements ClientWhitelist {

    public static final String PROPERTY = "auth.client.whitelist";

    private final Set<String> allowed = new HashSet<>();

    public PropertyBasedClientWhitelist(Properties properties) {
        String value = properties.getProperty(PROPERTY, "");
        for (String entry : value.split(",")) {
            String id = entry.trim();
            if (!id.isEmpty()) {
                allowed.add(id.toLowerCase(Locale.ROOT));
            }
        }
        if (allowed.isEmpty()) {
            LoggerUtil.warn("No client software configured in " + PROPERTY + "; all clients will be rejected");
        } else {
            LoggerUtil.info("Client whitelist initialized with " + allowed.size() + " entries");
        }
    }

    @Override
    public boolean isAllowed(String clientSoftwareId) {
        if (clientSoftwareId == null) {
            return false;
        }
        return allowed.contains(clientSoftwareId.trim().toLowerCase(Locale.ROOT));
    }

    public int size() {
        return allowed.size();
    }
}
