/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.auth;

/**
 * Decides which client software may identify to the server.
 */
public interface ClientWhitelist {

    /**
     * @param clientSoftwareId the id a client sends in its {@code ID} packet (e.g. "69d7")
     * @return true if the client may proceed
     */
    boolean isAllowed(String clientSoftwareId);
}
