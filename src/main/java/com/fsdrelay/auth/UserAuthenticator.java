/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.auth;

/**
 * Verifies network credentials presented at login.
 */
public interface UserAuthenticator {

    /**
     * @param networkId the member's network id (CID)
     * @param password  the password as sent by the client
     * @return success with the member's record, or a failure describing why
     */
    AuthResult authenticate(String networkId, String password);
}
