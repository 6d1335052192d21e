/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.auth;

/**
 * Result of an authentication attempt.
 */
public class AuthResult {

    public enum AuthFailure {
        INVALID_CREDENTIALS,
        USER_NOT_FOUND,
        CLIENT_NOT_WHITELISTED,
        OTHER
    }

    private final boolean success;
    private final UserRecord user;
    private final AuthFailure failure;
    private final String errorMessage;

    private AuthResult(boolean success, UserRecord user, AuthFailure failure, String errorMessage) {
        this.success = success;
        this.user = user;
        this.failure = failure;
        this.errorMessage = errorMessage;
    }

    /**
     * Create a successful authentication result.
     *
     * @param user The authenticated member's record
     * @return AuthResult indicating success
     */
    public static AuthResult success(UserRecord user) {
        if (user == null) {
            throw new IllegalArgumentException("Successful auth result needs a user record");
        }
        return new AuthResult(true, user, null, null);
    }

    /**
     * Create a failed authentication result.
     *
     * @param failure Failure category
     * @param message Error message describing the failure
     * @return AuthResult indicating failure
     */
    public static AuthResult failure(AuthFailure failure, String message) {
        return new AuthResult(false, null, failure != null ? failure : AuthFailure.OTHER, message);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return The user record, or null if authentication failed
     */
    public UserRecord getUser() {
        return user;
    }

    /**
     * @return Failure category, or null if authentication succeeded
     */
    public AuthFailure getFailure() {
        return failure;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("AuthResult[success=true, user=%s]", user.realName());
        } else {
            return String.format("AuthResult[success=false, failure=%s, error=%s]", failure, errorMessage);
        }
    }
}
