/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.auth;

/**
 * What the server knows about an authenticated network member.
 */
public record UserRecord(String realName, int atcRating, int pilotRating) {
}
