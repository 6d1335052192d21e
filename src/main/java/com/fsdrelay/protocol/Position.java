/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

/**
 * Last known position of a client, altitude in feet.
 */
public record Position(double latitude, double longitude, int altitude) {
}
