/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.protocol;

public enum ClientType {
    PILOT,
    ATC,
    OBSERVER
}
