/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared ObjectMapper instance. ObjectMapper is thread-safe after configuration,
 * so a single instance can be reused by every command handler.
 */
public final class JacksonConfig {

    private static final ObjectMapper PRETTY_INSTANCE = new ObjectMapper();

    static {
        PRETTY_INSTANCE.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private JacksonConfig() {}

    /** ObjectMapper with pretty-printing, used for JSON blobs clients display verbatim. */
    public static ObjectMapper prettyMapper() {
        return PRETTY_INSTANCE;
    }
}
