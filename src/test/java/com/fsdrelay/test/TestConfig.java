/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Centralized test configuration utility.
 * Provides access to test configuration values from test.properties file.
 */
public final class TestConfig {
    private static final String CONFIG_FILE = "/test.properties";

    private TestConfig() {}

    /**
     * Fresh copy of the test properties; callers may modify it.
     */
    public static Properties properties() {
        Properties properties = new Properties();
        try (InputStream input = TestConfig.class.getResourceAsStream(CONFIG_FILE)) {
            if (input == null) {
                throw new IllegalStateException(CONFIG_FILE + " not found on test classpath");
            }
            properties.load(input);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return properties;
    }
}
