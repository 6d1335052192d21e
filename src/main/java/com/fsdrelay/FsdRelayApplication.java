/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay;

import com.fsdrelay.auth.PropertyBasedClientWhitelist;
import com.fsdrelay.auth.PropertyBasedUserAuthenticator;
import com.fsdrelay.server.FsdServer;
import com.fsdrelay.server.ServerConfig;
import com.fsdrelay.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Launcher for the FSD relay server.
 */
public class FsdRelayApplication {

    static final Path EXTERNAL_CONFIG = Paths.get("config", "application.properties");

    private static FsdServer server;
    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        try {
            Properties properties = loadConfiguration();
            ServerConfig config = ServerConfig.fromProperties(properties);
            LoggerUtil.setDebugEnabled(config.isDebug());

            printBanner(config);

            server = new FsdServer(config,
                    new PropertyBasedClientWhitelist(properties),
                    new PropertyBasedUserAuthenticator(properties));
            server.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LoggerUtil.info("Shutting down " + config.getName() + "...");
                shutdown();
            }, "fsd-shutdown"));

            LoggerUtil.info(config.getName() + " started on port " + server.getBoundPort());

            shutdownLatch.await();

        } catch (Exception e) {
            LoggerUtil.error("Failed to start FSD relay", e);
            System.exit(1);
        }
    }

    /**
     * Loads application.properties from the classpath, then applies overrides from
     * config/application.properties in the working directory if that file exists.
     */
    static Properties loadConfiguration() throws IOException {
        Properties config = new Properties();

        try (InputStream inputStream = FsdRelayApplication.class.getClassLoader()
                .getResourceAsStream("application.properties")) {

            if (inputStream == null) {
                throw new IOException("application.properties not found in classpath");
            }
            config.load(inputStream);
        }

        if (Files.exists(EXTERNAL_CONFIG)) {
            LoggerUtil.info("Loading configuration overrides from external file: " + EXTERNAL_CONFIG.toAbsolutePath());
            try (InputStream inputStream = Files.newInputStream(EXTERNAL_CONFIG)) {
                Properties externalConfig = new Properties();
                externalConfig.load(inputStream);
                config.putAll(externalConfig);
                LoggerUtil.info("Loaded " + externalConfig.size() + " configuration overrides");
            }
        } else {
            LoggerUtil.info("No external configuration file found, using classpath defaults only");
        }

        return config;
    }

    private static void printBanner(ServerConfig config) {
        LoggerUtil.info("========================================");
        LoggerUtil.info(" " + config.getName() + " " + config.getVersion());
        LoggerUtil.info(" protocol: " + config.getProtocolVersion());
        LoggerUtil.info("========================================");
    }

    private static void shutdown() {
        try {
            if (server != null) {
                server.stop();
            }
        } finally {
            shutdownLatch.countDown();
        }
    }
}
