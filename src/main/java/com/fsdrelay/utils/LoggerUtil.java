/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.fsdrelay.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static volatile boolean silent = false;
    private static volatile boolean debugEnabled = false;

    public static void log(String level, String msg) {
        if (silent) return;
        String line = "[" + TS.format(LocalDateTime.now()) + "][" + level + "][" + Thread.currentThread().getName() + "] " + msg;
        if ("ERROR".equals(level)) {
            System.err.println(line);
        } else {
            System.out.println(line);
        }
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }

    /**
     * Logs an error together with the cause's type and message. Stack traces are
     * only printed when debug logging is on.
     */
    public static void error(String msg, Throwable cause) {
        log("ERROR", msg + ": " + cause);
        if (debugEnabled && !silent && cause != null) {
            cause.printStackTrace();
        }
    }

    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled && !silent) {
            log("DEBUG", msgSupplier.get());
        }
    }
    public static boolean isDebugEnabled() { return debugEnabled && !silent; }
    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    public static void setSilent(boolean silent) { LoggerUtil.silent = silent; }

    private LoggerUtil() {}
}
