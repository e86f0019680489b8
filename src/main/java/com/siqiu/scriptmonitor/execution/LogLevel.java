package com.siqiu.scriptmonitor.execution;

import java.util.Locale;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR,
    TIMER;

    /** Unknown or missing levels fall back to INFO. */
    public static LogLevel parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if ("LOG".equals(normalized)) {
            return INFO;
        }
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        for (LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return INFO;
    }
}
