package com.siqiu.scriptmonitor.execution;

import java.time.Instant;

public record ScriptLogEntry(
        LogLevel level,
        String message,
        Instant timestamp
) {}
