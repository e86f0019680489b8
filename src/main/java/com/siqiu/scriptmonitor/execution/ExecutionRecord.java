package com.siqiu.scriptmonitor.execution;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable outcome of one script run. {@code result} is the script's return value and is
 * {@code null} for every non-success status; {@code error} describes what went wrong.
 */
public record ExecutionRecord(
        UUID id,
        long scheduleId,
        Instant triggeredAt,
        Instant startedAt,
        long durationMs,
        ExecutionStatus status,
        JsonNode result,
        JsonNode error,
        List<ScriptLogEntry> logs
) {
    public ExecutionRecord {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
