package com.siqiu.scriptmonitor.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.siqiu.scriptmonitor.execution.ExecutionStatus;
import com.siqiu.scriptmonitor.execution.ScriptLogEntry;

import java.util.List;

public record ScriptOutcome(
        ExecutionStatus status,
        JsonNode result,
        JsonNode error,
        List<ScriptLogEntry> logs
) {
    public ScriptOutcome {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
