package com.siqiu.scriptmonitor.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.siqiu.scriptmonitor.execution.ExecutionRecord;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public class ExecutionResponse {

    public UUID id;
    public long scheduleId;
    public String status;
    public Instant triggeredAt;
    public Instant startedAt;
    public long durationMs;
    public JsonNode result;
    public JsonNode error;
    public List<LogLine> logs;

    public static class LogLine {
        public String level;
        public String message;
        public Instant timestamp;
    }

    public static ExecutionResponse from(ExecutionRecord record) {
        ExecutionResponse r = new ExecutionResponse();
        r.id = record.id();
        r.scheduleId = record.scheduleId();
        r.status = record.status().wireName();
        r.triggeredAt = record.triggeredAt();
        r.startedAt = record.startedAt();
        r.durationMs = record.durationMs();
        r.result = record.result();
        r.error = record.error();
        r.logs = record.logs().stream().map(e -> {
            LogLine line = new LogLine();
            line.level = e.level().name();
            line.message = e.message();
            line.timestamp = e.timestamp();
            return line;
        }).toList();
        return r;
    }
}
