package com.siqiu.scriptmonitor.execution;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class ExecutionQueryService {

    static final int MAX_LIMIT = 100;

    private final ExecutionRecordRepository records;

    public ExecutionQueryService(ExecutionRecordRepository records) {
        this.records = records;
    }

    public ExecutionRecord getOrThrow(UUID id) {
        return records.findById(id).orElseThrow(() -> new ExecutionNotFoundException(id));
    }

    public List<ExecutionRecord> recent(long scheduleId, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return records.findRecentBySchedule(scheduleId, bounded);
    }
}
