package com.siqiu.scriptmonitor.alert;

import com.siqiu.scriptmonitor.execution.ExecutionRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compares execution duration with a threshold regardless of outcome.
 */
public class LatencyCondition implements AlertCondition {

    private final Comparison comparison;
    private final long thresholdMs;

    public LatencyCondition(Comparison comparison, Long thresholdMs) {
        if (thresholdMs == null) {
            throw new IllegalArgumentException("latency rule requires threshold_ms");
        }
        this.comparison = comparison;
        this.thresholdMs = thresholdMs;
    }

    @Override
    public Evaluation evaluate(ExecutionRecord record) {
        return comparison.test(record.durationMs(), thresholdMs) ? Evaluation.SATISFIED : Evaluation.CLEARED;
    }

    @Override
    public String describe() {
        return "duration_ms " + comparison.symbol() + " " + thresholdMs;
    }

    @Override
    public Map<String, Object> matchedData(ExecutionRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("durationMs", record.durationMs());
        data.put("status", record.status().wireName());
        return data;
    }
}
