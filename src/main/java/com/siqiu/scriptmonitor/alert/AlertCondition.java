package com.siqiu.scriptmonitor.alert;

import com.siqiu.scriptmonitor.execution.ExecutionRecord;

import java.util.Map;

public interface AlertCondition {

    Evaluation evaluate(ExecutionRecord record);

    /** Human-readable form, e.g. {@code duration_ms > 1000}. */
    String describe();

    /** Data from the record that the condition looked at, copied into the alert snapshot. */
    Map<String, Object> matchedData(ExecutionRecord record);

    static AlertCondition forRule(AlertRule rule) {
        switch (rule.getKind()) {
            case CONSECUTIVE_FAILURES:
                return new ConsecutiveFailureCondition(rule.getThreshold(), rule.countedStatuses());
            case LATENCY:
                return new LatencyCondition(Comparison.parse(rule.getComparator()), rule.getThresholdMs());
            case RESULT_FIELD:
                return new ResultFieldCondition(rule.getFieldPath(), Comparison.parse(rule.getComparator()), rule.getExpectedValue());
            default:
                throw new IllegalArgumentException("Unsupported rule kind " + rule.getKind());
        }
    }
}
