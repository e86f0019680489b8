package com.siqiu.scriptmonitor.alert;

import com.siqiu.scriptmonitor.execution.ExecutionRecord;
import com.siqiu.scriptmonitor.execution.ExecutionStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class ConsecutiveFailureCondition implements AlertCondition {

    private final int threshold;
    private final Set<ExecutionStatus> counted;

    /**
     * @param counted failure statuses that extend the streak; empty means all failure-like statuses
     */
    public ConsecutiveFailureCondition(int threshold, Set<ExecutionStatus> counted) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        this.threshold = threshold;
        this.counted = Set.copyOf(counted);
    }

    @Override
    public Evaluation evaluate(ExecutionRecord record) {
        ExecutionStatus status = record.status();
        if (!status.isFailureLike()) {
            return Evaluation.CLEARED;
        }
        if (counted.isEmpty() || counted.contains(status)) {
            return Evaluation.SATISFIED;
        }
        return Evaluation.IGNORED;
    }

    @Override
    public String describe() {
        String scope = counted.isEmpty()
                ? "any failure"
                : counted.stream().map(ExecutionStatus::wireName).sorted().collect(Collectors.joining("|"));
        return "consecutive " + scope + " >= " + threshold;
    }

    @Override
    public Map<String, Object> matchedData(ExecutionRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", record.status().wireName());
        if (record.error() != null) {
            data.put("error", record.error().path("message").asText(null));
        }
        return data;
    }
}
