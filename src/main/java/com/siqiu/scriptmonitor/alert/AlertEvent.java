package com.siqiu.scriptmonitor.alert;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One firing of a rule, with a snapshot of the condition and the data that matched it.
 */
public record AlertEvent(
        UUID id,
        long ruleId,
        long scheduleId,
        UUID executionId,
        Instant triggeredAt,
        Map<String, Object> snapshot
) {
    public AlertEvent {
        snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
    }
}
