package com.siqiu.scriptmonitor.worker;

import java.time.Instant;
import java.util.Map;

/**
 * One due trigger. Carries snapshots so later edits to the schedule do not affect a queued run.
 */
public record RunRequest(
        long scheduleId,
        String script,
        Map<String, String> params,
        Map<String, String> env,
        Instant triggerTime
) {
    public RunRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
        env = env == null ? Map.of() : Map.copyOf(env);
    }
}
