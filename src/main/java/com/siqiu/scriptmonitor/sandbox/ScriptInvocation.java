package com.siqiu.scriptmonitor.sandbox;

import com.siqiu.scriptmonitor.network.FetchSession;

import java.time.Duration;
import java.util.Map;

/**
 * Everything one sandboxed run needs: the script snapshot, its bindings, its wall-clock budget
 * and the egress session bound to the execution's outer deadline.
 */
public record ScriptInvocation(
        long scheduleId,
        String script,
        Map<String, String> params,
        Map<String, String> env,
        Duration timeBudget,
        FetchSession fetch
) {
    public ScriptInvocation {
        params = params == null ? Map.of() : Map.copyOf(params);
        env = env == null ? Map.of() : Map.copyOf(env);
    }
}
