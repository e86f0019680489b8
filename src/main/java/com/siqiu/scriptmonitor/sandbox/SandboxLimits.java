package com.siqiu.scriptmonitor.sandbox;

import java.util.List;

/**
 * Per-execution ceilings applied to every interpreter instance.
 *
 * @param maxStatements     guest statements the script may execute
 * @param maxAllocatedBytes bytes the executing thread may allocate while the script runs
 * @param maxLogEntries     log lines kept; later lines are counted but dropped
 * @param deniedGlobals     global bindings removed before the script starts
 */
public record SandboxLimits(
        long maxStatements,
        long maxAllocatedBytes,
        int maxLogEntries,
        List<String> deniedGlobals
) {
    public SandboxLimits {
        deniedGlobals = List.copyOf(deniedGlobals);
    }
}
