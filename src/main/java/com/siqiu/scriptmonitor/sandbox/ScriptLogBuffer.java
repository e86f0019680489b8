package com.siqiu.scriptmonitor.sandbox;

import com.siqiu.scriptmonitor.execution.LogLevel;
import com.siqiu.scriptmonitor.execution.ScriptLogEntry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures script log calls for one execution. Bounded; overflow is summarized in a final entry.
 */
public class ScriptLogBuffer {

    private final int capacity;
    private final Clock clock;
    private final List<ScriptLogEntry> entries = new ArrayList<>();
    private int dropped;

    public ScriptLogBuffer(int capacity, Clock clock) {
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized void append(LogLevel level, String message) {
        if (entries.size() >= capacity) {
            dropped++;
            return;
        }
        entries.add(new ScriptLogEntry(level, message == null ? "" : message, clock.instant()));
    }

    public synchronized List<ScriptLogEntry> snapshot() {
        List<ScriptLogEntry> out = new ArrayList<>(entries);
        if (dropped > 0) {
            out.add(new ScriptLogEntry(LogLevel.WARN,
                    dropped + " log entries dropped (limit " + capacity + ")", clock.instant()));
        }
        return out;
    }
}
