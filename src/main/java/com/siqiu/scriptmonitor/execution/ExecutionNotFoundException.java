package com.siqiu.scriptmonitor.execution;

import java.util.UUID;

public class ExecutionNotFoundException extends RuntimeException {
    public ExecutionNotFoundException(UUID id) {
        super("Execution not found: " + id);
    }
}
