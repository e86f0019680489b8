package com.siqiu.scriptmonitor.execution;

public enum ExecutionStatus {
    SUCCESS("success"),
    FAILURE("failure"),            // uncaught script exception or failed assertion
    TIMEOUT("timeout"),            // outer deadline or script time budget exceeded
    RESOURCE_EXCEEDED("resource-exceeded"),
    ENGINE_ERROR("engine-error");  // interpreter fault, not attributable to the script

    private final String wireName;

    ExecutionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Every non-success outcome counts toward consecutive-failure streaks.
     */
    public boolean isFailureLike() {
        return this != SUCCESS;
    }
}
