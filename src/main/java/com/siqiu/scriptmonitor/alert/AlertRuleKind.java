package com.siqiu.scriptmonitor.alert;

public enum AlertRuleKind {
    CONSECUTIVE_FAILURES,
    LATENCY,
    RESULT_FIELD
}
