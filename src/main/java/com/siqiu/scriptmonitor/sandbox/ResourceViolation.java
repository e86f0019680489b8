package com.siqiu.scriptmonitor.sandbox;

public record ResourceViolation(GuardLimit limit, String message) {}
