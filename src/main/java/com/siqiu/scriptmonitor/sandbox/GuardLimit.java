package com.siqiu.scriptmonitor.sandbox;

public enum GuardLimit {
    STATEMENTS("statements"),
    MEMORY("memory"),
    STACK("stack"),
    WALL_CLOCK("wall_clock");

    private final String label;

    GuardLimit(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
