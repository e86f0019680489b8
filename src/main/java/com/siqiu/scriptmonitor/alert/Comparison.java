package com.siqiu.scriptmonitor.alert;

public enum Comparison {
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    EQ("=="),
    NE("!=");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double actual, double threshold) {
        switch (this) {
            case GT: return actual > threshold;
            case GTE: return actual >= threshold;
            case LT: return actual < threshold;
            case LTE: return actual <= threshold;
            case EQ: return actual == threshold;
            case NE: return actual != threshold;
            default: throw new IllegalStateException("Unhandled comparison " + this);
        }
    }

    /** Only equality comparisons are defined for text. */
    public boolean test(String actual, String expected) {
        switch (this) {
            case EQ: return actual.equals(expected);
            case NE: return !actual.equals(expected);
            default: return false;
        }
    }

    /** Accepts the enum name or its symbol ({@code ">="}, {@code "gte"}, ...). */
    public static Comparison parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("comparator is required");
        }
        String s = raw.trim();
        for (Comparison c : values()) {
            if (c.symbol.equals(s) || c.name().equalsIgnoreCase(s)) return c;
        }
        if ("=".equals(s)) return EQ;
        throw new IllegalArgumentException("Unknown comparator: " + raw);
    }
}
