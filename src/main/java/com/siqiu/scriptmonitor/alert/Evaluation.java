package com.siqiu.scriptmonitor.alert;

/**
 * What one execution record means for one rule.
 */
public enum Evaluation {
    /** Condition holds; counts toward the streak. */
    SATISFIED,
    /** Condition clearly does not hold; resets the streak. */
    CLEARED,
    /** Record is outside the rule's scope; state is left untouched. */
    IGNORED
}
