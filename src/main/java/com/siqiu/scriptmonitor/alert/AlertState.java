package com.siqiu.scriptmonitor.alert;

import java.util.UUID;

/**
 * Evaluation state of one rule for one schedule.
 *
 * @param counter         current streak of satisfied evaluations (failure streak for failure rules)
 * @param active          true once the rule has fired for the current streak
 * @param lastExecutionId last record applied to this state, null before the first one
 */
public record AlertState(int counter, boolean active, UUID lastExecutionId) {

    public static final AlertState INITIAL = new AlertState(0, false, null);

    public AlertState satisfied(UUID executionId) {
        return new AlertState(counter + 1, active, executionId);
    }

    public AlertState cleared(UUID executionId) {
        return new AlertState(0, false, executionId);
    }

    public AlertState unchanged(UUID executionId) {
        return new AlertState(counter, active, executionId);
    }

    public AlertState fired() {
        return new AlertState(counter, true, lastExecutionId);
    }
}
