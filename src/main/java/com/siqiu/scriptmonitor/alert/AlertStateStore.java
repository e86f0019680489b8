package com.siqiu.scriptmonitor.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory alert state, grouped by schedule id and then rule id.
 * <p>
 * Every key of a schedule is only touched from that schedule's evaluator partition. Rules flagged
 * {@code checkpoint} are loaded from and written through to {@link AlertStateRepository}; the rest
 * start from zero after a restart.
 */
@Component
public class AlertStateStore {

    private static final Logger log = LoggerFactory.getLogger(AlertStateStore.class);

    private final AlertStateRepository checkpoints;
    private final Clock clock;
    private final Map<Long, Map<Long, AlertState>> states = new ConcurrentHashMap<>();

    public AlertStateStore(AlertStateRepository checkpoints, Clock clock) {
        this.checkpoints = checkpoints;
        this.clock = clock;
    }

    public AlertState get(long scheduleId, AlertRule rule) {
        Map<Long, AlertState> rules = rulesOf(scheduleId);
        AlertState state = rules.get(rule.getId());
        if (state != null) return state;

        if (rule.isCheckpoint()) {
            try {
                state = checkpoints.find(scheduleId, rule.getId()).orElse(AlertState.INITIAL);
            } catch (RuntimeException e) {
                log.warn("alert_state_load_failed scheduleId={} ruleId={}", scheduleId, rule.getId(), e);
                state = AlertState.INITIAL;
            }
        } else {
            state = AlertState.INITIAL;
        }
        rules.put(rule.getId(), state);
        return state;
    }

    public void put(long scheduleId, AlertRule rule, AlertState state) {
        rulesOf(scheduleId).put(rule.getId(), state);
        if (rule.isCheckpoint()) {
            try {
                checkpoints.checkpoint(scheduleId, rule.getId(), state, clock.instant());
            } catch (RuntimeException e) {
                // in-memory state stays authoritative; the next update retries the write
                log.warn("alert_state_checkpoint_failed scheduleId={} ruleId={}", scheduleId, rule.getId(), e);
            }
        }
    }

    /** Drop state of rules that are no longer enabled for the schedule. */
    public void retainRules(long scheduleId, Collection<Long> ruleIds) {
        Map<Long, AlertState> rules = states.get(scheduleId);
        if (rules == null) return;
        rules.keySet().retainAll(ruleIds);
        if (rules.isEmpty()) {
            states.remove(scheduleId, rules);
        }
    }

    int size() {
        return states.values().stream().mapToInt(Map::size).sum();
    }

    int scheduleCount() {
        return states.size();
    }

    private Map<Long, AlertState> rulesOf(long scheduleId) {
        return states.computeIfAbsent(scheduleId, id -> new ConcurrentHashMap<>());
    }
}
