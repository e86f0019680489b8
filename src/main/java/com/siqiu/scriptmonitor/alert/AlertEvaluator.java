package com.siqiu.scriptmonitor.alert;

import com.siqiu.scriptmonitor.execution.ExecutionRecord;
import com.siqiu.scriptmonitor.metrics.MonitorMetrics;
import com.siqiu.scriptmonitor.notify.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Applies a schedule's enabled alert rules to each of its execution records.
 * <p>
 * Records are partitioned by schedule id onto single-thread executors, so all state of one schedule
 * has exactly one writer and is updated in record order, while different schedules proceed in
 * parallel. Execution workers only enqueue and never wait for evaluation.
 */
@Component
public class AlertEvaluator implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(AlertEvaluator.class);

    private final AlertRuleRepository rules;
    private final AlertStateStore states;
    private final AlertEventRepository events;
    private final NotificationDispatcher dispatcher;
    private final MonitorMetrics metrics;
    private final Clock clock;
    private final ExecutorService[] partitions;

    public AlertEvaluator(
            AlertRuleRepository rules,
            AlertStateStore states,
            AlertEventRepository events,
            NotificationDispatcher dispatcher,
            MonitorMetrics metrics,
            Clock clock,
            @Value("${monitor.alerts.partitions:4}") int partitionCount
    ) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("monitor.alerts.partitions must be >= 1");
        }
        this.rules = rules;
        this.states = states;
        this.events = events;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
        this.partitions = new ExecutorService[partitionCount];
        for (int i = 0; i < partitionCount; i++) {
            String name = "alert-eval-" + i;
            partitions[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
        }
    }

    /**
     * Queue a record for evaluation on its schedule's partition.
     */
    public void submit(ExecutionRecord record) {
        ExecutorService partition = partitions[Math.floorMod(Long.hashCode(record.scheduleId()), partitions.length)];
        try {
            partition.execute(() -> {
                try {
                    evaluate(record);
                } catch (Exception e) {
                    log.error("alert_evaluation_failed scheduleId={} executionId={}", record.scheduleId(), record.id(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("alert_evaluation_rejected scheduleId={} executionId={} reason=shutdown", record.scheduleId(), record.id());
        }
    }

    /**
     * Evaluate one record against every enabled rule of its schedule. Must be called from the schedule's
     * partition (or, in tests, from a single thread).
     *
     * @return events fired by this record
     */
    List<AlertEvent> evaluate(ExecutionRecord record) {
        long scheduleId = record.scheduleId();
        List<AlertRule> bound = rules.findByScheduleIdAndEnabledTrue(scheduleId);
        Set<Long> ruleIds = bound.stream().map(AlertRule::getId).collect(Collectors.toSet());
        states.retainRules(scheduleId, ruleIds);

        List<AlertEvent> fired = new ArrayList<>();
        for (AlertRule rule : bound) {
            AlertCondition condition;
            try {
                condition = AlertCondition.forRule(rule);
            } catch (IllegalArgumentException e) {
                log.warn("alert_rule_config_error ruleId={} scheduleId={} reason={}", rule.getId(), scheduleId, e.getMessage());
                continue;
            }

            AlertState before = states.get(scheduleId, rule);
            if (record.id().equals(before.lastExecutionId())) {
                // already applied, e.g. replay after a checkpoint
                continue;
            }

            Evaluation evaluation = condition.evaluate(record);
            AlertState after = apply(before, evaluation, record.id());

            boolean fire = evaluation == Evaluation.SATISFIED
                    && after.counter() >= rule.getThreshold()
                    && !(rule.isEdgeTriggered() && after.active());
            if (fire && rule.isEdgeTriggered()) {
                after = after.fired();
            }
            states.put(scheduleId, rule, after);

            if (fire) {
                fired.add(fire(rule, condition, record, after));
            }
        }
        return fired;
    }

    private static AlertState apply(AlertState state, Evaluation evaluation, UUID executionId) {
        switch (evaluation) {
            case SATISFIED:
                return state.satisfied(executionId);
            case CLEARED:
                return state.cleared(executionId);
            default:
                return state.unchanged(executionId);
        }
    }

    private AlertEvent fire(AlertRule rule, AlertCondition condition, ExecutionRecord record, AlertState state) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("ruleName", rule.getName());
        snapshot.put("kind", rule.getKind().name());
        snapshot.put("condition", condition.describe());
        snapshot.put("counter", state.counter());
        snapshot.put("status", record.status().wireName());
        snapshot.put("durationMs", record.durationMs());
        snapshot.put("startedAt", record.startedAt().toString());
        snapshot.put("matched", condition.matchedData(record));

        AlertEvent event = new AlertEvent(UUID.randomUUID(), rule.getId(), record.scheduleId(), record.id(),
                clock.instant(), snapshot);
        try {
            events.recordAlertEvent(event);
        } catch (RuntimeException e) {
            log.error("alert_event_write_failed eventId={} ruleId={}", event.id(), rule.getId(), e);
        }

        metrics.incAlertsFired();
        log.info("alert_fired eventId={} ruleId={} scheduleId={} executionId={} condition='{}'",
                event.id(), rule.getId(), record.scheduleId(), record.id(), condition.describe());

        dispatcher.dispatch(event, rule.getChannelIds());
        return event;
    }

    @Override
    public void destroy() throws InterruptedException {
        for (ExecutorService partition : partitions) {
            partition.shutdown();
        }
        for (ExecutorService partition : partitions) {
            if (!partition.awaitTermination(5, TimeUnit.SECONDS)) {
                partition.shutdownNow();
            }
        }
    }
}
