package com.siqiu.scriptmonitor.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siqiu.scriptmonitor.execution.ExecutionRecord;
import com.siqiu.scriptmonitor.execution.ExecutionStatus;
import com.siqiu.scriptmonitor.metrics.MonitorMetrics;
import com.siqiu.scriptmonitor.notify.NotificationDispatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertEvaluatorTest {

    private static final long SCHEDULE = 7L;
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Mock AlertRuleRepository rules;
    @Mock AlertStateRepository checkpoints;
    @Mock AlertEventRepository events;
    @Mock NotificationDispatcher dispatcher;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
    private AlertEvaluator evaluator;
    private AlertStateStore states;

    @BeforeEach
    void setUp() {
        states = new AlertStateStore(checkpoints, clock);
        evaluator = new AlertEvaluator(rules, states, events, dispatcher,
                new MonitorMetrics(new SimpleMeterRegistry()), clock, 1);
    }

    @AfterEach
    void tearDown() throws Exception {
        evaluator.destroy();
    }

    @Test
    void threeFailuresFireExactlyOnceOnTheThird() {
        AlertRule rule = withId(AlertRule.consecutiveFailures(SCHEDULE, "down", 3), 1L);
        rule.setChannelIds(List.of(10L));
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(rule));

        List<Integer> firedAt = run(ExecutionStatus.FAILURE, ExecutionStatus.FAILURE, ExecutionStatus.FAILURE);

        assertThat(firedAt).containsExactly(3);
        verify(events, times(1)).recordAlertEvent(any());
        verify(dispatcher, times(1)).dispatch(any(AlertEvent.class), eq(List.of(10L)));
    }

    @Test
    void successResetsTheStreak() {
        AlertRule rule = withId(AlertRule.consecutiveFailures(SCHEDULE, "down", 3), 1L);
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(rule));

        List<Integer> firedAt = run(
                ExecutionStatus.FAILURE, ExecutionStatus.FAILURE, ExecutionStatus.SUCCESS,
                ExecutionStatus.FAILURE, ExecutionStatus.FAILURE, ExecutionStatus.FAILURE);

        assertThat(firedAt).containsExactly(6);
    }

    @Test
    void failuresPastThresholdDoNotRefireUntilCleared() {
        AlertRule rule = withId(AlertRule.consecutiveFailures(SCHEDULE, "down", 2), 1L);
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(rule));

        List<Integer> firedAt = run(
                ExecutionStatus.TIMEOUT, ExecutionStatus.ENGINE_ERROR, ExecutionStatus.RESOURCE_EXCEEDED,
                ExecutionStatus.FAILURE, ExecutionStatus.SUCCESS, ExecutionStatus.FAILURE, ExecutionStatus.FAILURE);

        assertThat(firedAt).containsExactly(2, 7);
    }

    @Test
    void statusSubsetLeavesCounterUntouchedForOtherFailures() {
        AlertRule rule = withId(AlertRule.consecutiveFailures(SCHEDULE, "timeouts", 2), 1L);
        rule.setStatuses("timeout");
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(rule));

        List<Integer> firedAt = run(ExecutionStatus.TIMEOUT, ExecutionStatus.FAILURE, ExecutionStatus.TIMEOUT);

        assertThat(firedAt).containsExactly(3);
    }

    @Test
    void latencyRuleFiresOnEveryQualifyingExecution() {
        AlertRule rule = withId(AlertRule.latency(SCHEDULE, "slow", Comparison.GT, 1000), 2L);
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(rule));

        List<Integer> firedAt = new ArrayList<>();
        long[] durations = {1500, 2000, 900, 1001};
        for (int i = 0; i < durations.length; i++) {
            if (!evaluator.evaluate(record(ExecutionStatus.SUCCESS, durations[i])).isEmpty()) {
                firedAt.add(i + 1);
            }
        }

        assertThat(firedAt).containsExactly(1, 2, 4);
    }

    @Test
    void dedupedLatencyRuleFiresOncePerStreak() {
        AlertRule rule = withId(AlertRule.latency(SCHEDULE, "slow", Comparison.GTE, 1000), 2L);
        rule.setDedupe(true);
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(rule));

        List<Integer> firedAt = new ArrayList<>();
        long[] durations = {1500, 2000, 900, 1000, 1200};
        for (int i = 0; i < durations.length; i++) {
            if (!evaluator.evaluate(record(ExecutionStatus.FAILURE, durations[i])).isEmpty()) {
                firedAt.add(i + 1);
            }
        }

        assertThat(firedAt).containsExactly(1, 4);
    }

    @Test
    void resultFieldRuleComparesNumericField() throws Exception {
        AlertRule rule = withId(AlertRule.resultField(SCHEDULE, "low stock", "data.count", Comparison.LT, "5"), 3L);
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(rule));

        ExecutionRecord low = new ExecutionRecord(UUID.randomUUID(), SCHEDULE, T0, T0, 10, ExecutionStatus.SUCCESS,
                mapper.readTree("{\"data\":{\"count\":3}}"), null, List.of());
        ExecutionRecord high = new ExecutionRecord(UUID.randomUUID(), SCHEDULE, T0, T0, 10, ExecutionStatus.SUCCESS,
                mapper.readTree("{\"data\":{\"count\":9}}"), null, List.of());

        assertThat(evaluator.evaluate(high)).isEmpty();
        List<AlertEvent> fired = evaluator.evaluate(low);

        assertThat(fired).hasSize(1);
        assertThat(fired.get(0).snapshot()).containsEntry("ruleName", "low stock");
    }

    @Test
    void sameRecordIsAppliedOnlyOnce() {
        AlertRule rule = withId(AlertRule.consecutiveFailures(SCHEDULE, "down", 2), 1L);
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(rule));

        ExecutionRecord failure = record(ExecutionStatus.FAILURE, 5);
        evaluator.evaluate(failure);
        evaluator.evaluate(failure);

        assertThat(states.get(SCHEDULE, rule).counter()).isEqualTo(1);
    }

    @Test
    void checkpointedRuleResumesFromStoredCounter() {
        AlertRule rule = withId(AlertRule.consecutiveFailures(SCHEDULE, "down", 3), 1L);
        rule.setCheckpoint(true);
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(rule));
        when(checkpoints.find(SCHEDULE, 1L)).thenReturn(Optional.of(new AlertState(2, false, UUID.randomUUID())));

        List<AlertEvent> fired = evaluator.evaluate(record(ExecutionStatus.FAILURE, 5));

        assertThat(fired).hasSize(1);
        verify(checkpoints).checkpoint(eq(SCHEDULE), eq(1L), argThat(s -> s.counter() == 3 && s.active()), eq(T0));
    }

    @Test
    void invalidRuleIsSkippedWithoutBlockingOthers() {
        AlertRule broken = withId(AlertRule.resultField(SCHEDULE, "broken", "x", Comparison.EQ, "1"), 4L);
        ReflectionTestUtils.setField(broken, "comparator", "~~");
        AlertRule down = withId(AlertRule.consecutiveFailures(SCHEDULE, "down", 1), 5L);
        when(rules.findByScheduleIdAndEnabledTrue(SCHEDULE)).thenReturn(List.of(broken, down));

        List<AlertEvent> fired = evaluator.evaluate(record(ExecutionStatus.FAILURE, 5));

        assertThat(fired).extracting(AlertEvent::ruleId).containsExactly(5L);
    }

    private List<Integer> run(ExecutionStatus... statuses) {
        List<Integer> firedAt = new ArrayList<>();
        for (int i = 0; i < statuses.length; i++) {
            if (!evaluator.evaluate(record(statuses[i], 5)).isEmpty()) {
                firedAt.add(i + 1);
            }
        }
        return firedAt;
    }

    private static ExecutionRecord record(ExecutionStatus status, long durationMs) {
        return new ExecutionRecord(UUID.randomUUID(), SCHEDULE, T0, T0, durationMs, status, null, null, List.of());
    }

    private static AlertRule withId(AlertRule rule, long id) {
        ReflectionTestUtils.setField(rule, "id", id);
        return rule;
    }
}
