package com.siqiu.scriptmonitor.alert;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertStateStoreTest {

    @Mock AlertStateRepository checkpoints;

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void retainRulesOnlyPrunesThatSchedule() {
        AlertStateStore store = new AlertStateStore(checkpoints, clock);
        AlertRule a = rule(1L, 100L, false);
        AlertRule b = rule(1L, 101L, false);
        AlertRule other = rule(2L, 100L, false);
        store.put(1L, a, AlertState.INITIAL.satisfied(UUID.randomUUID()));
        store.put(1L, b, AlertState.INITIAL.satisfied(UUID.randomUUID()));
        store.put(2L, other, AlertState.INITIAL.satisfied(UUID.randomUUID()));

        store.retainRules(1L, List.of(101L));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.get(1L, b).counter()).isEqualTo(1);
        assertThat(store.get(2L, other).counter()).isEqualTo(1);
        assertThat(store.get(1L, a)).isEqualTo(AlertState.INITIAL);
    }

    @Test
    void scheduleWithoutRulesIsForgotten() {
        AlertStateStore store = new AlertStateStore(checkpoints, clock);
        store.put(3L, rule(3L, 5L, false), AlertState.INITIAL.satisfied(UUID.randomUUID()));

        store.retainRules(3L, List.of());
        store.retainRules(99L, List.of(1L));

        assertThat(store.size()).isZero();
        assertThat(store.scheduleCount()).isZero();
    }

    @Test
    void checkpointRuleLoadsOnceAndWritesThrough() {
        AlertStateStore store = new AlertStateStore(checkpoints, clock);
        AlertRule rule = rule(4L, 8L, true);
        when(checkpoints.find(4L, 8L)).thenReturn(Optional.of(new AlertState(2, false, null)));

        assertThat(store.get(4L, rule).counter()).isEqualTo(2);
        assertThat(store.get(4L, rule).counter()).isEqualTo(2);
        store.put(4L, rule, new AlertState(3, true, null));

        verify(checkpoints, times(1)).find(4L, 8L);
        verify(checkpoints).checkpoint(eq(4L), eq(8L), eq(new AlertState(3, true, null)), any());
    }

    private static AlertRule rule(long scheduleId, long id, boolean checkpoint) {
        AlertRule rule = AlertRule.consecutiveFailures(scheduleId, "r" + id, 1);
        rule.setCheckpoint(checkpoint);
        ReflectionTestUtils.setField(rule, "id", id);
        return rule;
    }
}
