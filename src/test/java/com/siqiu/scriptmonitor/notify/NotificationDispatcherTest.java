package com.siqiu.scriptmonitor.notify;

import com.siqiu.scriptmonitor.alert.AlertEvent;
import com.siqiu.scriptmonitor.metrics.MonitorMetrics;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Mock NotificationChannelRepository channels;
    @Mock NotificationFailureRepository failures;
    @Mock NotificationTransport webhook;
    @Mock DeadLetterClient deadLetters;

    private SimpleMeterRegistry registry;
    private NotificationDispatcher dispatcher;
    private final AlertEvent event = new AlertEvent(UUID.randomUUID(), 1L, 7L, UUID.randomUUID(), NOW, Map.of("ruleName", "down"));

    @BeforeEach
    void setUp() {
        when(webhook.type()).thenReturn("WEBHOOK");
        registry = new SimpleMeterRegistry();
        dispatcher = new NotificationDispatcher(channels, List.of(webhook), failures, Optional.of(deadLetters),
                new MonitorMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC), 3, 0);
    }

    @AfterEach
    void tearDown() throws Exception {
        dispatcher.destroy();
    }

    @Test
    void deliversToEnabledChannel() throws Exception {
        NotificationChannel channel = channel(10L, "WEBHOOK");
        when(channels.findById(10L)).thenReturn(Optional.of(channel));

        dispatcher.dispatch(event, List.of(10L));

        verify(webhook, timeout(2000)).deliver(channel, event);
        verify(failures, after(200).never()).recordFailure(any(), anyLong(), anyInt(), any(), any());
    }

    @Test
    void retryableFailureIsRetriedUntilAttemptsRunOut() throws Exception {
        NotificationChannel channel = channel(10L, "webhook");
        when(channels.findById(10L)).thenReturn(Optional.of(channel));
        doThrow(new DeliveryException("Code: 503, reason: Service Unavailable", true))
                .when(webhook).deliver(channel, event);

        dispatcher.dispatch(event, List.of(10L));

        verify(failures, timeout(2000)).recordFailure(eq(event.id()), eq(10L), eq(3), contains("503"), eq(NOW));
        verify(webhook, times(3)).deliver(channel, event);
        verify(deadLetters).publishDeadNotification(argThat(d -> d.attempts() == 3 && d.channelId() == 10L));
        assertThat(registry.get("monitor_notification_retries_total").counter().count()).isEqualTo(2.0);
    }

    @Test
    void permanentFailureIsNotRetried() throws Exception {
        NotificationChannel channel = channel(10L, "WEBHOOK");
        when(channels.findById(10L)).thenReturn(Optional.of(channel));
        doThrow(new DeliveryException("Code: 404, reason: Not Found", false))
                .when(webhook).deliver(channel, event);

        dispatcher.dispatch(event, List.of(10L));

        verify(failures, timeout(2000)).recordFailure(eq(event.id()), eq(10L), eq(1), any(), eq(NOW));
        verify(webhook, times(1)).deliver(channel, event);
    }

    @Test
    void unknownChannelIsRecordedAsFailureWithoutDelivery() throws Exception {
        when(channels.findById(99L)).thenReturn(Optional.empty());

        dispatcher.dispatch(event, List.of(99L));

        verify(failures, timeout(2000)).recordFailure(eq(event.id()), eq(99L), eq(1), contains("unknown channel"), eq(NOW));
        verify(webhook, never()).deliver(any(), any());
    }

    @Test
    void channelTypeWithoutTransportFailsImmediately() throws Exception {
        when(channels.findById(11L)).thenReturn(Optional.of(channel(11L, "EMAIL")));

        dispatcher.dispatch(event, List.of(11L));

        verify(failures, timeout(2000)).recordFailure(eq(event.id()), eq(11L), eq(1), contains("EMAIL"), eq(NOW));
    }

    @Test
    void disabledChannelIsSkipped() throws Exception {
        NotificationChannel channel = channel(12L, "WEBHOOK");
        channel.setEnabled(false);
        when(channels.findById(12L)).thenReturn(Optional.of(channel));

        dispatcher.dispatch(event, List.of(12L));

        verify(channels, timeout(2000)).findById(12L);
        verify(webhook, after(200).never()).deliver(any(), any());
        verifyNoInteractions(failures);
    }

    @Test
    void deadLetterFailureDoesNotPropagate() throws Exception {
        when(channels.findById(99L)).thenReturn(Optional.empty());
        doThrow(new RuntimeException("sqs down")).when(deadLetters).publishDeadNotification(any());

        dispatcher.dispatch(event, List.of(99L));

        verify(deadLetters, timeout(2000)).publishDeadNotification(any());
        verify(failures).recordFailure(any(), eq(99L), eq(1), any(), any());
    }

    @Test
    void backoffDoublesAndIsCapped() throws Exception {
        NotificationDispatcher slow = new NotificationDispatcher(channels, List.of(webhook), failures, Optional.empty(),
                new MonitorMetrics(new SimpleMeterRegistry()), Clock.systemUTC(), 5, 1000);
        try {
            assertThat(slow.backoffMs(1)).isEqualTo(1000);
            assertThat(slow.backoffMs(2)).isEqualTo(2000);
            assertThat(slow.backoffMs(4)).isEqualTo(8000);
            assertThat(slow.backoffMs(7)).isEqualTo(64000);
            assertThat(slow.backoffMs(12)).isEqualTo(64000);
        } finally {
            slow.destroy();
        }
    }

    private static NotificationChannel channel(long id, String type) {
        NotificationChannel channel = new NotificationChannel("ops", type, "https://hooks.example.com/alert");
        ReflectionTestUtils.setField(channel, "id", id);
        return channel;
    }
}
