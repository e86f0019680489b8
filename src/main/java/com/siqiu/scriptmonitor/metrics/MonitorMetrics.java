package com.siqiu.scriptmonitor.metrics;

import com.siqiu.scriptmonitor.execution.ExecutionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

@Component
public class MonitorMetrics {

    private final MeterRegistry registry;

    private final Timer triggerLagTimer; // histogram-backed timer
    private final Timer executionDuration;

    private final Counter triggersEmitted;
    private final Counter triggersSkipped;
    private final Counter scheduleConfigErrors;
    private final Counter runRequestsDropped;

    private final Map<ExecutionStatus, Counter> executionsByStatus = new EnumMap<>(ExecutionStatus.class);

    private final Counter alertsFired;
    private final Counter notificationsDelivered;
    private final Counter notificationRetries;
    private final Counter notificationsFailed;
    private final Counter deadLettersPublished;

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.triggerLagTimer = Timer.builder("monitor_trigger_lag_seconds")
                .description("Lag between a schedule's due time and the start of its execution")
                .publishPercentileHistogram(true)
                .serviceLevelObjectives(
                        Duration.ofMillis(100),
                        Duration.ofMillis(500),
                        Duration.ofSeconds(1),
                        Duration.ofSeconds(5),
                        Duration.ofSeconds(30)
                )
                .register(registry);

        this.executionDuration = Timer.builder("monitor_execution_duration_seconds")
                .description("Wall-clock duration of script executions")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.triggersEmitted = Counter.builder("monitor_triggers_emitted_total")
                .description("Run requests emitted by the trigger scheduler")
                .register(registry);

        this.triggersSkipped = Counter.builder("monitor_triggers_skipped_total")
                .description("Due triggers skipped because the schedule was still running")
                .register(registry);

        this.scheduleConfigErrors = Counter.builder("monitor_schedule_config_errors_total")
                .description("Schedules treated as disabled because of an unparseable cron expression")
                .register(registry);

        this.runRequestsDropped = Counter.builder("monitor_run_requests_dropped_total")
                .description("Run requests dropped by the coordinator (schedule already queued or running)")
                .register(registry);

        for (ExecutionStatus status : ExecutionStatus.values()) {
            executionsByStatus.put(status, Counter.builder("monitor_executions_total")
                    .description("Completed executions by terminal status")
                    .tag("status", status.wireName())
                    .register(registry));
        }

        this.alertsFired = Counter.builder("monitor_alerts_fired_total")
                .description("Alert events emitted by the evaluator")
                .register(registry);

        this.notificationsDelivered = Counter.builder("monitor_notifications_delivered_total")
                .description("Alert notifications delivered to a channel")
                .register(registry);

        this.notificationRetries = Counter.builder("monitor_notification_retries_total")
                .description("Notification delivery attempts scheduled for retry")
                .register(registry);

        this.notificationsFailed = Counter.builder("monitor_notifications_failed_total")
                .description("Notifications that exhausted their delivery attempts")
                .register(registry);

        this.deadLettersPublished = Counter.builder("monitor_dead_letters_published_total")
                .description("Exhausted notifications published to the dead-letter queue")
                .register(registry);
    }

    public void observeTriggerLag(Duration lag) {
        triggerLagTimer.record(lag);
    }

    public void observeExecution(ExecutionStatus status, Duration duration) {
        executionsByStatus.get(status).increment();
        executionDuration.record(duration);
    }

    public void gauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value)
                .description(description)
                .register(registry);
    }

    public void incTriggersEmitted() { triggersEmitted.increment(); }
    public void incTriggersSkipped() { triggersSkipped.increment(); }
    public void incScheduleConfigErrors() { scheduleConfigErrors.increment(); }
    public void incRunRequestsDropped() { runRequestsDropped.increment(); }

    public void incAlertsFired() { alertsFired.increment(); }
    public void incNotificationsDelivered() { notificationsDelivered.increment(); }
    public void incNotificationRetries() { notificationRetries.increment(); }
    public void incNotificationsFailed() { notificationsFailed.increment(); }
    public void incDeadLettersPublished() { deadLettersPublished.increment(); }
}
