package com.siqiu.scriptmonitor.scheduler;

import com.siqiu.scriptmonitor.metrics.MonitorMetrics;
import com.siqiu.scriptmonitor.schedule.Schedule;
import com.siqiu.scriptmonitor.schedule.ScheduleRepository;
import com.siqiu.scriptmonitor.worker.ExecutionCoordinator;
import com.siqiu.scriptmonitor.worker.RunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns enabled schedules into run requests.
 * <p>
 * Keeps one next-fire time per schedule. {@link #tick()} fires whatever is due and advances it from
 * "now" (missed occurrences collapse into one run); {@link #reconcile()} re-reads the schedule store
 * and adds, removes or re-times entries so edits take effect without a restart.
 */
@Component
public class TriggerScheduler {

    private static final Logger log = LoggerFactory.getLogger(TriggerScheduler.class);

    private final ScheduleRepository schedules;
    private final ExecutionCoordinator coordinator;
    private final MonitorMetrics metrics;
    private final Clock clock;
    private final ZoneId zone;
    private final boolean enabled;

    private final Map<Long, ScheduledTrigger> table = new ConcurrentHashMap<>();
    // last configuration problem reported per schedule
    private final Map<Long, String> reportedErrors = new ConcurrentHashMap<>();
    private volatile boolean loaded;

    public TriggerScheduler(
            ScheduleRepository schedules,
            ExecutionCoordinator coordinator,
            MonitorMetrics metrics,
            Clock clock,
            @Value("${monitor.scheduler.zone:UTC}") String zone,
            @Value("${monitor.scheduler.enabled:true}") boolean enabled
    ) {
        this.schedules = schedules;
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.clock = clock;
        this.zone = ZoneId.of(zone);
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${monitor.scheduler.tick-ms:1000}")
    public synchronized void tick() {
        if (!enabled) return;
        if (!loaded) {
            reconcileNow();
        }

        Instant now = clock.instant();
        for (ScheduledTrigger trigger : table.values()) {
            if (trigger.nextFire().isAfter(now)) continue;
            try {
                fire(trigger, now);
            } catch (RuntimeException e) {
                // one bad entry must not stall the loop
                log.error("trigger_failed scheduleId={}", trigger.scheduleId(), e);
            }
        }
    }

    @Scheduled(fixedDelayString = "${monitor.scheduler.reconcile-ms:10000}")
    public synchronized void reconcile() {
        if (!enabled) return;
        reconcileNow();
    }

    public int loadedSchedules() {
        return table.size();
    }

    /** Next fire time of a loaded schedule, or null if it is not loaded (disabled, deleted or invalid). */
    public Instant nextFireOf(long scheduleId) {
        ScheduledTrigger trigger = table.get(scheduleId);
        return trigger == null ? null : trigger.nextFire();
    }

    private void fire(ScheduledTrigger trigger, Instant now) {
        long id = trigger.scheduleId();
        if (coordinator.isActive(id)) {
            metrics.incTriggersSkipped();
            log.info("trigger_skipped scheduleId={} reason=still_running dueAt={}", id, trigger.nextFire());
        } else {
            RunRequest request = new RunRequest(id, trigger.script(), trigger.params(), trigger.env(), trigger.nextFire());
            if (coordinator.submit(request)) {
                metrics.incTriggersEmitted();
                log.debug("trigger_emitted scheduleId={} dueAt={}", id, trigger.nextFire());
            }
        }

        Instant next = CronParser.next(trigger.cron(), now, zone);
        if (next == null) {
            table.remove(id);
            log.info("schedule_exhausted scheduleId={} cron='{}'", id, trigger.cronText());
        } else {
            table.put(id, trigger.withNextFire(next));
        }
    }

    private void reconcileNow() {
        List<Schedule> enabledSchedules;
        try {
            enabledSchedules = schedules.findByEnabledTrue();
        } catch (RuntimeException e) {
            log.error("schedule_reload_failed loaded={}", table.size(), e);
            return;
        }

        Instant now = clock.instant();
        Set<Long> seen = new HashSet<>();
        for (Schedule schedule : enabledSchedules) {
            long id = schedule.getId();
            seen.add(id);
            try {
                reconcileOne(schedule, now);
            } catch (RuntimeException e) {
                // a schedule that cannot be loaded is treated as disabled; the others still fire
                table.remove(id);
                reportConfigError(schedule, "load:" + e, e.toString());
            }
        }

        table.keySet().removeIf(id -> {
            if (seen.contains(id)) return false;
            log.info("schedule_unloaded scheduleId={}", id);
            return true;
        });
        reportedErrors.keySet().retainAll(seen);
        loaded = true;
    }

    private void reconcileOne(Schedule schedule, Instant now) {
        long id = schedule.getId();
        ScheduledTrigger existing = table.get(id);
        if (existing != null && existing.cronText().equals(schedule.getCronExpression())) {
            table.put(id, existing.refreshedFrom(schedule));
            reportedErrors.remove(id);
            return;
        }

        CronExpression cron;
        try {
            cron = CronParser.parse(schedule.getCronExpression());
        } catch (IllegalArgumentException e) {
            table.remove(id);
            reportConfigError(schedule, "cron:" + schedule.getCronExpression(), e.getMessage());
            return;
        }

        Instant next = CronParser.next(cron, now, zone);
        if (next == null) {
            table.remove(id);
            reportedErrors.remove(id);
            return;
        }
        table.put(id, ScheduledTrigger.of(schedule, cron, next));
        reportedErrors.remove(id);
        if (existing == null) {
            log.info("schedule_loaded scheduleId={} cron='{}' nextFire={}", id, schedule.getCronExpression(), next);
        } else {
            log.info("schedule_rescheduled scheduleId={} cron='{}' nextFire={}", id, schedule.getCronExpression(), next);
        }
    }

    // reported once per distinct problem until the schedule changes or loads cleanly
    private void reportConfigError(Schedule schedule, String problem, String reason) {
        String previous = reportedErrors.put(schedule.getId(), problem);
        if (!Objects.equals(previous, problem)) {
            metrics.incScheduleConfigErrors();
            log.warn("schedule_config_error scheduleId={} cron='{}' reason={}",
                    schedule.getId(), schedule.getCronExpression(), reason);
        }
    }
}
