package com.siqiu.scriptmonitor.scheduler;

import com.siqiu.scriptmonitor.schedule.Schedule;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row of the in-memory next-fire table.
 */
record ScheduledTrigger(
        long scheduleId,
        String cronText,
        CronExpression cron,
        String script,
        Map<String, String> params,
        Map<String, String> env,
        Instant nextFire
) {
    static ScheduledTrigger of(Schedule schedule, CronExpression cron, Instant nextFire) {
        return new ScheduledTrigger(
                schedule.getId(),
                schedule.getCronExpression(),
                cron,
                schedule.getScript(),
                bindings(schedule.getParams()),
                bindings(schedule.getEnv()),
                nextFire);
    }

    /** Same cron and next-fire time, latest script and bindings. */
    ScheduledTrigger refreshedFrom(Schedule schedule) {
        return new ScheduledTrigger(scheduleId, cronText, cron, schedule.getScript(),
                bindings(schedule.getParams()), bindings(schedule.getEnv()), nextFire);
    }

    ScheduledTrigger withNextFire(Instant next) {
        return new ScheduledTrigger(scheduleId, cronText, cron, script, params, env, next);
    }

    // jsonb {"k": null} comes back as a null value; such keys are dropped
    static Map<String, String> bindings(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) {
                out.put(k, v);
            }
        });
        return Map.copyOf(out);
    }
}
