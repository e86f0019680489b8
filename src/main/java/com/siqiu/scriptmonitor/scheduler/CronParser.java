package com.siqiu.scriptmonitor.scheduler;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Six-field cron (seconds first). Five-field expressions run at second 0; {@code @hourly}-style macros are accepted.
 */
final class CronParser {

    private CronParser() {}

    static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression is empty");
        }
        String trimmed = expression.trim();
        if (!trimmed.startsWith("@") && trimmed.split("\\s+").length == 5) {
            trimmed = "0 " + trimmed;
        }
        return CronExpression.parse(trimmed);
    }

    /** Next fire strictly after {@code after}, or null if the expression never fires again. */
    static Instant next(CronExpression cron, Instant after, ZoneId zone) {
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(after, zone));
        return next == null ? null : next.toInstant();
    }
}
