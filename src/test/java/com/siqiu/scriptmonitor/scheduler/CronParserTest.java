package com.siqiu.scriptmonitor.scheduler;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronParserTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    @Test
    void fiveFieldExpressionRunsAtSecondZero() {
        CronExpression cron = CronParser.parse("*/15 * * * *");

        assertThat(CronParser.next(cron, NOW, ZoneId.of("UTC"))).isEqualTo(Instant.parse("2026-03-01T10:30:00Z"));
    }

    @Test
    void sixFieldExpressionKeepsSeconds() {
        CronExpression cron = CronParser.parse("45 * * * * *");

        assertThat(CronParser.next(cron, NOW, ZoneId.of("UTC"))).isEqualTo(Instant.parse("2026-03-01T10:15:45Z"));
    }

    @Test
    void macrosAreAccepted() {
        CronExpression cron = CronParser.parse("@daily");

        assertThat(CronParser.next(cron, NOW, ZoneId.of("UTC"))).isEqualTo(Instant.parse("2026-03-02T00:00:00Z"));
    }

    @Test
    void evaluatedInConfiguredZone() {
        CronExpression cron = CronParser.parse("0 0 9 * * *");

        // 09:00 in Berlin (UTC+1 in March before DST) is 08:00 UTC
        assertThat(CronParser.next(cron, NOW, ZoneId.of("Europe/Berlin"))).isEqualTo(Instant.parse("2026-03-02T08:00:00Z"));
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> CronParser.parse("every minute")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CronParser.parse("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CronParser.parse("61 * * * * *")).isInstanceOf(IllegalArgumentException.class);
    }
}
