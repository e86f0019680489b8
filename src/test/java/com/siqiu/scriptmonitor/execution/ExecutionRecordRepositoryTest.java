package com.siqiu.scriptmonitor.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siqiu.scriptmonitor.ScriptMonitorApplication;
import com.siqiu.scriptmonitor.TestcontainersConfig;
import com.siqiu.scriptmonitor.schedule.Schedule;
import com.siqiu.scriptmonitor.schedule.ScheduleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {ScriptMonitorApplication.class, TestcontainersConfig.class})
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ExecutionRecordRepositoryTest {

    @Autowired ExecutionRecordRepository records;
    @Autowired ScheduleRepository schedules;
    @Autowired JdbcTemplate jdbc;

    private final ObjectMapper mapper = new ObjectMapper();
    private long scheduleId;

    @BeforeEach
    void setup() {
        scheduleId = schedules.save(new Schedule("alice", "homepage", "*/5 * * * *", "return 1;")).getId();
    }

    @Test
    void recordExecution_persistsPayloadsAndLogsInOrder() throws Exception {
        Instant t = Instant.parse("2026-03-01T00:00:10Z");
        ExecutionRecord record = new ExecutionRecord(UUID.randomUUID(), scheduleId, t, t.plusMillis(30), 120,
                ExecutionStatus.SUCCESS, mapper.readTree("{\"ok\":true,\"items\":[1,2]}"), null,
                List.of(new ScriptLogEntry(LogLevel.INFO, "first", t),
                        new ScriptLogEntry(LogLevel.TIMER, "fetch: 12ms", t.plusMillis(5))));

        records.recordExecution(record);

        ExecutionRecord loaded = records.findById(record.id()).orElseThrow();
        assertThat(loaded.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(loaded.durationMs()).isEqualTo(120);
        assertThat(loaded.result().get("items").size()).isEqualTo(2);
        assertThat(loaded.error()).isNull();
        assertThat(loaded.logs()).extracting(ScriptLogEntry::message).containsExactly("first", "fetch: 12ms");
        assertThat(loaded.logs().get(1).level()).isEqualTo(LogLevel.TIMER);
    }

    @Test
    void findRecentBySchedule_returnsNewestFirst() throws Exception {
        Instant base = Instant.parse("2026-03-01T00:00:00Z");
        for (int i = 0; i < 3; i++) {
            records.recordExecution(new ExecutionRecord(UUID.randomUUID(), scheduleId, base.plusSeconds(i * 60L),
                    base.plusSeconds(i * 60L), 5, i == 2 ? ExecutionStatus.TIMEOUT : ExecutionStatus.SUCCESS,
                    null, i == 2 ? mapper.readTree("{\"type\":\"timeout\"}") : null, List.of()));
        }

        List<ExecutionRecord> recent = records.findRecentBySchedule(scheduleId, 2);

        assertThat(recent).hasSize(2);
        assertThat(recent.get(0).status()).isEqualTo(ExecutionStatus.TIMEOUT);
        assertThat(recent.get(0).startedAt()).isAfter(recent.get(1).startedAt());
    }

    @Test
    void appendLog_addsLineToExistingRecord() {
        Instant t = Instant.parse("2026-03-01T00:00:10Z");
        ExecutionRecord record = new ExecutionRecord(UUID.randomUUID(), scheduleId, t, t, 1,
                ExecutionStatus.FAILURE, null, null, List.of());
        records.recordExecution(record);

        records.appendLog(record.id(), LogLevel.ERROR, "late line", t.plusSeconds(1));

        Integer n = jdbc.queryForObject("SELECT count(*) FROM execution_logs WHERE execution_id = ?", Integer.class, record.id());
        assertThat(n).isEqualTo(1);
        assertThat(records.findById(record.id()).orElseThrow().logs().get(0).level()).isEqualTo(LogLevel.ERROR);
    }

    @Test
    void recordExecution_storesNulCharactersAsReplacement() throws Exception {
        Instant t = Instant.parse("2026-03-01T00:00:10Z");
        ExecutionRecord record = new ExecutionRecord(UUID.randomUUID(), scheduleId, t, t, 3,
                ExecutionStatus.SUCCESS, mapper.readTree("{\"body\":\"\\u0000PNG\"}"), null,
                List.of(new ScriptLogEntry(LogLevel.INFO, "a\u0000b", t)));

        records.recordExecution(record);

        ExecutionRecord loaded = records.findById(record.id()).orElseThrow();
        assertThat(loaded.result().get("body").asText()).isEqualTo("\uFFFDPNG");
        assertThat(loaded.logs().get(0).message()).isEqualTo("a\uFFFDb");
    }

    @Test
    void recordMinimal_keepsStatusWithoutResultOrLogs() {
        Instant t = Instant.parse("2026-03-01T00:00:10Z");
        ExecutionRecord record = new ExecutionRecord(UUID.randomUUID(), scheduleId, t, t, 9,
                ExecutionStatus.SUCCESS, null, null, List.of(new ScriptLogEntry(LogLevel.INFO, "x", t)));

        records.recordMinimal(record, "storage rejected the full record");

        ExecutionRecord loaded = records.findById(record.id()).orElseThrow();
        assertThat(loaded.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(loaded.durationMs()).isEqualTo(9);
        assertThat(loaded.result()).isNull();
        assertThat(loaded.error().get("type").asText()).isEqualTo("record_incomplete");
        assertThat(loaded.logs()).isEmpty();
    }

    @Test
    void findById_unknownIsEmpty() {
        assertThat(records.findById(UUID.randomUUID())).isEmpty();
    }
}
