package com.siqiu.scriptmonitor.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;

@Repository
public class AlertEventRepository {

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public AlertEventRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.mapper = mapper;
    }

    public void recordAlertEvent(AlertEvent event) {
        String snapshot;
        try {
            snapshot = mapper.writeValueAsString(event.snapshot());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert snapshot", e);
        }
        String sql = """
            INSERT INTO alert_events(id, rule_id, schedule_id, execution_id, triggered_at, snapshot)
            VALUES (?, ?, ?, ?, ?, ?::jsonb)
            """;
        jdbc.update(sql,
                event.id(),
                event.ruleId(),
                event.scheduleId(),
                event.executionId(),
                Timestamp.from(event.triggeredAt()),
                snapshot);
    }

    public int countByRule(long ruleId) {
        Integer n = jdbc.queryForObject("SELECT count(*) FROM alert_events WHERE rule_id = ?", Integer.class, ruleId);
        return n == null ? 0 : n;
    }
}
