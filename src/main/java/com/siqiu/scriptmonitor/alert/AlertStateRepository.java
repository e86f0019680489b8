package com.siqiu.scriptmonitor.alert;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Checkpoints of alert state for rules that need to survive a restart.
 */
@Repository
public class AlertStateRepository {

    private final JdbcTemplate jdbc;

    public AlertStateRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<AlertState> find(long scheduleId, long ruleId) {
        String sql = """
            SELECT counter, active, last_execution_id
              FROM alert_states
             WHERE schedule_id = ? AND rule_id = ?
            """;
        List<AlertState> rows = jdbc.query(sql, (rs, i) -> new AlertState(
                rs.getInt("counter"),
                rs.getBoolean("active"),
                rs.getObject("last_execution_id", UUID.class)
        ), scheduleId, ruleId);
        return rows.stream().findFirst();
    }

    public void checkpoint(long scheduleId, long ruleId, AlertState state, Instant at) {
        String sql = """
            INSERT INTO alert_states(schedule_id, rule_id, counter, active, last_execution_id, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (schedule_id, rule_id) DO UPDATE
               SET counter = EXCLUDED.counter,
                   active = EXCLUDED.active,
                   last_execution_id = EXCLUDED.last_execution_id,
                   updated_at = EXCLUDED.updated_at
            """;
        jdbc.update(sql, scheduleId, ruleId, state.counter(), state.active(), state.lastExecutionId(), Timestamp.from(at));
    }
}
