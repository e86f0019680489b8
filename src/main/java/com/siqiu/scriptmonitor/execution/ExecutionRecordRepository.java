package com.siqiu.scriptmonitor.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only sink for execution records and their captured log lines.
 * <p>
 * PostgreSQL rejects NUL in TEXT and jsonb, so NUL characters in script output are stored as U+FFFD.
 */
@Repository
public class ExecutionRecordRepository {

    private static final char NUL = '\u0000';
    private static final char REPLACEMENT = '\uFFFD';
    private static final int LOG_BATCH_SIZE = 500;

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public ExecutionRecordRepository(JdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.mapper = mapper;
    }

    /**
     * Insert the record and all of its log lines in one transaction.
     */
    @Transactional
    public void recordExecution(ExecutionRecord record) {
        insertRecord(record, record.result(), record.error());

        String sql = """
            INSERT INTO execution_logs(execution_id, level, message, logged_at)
            VALUES (?, ?, ?, ?)
            """;
        jdbc.batchUpdate(sql, record.logs(), LOG_BATCH_SIZE, (ps, entry) -> {
            ps.setObject(1, record.id());
            ps.setString(2, entry.level().name());
            ps.setString(3, withoutNul(entry.message()));
            ps.setTimestamp(4, Timestamp.from(entry.timestamp()));
        });
    }

    /**
     * Last-resort write used when the full record cannot be stored: the outcome without its result
     * and logs, and an error saying why.
     */
    public void recordMinimal(ExecutionRecord record, String reason) {
        ObjectNode error = JsonNodeFactory.instance.objectNode();
        error.put("type", "record_incomplete");
        error.put("message", "result and logs could not be stored: " + reason);
        if (record.error() != null) {
            error.put("originalType", record.error().path("type").asText(null));
        }
        insertRecord(record, null, error);
    }

    public void appendLog(UUID executionId, LogLevel level, String message, Instant timestamp) {
        String sql = """
            INSERT INTO execution_logs(execution_id, level, message, logged_at)
            VALUES (?, ?, ?, ?)
            """;
        jdbc.update(sql, executionId, level.name(), withoutNul(message), Timestamp.from(timestamp));
    }

    private void insertRecord(ExecutionRecord record, JsonNode result, JsonNode error) {
        String sql = """
            INSERT INTO executions(id, schedule_id, triggered_at, started_at, duration_ms, status, result, error)
            VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb)
            """;
        jdbc.update(sql,
                record.id(),
                record.scheduleId(),
                Timestamp.from(record.triggeredAt()),
                Timestamp.from(record.startedAt()),
                record.durationMs(),
                record.status().name(),
                toJson(withoutNul(result)),
                toJson(withoutNul(error)));
    }

    public Optional<ExecutionRecord> findById(UUID id) {
        String sql = """
            SELECT id, schedule_id, triggered_at, started_at, duration_ms, status, result::text AS result, error::text AS error
              FROM executions
             WHERE id = ?
            """;
        List<ExecutionRecord> rows = jdbc.query(sql, recordMapper(), id);
        return rows.stream().findFirst();
    }

    /**
     * Most recent executions of one schedule, newest first.
     */
    public List<ExecutionRecord> findRecentBySchedule(long scheduleId, int limit) {
        String sql = """
            SELECT id, schedule_id, triggered_at, started_at, duration_ms, status, result::text AS result, error::text AS error
              FROM executions
             WHERE schedule_id = ?
             ORDER BY started_at DESC
             LIMIT ?
            """;
        return jdbc.query(sql, recordMapper(), scheduleId, limit);
    }

    private List<ScriptLogEntry> findLogs(UUID executionId) {
        String sql = """
            SELECT level, message, logged_at
              FROM execution_logs
             WHERE execution_id = ?
             ORDER BY id
            """;
        return jdbc.query(sql, (rs, i) -> new ScriptLogEntry(
                LogLevel.parse(rs.getString("level")),
                rs.getString("message"),
                rs.getTimestamp("logged_at").toInstant()
        ), executionId);
    }

    private RowMapper<ExecutionRecord> recordMapper() {
        return (rs, i) -> {
            UUID id = rs.getObject("id", UUID.class);
            return new ExecutionRecord(
                    id,
                    rs.getLong("schedule_id"),
                    rs.getTimestamp("triggered_at").toInstant(),
                    rs.getTimestamp("started_at").toInstant(),
                    rs.getLong("duration_ms"),
                    ExecutionStatus.valueOf(rs.getString("status")),
                    readJson(rs, "result"),
                    readJson(rs, "error"),
                    findLogs(id)
            );
        };
    }

    private JsonNode readJson(ResultSet rs, String column) throws SQLException {
        String raw = rs.getString(column);
        if (raw == null) return null;
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new SQLException("Unreadable JSON in column " + column, e);
        }
    }

    static String withoutNul(String text) {
        return text == null || text.indexOf(NUL) < 0 ? text : text.replace(NUL, REPLACEMENT);
    }

    static JsonNode withoutNul(JsonNode node) {
        if (node == null) return null;
        if (node.isTextual()) {
            String text = node.textValue();
            return text.indexOf(NUL) < 0 ? node : TextNode.valueOf(withoutNul(text));
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(node.size());
            node.forEach(item -> out.add(withoutNul(item)));
            return out;
        }
        if (node.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            node.fields().forEachRemaining(field -> out.set(withoutNul(field.getKey()), withoutNul(field.getValue())));
            return out;
        }
        return node;
    }

    private String toJson(JsonNode node) {
        if (node == null) return null;
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution payload", e);
        }
    }
}
