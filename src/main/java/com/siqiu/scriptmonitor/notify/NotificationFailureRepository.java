package com.siqiu.scriptmonitor.notify;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

@Repository
public class NotificationFailureRepository {

    private final JdbcTemplate jdbc;

    public NotificationFailureRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void recordFailure(UUID eventId, long channelId, int attempts, String lastError, Instant failedAt) {
        String sql = """
            INSERT INTO notification_failures(event_id, channel_id, attempts, last_error, failed_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        jdbc.update(sql, eventId, channelId, attempts, lastError, Timestamp.from(failedAt));
    }
}
