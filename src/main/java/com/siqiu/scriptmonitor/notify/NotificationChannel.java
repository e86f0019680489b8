package com.siqiu.scriptmonitor.notify;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@Entity
@Table(name = "notification_channels")
public class NotificationChannel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // transport key, e.g. WEBHOOK or LOG; unknown types are kept so they can be reported
    @Column(nullable = false)
    private String type;

    @Column(columnDefinition = "TEXT")
    private String target;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private Map<String, String> headers = new HashMap<>();

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected NotificationChannel() {}

    public NotificationChannel(String name, String type, String target) {
        this.name = name;
        this.type = type;
        this.target = target;
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public String getType() { return type; }
    public String getTarget() { return target; }
    public Map<String, String> getHeaders() { return headers == null ? Map.of() : headers; }
    public boolean isEnabled() { return enabled; }
    public Instant getCreatedAt() { return createdAt; }

    public String transportKey() {
        return type == null ? "" : type.trim().toUpperCase(Locale.ROOT);
    }

    public void setHeaders(Map<String, String> headers) { this.headers = new HashMap<>(headers); }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
