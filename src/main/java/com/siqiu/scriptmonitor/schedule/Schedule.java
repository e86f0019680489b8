package com.siqiu.scriptmonitor.schedule;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "schedules")
public class Schedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String owner;

    @Column(nullable = false)
    private String name;

    @Column(name = "cron_expression", nullable = false)
    private String cronExpression;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String script;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private Map<String, String> params = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private Map<String, String> env = new HashMap<>();

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    private Instant updatedAt;

    @Version
    private Long version;

    protected Schedule() {}

    public Schedule(String owner, String name, String cronExpression, String script) {
        this.owner = owner;
        this.name = name;
        this.cronExpression = cronExpression;
        this.script = script;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public String getOwner() { return owner; }
    public String getName() { return name; }
    public String getCronExpression() { return cronExpression; }
    public String getScript() { return script; }
    public Map<String, String> getParams() { return params == null ? Map.of() : params; }
    public Map<String, String> getEnv() { return env == null ? Map.of() : env; }
    public boolean isEnabled() { return enabled; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }

    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }
    public void setScript(String script) { this.script = script; }
    public void setParams(Map<String, String> params) { this.params = new HashMap<>(params); }
    public void setEnv(Map<String, String> env) { this.env = new HashMap<>(env); }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
