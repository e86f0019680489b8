package com.siqiu.scriptmonitor.alert;

import com.siqiu.scriptmonitor.execution.ExecutionStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Entity
@Table(name = "alert_rules")
public class AlertRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "schedule_id", nullable = false)
    private Long scheduleId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AlertRuleKind kind;

    // consecutive matches required before firing (failure streak length, or dedupe streak)
    @Column(nullable = false)
    private int threshold = 1;

    @Column(name = "threshold_ms")
    private Long thresholdMs;

    // stored as symbol or enum name; parsed on use
    private String comparator;

    // JSON pointer ("/data/count") or dotted path ("data.count") into the result payload
    @Column(name = "field_path")
    private String fieldPath;

    @Column(name = "expected_value", columnDefinition = "TEXT")
    private String expectedValue;

    // comma-separated failure statuses counted by a consecutive-failure rule; empty means all
    private String statuses;

    @Column(nullable = false)
    private boolean dedupe = false;

    @Column(nullable = false)
    private boolean checkpoint = false;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "channel_ids", nullable = false, columnDefinition = "jsonb")
    private List<Long> channelIds = new ArrayList<>();

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected AlertRule() {}

    private AlertRule(Long scheduleId, String name, AlertRuleKind kind) {
        this.scheduleId = scheduleId;
        this.name = name;
        this.kind = kind;
    }

    public static AlertRule consecutiveFailures(long scheduleId, String name, int threshold) {
        AlertRule r = new AlertRule(scheduleId, name, AlertRuleKind.CONSECUTIVE_FAILURES);
        r.threshold = threshold;
        return r;
    }

    public static AlertRule latency(long scheduleId, String name, Comparison comparison, long thresholdMs) {
        AlertRule r = new AlertRule(scheduleId, name, AlertRuleKind.LATENCY);
        r.comparator = comparison.symbol();
        r.thresholdMs = thresholdMs;
        return r;
    }

    public static AlertRule resultField(long scheduleId, String name, String fieldPath, Comparison comparison, String expectedValue) {
        AlertRule r = new AlertRule(scheduleId, name, AlertRuleKind.RESULT_FIELD);
        r.fieldPath = fieldPath;
        r.comparator = comparison.symbol();
        r.expectedValue = expectedValue;
        return r;
    }

    /**
     * Failure statuses this rule counts. Empty set means every failure-like status.
     */
    public Set<ExecutionStatus> countedStatuses() {
        if (statuses == null || statuses.isBlank()) {
            return EnumSet.noneOf(ExecutionStatus.class);
        }
        EnumSet<ExecutionStatus> out = EnumSet.noneOf(ExecutionStatus.class);
        Arrays.stream(statuses.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT).replace('-', '_'))
                .map(ExecutionStatus::valueOf)
                .forEach(out::add);
        return out;
    }

    /** Edge-triggered rules fire once per streak; level-triggered rules fire on every match. */
    public boolean isEdgeTriggered() {
        return kind == AlertRuleKind.CONSECUTIVE_FAILURES || dedupe;
    }

    public Long getId() { return id; }
    public Long getScheduleId() { return scheduleId; }
    public String getName() { return name; }
    public AlertRuleKind getKind() { return kind; }
    public int getThreshold() { return threshold; }
    public Long getThresholdMs() { return thresholdMs; }
    public String getComparator() { return comparator; }
    public String getFieldPath() { return fieldPath; }
    public String getExpectedValue() { return expectedValue; }
    public String getStatuses() { return statuses; }
    public boolean isDedupe() { return dedupe; }
    public boolean isCheckpoint() { return checkpoint; }
    public List<Long> getChannelIds() { return channelIds == null ? List.of() : channelIds; }
    public boolean isEnabled() { return enabled; }
    public Instant getCreatedAt() { return createdAt; }

    public void setThreshold(int threshold) { this.threshold = threshold; }
    public void setStatuses(String statuses) { this.statuses = statuses; }
    public void setDedupe(boolean dedupe) { this.dedupe = dedupe; }
    public void setCheckpoint(boolean checkpoint) { this.checkpoint = checkpoint; }
    public void setChannelIds(List<Long> channelIds) { this.channelIds = new ArrayList<>(channelIds); }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
