package com.siqiu.scriptmonitor.notify;

import java.time.Instant;
import java.util.UUID;

public record DeadNotificationEvent(
        UUID eventId,
        long ruleId,
        long scheduleId,
        long channelId,
        int attempts,
        String error,
        Instant failedAt
) {}
