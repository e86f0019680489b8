package com.siqiu.scriptmonitor.notify;

import com.siqiu.scriptmonitor.alert.AlertEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LogTransport implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(LogTransport.class);

    @Override
    public String type() {
        return "LOG";
    }

    @Override
    public void deliver(NotificationChannel channel, AlertEvent event) {
        log.warn("alert_notification channel={} eventId={} ruleId={} scheduleId={} executionId={} snapshot={}",
                channel.getName(), event.id(), event.ruleId(), event.scheduleId(), event.executionId(), event.snapshot());
    }
}
