package com.siqiu.scriptmonitor.notify;

public interface DeadLetterClient {
    void publishDeadNotification(DeadNotificationEvent event);
}
