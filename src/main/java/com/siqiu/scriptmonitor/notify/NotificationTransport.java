package com.siqiu.scriptmonitor.notify;

import com.siqiu.scriptmonitor.alert.AlertEvent;

/**
 * Delivers alert events for one channel type.
 */
public interface NotificationTransport {

    /** Channel type handled by this transport, upper case. */
    String type();

    /**
     * Deliver synchronously; the dispatcher owns retries and runs this off the evaluator threads.
     */
    void deliver(NotificationChannel channel, AlertEvent event) throws DeliveryException;
}
