package com.siqiu.scriptmonitor.notify;

/**
 * A channel could not take an alert event. Non-retryable failures (bad configuration, permanent
 * rejection by the receiver) end the delivery immediately.
 */
public class DeliveryException extends Exception {

    private final boolean retryable;

    public DeliveryException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
